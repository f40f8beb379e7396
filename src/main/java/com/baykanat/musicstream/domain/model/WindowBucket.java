package com.baykanat.musicstream.domain.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/** [start, end) aralığı; slide interval'e hizalı, bitişik ve örtüşmeyen bucket. */
@Value
public class WindowBucket implements Comparable<WindowBucket> {

    Instant start;
    Instant end;

    /** Timestamp'in düştüğü bucket'ı hesaplar (epoch'a hizalı). */
    public static WindowBucket containing(Instant timestamp, Duration size) {
        long sizeMs = size.toMillis();
        long startMs = Math.floorDiv(timestamp.toEpochMilli(), sizeMs) * sizeMs;
        return new WindowBucket(Instant.ofEpochMilli(startMs), Instant.ofEpochMilli(startMs + sizeMs));
    }

    @Override
    public int compareTo(WindowBucket other) {
        return start.compareTo(other.start);
    }
}
