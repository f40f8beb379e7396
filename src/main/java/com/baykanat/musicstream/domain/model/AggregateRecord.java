package com.baykanat.musicstream.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Bir AggregateKey'in sayaç değerleri. Açık bucket'ta her apply yeni bir kopya üretir; finalize sonrası sabit. */
@Value
@Builder(toBuilder = true)
public class AggregateRecord {

    AggregateKey key;
    long playCount;
    long totalDurationMs;
    Instant lastUpdated;

    /** İlk event için kayıt. */
    public static AggregateRecord first(AggregateKey key, long durationMs, Instant at) {
        return new AggregateRecord(key, 1, durationMs, at);
    }

    /** Bir play daha ekler; sayaçlar azalmaz. */
    public AggregateRecord plus(long durationMs, Instant at) {
        Instant updated = lastUpdated == null || at.isAfter(lastUpdated) ? at : lastUpdated;
        return new AggregateRecord(key, playCount + 1, totalDurationMs + durationMs, updated);
    }
}
