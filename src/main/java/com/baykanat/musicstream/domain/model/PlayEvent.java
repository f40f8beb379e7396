package com.baykanat.musicstream.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Normalize edilmiş dinleme event'i; ingest sonrası değişmez. late: watermark'tan eski timestamp. */
@Value
@Builder(toBuilder = true)
public class PlayEvent {

    String eventId;
    String userId;
    String trackId;
    String artistId;
    String genre;
    Instant timestamp;
    long durationPlayedMs;
    String device;
    String context;
    boolean late;
}
