package com.baykanat.musicstream.domain.model;

import lombok.Builder;
import lombok.Value;

/** Bir entity'nin trend skoru; her hesaplama döngüsünde komple yenilenir. */
@Value
@Builder
public class TrendScore {

    EntityType entityType;
    String entityId;
    WindowBucket window;
    double score;
    int rank;
    long currentPlays;
    long previousPlays;
}
