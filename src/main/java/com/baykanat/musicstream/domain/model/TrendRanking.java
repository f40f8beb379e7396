package com.baykanat.musicstream.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Tek hesaplama döngüsünün tam sıralaması; kısmi güncelleme yok. */
@Value
@Builder
public class TrendRanking {

    EntityType entityType;
    int lookbackDays;
    WindowBucket window;
    Instant generatedAt;
    List<TrendScore> scores;

    public TrendRanking(EntityType entityType, int lookbackDays, WindowBucket window,
                        Instant generatedAt, List<TrendScore> scores) {
        this.entityType = entityType;
        this.lookbackDays = lookbackDays;
        this.window = window;
        this.generatedAt = generatedAt;
        this.scores = List.copyOf(scores);
    }
}
