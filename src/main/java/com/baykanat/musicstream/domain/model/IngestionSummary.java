package com.baykanat.musicstream.domain.model;

import lombok.Value;

/** Bir ingestion batch'inin sonuç sayıları. */
@Value
public class IngestionSummary {

    int applied;
    int duplicates;
    int droppedLate;
    int invalid;

    public int total() {
        return applied + duplicates + droppedLate + invalid;
    }
}
