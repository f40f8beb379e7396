package com.baykanat.musicstream.domain.model;

/** WindowedAggregator.apply sonucu. */
public enum ApplyOutcome {
    APPLIED,
    APPLIED_LATE,
    DUPLICATE,
    DROPPED_LATE;

    public boolean counted() {
        return this == APPLIED || this == APPLIED_LATE;
    }
}
