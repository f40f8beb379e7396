package com.baykanat.musicstream.domain.model;

import lombok.Value;

/** Sliding pencere toplamları. */
@Value
public class WindowTotals {

    long playCount;
    long totalDurationMs;

    public static WindowTotals zero() {
        return new WindowTotals(0, 0);
    }

    public WindowTotals plus(AggregateRecord record) {
        return new WindowTotals(playCount + record.getPlayCount(), totalDurationMs + record.getTotalDurationMs());
    }
}
