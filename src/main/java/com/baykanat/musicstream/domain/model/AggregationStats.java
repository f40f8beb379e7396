package com.baykanat.musicstream.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Aggregator sayaçlarının anlık görüntüsü. */
@Value
@Builder
public class AggregationStats {

    long appliedEvents;
    long duplicateEvents;
    long lateAppliedEvents;
    long droppedLateEvents;
    int openBuckets;
    int finalizedBuckets;
    int pendingPersistBuckets;
    Instant watermark;
}
