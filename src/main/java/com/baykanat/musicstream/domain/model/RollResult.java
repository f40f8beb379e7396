package com.baykanat.musicstream.domain.model;

import lombok.Value;

import java.time.Instant;

/** rollWindow çağrısının özeti. */
@Value
public class RollResult {

    Instant rolledAt;
    int finalizedBuckets;
    int prunedBuckets;
    int persistedBuckets;
}
