package com.baykanat.musicstream.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Windowed aggregator counters")
public class AggregationStatsResponse {

    @JsonProperty("applied_events")
    private long appliedEvents;

    @JsonProperty("duplicate_events")
    private long duplicateEvents;

    @JsonProperty("late_applied_events")
    private long lateAppliedEvents;

    @JsonProperty("dropped_late_events")
    private long droppedLateEvents;

    @JsonProperty("open_buckets")
    private int openBuckets;

    @JsonProperty("finalized_buckets")
    private int finalizedBuckets;

    @JsonProperty("pending_persist_buckets")
    private int pendingPersistBuckets;

    @JsonProperty("watermark")
    private String watermark;
}
