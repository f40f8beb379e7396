package com.baykanat.musicstream.api.dto;

import com.baykanat.musicstream.domain.model.TrendRanking;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Trend sıralaması yanıtı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Ranked trend list for one entity type")
public class TrendResponse {

    @JsonProperty("entity_type")
    @Schema(description = "Ranked entity type", example = "ARTIST")
    private String entityType;

    @JsonProperty("lookback_days")
    @Schema(description = "Lookback period in days", example = "7")
    private int lookbackDays;

    @JsonProperty("window_start")
    @Schema(description = "Start of the current period", example = "2026-02-08T00:00:00Z")
    private String windowStart;

    @JsonProperty("window_end")
    @Schema(description = "End of the current period", example = "2026-02-15T00:00:00Z")
    private String windowEnd;

    @JsonProperty("generated_at")
    private String generatedAt;

    @JsonProperty("entries")
    private List<Entry> entries;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "One ranked entity")
    public static class Entry {
        @JsonProperty("rank")
        private int rank;
        @JsonProperty("entity_id")
        private String entityId;
        @JsonProperty("score")
        private double score;
        @JsonProperty("current_plays")
        private long currentPlays;
        @JsonProperty("previous_plays")
        private long previousPlays;
    }

    public static TrendResponse from(TrendRanking ranking) {
        return TrendResponse.builder()
                .entityType(ranking.getEntityType().name())
                .lookbackDays(ranking.getLookbackDays())
                .windowStart(ranking.getWindow().getStart().toString())
                .windowEnd(ranking.getWindow().getEnd().toString())
                .generatedAt(ranking.getGeneratedAt().toString())
                .entries(ranking.getScores().stream()
                        .map(s -> Entry.builder()
                                .rank(s.getRank())
                                .entityId(s.getEntityId())
                                .score(s.getScore())
                                .currentPlays(s.getCurrentPlays())
                                .previousPlays(s.getPreviousPlays())
                                .build())
                        .toList())
                .build();
    }
}
