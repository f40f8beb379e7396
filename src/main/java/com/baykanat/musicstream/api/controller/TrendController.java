package com.baykanat.musicstream.api.controller;

import com.baykanat.musicstream.api.dto.TrendResponse;
import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.TrendRanking;
import com.baykanat.musicstream.domain.model.TrendScore;
import com.baykanat.musicstream.domain.service.TrendRanker;
import com.baykanat.musicstream.infrastructure.persistence.TrendScoreJdbcRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/** GET /trends: finalize edilmiş aggregate'lerden anlık trend sıralaması; GET /trends/latest: son saklanan döngü. */
@RestController
@RequestMapping("/trends")
@RequiredArgsConstructor
@Validated
@Tag(name = "Trends", description = "Trend ranking over finalized listening aggregates")
public class TrendController {

    private final TrendRanker trendRanker;
    private final TrendScoreJdbcRepository trendScoreRepository;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Rank trending entities", description = "Scores growth vs. the prior period plus volume, top-N by score")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ranking computed"),
            @ApiResponse(responseCode = "400", description = "Invalid query parameters"),
            @ApiResponse(responseCode = "422", description = "No finalized buckets in the lookback period")
    })
    public ResponseEntity<TrendResponse> getTrends(
            @Parameter(description = "Entity type: USER, ARTIST, GENRE or TRACK", example = "ARTIST")
            @RequestParam(value = "entity_type", defaultValue = "TRACK") EntityType entityType,

            @Parameter(description = "Lookback in days", example = "7")
            @RequestParam(value = "days", defaultValue = "7") @Min(1) @Max(365) int days,

            @Parameter(description = "Maximum number of entries", example = "20")
            @RequestParam(value = "limit", defaultValue = "20") @Min(1) @Max(500) int limit
    ) {
        return ResponseEntity.ok(TrendResponse.from(trendRanker.rank(entityType, days, limit, clock.instant())));
    }

    /** Scheduler'ın son döngüsü: önce bellekteki sıralama, restart sonrası tablo; hiçbiri yoksa boş liste. */
    @GetMapping("/latest")
    @Operation(summary = "Latest published trend cycle")
    public ResponseEntity<TrendResponse> getLatest(
            @RequestParam(value = "entity_type", defaultValue = "TRACK") EntityType entityType,
            @RequestParam(value = "days", defaultValue = "7") @Min(1) @Max(365) int days
    ) {
        Optional<TrendRanking> published = trendRanker.latest(entityType)
                .filter(ranking -> ranking.getLookbackDays() == days);
        if (published.isPresent()) {
            return ResponseEntity.ok(TrendResponse.from(published.get()));
        }

        List<TrendScore> scores = trendScoreRepository.findAll(entityType, days);
        TrendResponse.TrendResponseBuilder response = TrendResponse.builder()
                .entityType(entityType.name())
                .lookbackDays(days)
                .entries(scores.stream()
                        .map(s -> TrendResponse.Entry.builder()
                                .rank(s.getRank())
                                .entityId(s.getEntityId())
                                .score(s.getScore())
                                .currentPlays(s.getCurrentPlays())
                                .previousPlays(s.getPreviousPlays())
                                .build())
                        .toList());
        if (!scores.isEmpty()) {
            response.windowStart(scores.get(0).getWindow().getStart().toString())
                    .windowEnd(scores.get(0).getWindow().getEnd().toString());
        }
        return ResponseEntity.ok(response.build());
    }
}
