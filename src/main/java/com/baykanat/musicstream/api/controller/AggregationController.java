package com.baykanat.musicstream.api.controller;

import com.baykanat.musicstream.api.dto.AggregationStatsResponse;
import com.baykanat.musicstream.domain.model.AggregationStats;
import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.RollResult;
import com.baykanat.musicstream.domain.model.WindowTotals;
import com.baykanat.musicstream.domain.service.WindowedAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/** Aggregator sayaçları, tek entity için sliding pencere toplamı ve manuel window roll (operasyon amaçlı). */
@Slf4j
@RestController
@RequestMapping("/aggregation")
@RequiredArgsConstructor
@Tag(name = "Aggregation", description = "Windowed aggregator state")
public class AggregationController {

    private final WindowedAggregator aggregator;
    private final Clock clock;

    @GetMapping("/stats")
    @Operation(summary = "Aggregator counters", description = "Applied, duplicate, late and dropped-late event counts and bucket state")
    public ResponseEntity<AggregationStatsResponse> getStats() {
        AggregationStats stats = aggregator.stats();
        return ResponseEntity.ok(AggregationStatsResponse.builder()
                .appliedEvents(stats.getAppliedEvents())
                .duplicateEvents(stats.getDuplicateEvents())
                .lateAppliedEvents(stats.getLateAppliedEvents())
                .droppedLateEvents(stats.getDroppedLateEvents())
                .openBuckets(stats.getOpenBuckets())
                .finalizedBuckets(stats.getFinalizedBuckets())
                .pendingPersistBuckets(stats.getPendingPersistBuckets())
                .watermark(stats.getWatermark().toString())
                .build());
    }

    /** Bir entity'nin now'ı içeren bucket'a kadar son window-size toplamı; açık bucket'lar dahil. */
    @GetMapping("/totals")
    @Operation(summary = "Sliding-window totals for one entity")
    public ResponseEntity<Map<String, Object>> getTotals(
            @RequestParam("entity_type") EntityType entityType,
            @RequestParam("entity_id") String entityId
    ) {
        WindowTotals totals = aggregator.windowTotals(entityType, entityId, clock.instant());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entity_type", entityType.name());
        body.put("entity_id", entityId);
        body.put("play_count", totals.getPlayCount());
        body.put("total_duration_ms", totals.getTotalDurationMs());
        return ResponseEntity.ok(body);
    }

    /** Scheduler'ı beklemeden roll tetikler; roll kendisiyle eşzamanlı çalışmaz. */
    @PostMapping("/roll")
    @Operation(summary = "Trigger a window roll now")
    public ResponseEntity<Map<String, Object>> roll() {
        RollResult result = aggregator.rollWindow(clock.instant());
        log.info("Manual window roll: {}", result);
        return ResponseEntity.ok(Map.of(
                "rolled_at", result.getRolledAt().toString(),
                "finalized_buckets", result.getFinalizedBuckets(),
                "pruned_buckets", result.getPrunedBuckets(),
                "persisted_buckets", result.getPersistedBuckets()));
    }
}
