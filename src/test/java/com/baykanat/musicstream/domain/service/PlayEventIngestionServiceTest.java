package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.api.dto.PlayEventRequest;
import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.mapper.PlayEventMapper;
import com.baykanat.musicstream.domain.model.IngestionSummary;
import com.baykanat.musicstream.domain.port.AggregateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for PlayEventIngestionService.
 *
 * <p>Verifies the consumer-side batch pipeline with a real normalizer and aggregator:
 * <ul>
 *   <li>Invalid payloads are dropped and counted, the rest of the batch continues</li>
 *   <li>Redelivered events are deduplicated</li>
 *   <li>Events for finalized buckets are dropped late</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class PlayEventIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-15T12:00:00Z");

    @Mock
    private AggregateStore aggregateStore;

    private SimpleMeterRegistry meterRegistry;
    private WindowedAggregator aggregator;
    private PlayEventIngestionService service;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        meterRegistry = new SimpleMeterRegistry();
        aggregator = new WindowedAggregator(aggregateStore, appProperties, meterRegistry);
        EventNormalizer normalizer = new EventNormalizer(Mappers.getMapper(PlayEventMapper.class),
                new IdempotencyService(), appProperties, Clock.fixed(NOW, ZoneOffset.UTC));
        service = new PlayEventIngestionService(normalizer, aggregator, meterRegistry);
    }

    private static PlayEventRequest play(String eventId, String userId, Instant at) {
        return PlayEventRequest.builder()
                .eventId(eventId)
                .userId(userId)
                .trackId("trk_1")
                .artistId("art_1")
                .genre("rock")
                .timestamp(at.getEpochSecond())
                .durationPlayedMs(1000L)
                .build();
    }

    @Test
    @DisplayName("Process batch - valid events are applied to the aggregator")
    void processBatchAppliesValidEvents() {
        IngestionSummary summary = service.processBatch(List.of(
                play("e1", "u1", NOW.minusSeconds(60)),
                play("e2", "u2", NOW.minusSeconds(30))));

        assertThat(summary.getApplied()).isEqualTo(2);
        assertThat(aggregator.stats().getAppliedEvents()).isEqualTo(2);
        assertThat(aggregator.stats().getOpenBuckets()).isEqualTo(1);
    }

    @Test
    @DisplayName("Process batch - invalid events are counted and skipped, the rest continues")
    void processBatchSkipsInvalidEvents() {
        PlayEventRequest missingUser = play("e2", null, NOW.minusSeconds(60));
        PlayEventRequest future = play("e3", "u3", NOW.plus(Duration.ofHours(1)));

        IngestionSummary summary = service.processBatch(List.of(
                play("e1", "u1", NOW.minusSeconds(60)), missingUser, future));

        assertThat(summary.getApplied()).isEqualTo(1);
        assertThat(summary.getInvalid()).isEqualTo(2);
        assertThat(summary.total()).isEqualTo(3);
        assertThat(meterRegistry.counter("musicstream.events.invalid").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Process batch - redelivered batch is deduplicated")
    void processBatchDeduplicatesRedelivery() {
        List<PlayEventRequest> batch = List.of(play("e1", "u1", NOW.minusSeconds(60)));

        service.processBatch(batch);
        IngestionSummary redelivered = service.processBatch(batch);

        assertThat(redelivered.getApplied()).isZero();
        assertThat(redelivered.getDuplicates()).isEqualTo(1);
    }

    @Test
    @DisplayName("Process batch - event for a finalized bucket is dropped late")
    void processBatchDropsLateEvents() {
        service.processBatch(List.of(play("e1", "u1", NOW.minus(Duration.ofHours(2)))));
        aggregator.rollWindow(NOW);

        IngestionSummary summary = service.processBatch(List.of(play("e2", "u1", NOW.minus(Duration.ofHours(2)))));

        assertThat(summary.getDroppedLate()).isEqualTo(1);
        assertThat(summary.getApplied()).isZero();
    }

    @Test
    @DisplayName("Process batch - out-of-range timestamp is dropped without failing the events after it")
    void processBatchSurvivesOutOfRangeTimestamp() {
        PlayEventRequest outOfRange = play("e2", "u2", NOW);
        outOfRange.setTimestamp(Long.MAX_VALUE);

        IngestionSummary summary = service.processBatch(List.of(
                play("e1", "u1", NOW.minusSeconds(60)),
                outOfRange,
                play("e3", "u3", NOW.minusSeconds(30))));

        assertThat(summary.getApplied()).isEqualTo(2);
        assertThat(summary.getInvalid()).isEqualTo(1);
        assertThat(meterRegistry.counter("musicstream.events.invalid").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Process batch - empty list returns zeros without touching storage")
    void processBatchHandlesEmptyList() {
        IngestionSummary summary = service.processBatch(Collections.emptyList());

        assertThat(summary.total()).isZero();
        verifyNoInteractions(aggregateStore);
    }
}
