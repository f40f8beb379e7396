package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.WindowRollException;
import com.baykanat.musicstream.domain.model.AggregateKey;
import com.baykanat.musicstream.domain.model.AggregateRecord;
import com.baykanat.musicstream.domain.model.ApplyOutcome;
import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.FinalizedBucket;
import com.baykanat.musicstream.domain.model.PlayEvent;
import com.baykanat.musicstream.domain.model.RollResult;
import com.baykanat.musicstream.domain.model.WindowBucket;
import com.baykanat.musicstream.domain.model.WindowTotals;
import com.baykanat.musicstream.domain.port.AggregateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for WindowedAggregator.
 *
 * <p>Covers bucket assignment, deduplication, the late-event policy, roll/persist retry
 * and concurrent applies against a single key. Storage is mocked.
 */
@ExtendWith(MockitoExtension.class)
class WindowedAggregatorTest {

    /** Bucket [10:00, 11:00) on 2026-02-15. */
    private static final Instant TEN = Instant.parse("2026-02-15T10:00:00Z");
    private static final WindowBucket TEN_BUCKET = new WindowBucket(TEN, TEN.plus(Duration.ofHours(1)));

    @Mock
    private AggregateStore aggregateStore;

    private AppProperties appProperties;
    private SimpleMeterRegistry meterRegistry;
    private WindowedAggregator aggregator;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        meterRegistry = new SimpleMeterRegistry();
        aggregator = new WindowedAggregator(aggregateStore, appProperties, meterRegistry);
    }

    static PlayEvent play(String eventId, String userId, String trackId, Instant ts) {
        return PlayEvent.builder()
                .eventId(eventId)
                .userId(userId)
                .trackId(trackId)
                .artistId("art_1")
                .genre("rock")
                .timestamp(ts)
                .durationPlayedMs(1000L)
                .build();
    }

    private long finalizedPlays(EntityType type, String entityId, WindowBucket bucket) {
        return aggregator.finalizedSnapshot().scan(bucket.getStart(), bucket.getEnd()).stream()
                .flatMap(b -> b.get(new AggregateKey(type, entityId, bucket)).stream())
                .mapToLong(AggregateRecord::getPlayCount)
                .sum();
    }

    @Test
    @DisplayName("Event is counted once under every dimension of its bucket")
    void eventIsCountedInEveryDimension() {
        aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(900)));
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(65)));

        assertThat(finalizedPlays(EntityType.USER, "u1", TEN_BUCKET)).isEqualTo(1);
        assertThat(finalizedPlays(EntityType.TRACK, "t1", TEN_BUCKET)).isEqualTo(1);
        assertThat(finalizedPlays(EntityType.ARTIST, "art_1", TEN_BUCKET)).isEqualTo(1);
        assertThat(finalizedPlays(EntityType.GENRE, "rock", TEN_BUCKET)).isEqualTo(1);
        assertThat(finalizedPlays(EntityType.USER_GENRE, "u1/rock", TEN_BUCKET)).isEqualTo(1);
        assertThat(finalizedPlays(EntityType.USER_TRACK, "u1/t1", TEN_BUCKET)).isEqualTo(1);
    }

    @Test
    @DisplayName("Applying the same event id twice increments counters once")
    void duplicateEventIsIgnored() {
        PlayEvent event = play("e1", "u1", "t1", TEN.plusSeconds(60));

        assertThat(aggregator.apply(event)).isEqualTo(ApplyOutcome.APPLIED);
        assertThat(aggregator.apply(event)).isEqualTo(ApplyOutcome.DUPLICATE);
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(65)));

        assertThat(finalizedPlays(EntityType.TRACK, "t1", TEN_BUCKET)).isEqualTo(1);
        assertThat(aggregator.stats().getDuplicateEvents()).isEqualTo(1);
    }

    @Test
    @DisplayName("Events in different buckets are counted separately and sum over the range")
    void countsAreAdditiveAcrossBuckets() {
        aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(60)));
        aggregator.apply(play("e2", "u1", "t1", TEN.plusSeconds(120)));
        aggregator.apply(play("e3", "u2", "t1", TEN.plus(Duration.ofMinutes(70))));
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(125)));

        WindowBucket eleven = new WindowBucket(TEN_BUCKET.getEnd(), TEN_BUCKET.getEnd().plus(Duration.ofHours(1)));
        assertThat(finalizedPlays(EntityType.TRACK, "t1", TEN_BUCKET)).isEqualTo(2);
        assertThat(finalizedPlays(EntityType.TRACK, "t1", eleven)).isEqualTo(1);
        assertThat(aggregator.finalizedSnapshot().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Event for an already finalized bucket is dropped and counted, finalized values unchanged")
    void lateEventForFinalizedBucketIsDropped() {
        aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(60)));
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(65)));

        ApplyOutcome outcome = aggregator.apply(play("e2", "u1", "t1", TEN.plusSeconds(1800)).toBuilder().late(true).build());

        assertThat(outcome).isEqualTo(ApplyOutcome.DROPPED_LATE);
        assertThat(finalizedPlays(EntityType.TRACK, "t1", TEN_BUCKET)).isEqualTo(1);
        assertThat(aggregator.stats().getDroppedLateEvents()).isEqualTo(1);
        assertThat(meterRegistry.counter("musicstream.aggregation.dropped_late_events").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Late event within allowed lateness is applied to its open bucket")
    void lateEventWithinGraceIsApplied() {
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(62)));
        assertThat(aggregator.currentWatermark()).isEqualTo(TEN_BUCKET.getEnd());

        ApplyOutcome outcome = aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(1800)).toBuilder().late(true).build());
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(66)));

        assertThat(outcome).isEqualTo(ApplyOutcome.APPLIED_LATE);
        assertThat(finalizedPlays(EntityType.TRACK, "t1", TEN_BUCKET)).isEqualTo(1);
        assertThat(aggregator.stats().getLateAppliedEvents()).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent applies to the same key lose no increments")
    void concurrentAppliesAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        aggregator.apply(play("e-" + worker + "-" + i, "u" + worker, "t1", TEN.plusSeconds(i)));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(65)));

        assertThat(finalizedPlays(EntityType.TRACK, "t1", TEN_BUCKET)).isEqualTo((long) threads * perThread);
        assertThat(finalizedPlays(EntityType.GENRE, "rock", TEN_BUCKET)).isEqualTo((long) threads * perThread);
        assertThat(aggregator.stats().getAppliedEvents()).isEqualTo((long) threads * perThread);
    }

    @Test
    @DisplayName("Failed persist keeps the bucket pending and the next roll writes it")
    void failedPersistIsRetriedOnNextRoll() {
        doThrow(new RuntimeException("connection refused"))
                .doNothing()
                .when(aggregateStore).putAll(anyCollection());

        aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(60)));

        assertThatThrownBy(() -> aggregator.rollWindow(TEN.plus(Duration.ofMinutes(65))))
                .isInstanceOf(WindowRollException.class)
                .hasMessageContaining("retry");
        assertThat(aggregator.stats().getPendingPersistBuckets()).isEqualTo(1);
        assertThat(aggregator.finalizedSnapshot().scan(TEN_BUCKET.getStart(), TEN_BUCKET.getEnd())).hasSize(1);

        RollResult retry = aggregator.rollWindow(TEN.plus(Duration.ofMinutes(66)));

        assertThat(retry.getPersistedBuckets()).isEqualTo(1);
        assertThat(aggregator.stats().getPendingPersistBuckets()).isZero();
        verify(aggregateStore, times(2)).putAll(anyCollection());
    }

    @Test
    @DisplayName("Buckets older than retention are pruned from the finalized view")
    void oldBucketsArePruned() {
        appProperties.getAggregation().setRetention(Duration.ofHours(3));
        aggregator = new WindowedAggregator(aggregateStore, appProperties, meterRegistry);
        doNothing().when(aggregateStore).putAll(anyCollection());

        aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(60)));
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(65)));
        assertThat(aggregator.finalizedSnapshot().size()).isEqualTo(1);

        RollResult later = aggregator.rollWindow(TEN.plus(Duration.ofHours(5)));

        assertThat(later.getPrunedBuckets()).isEqualTo(1);
        assertThat(aggregator.finalizedSnapshot().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Window totals cover finalized and open buckets inside the window size")
    void windowTotalsSpanFinalizedAndOpenBuckets() {
        appProperties.getAggregation().setWindowSize(Duration.ofHours(3));
        aggregator = new WindowedAggregator(aggregateStore, appProperties, meterRegistry);

        aggregator.apply(play("e0", "u1", "t1", TEN.minus(Duration.ofMinutes(30))));
        aggregator.apply(play("e1", "u1", "t1", TEN.plus(Duration.ofMinutes(15))));
        aggregator.apply(play("e2", "u1", "t1", TEN.plus(Duration.ofMinutes(75))));
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(125)));
        aggregator.apply(play("e3", "u1", "t1", TEN.plus(Duration.ofMinutes(130))));

        WindowTotals totals = aggregator.windowTotals(EntityType.TRACK, "t1", TEN.plus(Duration.ofMinutes(150)));

        assertThat(totals.getPlayCount()).isEqualTo(3);
        assertThat(totals.getTotalDurationMs()).isEqualTo(3000L);
    }

    @Test
    @DisplayName("Recent tracks include open buckets and only the given user")
    void recentTracksIncludeOpenBuckets() {
        aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(60)));
        aggregator.rollWindow(TEN.plus(Duration.ofMinutes(65)));
        aggregator.apply(play("e2", "u1", "t2", TEN.plus(Duration.ofMinutes(70))));
        aggregator.apply(play("e3", "u10", "t3", TEN.plus(Duration.ofMinutes(70))));

        assertThat(aggregator.recentTracks("u1", TEN)).containsExactlyInAnyOrder("t1", "t2");
        assertThat(aggregator.recentTracks("u1", TEN.plus(Duration.ofMinutes(61)))).containsExactly("t2");
    }

    @Test
    @DisplayName("Restored buckets are readable and reject later events")
    void restoredBucketsAreFinal() {
        AggregateRecord record = AggregateRecord.first(new AggregateKey(EntityType.TRACK, "t1", TEN_BUCKET), 1000L, TEN);
        aggregator.restore(List.of(FinalizedBucket.of(TEN_BUCKET, List.of(record))));

        assertThat(finalizedPlays(EntityType.TRACK, "t1", TEN_BUCKET)).isEqualTo(1);
        assertThat(aggregator.currentWatermark()).isEqualTo(TEN_BUCKET.getEnd());
        assertThat(aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(60)))).isEqualTo(ApplyOutcome.DROPPED_LATE);
    }

    @Test
    @DisplayName("Window size that is not a multiple of the slide interval is rejected")
    void invalidWindowSizeIsRejected() {
        appProperties.getAggregation().setWindowSize(Duration.ofMinutes(90));

        assertThatThrownBy(() -> new WindowedAggregator(aggregateStore, appProperties, meterRegistry))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Apply arriving while a roll holds the gate waits, then is dropped late against the sealed bucket")
    void applyDuringRollWaitsAndIsDroppedLate() throws Exception {
        aggregator.apply(play("e1", "u1", "t1", TEN.plusSeconds(60)));
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<ApplyOutcome> pending;

        aggregator.rollGate().writeLock().lock();
        try {
            pending = pool.submit(() -> aggregator.apply(play("e2", "u1", "t1", TEN.plusSeconds(120))));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!aggregator.rollGate().hasQueuedThreads() && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertThat(aggregator.rollGate().hasQueuedThreads()).isTrue();
            assertThat(pending.isDone()).isFalse();

            aggregator.rollWindow(TEN.plus(Duration.ofMinutes(65)));
            assertThat(pending.isDone()).isFalse();
        } finally {
            aggregator.rollGate().writeLock().unlock();
        }

        try {
            assertThat(pending.get(5, TimeUnit.SECONDS)).isEqualTo(ApplyOutcome.DROPPED_LATE);
        } finally {
            pool.shutdownNow();
        }
        assertThat(finalizedPlays(EntityType.TRACK, "t1", TEN_BUCKET)).isEqualTo(1);
        assertThat(aggregator.stats().getDroppedLateEvents()).isEqualTo(1);
    }

    @Test
    @DisplayName("Readers never miss a bucket while it moves from open to finalized")
    void readersSeeEveryBucketDuringRolls() throws Exception {
        int plays = 3000;
        appProperties.getAggregation().setSlideInterval(Duration.ofSeconds(1));
        appProperties.getAggregation().setWindowSize(Duration.ofSeconds(plays));
        appProperties.getAggregation().setAllowedLateness(Duration.ZERO);
        aggregator = new WindowedAggregator(aggregateStore, appProperties, meterRegistry);

        for (int i = 0; i < plays; i++) {
            aggregator.apply(play("e" + i, "u1", "t" + i, TEN.plusSeconds(i)));
        }
        Instant readAt = TEN.plusSeconds(plays - 1);

        AtomicBoolean rolling = new AtomicBoolean(true);
        AtomicInteger misses = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> reader = pool.submit(() -> {
                while (rolling.get()) {
                    if (aggregator.recentTracks("u1", TEN).size() != plays) {
                        misses.incrementAndGet();
                    }
                    if (aggregator.windowTotals(EntityType.USER, "u1", readAt).getPlayCount() != plays) {
                        misses.incrementAndGet();
                    }
                }
            });
            Future<?> roller = pool.submit(() -> {
                try {
                    for (int i = 1; i <= plays; i++) {
                        aggregator.rollWindow(TEN.plusSeconds(i));
                    }
                } finally {
                    rolling.set(false);
                }
            });
            roller.get(60, TimeUnit.SECONDS);
            reader.get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(aggregator.finalizedSnapshot().size()).isEqualTo(plays);
        assertThat(misses.get()).isZero();
    }
}
