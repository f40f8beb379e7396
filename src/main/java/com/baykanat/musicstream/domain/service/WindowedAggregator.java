package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.WindowRollException;
import com.baykanat.musicstream.domain.model.AggregateKey;
import com.baykanat.musicstream.domain.model.AggregateRecord;
import com.baykanat.musicstream.domain.model.AggregationStats;
import com.baykanat.musicstream.domain.model.ApplyOutcome;
import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.FinalizedBucket;
import com.baykanat.musicstream.domain.model.FinalizedSnapshot;
import com.baykanat.musicstream.domain.model.PlayEvent;
import com.baykanat.musicstream.domain.model.RollResult;
import com.baykanat.musicstream.domain.model.WindowBucket;
import com.baykanat.musicstream.domain.model.WindowTotals;
import com.baykanat.musicstream.domain.port.AggregateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Play event'leri slide interval'e hizalı bucket'larda (user, artist, genre, track ve kullanıcı profili boyutları)
 * sayar. Açık bucket'larda her key compute ile tek yazarlı güncellenir; farklı key'ler paralel ilerler.
 *
 * <p>rollWindow kendisiyle eşzamanlı çalışmaz ve read/write lock'un yazma tarafını tutar. Roll sırasında gelen
 * apply roll bitene kadar bekler, sonra late olarak ele alınır: bucket'ı finalize edildiyse düşürülür ve
 * dropped_late_events artar.
 */
@Slf4j
@Service
public class WindowedAggregator {

    private final AggregateStore aggregateStore;
    private final Duration slideInterval;
    private final Duration windowSize;
    private final Duration allowedLateness;
    private final Duration retention;

    private final Counter appliedCounter;
    private final Counter duplicateCounter;
    private final Counter lateAppliedCounter;
    private final Counter droppedLateCounter;

    private final ConcurrentSkipListMap<Instant, OpenBucket> openBuckets = new ConcurrentSkipListMap<>();
    private final ConcurrentSkipListMap<Instant, FinalizedBucket> pendingPersist = new ConcurrentSkipListMap<>();
    private final AtomicReference<FinalizedSnapshot> finalized = new AtomicReference<>(FinalizedSnapshot.empty());

    private final ReentrantReadWriteLock rollGate = new ReentrantReadWriteLock();
    private final ReentrantLock rollLock = new ReentrantLock();

    /** Bitişi bu anı geçmeyen bucket'lar finalize edilmiştir (veya artık açılamaz). */
    private volatile Instant finalizedHorizon = Instant.EPOCH;
    /** Son roll anının bucket başlangıcı; bundan eski timestamp'ler late işaretlenir. */
    private volatile Instant watermark = Instant.EPOCH;

    public WindowedAggregator(AggregateStore aggregateStore, AppProperties appProperties, MeterRegistry meterRegistry) {
        AppProperties.AggregationProperties props = appProperties.getAggregation();
        if (props.getSlideInterval().isZero() || props.getSlideInterval().isNegative()) {
            throw new IllegalArgumentException("app.aggregation.slide-interval must be positive");
        }
        if (props.getWindowSize().toMillis() % props.getSlideInterval().toMillis() != 0
                || props.getWindowSize().compareTo(props.getSlideInterval()) < 0) {
            throw new IllegalArgumentException("app.aggregation.window-size must be a positive multiple of slide-interval");
        }
        this.aggregateStore = aggregateStore;
        this.slideInterval = props.getSlideInterval();
        this.windowSize = props.getWindowSize();
        this.allowedLateness = props.getAllowedLateness();
        this.retention = props.getRetention();

        this.appliedCounter = meterRegistry.counter("musicstream.aggregation.applied");
        this.duplicateCounter = meterRegistry.counter("musicstream.aggregation.duplicates");
        this.lateAppliedCounter = meterRegistry.counter("musicstream.aggregation.late_applied");
        this.droppedLateCounter = meterRegistry.counter("musicstream.aggregation.dropped_late_events");
    }

    /**
     * Event'i timestamp'inin düştüğü bucket'taki tüm boyut key'lerine uygular.
     * Aynı event id aynı bucket'ta ikinci kez gelirse sayılmaz.
     */
    public ApplyOutcome apply(PlayEvent event) {
        WindowBucket bucket = WindowBucket.containing(event.getTimestamp(), slideInterval);

        rollGate.readLock().lock();
        try {
            if (!bucket.getEnd().isAfter(finalizedHorizon)) {
                droppedLateCounter.increment();
                log.warn("Dropped late event: event_id={}, user_id={}, bucket_start={} already finalized",
                        event.getEventId(), event.getUserId(), bucket.getStart());
                return ApplyOutcome.DROPPED_LATE;
            }

            OpenBucket open = openBuckets.computeIfAbsent(bucket.getStart(), start -> new OpenBucket(bucket));
            if (!open.markSeen(event.getEventId())) {
                duplicateCounter.increment();
                log.debug("Duplicate event skipped: event_id={}, bucket_start={}", event.getEventId(), bucket.getStart());
                return ApplyOutcome.DUPLICATE;
            }

            for (AggregateKey key : keysFor(event, bucket)) {
                open.increment(key, event.getDurationPlayedMs(), event.getTimestamp());
            }
            appliedCounter.increment();

            if (event.isLate()) {
                lateAppliedCounter.increment();
                return ApplyOutcome.APPLIED_LATE;
            }
            return ApplyOutcome.APPLIED;
        } finally {
            rollGate.readLock().unlock();
        }
    }

    /**
     * Bitişi + allowedLateness &lt;= now olan açık bucket'ları finalize eder, retention dışında kalanları budar
     * ve bekleyen finalize bucket'ları storage'a yazar. Yazım hatası bu roll'u başarısız kılar; bucket'lar
     * bekleyen listede kalır ve sonraki roll'da tekrar yazılır.
     */
    public RollResult rollWindow(Instant now) {
        rollLock.lock();
        try {
            List<FinalizedBucket> sealed = new ArrayList<>();
            int pruned;

            rollGate.writeLock().lock();
            try {
                Instant horizon = now.minus(allowedLateness);
                if (horizon.isAfter(finalizedHorizon)) {
                    finalizedHorizon = horizon;
                }

                Iterator<OpenBucket> it = openBuckets.values().iterator();
                while (it.hasNext()) {
                    OpenBucket open = it.next();
                    if (open.bucket.getEnd().isAfter(finalizedHorizon)) {
                        break;
                    }
                    sealed.add(open.seal());
                    it.remove();
                }

                Instant pruneBefore = now.minus(retention);
                FinalizedSnapshot previous = finalized.get();
                FinalizedSnapshot next = previous.with(sealed, pruneBefore);
                pruned = previous.size() + sealed.size() - next.size();
                finalized.set(next);

                for (FinalizedBucket bucket : sealed) {
                    pendingPersist.put(bucket.getBucket().getStart(), bucket);
                }
                pendingPersist.headMap(pruneBefore).entrySet()
                        .removeIf(e -> !e.getValue().getBucket().getEnd().isAfter(pruneBefore));

                Instant rollBucketStart = WindowBucket.containing(now, slideInterval).getStart();
                if (rollBucketStart.isAfter(watermark)) {
                    watermark = rollBucketStart;
                }
            } finally {
                rollGate.writeLock().unlock();
            }

            int persisted = persistPending();
            if (!sealed.isEmpty() || pruned > 0) {
                log.info("Window roll at {}: {} buckets finalized, {} pruned, {} persisted",
                        now, sealed.size(), pruned, persisted);
            }
            return new RollResult(now, sealed.size(), pruned, persisted);
        } finally {
            rollLock.unlock();
        }
    }

    /** Bekleyen bucket'ları sırayla yazar; upsert olduğu için tekrar yazım güvenli. */
    private int persistPending() {
        int persisted = 0;
        for (Map.Entry<Instant, FinalizedBucket> entry : pendingPersist.entrySet()) {
            FinalizedBucket bucket = entry.getValue();
            try {
                aggregateStore.putAll(bucket.getRecords().values());
            } catch (RuntimeException e) {
                throw new WindowRollException(
                        "Failed to persist finalized bucket; will retry on next roll",
                        "bucket_start=" + bucket.getBucket().getStart() + ", records=" + bucket.getRecords().size(),
                        e);
            }
            pendingPersist.remove(entry.getKey());
            persisted++;
        }
        return persisted;
    }

    /**
     * Storage'dan okunan finalize bucket'ları yükler (açılışta). Watermark en son yüklenen bucket'ın bitişine
     * ilerler; bu bucket'lara sonradan gelen event'ler late işaretlenir ve düşürülür.
     */
    public void restore(Collection<FinalizedBucket> buckets) {
        if (buckets.isEmpty()) {
            return;
        }
        rollLock.lock();
        try {
            rollGate.writeLock().lock();
            try {
                finalized.set(finalized.get().with(buckets, null));
                for (FinalizedBucket bucket : buckets) {
                    Instant end = bucket.getBucket().getEnd();
                    if (end.isAfter(finalizedHorizon)) {
                        finalizedHorizon = end;
                    }
                    if (end.isAfter(watermark)) {
                        watermark = end;
                    }
                    openBuckets.remove(bucket.getBucket().getStart());
                }
            } finally {
                rollGate.writeLock().unlock();
            }
            log.info("Restored {} finalized buckets, horizon={}", buckets.size(), finalizedHorizon);
        } finally {
            rollLock.unlock();
        }
    }

    /** Roll ile apply arasındaki gate; testler roll sırasında gelen apply'ı kurgulamak için kullanır. */
    ReentrantReadWriteLock rollGate() {
        return rollGate;
    }

    public FinalizedSnapshot finalizedSnapshot() {
        return finalized.get();
    }

    public Instant currentWatermark() {
        return watermark;
    }

    /**
     * now'ı içeren bucket dahil son window-size boyunca (finalize + açık bucket'lar) entity toplamları. Açık ve finalize görünüm roll ile
     * aynı anda değişmesin diye okuma gate'in okuma tarafında yapılır.
     */
    public WindowTotals windowTotals(EntityType type, String entityId, Instant now) {
        Instant to = WindowBucket.containing(now, slideInterval).getEnd();
        Instant from = to.minus(windowSize);
        WindowTotals totals = WindowTotals.zero();

        rollGate.readLock().lock();
        try {
            for (FinalizedBucket bucket : finalized.get().scan(from, to)) {
                totals = bucket.get(new AggregateKey(type, entityId, bucket.getBucket()))
                        .map(totals::plus)
                        .orElse(totals);
            }
            for (OpenBucket open : openBuckets.subMap(from, true, to, false).values()) {
                AggregateRecord record = open.counters.get(new AggregateKey(type, entityId, open.bucket));
                if (record != null) {
                    totals = totals.plus(record);
                }
            }
        } finally {
            rollGate.readLock().unlock();
        }
        return totals;
    }

    /** Kullanıcının since'ten beri dinlediği track id'leri; açık bucket'lar dahil, roll ile tutarlı tek görünüm. */
    public Set<String> recentTracks(String userId, Instant since) {
        Set<String> trackIds = new HashSet<>();
        String prefix = EntityType.userPrefix(userId);
        Instant alignedSince = WindowBucket.containing(since, slideInterval).getStart();

        rollGate.readLock().lock();
        try {
            for (FinalizedBucket bucket : finalized.get().scan(alignedSince, Instant.MAX)) {
                bucket.select(EntityType.USER_TRACK, id -> id.startsWith(prefix))
                        .forEach(r -> trackIds.add(EntityType.valuePart(r.getKey().getEntityId())));
            }
            for (OpenBucket open : openBuckets.tailMap(alignedSince, true).values()) {
                for (AggregateKey key : open.counters.keySet()) {
                    if (key.getEntityType() == EntityType.USER_TRACK && key.getEntityId().startsWith(prefix)) {
                        trackIds.add(EntityType.valuePart(key.getEntityId()));
                    }
                }
            }
        } finally {
            rollGate.readLock().unlock();
        }
        return trackIds;
    }

    public AggregationStats stats() {
        return AggregationStats.builder()
                .appliedEvents((long) appliedCounter.count())
                .duplicateEvents((long) duplicateCounter.count())
                .lateAppliedEvents((long) lateAppliedCounter.count())
                .droppedLateEvents((long) droppedLateCounter.count())
                .openBuckets(openBuckets.size())
                .finalizedBuckets(finalized.get().size())
                .pendingPersistBuckets(pendingPersist.size())
                .watermark(watermark)
                .build();
    }

    private static List<AggregateKey> keysFor(PlayEvent event, WindowBucket bucket) {
        String userId = event.getUserId();
        return List.of(
                new AggregateKey(EntityType.USER, userId, bucket),
                new AggregateKey(EntityType.ARTIST, event.getArtistId(), bucket),
                new AggregateKey(EntityType.GENRE, event.getGenre(), bucket),
                new AggregateKey(EntityType.TRACK, event.getTrackId(), bucket),
                new AggregateKey(EntityType.USER_GENRE, EntityType.compositeId(userId, event.getGenre()), bucket),
                new AggregateKey(EntityType.USER_ARTIST, EntityType.compositeId(userId, event.getArtistId()), bucket),
                new AggregateKey(EntityType.USER_TRACK, EntityType.compositeId(userId, event.getTrackId()), bucket)
        );
    }

    /** Yazmaya açık bucket: event id dedup seti + key başına sayaçlar. */
    private static final class OpenBucket {

        private final WindowBucket bucket;
        private final Set<String> seenEventIds = ConcurrentHashMap.newKeySet();
        private final ConcurrentHashMap<AggregateKey, AggregateRecord> counters = new ConcurrentHashMap<>();

        private OpenBucket(WindowBucket bucket) {
            this.bucket = bucket;
        }

        private boolean markSeen(String eventId) {
            return seenEventIds.add(eventId);
        }

        private void increment(AggregateKey key, long durationMs, Instant at) {
            counters.compute(key, (k, current) -> current == null
                    ? AggregateRecord.first(k, durationMs, at)
                    : current.plus(durationMs, at));
        }

        private FinalizedBucket seal() {
            return new FinalizedBucket(bucket, counters);
        }
    }
}
