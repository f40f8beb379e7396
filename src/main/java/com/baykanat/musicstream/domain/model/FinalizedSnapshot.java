package com.baykanat.musicstream.domain.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Finalize edilmiş bucket'ların tutarlı görüntüsü. Her roll yeni bir snapshot yayınlar (copy-on-write);
 * okuyucular in-flight apply çağrılarıyla koordinasyon gerektirmez.
 */
public final class FinalizedSnapshot {

    private static final FinalizedSnapshot EMPTY = new FinalizedSnapshot(new TreeMap<>());

    private final NavigableMap<Instant, FinalizedBucket> buckets;

    private FinalizedSnapshot(NavigableMap<Instant, FinalizedBucket> buckets) {
        this.buckets = Collections.unmodifiableNavigableMap(buckets);
    }

    public static FinalizedSnapshot empty() {
        return EMPTY;
    }

    /** Eklenen bucket'lar ve budama sınırıyla yeni snapshot üretir; mevcut snapshot değişmez. */
    public FinalizedSnapshot with(Collection<FinalizedBucket> added, Instant pruneBefore) {
        TreeMap<Instant, FinalizedBucket> next = new TreeMap<>(buckets);
        for (FinalizedBucket bucket : added) {
            next.put(bucket.getBucket().getStart(), bucket);
        }
        if (pruneBefore != null) {
            next.entrySet().removeIf(e -> !e.getValue().getBucket().getEnd().isAfter(pruneBefore));
        }
        return new FinalizedSnapshot(next);
    }

    /** Başlangıcı [from, to) aralığında olan bucket'lar, başlangıca göre sıralı. Her bucket tek bir aralığa düşer. */
    public List<FinalizedBucket> scan(Instant from, Instant to) {
        if (!from.isBefore(to)) {
            return List.of();
        }
        return List.copyOf(buckets.subMap(from, true, to, false).values());
    }

    public int size() {
        return buckets.size();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }
}
