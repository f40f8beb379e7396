package com.baykanat.musicstream.domain.model;

import lombok.Getter;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/** Finalize edilmiş, salt okunur bucket; tüm kayıtlar bu bucket'a ait AggregateKey'lerle tutulur. */
@Getter
public final class FinalizedBucket {

    private final WindowBucket bucket;
    private final Map<AggregateKey, AggregateRecord> records;

    public FinalizedBucket(WindowBucket bucket, Map<AggregateKey, AggregateRecord> records) {
        for (AggregateKey key : records.keySet()) {
            if (!bucket.equals(key.getBucket())) {
                throw new IllegalArgumentException("Record key " + key + " does not belong to bucket " + bucket);
            }
        }
        this.bucket = bucket;
        this.records = Map.copyOf(records);
    }

    /** Kayıtlardan bucket'ı kurar; hepsinin aynı bucket'a ait olması beklenir. */
    public static FinalizedBucket of(WindowBucket bucket, Collection<AggregateRecord> records) {
        return new FinalizedBucket(bucket, records.stream()
                .collect(Collectors.toMap(AggregateRecord::getKey, r -> r)));
    }

    public Optional<AggregateRecord> get(AggregateKey key) {
        return Optional.ofNullable(records.get(key));
    }

    /** Tip ve id filtresine uyan kayıtlar. */
    public Collection<AggregateRecord> select(EntityType type, Predicate<String> entityIdFilter) {
        return records.values().stream()
                .filter(r -> r.getKey().getEntityType() == type)
                .filter(r -> entityIdFilter.test(r.getKey().getEntityId()))
                .toList();
    }
}
