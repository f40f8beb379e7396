package com.baykanat.musicstream.domain.port;

import com.baykanat.musicstream.domain.model.AggregateKey;
import com.baykanat.musicstream.domain.model.AggregateRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Finalize edilmiş aggregate'lerin kalıcı deposu. put upsert'tür; aynı kaydın tekrar yazılması güvenlidir. */
public interface AggregateStore {

    Optional<AggregateRecord> get(AggregateKey key);

    void put(AggregateKey key, AggregateRecord record);

    /** Aynı bucket'ın kayıtlarını toplu yazar. */
    void putAll(Collection<AggregateRecord> records);

    /** Bucket başlangıcı [windowStart, windowEnd) aralığında olan kayıtlar. */
    List<AggregateRecord> scanRange(Instant windowStart, Instant windowEnd);

    /** Bitişi cutoff'tan önce olan kayıtları siler; silinen sayıyı döner. */
    int deleteOlderThan(Instant cutoff);
}
