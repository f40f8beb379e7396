package com.baykanat.musicstream.infrastructure.persistence;

import com.baykanat.musicstream.domain.model.AggregateKey;
import com.baykanat.musicstream.domain.model.AggregateRecord;
import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.WindowBucket;
import com.baykanat.musicstream.domain.port.AggregateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** aggregate_records tablosu: finalize edilmiş bucket kayıtları. ON CONFLICT upsert ile tekrar yazım idempotent. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class AggregateJdbcRepository implements AggregateStore {

    private static final String UPSERT_SQL = """
            INSERT INTO aggregate_records
                (entity_type, entity_id, bucket_start, bucket_end, play_count, total_duration_ms, last_updated)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (entity_type, entity_id, bucket_start) DO UPDATE SET
                bucket_end = EXCLUDED.bucket_end,
                play_count = EXCLUDED.play_count,
                total_duration_ms = EXCLUDED.total_duration_ms,
                last_updated = EXCLUDED.last_updated
            """;

    private static final RowMapper<AggregateRecord> ROW_MAPPER = (rs, rowNum) -> {
        WindowBucket bucket = new WindowBucket(
                rs.getTimestamp("bucket_start").toInstant(),
                rs.getTimestamp("bucket_end").toInstant());
        Timestamp lastUpdated = rs.getTimestamp("last_updated");
        return AggregateRecord.builder()
                .key(new AggregateKey(EntityType.valueOf(rs.getString("entity_type")), rs.getString("entity_id"), bucket))
                .playCount(rs.getLong("play_count"))
                .totalDurationMs(rs.getLong("total_duration_ms"))
                .lastUpdated(lastUpdated != null ? lastUpdated.toInstant() : null)
                .build();
    };

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<AggregateRecord> get(AggregateKey key) {
        String sql = """
                SELECT entity_type, entity_id, bucket_start, bucket_end, play_count, total_duration_ms, last_updated
                FROM aggregate_records
                WHERE entity_type = ? AND entity_id = ? AND bucket_start = ?
                """;
        List<AggregateRecord> rows = jdbcTemplate.query(sql, ROW_MAPPER,
                key.getEntityType().name(), key.getEntityId(), Timestamp.from(key.getBucket().getStart()));
        return rows.stream().findFirst();
    }

    @Override
    public void put(AggregateKey key, AggregateRecord record) {
        if (!key.equals(record.getKey())) {
            throw new IllegalArgumentException("Record key " + record.getKey() + " does not match " + key);
        }
        jdbcTemplate.update(UPSERT_SQL, toArgs(record));
    }

    /** Bucket kayıtlarını tek transaction'da toplu upsert eder. */
    @Override
    @Transactional
    public void putAll(Collection<AggregateRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<Object[]> batchArgs = records.stream()
                .map(AggregateJdbcRepository::toArgs)
                .toList();
        jdbcTemplate.batchUpdate(UPSERT_SQL, Objects.requireNonNull(batchArgs));
        log.debug("Upserted {} aggregate records", records.size());
    }

    @Override
    public List<AggregateRecord> scanRange(Instant windowStart, Instant windowEnd) {
        String sql = """
                SELECT entity_type, entity_id, bucket_start, bucket_end, play_count, total_duration_ms, last_updated
                FROM aggregate_records
                WHERE bucket_start >= ? AND bucket_start < ?
                ORDER BY bucket_start
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(windowStart), Timestamp.from(windowEnd));
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM aggregate_records WHERE bucket_end <= ?", Timestamp.from(cutoff));
    }

    private static Object[] toArgs(AggregateRecord record) {
        AggregateKey key = record.getKey();
        return new Object[]{
                key.getEntityType().name(),
                key.getEntityId(),
                Timestamp.from(key.getBucket().getStart()),
                Timestamp.from(key.getBucket().getEnd()),
                record.getPlayCount(),
                record.getTotalDurationMs(),
                record.getLastUpdated() != null ? Timestamp.from(record.getLastUpdated()) : null
        };
    }
}
