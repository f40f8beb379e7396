package com.baykanat.musicstream.infrastructure.persistence;

import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.TrendRanking;
import com.baykanat.musicstream.domain.model.TrendScore;
import com.baykanat.musicstream.domain.model.WindowBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;

/** trend_scores tablosu; (entity_type, lookback_days) için sıralama tek transaction'da komple değiştirilir. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TrendScoreJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Önceki döngünün satırlarını siler, yenilerini ekler; okuyucu karışık döngü görmez. */
    @Transactional
    public void replaceAll(TrendRanking ranking) {
        jdbcTemplate.update("DELETE FROM trend_scores WHERE entity_type = ? AND lookback_days = ?",
                ranking.getEntityType().name(), ranking.getLookbackDays());

        if (ranking.getScores().isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO trend_scores
                    (entity_type, lookback_days, entity_id, score, rank, current_plays, previous_plays,
                     window_start, window_end, generated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        Timestamp windowStart = Timestamp.from(ranking.getWindow().getStart());
        Timestamp windowEnd = Timestamp.from(ranking.getWindow().getEnd());
        Timestamp generatedAt = Timestamp.from(ranking.getGeneratedAt());

        List<Object[]> batchArgs = ranking.getScores().stream()
                .map(s -> new Object[]{
                        s.getEntityType().name(), ranking.getLookbackDays(), s.getEntityId(), s.getScore(),
                        s.getRank(), s.getCurrentPlays(), s.getPreviousPlays(), windowStart, windowEnd, generatedAt})
                .toList();
        jdbcTemplate.batchUpdate(sql, Objects.requireNonNull(batchArgs));
        log.debug("Replaced trend scores for entity_type={}, lookback_days={}: {} rows",
                ranking.getEntityType(), ranking.getLookbackDays(), batchArgs.size());
    }

    /** Saklanan son döngünün skorları, rank sırasıyla. */
    public List<TrendScore> findAll(EntityType entityType, int lookbackDays) {
        return jdbcTemplate.query("""
                        SELECT entity_id, score, rank, current_plays, previous_plays, window_start, window_end
                        FROM trend_scores
                        WHERE entity_type = ? AND lookback_days = ?
                        ORDER BY rank
                        """,
                (rs, rowNum) -> TrendScore.builder()
                        .entityType(entityType)
                        .entityId(rs.getString("entity_id"))
                        .window(new WindowBucket(
                                rs.getTimestamp("window_start").toInstant(),
                                rs.getTimestamp("window_end").toInstant()))
                        .score(rs.getDouble("score"))
                        .rank(rs.getInt("rank"))
                        .currentPlays(rs.getLong("current_plays"))
                        .previousPlays(rs.getLong("previous_plays"))
                        .build(),
                entityType.name(), lookbackDays);
    }
}
