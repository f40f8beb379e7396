package com.baykanat.musicstream.infrastructure.persistence;

import com.baykanat.musicstream.domain.model.CatalogTrack;
import com.baykanat.musicstream.domain.port.TrackCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/** catalog_tracks tablosu (salt okunur); harici metadata entegrasyonu tarafından doldurulur. */
@Repository
@RequiredArgsConstructor
public class CatalogJdbcRepository implements TrackCatalog {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<CatalogTrack> findCandidates(Collection<String> genres, Collection<String> artistIds, int limit) {
        if (genres.isEmpty() && artistIds.isEmpty()) {
            return List.of();
        }

        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (!genres.isEmpty()) {
            conditions.add("genre IN (" + placeholders(genres.size()) + ")");
            params.addAll(genres);
        }
        if (!artistIds.isEmpty()) {
            conditions.add("artist_id IN (" + placeholders(artistIds.size()) + ")");
            params.addAll(artistIds);
        }
        params.add(limit);

        String sql = "SELECT track_id, artist_id, genre, title, added_at FROM catalog_tracks WHERE "
                + String.join(" OR ", conditions)
                + " ORDER BY added_at DESC NULLS LAST, track_id LIMIT ?";

        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            Timestamp addedAt = rs.getTimestamp("added_at");
            return CatalogTrack.builder()
                    .trackId(rs.getString("track_id"))
                    .artistId(rs.getString("artist_id"))
                    .genre(rs.getString("genre"))
                    .title(rs.getString("title"))
                    .addedAt(addedAt != null ? addedAt.toInstant() : null)
                    .build();
        }, params.toArray());
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }
}
