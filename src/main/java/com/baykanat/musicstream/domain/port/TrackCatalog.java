package com.baykanat.musicstream.domain.port;

import com.baykanat.musicstream.domain.model.CatalogTrack;

import java.util.Collection;
import java.util.List;

/** Salt okunur katalog; harici müzik metadata entegrasyonu tarafından doldurulur. */
public interface TrackCatalog {

    /** Genre veya artist'i eşleşen parçalar, en yeni eklenen önce. */
    List<CatalogTrack> findCandidates(Collection<String> genres, Collection<String> artistIds, int limit);
}
