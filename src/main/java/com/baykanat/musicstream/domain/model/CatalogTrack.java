package com.baykanat.musicstream.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Katalogdan gelen aday parça (salt okunur). */
@Value
@Builder
public class CatalogTrack {

    String trackId;
    String artistId;
    String genre;
    String title;
    Instant addedAt;
}
