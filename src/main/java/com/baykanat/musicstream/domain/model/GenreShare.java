package com.baykanat.musicstream.domain.model;

import lombok.Value;

/** Kullanıcının bir genre'deki oynatma sayısı ve yüzdesi. */
@Value
public class GenreShare {

    String genre;
    long playCount;
    double percentage;
}
