package com.baykanat.musicstream.domain.model;

/** Aggregate boyutları; USER_* tipleri kullanıcı profili için "userId/değer" şeklinde bileşik id taşır. */
public enum EntityType {

    USER,
    ARTIST,
    GENRE,
    TRACK,
    USER_GENRE,
    USER_ARTIST,
    USER_TRACK;

    private static final String COMPOSITE_SEPARATOR = "/";

    /** Profil boyutları için bileşik entity id üretir. */
    public static String compositeId(String userId, String value) {
        return userId + COMPOSITE_SEPARATOR + value;
    }

    /** Bileşik id'nin kullanıcıdan sonraki kısmını döner; bileşik değilse id'nin kendisi. */
    public static String valuePart(String compositeId) {
        int idx = compositeId.indexOf(COMPOSITE_SEPARATOR);
        return idx < 0 ? compositeId : compositeId.substring(idx + 1);
    }

    /** Bileşik id için prefix; scan'lerde kullanıcının kayıtlarını süzmek için. */
    public static String userPrefix(String userId) {
        return userId + COMPOSITE_SEPARATOR;
    }

    public boolean isProfileDimension() {
        return this == USER_GENRE || this == USER_ARTIST || this == USER_TRACK;
    }
}
