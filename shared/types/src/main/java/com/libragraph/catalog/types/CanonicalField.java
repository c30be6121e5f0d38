package com.libragraph.catalog.types;

/**
 * Metadata keys shared by every dialect.
 * Numeric fields carry {@link Integer} values, all others {@link String}.
 */
public enum CanonicalField {
    TITLE("title", false),
    ARTIST("artist", false),
    ALBUM("album", false),
    ALBUM_ARTIST("album_artist", false),
    GENRE("genre", false),
    DATE("date", false),
    LANGUAGE("language", false),
    PUBLISHER("publisher", false),
    TRACK("track", true),
    TRACK_TOTAL("track_total", true),
    DISC("disc", true),
    DISC_TOTAL("disc_total", true),
    AUTHOR("author", false),
    IDENTIFIER("identifier", false),
    LYRICS("lyrics", false),
    ENCODER("encoder", false),
    COMPOSER("composer", false),
    COMMENT("comment", false);

    private final String key;
    private final boolean numeric;

    CanonicalField(String key, boolean numeric) {
        this.key = key;
        this.numeric = numeric;
    }

    /** Snake-case name used in exported maps and JSON. */
    public String key() {
        return key;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public static CanonicalField fromKey(String key) {
        for (CanonicalField f : values()) {
            if (f.key.equals(key)) return f;
        }
        throw new IllegalArgumentException("Unknown canonical field: " + key);
    }
}
