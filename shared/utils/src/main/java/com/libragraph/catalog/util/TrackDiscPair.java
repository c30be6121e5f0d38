package com.libragraph.catalog.util;

/**
 * A track or disc position with its optional total, e.g. track 3 of 12.
 * Either side may be null when the source notation did not carry it.
 */
public record TrackDiscPair(Integer number, Integer total) {

    private static final TrackDiscPair EMPTY = new TrackDiscPair(null, null);

    public static TrackDiscPair empty() {
        return EMPTY;
    }

    public static TrackDiscPair of(Integer number) {
        return new TrackDiscPair(number, null);
    }

    public boolean hasNumber() {
        return number != null;
    }

    public boolean hasTotal() {
        return total != null;
    }
}
