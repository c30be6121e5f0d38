package com.libragraph.catalog.extractors.video;

import java.util.Map;
import java.util.Objects;

/**
 * One typed track reported by a {@link VideoContainerDecoder}.
 *
 * @param type            track kind; every decoded container has a {@link Type#GENERAL} track
 * @param attributes      attribute name → value, using the General-track vocabulary
 *                        ({@code title}, {@code album}, {@code performer}, {@code genre}, {@code recorded_date})
 * @param durationSeconds container duration in seconds, null when unknown
 */
public record MediaTrack(
        Type type,
        Map<String, String> attributes,
        Double durationSeconds
) {
    public enum Type {
        GENERAL,
        VIDEO,
        AUDIO,
        TEXT,
        OTHER
    }

    public MediaTrack {
        Objects.requireNonNull(type, "type cannot be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static MediaTrack general(Map<String, String> attributes, Double durationSeconds) {
        return new MediaTrack(Type.GENERAL, attributes, durationSeconds);
    }
}
