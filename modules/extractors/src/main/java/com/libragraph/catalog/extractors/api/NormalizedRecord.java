package com.libragraph.catalog.extractors.api;

import com.fasterxml.jackson.annotation.JsonValue;
import com.libragraph.catalog.types.CanonicalField;
import com.libragraph.catalog.types.TagFormat;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Uniform metadata record produced by every extractor, whatever the source dialect.
 * Optional attributes are null when the source does not expose them; a field is
 * never present with a null or blank value.
 *
 * @param container   lowercase file-type tag taken from the extension (mp3, mkv, epub)
 * @param tagFormat   dialect the fields were read from
 * @param fields      canonical field → String, or Integer for track/disc numbers
 * @param durationMs  duration in whole milliseconds, only when positive
 * @param chapters    chapter count, only when greater than zero
 * @param hasCoverArt embedded cover art presence, only when the dialect can tell
 */
public record NormalizedRecord(
        String container,
        TagFormat tagFormat,
        Map<CanonicalField, Object> fields,
        Long durationMs,
        Integer chapters,
        Boolean hasCoverArt
) {
    public NormalizedRecord {
        Objects.requireNonNull(container, "container cannot be null");
        Objects.requireNonNull(tagFormat, "tagFormat cannot be null");
        Objects.requireNonNull(fields, "fields cannot be null");
        EnumMap<CanonicalField, Object> copy = new EnumMap<>(CanonicalField.class);
        fields.forEach((field, value) -> copy.put(field, checkValue(field, value)));
        fields = Collections.unmodifiableMap(copy);
        if (durationMs != null && durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative, got: " + durationMs);
        }
        if (chapters != null && chapters <= 0) {
            throw new IllegalArgumentException("chapters must be positive when present, got: " + chapters);
        }
    }

    public static Builder builder(String container, TagFormat tagFormat) {
        return new Builder(container, tagFormat);
    }

    /**
     * True when at least one of fields, duration, chapters or cover-art was populated.
     * Records without data are treated as a failed extraction.
     */
    public boolean hasData() {
        return !fields.isEmpty() || durationMs != null || chapters != null || hasCoverArt != null;
    }

    public Optional<String> text(CanonicalField field) {
        Object value = fields.get(field);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public OptionalInt number(CanonicalField field) {
        Object value = fields.get(field);
        return value instanceof Integer i ? OptionalInt.of(i) : OptionalInt.empty();
    }

    /**
     * Snake-case map view ({@code container}, {@code tag_format}, {@code fields},
     * {@code duration_ms}, {@code chapters}, {@code has_cover_art}); absent optionals are omitted.
     */
    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> fieldMap = new LinkedHashMap<>();
        fields.forEach((field, value) -> fieldMap.put(field.key(), value));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("container", container);
        result.put("tag_format", tagFormat.label());
        result.put("fields", fieldMap);
        if (durationMs != null) result.put("duration_ms", durationMs);
        if (chapters != null) result.put("chapters", chapters);
        if (hasCoverArt != null) result.put("has_cover_art", hasCoverArt);
        return result;
    }

    private static Object checkValue(CanonicalField field, Object value) {
        if (field.isNumeric()) {
            if (!(value instanceof Integer)) {
                throw new IllegalArgumentException(
                        "Field '" + field.key() + "' requires an Integer, got: " + describe(value));
            }
        } else if (!(value instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException(
                    "Field '" + field.key() + "' requires a non-blank String, got: " + describe(value));
        }
        return value;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }

    /**
     * Accumulates fields for one extraction. Null and blank values are dropped
     * so that absent tags never show up as empty fields.
     */
    public static class Builder {
        private final String container;
        private final TagFormat tagFormat;
        private final Map<CanonicalField, Object> fields = new EnumMap<>(CanonicalField.class);
        private Long durationMs;
        private Integer chapters;
        private Boolean hasCoverArt;

        private Builder(String container, TagFormat tagFormat) {
            this.container = container;
            this.tagFormat = tagFormat;
        }

        public Builder text(CanonicalField field, String value) {
            if (field.isNumeric()) {
                throw new IllegalArgumentException("Field '" + field.key() + "' is numeric");
            }
            if (value != null && !value.isBlank()) {
                fields.put(field, value);
            }
            return this;
        }

        public Builder number(CanonicalField field, Integer value) {
            if (!field.isNumeric()) {
                throw new IllegalArgumentException("Field '" + field.key() + "' is not numeric");
            }
            if (value != null) {
                fields.put(field, value);
            }
            return this;
        }

        public Builder fields(Map<CanonicalField, Object> values) {
            values.forEach((field, value) -> {
                if (field.isNumeric()) {
                    number(field, (Integer) value);
                } else {
                    text(field, (String) value);
                }
            });
            return this;
        }

        /** Sets the duration from fractional seconds; non-positive or missing values are ignored. */
        public Builder durationSeconds(Double seconds) {
            if (seconds != null && !seconds.isNaN() && !seconds.isInfinite() && seconds > 0) {
                this.durationMs = (long) Math.floor(seconds * 1000);
            }
            return this;
        }

        public Builder chapters(Integer count) {
            this.chapters = count != null && count > 0 ? count : null;
            return this;
        }

        public Builder hasCoverArt(Boolean present) {
            this.hasCoverArt = present;
            return this;
        }

        public boolean hasFields() {
            return !fields.isEmpty();
        }

        public NormalizedRecord build() {
            return new NormalizedRecord(container, tagFormat, fields, durationMs, chapters, hasCoverArt);
        }
    }
}
