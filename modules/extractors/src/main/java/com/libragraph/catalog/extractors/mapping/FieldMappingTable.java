package com.libragraph.catalog.extractors.mapping;

import com.libragraph.catalog.types.CanonicalField;
import com.libragraph.catalog.types.TagFormat;
import com.libragraph.catalog.util.TrackDiscNotation;
import com.libragraph.catalog.util.TrackDiscPair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Lookup from one dialect's tag keys to canonical fields.
 *
 * <p>Three kinds of entries:
 * <ul>
 *   <li>plain keys: first value of the key becomes the field; numeric fields go
 *       through {@link TrackDiscNotation} and keep only the number part</li>
 *   <li>joined keys: every value of the key, joined with a separator</li>
 *   <li>notation keys: one value split into a number and a total field,
 *       e.g. ID3 {@code TRCK = "3/12"}</li>
 * </ul>
 * Entries are applied in declaration order; when two keys target the same
 * field and both are present, the later one wins.
 */
public final class FieldMappingTable {

    private final TagFormat dialect;
    private final boolean caseInsensitiveKeys;
    private final List<Entry> entries;

    private FieldMappingTable(TagFormat dialect, boolean caseInsensitiveKeys, List<Entry> entries) {
        this.dialect = dialect;
        this.caseInsensitiveKeys = caseInsensitiveKeys;
        this.entries = List.copyOf(entries);
    }

    public static Builder builder(TagFormat dialect) {
        return new Builder(dialect);
    }

    public TagFormat dialect() {
        return dialect;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitiveKeys;
    }

    /** Source keys in declaration order. */
    public List<String> keys() {
        return entries.stream().map(Entry::key).toList();
    }

    /** Canonical field a plain or joined key maps to. Notation keys map to their number field. */
    public Optional<CanonicalField> fieldFor(String key) {
        String wanted = normalizeKey(key);
        return entries.stream()
                .filter(e -> normalizeKey(e.key()).equals(wanted))
                .map(Entry::field)
                .findFirst();
    }

    /**
     * Same table for another dialect, for dialects that share key structure
     * (APE tags reuse the Vorbis comment names).
     */
    public FieldMappingTable aliasFor(TagFormat otherDialect) {
        return new FieldMappingTable(otherDialect, caseInsensitiveKeys, entries);
    }

    /**
     * Maps a decoded tag container to canonical fields.
     *
     * @param tags key → values as produced by the decode adapter; values are usually
     *             strings, numbers, or number pairs for notation keys
     * @return canonical fields with null and blank values left out
     */
    public Map<CanonicalField, Object> apply(Map<String, ? extends List<?>> tags) {
        Map<String, List<?>> lookup = index(tags);
        Map<CanonicalField, Object> fields = new EnumMap<>(CanonicalField.class);

        for (Entry entry : entries) {
            List<?> values = lookup.get(normalizeKey(entry.key()));
            if (values == null || values.isEmpty()) {
                continue;
            }
            switch (entry.kind()) {
                case PLAIN -> putFirst(fields, entry.field(), values.get(0));
                case JOINED -> {
                    String joined = joinValues(values, entry.separator());
                    if (joined != null) {
                        fields.put(entry.field(), joined);
                    }
                }
                case NOTATION -> {
                    TrackDiscPair pair = TrackDiscNotation.parse(values.get(0));
                    if (pair.hasNumber()) {
                        fields.put(entry.field(), pair.number());
                    }
                    if (pair.hasTotal()) {
                        fields.put(entry.totalField(), pair.total());
                    }
                }
            }
        }
        return fields;
    }

    /** Convenience for single-valued sources such as a video General track. */
    public Map<CanonicalField, Object> applySingleValued(Map<String, ?> attributes) {
        Map<String, List<?>> tags = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (value != null) {
                tags.put(key, List.of(value));
            }
        });
        return apply(tags);
    }

    private Map<String, List<?>> index(Map<String, ? extends List<?>> tags) {
        if (!caseInsensitiveKeys) {
            return Collections.unmodifiableMap(tags);
        }
        Map<String, List<?>> upper = new LinkedHashMap<>();
        tags.forEach((key, values) -> upper.putIfAbsent(normalizeKey(key), values));
        return upper;
    }

    private String normalizeKey(String key) {
        return caseInsensitiveKeys ? key.toUpperCase(Locale.ROOT) : key;
    }

    private static void putFirst(Map<CanonicalField, Object> fields, CanonicalField field, Object value) {
        if (field.isNumeric()) {
            Integer number = TrackDiscNotation.parse(value).number();
            if (number != null) {
                fields.put(field, number);
            }
        } else {
            String text = textOf(value);
            if (text != null) {
                fields.put(field, text);
            }
        }
    }

    private static String joinValues(List<?> values, String separator) {
        StringJoiner joiner = new StringJoiner(separator);
        for (Object value : values) {
            String text = textOf(value);
            if (text != null) {
                joiner.add(text);
            }
        }
        return joiner.length() > 0 ? joiner.toString() : null;
    }

    /** String form of a tag value; binary payloads and blank strings yield null. */
    static String textOf(Object value) {
        if (value == null || value instanceof byte[]) {
            return null;
        }
        if (value instanceof List<?> list) {
            return list.isEmpty() ? null : textOf(list.get(0));
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    enum Kind { PLAIN, JOINED, NOTATION }

    record Entry(String key, Kind kind, CanonicalField field, CanonicalField totalField, String separator) {
    }

    public static class Builder {
        private final TagFormat dialect;
        private final List<Entry> entries = new ArrayList<>();
        private boolean caseInsensitiveKeys = false;

        private Builder(TagFormat dialect) {
            this.dialect = dialect;
        }

        public Builder caseInsensitiveKeys() {
            this.caseInsensitiveKeys = true;
            return this;
        }

        public Builder map(String key, CanonicalField field) {
            entries.add(new Entry(key, Kind.PLAIN, field, null, null));
            return this;
        }

        public Builder joined(String key, CanonicalField field, String separator) {
            if (field.isNumeric()) {
                throw new IllegalArgumentException("Joined key '" + key + "' cannot target numeric field " + field);
            }
            entries.add(new Entry(key, Kind.JOINED, field, null, separator));
            return this;
        }

        public Builder notation(String key, CanonicalField numberField, CanonicalField totalField) {
            if (!numberField.isNumeric() || !totalField.isNumeric()) {
                throw new IllegalArgumentException("Notation key '" + key + "' needs numeric fields");
            }
            entries.add(new Entry(key, Kind.NOTATION, numberField, totalField, null));
            return this;
        }

        public FieldMappingTable build() {
            return new FieldMappingTable(dialect, caseInsensitiveKeys, entries);
        }
    }

    @Override
    public String toString() {
        Map<String, String> view = new LinkedHashMap<>();
        entries.forEach(e -> view.put(e.key(), e.field().key()));
        return "FieldMappingTable[" + dialect.label() + " " + view + "]";
    }
}
