package com.libragraph.catalog.extractors.ebook;

import java.util.Map;

/**
 * One Dublin Core element value with its XML attributes (e.g. {@code opf:role="aut"}).
 */
public record DublinCoreValue(String value, Map<String, String> attributes) {

    public DublinCoreValue {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static DublinCoreValue of(String value) {
        return new DublinCoreValue(value, Map.of());
    }
}
