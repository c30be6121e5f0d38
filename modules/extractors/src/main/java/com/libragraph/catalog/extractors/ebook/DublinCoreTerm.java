package com.libragraph.catalog.extractors.ebook;

/**
 * Dublin Core elements read from an EPUB package document.
 */
public enum DublinCoreTerm {
    TITLE("title"),
    CREATOR("creator"),
    LANGUAGE("language"),
    PUBLISHER("publisher"),
    DATE("date"),
    IDENTIFIER("identifier");

    private final String term;

    DublinCoreTerm(String term) {
        this.term = term;
    }

    /** Local element name, e.g. {@code creator} for {@code dc:creator}. */
    public String term() {
        return term;
    }
}
