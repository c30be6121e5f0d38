package com.libragraph.catalog.types;

/**
 * Tag-encoding dialect a normalized record was read from.
 * Distinct from the container file type: a FLAC file carries VORBIS tags.
 */
public enum TagFormat {
    ID3("id3"),
    MP4("mp4"),
    VORBIS("vorbis"),
    APE("ape"),
    RIFF("riff"),
    MATROSKA("matroska"),
    OPF("opf"),
    UNKNOWN("unknown");

    private final String label;

    TagFormat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TagFormat fromLabel(String label) {
        for (TagFormat f : values()) {
            if (f.label.equals(label)) return f;
        }
        throw new IllegalArgumentException("Unknown TagFormat label: " + label);
    }
}
