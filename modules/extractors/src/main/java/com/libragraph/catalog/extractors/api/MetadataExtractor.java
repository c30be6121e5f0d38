package com.libragraph.catalog.extractors.api;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Strategy for reading one family of media files into a {@link NormalizedRecord}.
 * Implementations are CDI beans and must be
 * stateless after construction so one instance can serve concurrent callers.
 */
public interface MetadataExtractor {

    /** Short identifier used in logs, configuration and diagnostics. */
    String name();

    /**
     * Higher priority is consulted first by the registry
     * (tagged audio=300 beats video container=200 for mp4/mov).
     */
    int priority();

    /**
     * Whether the external decode capability could be initialized.
     * Determined once at construction and never re-checked.
     */
    boolean isAvailable();

    /**
     * Cheap, side-effect-free applicability check. Always false when
     * {@link #isAvailable()} is false.
     */
    boolean supports(FileContext context);

    /**
     * Decodes the file and maps its tags to canonical fields.
     *
     * @return the record, or empty if decoding failed or produced nothing
     */
    Optional<NormalizedRecord> extract(Path path);
}
