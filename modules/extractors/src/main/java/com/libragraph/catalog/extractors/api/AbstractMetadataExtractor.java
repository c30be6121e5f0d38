package com.libragraph.catalog.extractors.api;

import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Base class for {@link MetadataExtractor} implementations. Provides:
 * <ul>
 *   <li>an availability flag fixed at construction</li>
 *   <li>extension-based {@link #supports(FileContext)}</li>
 *   <li>conversion of any decode failure into an empty result</li>
 * </ul>
 * Subclasses implement {@link #doExtract(Path)}.
 */
public abstract class AbstractMetadataExtractor implements MetadataExtractor {

    protected final Logger log = Logger.getLogger(getClass());

    private final String name;
    private final int priority;
    private final Set<String> extensions;
    private final boolean available;

    /** For CDI client proxies only; a proxy delegates every call to the contextual instance. */
    protected AbstractMetadataExtractor() {
        this.name = null;
        this.priority = 0;
        this.extensions = Set.of();
        this.available = false;
    }

    protected AbstractMetadataExtractor(String name, int priority, Set<String> extensions, boolean available) {
        this.name = name;
        this.priority = priority;
        this.extensions = Set.copyOf(extensions);
        this.available = available;
        if (!available) {
            log.infof("Extractor '%s' disabled: decode capability unavailable", name);
        }
    }

    // -- template method for subclasses --

    /**
     * Performs the decode and mapping. May throw; failures become an empty result.
     */
    protected abstract Optional<NormalizedRecord> doExtract(Path path) throws Exception;

    // -- MetadataExtractor contract --

    @Override
    public String name() {
        return name;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public boolean supports(FileContext context) {
        return available && extensions.contains(context.extension());
    }

    @Override
    public Optional<NormalizedRecord> extract(Path path) {
        if (!available) {
            return Optional.empty();
        }
        try {
            return doExtract(path).filter(NormalizedRecord::hasData);
        } catch (Exception e) {
            log.debugf("Extractor '%s' could not read %s: %s", name, path, e.getMessage());
            return Optional.empty();
        }
    }

    /** Extensions this extractor claims, lowercase without dot. */
    public Set<String> extensions() {
        return extensions;
    }

    /** Container tag for a path: its lowercase extension. */
    protected static String containerOf(Path path) {
        return FileContext.extensionOf(path);
    }

    /**
     * Runs a decoder's availability check once. A check that throws, or a decode
     * library missing from the classpath, counts as unavailable.
     */
    protected static boolean checkAvailability(String name, BooleanSupplier check) {
        try {
            return check.getAsBoolean();
        } catch (RuntimeException | LinkageError e) {
            Logger.getLogger(AbstractMetadataExtractor.class)
                    .debugf("Availability check for '%s' failed: %s", name, e.toString());
            return false;
        }
    }
}
