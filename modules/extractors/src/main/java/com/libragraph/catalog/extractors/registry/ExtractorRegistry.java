package com.libragraph.catalog.extractors.registry;

import com.libragraph.catalog.extractors.api.FileContext;
import com.libragraph.catalog.extractors.api.MetadataExtractor;
import com.libragraph.catalog.extractors.api.NormalizedRecord;
import com.libragraph.catalog.extractors.audio.FfmpegApeTagDecoder;
import com.libragraph.catalog.extractors.audio.JaudiotaggerAudioDecoder;
import com.libragraph.catalog.extractors.audio.TaggedAudioExtractor;
import com.libragraph.catalog.extractors.ebook.EbookExtractor;
import com.libragraph.catalog.extractors.ebook.TikaEbookMetadataDecoder;
import com.libragraph.catalog.extractors.video.FfmpegVideoContainerDecoder;
import com.libragraph.catalog.extractors.video.VideoContainerExtractor;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.StreamSupport;

/**
 * Central registry that runs a file through the extractors in priority order.
 *
 * <p>First match wins: the first extractor that supports the file and returns a
 * record with data decides the result, later extractors are never consulted.
 * No exception thrown by an extractor reaches the caller.
 * <p>
 * Under CDI all {@link MetadataExtractor} beans are discovered and sorted by
 * descending {@link MetadataExtractor#priority()}; extractors named in
 * {@code catalog.extractors.disabled} are skipped.
 */
@ApplicationScoped
public class ExtractorRegistry {

    private static final Logger log = Logger.getLogger(ExtractorRegistry.class);

    static final Comparator<MetadataExtractor> BY_PRIORITY =
            Comparator.comparingInt(MetadataExtractor::priority).reversed();

    @Inject
    Instance<MetadataExtractor> discovered;

    @ConfigProperty(name = "catalog.extractors.disabled")
    Optional<List<String>> disabled;

    private List<MetadataExtractor> extractors = List.of();

    ExtractorRegistry() {
    }

    /**
     * Registry over a fixed list, consulted in the given order.
     */
    public ExtractorRegistry(List<? extends MetadataExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    /**
     * Default registry without CDI: tagged audio, then video container, then ebook.
     */
    public static ExtractorRegistry defaultRegistry() {
        return new ExtractorRegistry(List.of(
                new TaggedAudioExtractor(new JaudiotaggerAudioDecoder(), new FfmpegApeTagDecoder()),
                new VideoContainerExtractor(new FfmpegVideoContainerDecoder()),
                new EbookExtractor(new TikaEbookMetadataDecoder())
        ));
    }

    @PostConstruct
    void init() {
        Set<String> skip = Set.copyOf(disabled.orElse(List.of()));
        extractors = StreamSupport.stream(discovered.spliterator(), false)
                .filter(e -> {
                    if (skip.contains(e.name())) {
                        log.infof("Extractor '%s' disabled by configuration", e.name());
                        return false;
                    }
                    return true;
                })
                .sorted(BY_PRIORITY)
                .toList();
        for (MetadataExtractor e : extractors) {
            log.infof("Registered extractor: %s (priority %d, available=%s)",
                    e.name(), e.priority(), e.isAvailable());
        }
        log.infof("ExtractorRegistry initialized with %d extractors", extractors.size());
    }

    /**
     * Extracts a normalized record for the file.
     *
     * @param path      file location
     * @param extension lowercase extension without dot, precomputed by the caller
     * @param mimeType  optional MIME hint, may be null
     * @return the record, empty when no extractor produced data or the path is null
     */
    public Optional<NormalizedRecord> extract(Path path, String extension, String mimeType) {
        return ExtractionBoundary.isolate("File context for " + path,
                        () -> Optional.of(FileContext.of(path, extension, mimeType)))
                .flatMap(this::extract);
    }

    public Optional<NormalizedRecord> extract(FileContext context) {
        if (context == null) {
            return Optional.empty();
        }
        for (MetadataExtractor extractor : extractors) {
            String label = "Extractor '" + extractor.name() + "' on " + context.path();
            if (!ExtractionBoundary.test(label + " (supports)", () -> extractor.supports(context))) {
                continue;
            }
            Optional<NormalizedRecord> result = ExtractionBoundary.isolate(label,
                    () -> extractor.extract(context.path()));
            if (result.filter(NormalizedRecord::hasData).isPresent()) {
                log.debugf("%s produced a %s record", label, result.get().tagFormat().label());
                return result;
            }
        }
        return Optional.empty();
    }

    /** Extractors in consultation order. */
    public List<MetadataExtractor> extractors() {
        return extractors;
    }

    public int size() {
        return extractors.size();
    }
}
