package com.libragraph.catalog.extractors.video;

import com.libragraph.catalog.extractors.api.AbstractMetadataExtractor;
import com.libragraph.catalog.extractors.api.NormalizedRecord;
import com.libragraph.catalog.extractors.mapping.FieldMappingTables;
import com.libragraph.catalog.types.TagFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Extractor for video containers (MKV, MP4, MOV), reading the General track.
 * Priority 200: below tagged audio, which claims mp4/mov first.
 */
@ApplicationScoped
public class VideoContainerExtractor extends AbstractMetadataExtractor {

    public static final String NAME = "video-container";
    public static final int PRIORITY = 200;

    static final Set<String> EXTENSIONS = Set.of("mkv", "mp4", "mov");

    private final VideoContainerDecoder decoder;

    VideoContainerExtractor() {
        this.decoder = null;
    }

    @Inject
    public VideoContainerExtractor(VideoContainerDecoder decoder) {
        super(NAME, PRIORITY, EXTENSIONS, checkAvailability(NAME, decoder::isAvailable));
        this.decoder = decoder;
    }

    @Override
    protected Optional<NormalizedRecord> doExtract(Path path) {
        Optional<MediaTrack> general = decoder.decode(path).stream()
                .filter(t -> t.type() == MediaTrack.Type.GENERAL)
                .findFirst();
        if (general.isEmpty()) {
            return Optional.empty();
        }

        String container = containerOf(path);
        TagFormat dialect = "mkv".equals(container) ? TagFormat.MATROSKA : TagFormat.MP4;

        // General-track attributes share one vocabulary whatever the container
        return Optional.of(NormalizedRecord.builder(container, dialect)
                .fields(FieldMappingTables.MATROSKA.applySingleValued(general.get().attributes()))
                .durationSeconds(general.get().durationSeconds())
                .build());
    }
}
