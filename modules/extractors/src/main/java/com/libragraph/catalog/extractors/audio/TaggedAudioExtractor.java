package com.libragraph.catalog.extractors.audio;

import com.libragraph.catalog.extractors.api.AbstractMetadataExtractor;
import com.libragraph.catalog.extractors.api.NormalizedRecord;
import com.libragraph.catalog.extractors.mapping.FieldMappingTables;
import com.libragraph.catalog.types.TagFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extractor for tagged audio: MP3/ID3, MP4/M4A/M4B atoms, FLAC/Ogg/Opus Vorbis comments,
 * WAV (RIFF INFO) and Monkey's Audio (APEv2).
 * Priority 300 (higher than the video container extractor) so mp4/mov files are
 * read for their audio tags first.
 * <p>
 * {@code .ape} files go to the {@link ApeTagDecoder}; the extension is only claimed
 * when that decoder is present and available.
 */
@ApplicationScoped
public class TaggedAudioExtractor extends AbstractMetadataExtractor {

    public static final String NAME = "tagged-audio";
    public static final int PRIORITY = 300;

    static final Set<String> EXTENSIONS = Set.of(
            "mp3", "m4a", "m4b", "mp4", "flac", "ogg", "opus", "wav", "mov");

    static final String APE_CONTAINER = "ape";

    private final TaggedAudioDecoder decoder;
    private final ApeTagDecoder apeDecoder;

    TaggedAudioExtractor() {
        this.decoder = null;
        this.apeDecoder = null;
    }

    @Inject
    public TaggedAudioExtractor(TaggedAudioDecoder decoder, ApeTagDecoder apeDecoder) {
        super(NAME, PRIORITY, extensionsFor(apeDecoder), checkAvailability(NAME, decoder::isAvailable));
        this.decoder = decoder;
        this.apeDecoder = apeDecoder;
    }

    /** Without an APE decoder; {@code .ape} files are not claimed. */
    public TaggedAudioExtractor(TaggedAudioDecoder decoder) {
        this(decoder, null);
    }

    private static Set<String> extensionsFor(ApeTagDecoder apeDecoder) {
        if (apeDecoder == null || !checkAvailability(NAME + "/" + APE_CONTAINER, apeDecoder::isAvailable)) {
            return EXTENSIONS;
        }
        Set<String> extensions = new HashSet<>(EXTENSIONS);
        extensions.add(APE_CONTAINER);
        return extensions;
    }

    @Override
    protected Optional<NormalizedRecord> doExtract(Path path) {
        String container = containerOf(path);
        Optional<DecodedAudio> decoded = APE_CONTAINER.equals(container)
                ? apeDecoder.decode(path)
                : decoder.decode(path);
        if (decoded.isEmpty()) {
            return Optional.empty();
        }
        DecodedAudio audio = decoded.get();
        TagFormat dialect = audio.dialect();

        NormalizedRecord.Builder builder = NormalizedRecord.builder(container, dialect);
        if (audio.hasTags()) {
            FieldMappingTables.forDialect(dialect)
                    .ifPresent(table -> builder.fields(table.apply(audio.tags())));
        }
        builder.durationSeconds(audio.durationSeconds());
        builder.hasCoverArt(hasCoverArt(dialect, audio));
        builder.chapters(countChapters(dialect, audio));
        return Optional.of(builder.build());
    }

    /**
     * APIC frames for ID3, a non-empty covr atom for MP4, a picture block for Vorbis.
     * Null when the file has no tags or the dialect has no such check.
     */
    static Boolean hasCoverArt(TagFormat dialect, DecodedAudio audio) {
        if (!audio.hasTags()) {
            return null;
        }
        Map<String, List<Object>> tags = audio.tags();
        return switch (dialect) {
            case ID3 -> tags.keySet().stream().anyMatch(key -> key.startsWith("APIC"));
            case MP4 -> tags.containsKey("covr");
            case VORBIS -> tags.keySet().stream()
                    .anyMatch(key -> key.toUpperCase(Locale.ROOT).equals(JaudiotaggerAudioDecoder.VORBIS_PICTURE_KEY));
            default -> null;
        };
    }

    /** Number of ID3 CHAP frames; null when there are none or the dialect is not ID3. */
    static Integer countChapters(TagFormat dialect, DecodedAudio audio) {
        if (dialect != TagFormat.ID3 || !audio.hasTags()) {
            return null;
        }
        int count = audio.tags().entrySet().stream()
                .filter(e -> e.getKey().startsWith("CHAP"))
                .mapToInt(e -> e.getValue().size())
                .sum();
        return count > 0 ? count : null;
    }
}
