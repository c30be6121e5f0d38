package com.libragraph.catalog.extractors.audio;

import com.libragraph.catalog.extractors.api.DecodeException;
import com.libragraph.catalog.extractors.api.FileContext;
import com.libragraph.catalog.types.TagFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.libragraph.catalog.types.CanonicalField.*;
import static org.assertj.core.api.Assertions.assertThat;

class TaggedAudioExtractorTest {

    @Test
    void shouldClaimAudioExtensions() {
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(null));

        assertThat(extractor.name()).isEqualTo("tagged-audio");
        assertThat(extractor.priority()).isEqualTo(300);
        assertThat(extractor.supports(FileContext.of(Path.of("a.mp3")))).isTrue();
        assertThat(extractor.supports(FileContext.of(Path.of("a.M4B")))).isTrue();
        assertThat(extractor.supports(FileContext.of(Path.of("a.mov")))).isTrue();
        assertThat(extractor.supports(FileContext.of(Path.of("a.mkv")))).isFalse();
        assertThat(extractor.supports(FileContext.of(Path.of("a.epub")))).isFalse();
    }

    @Test
    void shouldClaimApeOnlyWithAvailableApeDecoder() {
        var withApe = new TaggedAudioExtractor(FakeDecoder.returning(null), FakeApeDecoder.returning(null));
        var unavailableApe = FakeApeDecoder.returning(null);
        unavailableApe.available = false;
        var withUnavailableApe = new TaggedAudioExtractor(FakeDecoder.returning(null), unavailableApe);
        var withoutApe = new TaggedAudioExtractor(FakeDecoder.returning(null));

        assertThat(withApe.supports(FileContext.of(Path.of("live.ape")))).isTrue();
        assertThat(withUnavailableApe.supports(FileContext.of(Path.of("live.ape")))).isFalse();
        assertThat(withUnavailableApe.isAvailable()).isTrue();
        assertThat(withoutApe.supports(FileContext.of(Path.of("live.ape")))).isFalse();
    }

    @Test
    void shouldRouteApeFilesToApeDecoderAndMapWithVorbisNames() {
        Map<String, List<Object>> items = new LinkedHashMap<>();
        items.put("Title", List.of("Blue in Green"));
        items.put("Artist", List.of("Bill Evans"));
        items.put("Album", List.of("Kind of Blue"));
        items.put("Year", List.of("1959"));
        var primary = FakeDecoder.returning(id3(Map.of("TIT2", List.of("wrong")), 1.0));
        var ape = FakeApeDecoder.returning(new DecodedAudio(TagFormat.APE, items, 337.5));
        var extractor = new TaggedAudioExtractor(primary, ape);

        var record = extractor.extract(Path.of("/music/03.ape")).orElseThrow();

        assertThat(record.container()).isEqualTo("ape");
        assertThat(record.tagFormat()).isEqualTo(TagFormat.APE);
        assertThat(record.fields())
                .containsEntry(TITLE, "Blue in Green")
                .containsEntry(ARTIST, "Bill Evans")
                .containsEntry(ALBUM, "Kind of Blue")
                .doesNotContainKey(DATE);
        assertThat(record.durationMs()).isEqualTo(337500L);
        assertThat(record.hasCoverArt()).isNull();
        assertThat(primary.decodeCalls).isZero();
        assertThat(ape.decodeCalls).isEqualTo(1);
    }

    @Test
    void shouldNeverSupportWhenDecoderUnavailable() {
        var decoder = FakeDecoder.returning(id3(Map.of("TIT2", List.of("x")), 10.0));
        decoder.available = false;
        var extractor = new TaggedAudioExtractor(decoder);

        assertThat(extractor.isAvailable()).isFalse();
        assertThat(extractor.supports(FileContext.of(Path.of("a.mp3")))).isFalse();
        assertThat(extractor.extract(Path.of("a.mp3"))).isEmpty();
        assertThat(decoder.decodeCalls).isZero();
    }

    @Test
    void shouldTreatFailingAvailabilityCheckAsUnavailable() {
        var decoder = new FakeDecoder(null) {
            @Override
            public boolean isAvailable() {
                throw new NoClassDefFoundError("org/jaudiotagger/audio/AudioFileIO");
            }
        };

        assertThat(new TaggedAudioExtractor(decoder).isAvailable()).isFalse();
    }

    @Test
    void shouldMapId3Tags() {
        Map<String, List<Object>> tags = new LinkedHashMap<>();
        tags.put("TIT2", List.of("So What"));
        tags.put("TPE1", List.of("Miles Davis"));
        tags.put("TRCK", List.of("1/5"));
        tags.put("TPOS", List.of("1"));
        tags.put("APIC", List.of(new byte[]{(byte) 0xFF, (byte) 0xD8}));
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(id3(tags, 545.75)));

        var record = extractor.extract(Path.of("/music/01.MP3")).orElseThrow();

        assertThat(record.container()).isEqualTo("mp3");
        assertThat(record.tagFormat()).isEqualTo(TagFormat.ID3);
        assertThat(record.fields())
                .containsEntry(TITLE, "So What")
                .containsEntry(ARTIST, "Miles Davis")
                .containsEntry(TRACK, 1)
                .containsEntry(TRACK_TOTAL, 5)
                .containsEntry(DISC, 1)
                .doesNotContainKey(DISC_TOTAL);
        assertThat(record.durationMs()).isEqualTo(545750L);
        assertThat(record.hasCoverArt()).isTrue();
        assertThat(record.chapters()).isNull();
    }

    @Test
    void shouldReportMissingId3CoverArtAsFalse() {
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(id3(Map.of("TIT2", List.of("x")), null)));

        var record = extractor.extract(Path.of("a.mp3")).orElseThrow();

        assertThat(record.hasCoverArt()).isFalse();
        assertThat(record.durationMs()).isNull();
    }

    @Test
    void shouldCountId3Chapters() {
        Map<String, List<Object>> tags = new LinkedHashMap<>();
        tags.put("TIT2", List.of("Audiobook"));
        tags.put("CHAP", List.of("ch0", "ch1", "ch2"));
        tags.put("CTOC", List.of("toc"));
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(id3(tags, 3600.0)));

        var record = extractor.extract(Path.of("book.mp3")).orElseThrow();

        assertThat(record.chapters()).isEqualTo(3);
    }

    @Test
    void shouldMapMp4Atoms() {
        Map<String, List<Object>> tags = new LinkedHashMap<>();
        tags.put("©nam", List.of("Chapter One"));
        tags.put("aART", List.of("Narrator"));
        tags.put("trkn", List.of(Arrays.asList((short) 2, (short) 9)));
        tags.put("covr", List.of(new byte[]{0x00}));
        var audio = new DecodedAudio(TagFormat.MP4, tags, 61.0009);
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(audio));

        var record = extractor.extract(Path.of("book.m4b")).orElseThrow();

        assertThat(record.container()).isEqualTo("m4b");
        assertThat(record.fields())
                .containsEntry(TITLE, "Chapter One")
                .containsEntry(ALBUM_ARTIST, "Narrator")
                .containsEntry(TRACK, 2)
                .containsEntry(TRACK_TOTAL, 9);
        assertThat(record.durationMs()).isEqualTo(61000L);
        assertThat(record.hasCoverArt()).isTrue();
    }

    @Test
    void shouldDetectVorbisPictureBlock() {
        Map<String, List<Object>> tags = new LinkedHashMap<>();
        tags.put("title", List.of("Track"));
        tags.put("metadata_block_picture", List.of("base64"));
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(new DecodedAudio(TagFormat.VORBIS, tags, 1.0)));

        var record = extractor.extract(Path.of("a.flac")).orElseThrow();

        assertThat(record.text(TITLE)).contains("Track");
        assertThat(record.hasCoverArt()).isTrue();
    }

    @Test
    void shouldLeaveCoverArtUnknownForRiff() {
        var audio = new DecodedAudio(TagFormat.RIFF, Map.of("INAM", List.of("Take 1")), 2.5);
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(audio));

        var record = extractor.extract(Path.of("take.wav")).orElseThrow();

        assertThat(record.text(TITLE)).contains("Take 1");
        assertThat(record.hasCoverArt()).isNull();
        assertThat(record.chapters()).isNull();
    }

    @Test
    void shouldKeepDurationOnlyRecordForUntaggedFile() {
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(new DecodedAudio(TagFormat.VORBIS, Map.of(), 12.0)));

        var record = extractor.extract(Path.of("a.ogg")).orElseThrow();

        assertThat(record.fields()).isEmpty();
        assertThat(record.hasCoverArt()).isNull();
        assertThat(record.durationMs()).isEqualTo(12000L);
    }

    @Test
    void shouldReturnEmptyWhenNothingWasDecoded() {
        var untagged = new TaggedAudioExtractor(FakeDecoder.returning(new DecodedAudio(TagFormat.ID3, Map.of(), null)));
        var unrecognized = new TaggedAudioExtractor(FakeDecoder.returning(null));

        assertThat(untagged.extract(Path.of("a.mp3"))).isEmpty();
        assertThat(unrecognized.extract(Path.of("a.mp3"))).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenDecoderFails() {
        var decoder = new FakeDecoder(null) {
            @Override
            public Optional<DecodedAudio> decode(Path path) {
                throw new DecodeException("Failed to read audio tags from " + path);
            }
        };

        assertThat(new TaggedAudioExtractor(decoder).extract(Path.of("a.mp3"))).isEmpty();
    }

    @Test
    void shouldIgnoreUnmappedDialect() {
        var audio = new DecodedAudio(TagFormat.UNKNOWN, Map.of("X", List.of("y")), 5.0);
        var extractor = new TaggedAudioExtractor(FakeDecoder.returning(audio));

        var record = extractor.extract(Path.of("a.wma")).orElseThrow();

        assertThat(record.fields()).isEmpty();
        assertThat(record.durationMs()).isEqualTo(5000L);
    }

    private static DecodedAudio id3(Map<String, List<Object>> tags, Double duration) {
        return new DecodedAudio(TagFormat.ID3, tags, duration);
    }

    static class FakeApeDecoder implements ApeTagDecoder {
        private final DecodedAudio result;
        boolean available = true;
        int decodeCalls;

        FakeApeDecoder(DecodedAudio result) {
            this.result = result;
        }

        static FakeApeDecoder returning(DecodedAudio result) {
            return new FakeApeDecoder(result);
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Optional<DecodedAudio> decode(Path path) {
            decodeCalls++;
            return Optional.ofNullable(result);
        }
    }

    static class FakeDecoder implements TaggedAudioDecoder {
        private final DecodedAudio result;
        boolean available = true;
        int decodeCalls;

        FakeDecoder(DecodedAudio result) {
            this.result = result;
        }

        static FakeDecoder returning(DecodedAudio result) {
            return new FakeDecoder(result);
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Optional<DecodedAudio> decode(Path path) {
            decodeCalls++;
            return Optional.ofNullable(result);
        }
    }
}
