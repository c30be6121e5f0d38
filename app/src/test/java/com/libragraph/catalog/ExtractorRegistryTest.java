package com.libragraph.catalog;

import com.libragraph.catalog.extractors.api.MetadataExtractor;
import com.libragraph.catalog.extractors.audio.TaggedAudioExtractor;
import com.libragraph.catalog.extractors.ebook.EbookExtractor;
import com.libragraph.catalog.extractors.ebook.TestEpubBuilder;
import com.libragraph.catalog.extractors.registry.ExtractorRegistry;
import com.libragraph.catalog.extractors.video.VideoContainerExtractor;
import com.libragraph.catalog.test.TempFiles;
import com.libragraph.catalog.types.CanonicalField;
import com.libragraph.catalog.types.TagFormat;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * CDI integration test verifying that ExtractorRegistry discovers all
 * MetadataExtractor beans via Quarkus/ArC and consults them by priority.
 */
@QuarkusTest
class ExtractorRegistryTest {

    @Inject
    ExtractorRegistry registry;

    @Inject
    Instance<MetadataExtractor> extractors;

    Path tempDir;

    @BeforeEach
    void createTempDir() throws Exception {
        tempDir = TempFiles.createDirectory();
    }

    @AfterEach
    void deleteTempDir() {
        TempFiles.deleteRecursively(tempDir);
    }

    @Test
    void shouldDiscoverAllExtractors() {
        long count = StreamSupport.stream(extractors.spliterator(), false).count();

        // tagged audio, video container, ebook
        assertThat(count).isEqualTo(3);
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    void shouldOrderByDescendingPriority() {
        assertThat(registry.extractors()).extracting(MetadataExtractor::name)
                .containsExactly(TaggedAudioExtractor.NAME, VideoContainerExtractor.NAME, EbookExtractor.NAME);
    }

    @Test
    void shouldLoadAllDecodeLibraries() {
        assertThat(registry.extractors()).allMatch(MetadataExtractor::isAvailable);
    }

    @Test
    void shouldExtractEpubEndToEnd() throws Exception {
        Path epub = new TestEpubBuilder()
                .title("Kindred")
                .creator("Octavia E. Butler")
                .language("en")
                .publisher("Doubleday")
                .writeTo(tempDir.resolve("kindred.epub"));

        var record = registry.extract(epub, "epub", null);

        assertThat(record).isPresent();
        assertThat(record.get().tagFormat()).isEqualTo(TagFormat.OPF);
        assertThat(record.get().text(CanonicalField.TITLE)).contains("Kindred");
        assertThat(record.get().text(CanonicalField.AUTHOR)).contains("Octavia E. Butler");
        assertThat(record.get().text(CanonicalField.PUBLISHER)).contains("Doubleday");
    }

    @Test
    void shouldReturnEmptyForUnclaimedFile() throws Exception {
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "shopping list");

        assertThat(registry.extract(notes, "txt", "text/plain")).isEmpty();
    }

    @Test
    void shouldReturnEmptyForCorruptAudio() throws Exception {
        Path fake = Files.writeString(tempDir.resolve("fake.m4a"), "not an mp4 box");

        assertThat(registry.extract(fake, "m4a", "audio/mp4")).isEmpty();
    }

    @Test
    void shouldReturnEmptyForNullPath() {
        assertThat(registry.extract(null, "mp3", null)).isEmpty();
    }
}
