package com.libragraph.catalog.test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Scratch directories for {@code @QuarkusTest} classes, where JUnit's
 * {@code @TempDir} field injection does not reach the test instance.
 */
public final class TempFiles {

    private TempFiles() {
    }

    public static Path createDirectory() throws IOException {
        return Files.createTempDirectory("catalog-test");
    }

    public static void deleteRecursively(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
