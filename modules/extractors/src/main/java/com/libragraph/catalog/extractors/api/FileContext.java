package com.libragraph.catalog.extractors.api;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes a media file handed to the extractors.
 *
 * @param path      filesystem location; existence is not checked
 * @param extension lowercase extension without the dot, empty when the name has none
 * @param mimeType  optional MIME hint from upstream classification
 */
public record FileContext(
        Path path,
        String extension,
        Optional<String> mimeType
) {
    public FileContext {
        Objects.requireNonNull(path, "path cannot be null");
        extension = normalizeExtension(extension);
        mimeType = mimeType == null ? Optional.empty() : mimeType.filter(m -> !m.isBlank());
    }

    /** Derives the extension from the file name. */
    public static FileContext of(Path path) {
        return new FileContext(path, extensionOf(path), Optional.empty());
    }

    public static FileContext of(Path path, String extension, String mimeType) {
        return new FileContext(path, extension, Optional.ofNullable(mimeType));
    }

    public FileContext withMimeType(String mimeType) {
        return new FileContext(path, extension, Optional.ofNullable(mimeType));
    }

    public String filename() {
        Path name = path.getFileName();
        return name != null ? name.toString() : "";
    }

    /**
     * Lowercase extension of the path's file name, without the dot.
     * Hidden files such as {@code .nomedia} have no extension.
     */
    public static String extensionOf(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return "";
        }
        String filename = name.toString();
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex <= 0 || dotIndex == filename.length() - 1) {
            return "";
        }
        return filename.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
    }

    private static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String ext = extension.trim();
        if (ext.startsWith(".")) {
            ext = ext.substring(1);
        }
        return ext.toLowerCase(Locale.ROOT);
    }
}
