package com.libragraph.catalog.extractors.video;

import java.nio.file.Path;
import java.util.List;

/**
 * Adapter over a video container metadata library.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface VideoContainerDecoder {

    boolean isAvailable();

    /**
     * Reads the container's tracks.
     *
     * @return the tracks, empty when the file could not be recognized
     * @throws com.libragraph.catalog.extractors.api.DecodeException if parsing fails
     */
    List<MediaTrack> decode(Path path);
}
