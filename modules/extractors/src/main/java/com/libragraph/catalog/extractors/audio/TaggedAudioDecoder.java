package com.libragraph.catalog.extractors.audio;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Adapter over an audio tag library.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface TaggedAudioDecoder {

    /**
     * Whether the underlying library can be loaded. Called once by the extractor.
     */
    boolean isAvailable();

    /**
     * Reads the file's tags and stream length.
     *
     * @return empty when the library does not recognize the file
     * @throws com.libragraph.catalog.extractors.api.DecodeException if reading fails
     */
    Optional<DecodedAudio> decode(Path path);
}
