package com.libragraph.catalog.extractors.audio;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Adapter for Monkey's Audio files, whose APEv2 items the main
 * {@link TaggedAudioDecoder} library cannot read.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface ApeTagDecoder {

    boolean isAvailable();

    /**
     * @return the APEv2 items with dialect {@link com.libragraph.catalog.types.TagFormat#APE}
     * @throws com.libragraph.catalog.extractors.api.DecodeException if reading fails
     */
    Optional<DecodedAudio> decode(Path path);
}
