package com.libragraph.catalog.extractors.audio;

import com.libragraph.catalog.extractors.ffmpeg.FfmpegContainer;
import com.libragraph.catalog.extractors.ffmpeg.FfmpegContainerReader;
import com.libragraph.catalog.types.TagFormat;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ApeTagDecoder} backed by FFmpeg's Monkey's Audio demuxer, which
 * exposes the APEv2 text items as format metadata under their own keys.
 * Binary items (cover art) are not reported.
 */
@ApplicationScoped
public class FfmpegApeTagDecoder implements ApeTagDecoder {

    @Override
    public boolean isAvailable() {
        return FfmpegContainerReader.isAvailable();
    }

    @Override
    public Optional<DecodedAudio> decode(Path path) {
        FfmpegContainer container = FfmpegContainerReader.read(path);
        Map<String, List<Object>> tags = new LinkedHashMap<>();
        container.metadata().forEach((key, value) -> tags.put(key, List.of(value)));
        return Optional.of(new DecodedAudio(TagFormat.APE, tags, container.durationSeconds()));
    }
}
