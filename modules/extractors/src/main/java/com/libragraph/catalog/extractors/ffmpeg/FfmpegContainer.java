package com.libragraph.catalog.extractors.ffmpeg;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Container-level facts FFmpeg reports for one file.
 *
 * @param format          demuxer name, e.g. {@code matroska,webm} or {@code ape}
 * @param metadata        format-level tags; lookups ignore key case
 * @param durationSeconds container duration, null when FFmpeg does not know it
 * @param videoCodec      codec of the first video stream, null when there is none
 * @param audioCodec      codec of the first audio stream, null when there is none
 */
public record FfmpegContainer(
        String format,
        Map<String, String> metadata,
        Double durationSeconds,
        String videoCodec,
        String audioCodec
) {
    public FfmpegContainer {
        TreeMap<String, String> tags = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (metadata != null) {
            tags.putAll(metadata);
        }
        metadata = Collections.unmodifiableMap(tags);
    }

    /** First non-blank value among the given tag names. */
    public String firstOf(String... keys) {
        for (String key : keys) {
            String value = metadata.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
