package com.libragraph.catalog.extractors.audio;

import com.libragraph.catalog.types.TagFormat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tag container returned by a {@link TaggedAudioDecoder}.
 *
 * @param dialect         tag dialect, decided by the adapter from the decoded tag's type
 * @param tags            dialect key (frame id, atom name, comment name) → values in file order;
 *                        values are strings, number pairs for track/disc atoms, or raw bytes
 * @param durationSeconds stream length in seconds, null when unknown
 */
public record DecodedAudio(
        TagFormat dialect,
        Map<String, List<Object>> tags,
        Double durationSeconds
) {
    public DecodedAudio {
        Objects.requireNonNull(dialect, "dialect cannot be null");
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        if (tags != null) {
            tags.forEach((key, values) -> {
                if (values != null && !values.isEmpty()) {
                    copy.put(key, Collections.unmodifiableList(values));
                }
            });
        }
        tags = Collections.unmodifiableMap(copy);
    }

    public boolean hasTags() {
        return !tags.isEmpty();
    }
}
