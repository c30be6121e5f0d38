package com.libragraph.catalog.extractors.video;

import com.libragraph.catalog.extractors.ffmpeg.FfmpegContainer;
import com.libragraph.catalog.extractors.ffmpeg.FfmpegContainerReader;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link VideoContainerDecoder} backed by FFmpeg, which reads Matroska as well
 * as MP4 and QuickTime.
 * <p>
 * The General track carries the container tags renamed to General-track attribute
 * names. Matroska keeps the segment title as {@code title} and its SimpleTags
 * upper-cased ({@code ARTIST}, {@code DATE_RECORDED}); MP4 atoms arrive as
 * {@code artist}, {@code date}. Lookups ignore case, so one table covers both.
 * A Video and an Audio track are added for the first stream of each kind.
 */
@ApplicationScoped
public class FfmpegVideoContainerDecoder implements VideoContainerDecoder {

    /** General-track attribute → FFmpeg tag names, first non-blank wins. */
    private static final Map<String, String[]> ATTRIBUTES = new LinkedHashMap<>();

    static {
        ATTRIBUTES.put("title", new String[]{"title"});
        ATTRIBUTES.put("album", new String[]{"album"});
        ATTRIBUTES.put("performer", new String[]{"performer", "lead_performer", "artist"});
        ATTRIBUTES.put("genre", new String[]{"genre"});
        ATTRIBUTES.put("recorded_date", new String[]{"date_recorded", "date"});
    }

    @Override
    public boolean isAvailable() {
        return FfmpegContainerReader.isAvailable();
    }

    @Override
    public List<MediaTrack> decode(Path path) {
        FfmpegContainer container = FfmpegContainerReader.read(path);
        return tracksOf(container);
    }

    static List<MediaTrack> tracksOf(FfmpegContainer container) {
        Map<String, String> attributes = new LinkedHashMap<>();
        ATTRIBUTES.forEach((name, keys) -> {
            String value = container.firstOf(keys);
            if (value != null) {
                attributes.put(name, value);
            }
        });

        List<MediaTrack> tracks = new ArrayList<>();
        tracks.add(MediaTrack.general(attributes, container.durationSeconds()));
        if (container.videoCodec() != null) {
            tracks.add(new MediaTrack(MediaTrack.Type.VIDEO, Map.of("format", container.videoCodec()), null));
        }
        if (container.audioCodec() != null) {
            tracks.add(new MediaTrack(MediaTrack.Type.AUDIO, Map.of("format", container.audioCodec()), null));
        }
        return tracks;
    }
}
