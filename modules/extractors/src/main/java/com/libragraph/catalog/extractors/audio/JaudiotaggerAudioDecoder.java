package com.libragraph.catalog.extractors.audio;

import com.libragraph.catalog.extractors.api.DecodeException;
import com.libragraph.catalog.types.TagFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.mp3.MP3File;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagField;
import org.jaudiotagger.tag.TagTextField;
import org.jaudiotagger.tag.flac.FlacTag;
import org.jaudiotagger.tag.id3.AbstractID3Tag;
import org.jaudiotagger.tag.id3.ID3v24Tag;
import org.jaudiotagger.tag.mp4.Mp4Tag;
import org.jaudiotagger.tag.mp4.field.Mp4DiscNoField;
import org.jaudiotagger.tag.mp4.field.Mp4TrackField;
import org.jaudiotagger.tag.vorbiscomment.VorbisCommentTag;
import org.jaudiotagger.tag.wav.WavTag;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TaggedAudioDecoder} backed by jaudiotagger.
 * Handles MP3 (ID3), MP4/M4A/M4B (atoms), FLAC and Ogg/Opus (Vorbis comments) and WAV (RIFF INFO or ID3).
 * jaudiotagger has no Monkey's Audio reader, so APEv2 tags are never produced here.
 *
 * <p>The dialect is fixed here from the tag's type; downstream code only sees the
 * {@link TagFormat}. ID3 tags are read as ID3v2.4 so frame ids are always four letters,
 * and WAV INFO fields are re-keyed to their RIFF chunk ids.
 */
@ApplicationScoped
public class JaudiotaggerAudioDecoder implements TaggedAudioDecoder {

    static final String VORBIS_PICTURE_KEY = "METADATA_BLOCK_PICTURE";

    /** jaudiotagger's generic field names for WAV INFO → RIFF chunk ids. */
    private static final Map<String, String> RIFF_IDS = Map.of(
            "TITLE", "INAM",
            "ARTIST", "IART",
            "ALBUM", "IPRD",
            "GENRE", "IGNR",
            "YEAR", "ICRD",
            "COMMENT", "ICMT"
    );

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("org.jaudiotagger.audio.AudioFileIO");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public Optional<DecodedAudio> decode(Path path) {
        AudioFile audioFile;
        try {
            audioFile = AudioFileIO.read(path.toFile());
        } catch (CannotReadException e) {
            return Optional.empty();
        } catch (Exception e) {
            throw new DecodeException("Failed to read audio tags from " + path, e);
        }

        Double duration = durationOf(audioFile.getAudioHeader());
        Tag tag = primaryTag(audioFile);

        if (audioFile instanceof MP3File) {
            return Optional.of(new DecodedAudio(TagFormat.ID3, collect(tag), duration));
        }
        if (tag instanceof WavTag wav) {
            return Optional.of(decodeWav(wav, duration));
        }
        if (tag == null) {
            return Optional.of(new DecodedAudio(dialectOf(audioFile.createDefaultTag()), Map.of(), duration));
        }

        Map<String, List<Object>> tags = collect(tag);
        if (tag instanceof FlacTag flac && !flac.getImages().isEmpty()) {
            tags.computeIfAbsent(VORBIS_PICTURE_KEY, k -> new ArrayList<>())
                    .addAll(flac.getImages());
        }
        return Optional.of(new DecodedAudio(dialectOf(tag), tags, duration));
    }

    static TagFormat dialectOf(Tag tag) {
        if (tag instanceof AbstractID3Tag) return TagFormat.ID3;
        if (tag instanceof Mp4Tag) return TagFormat.MP4;
        if (tag instanceof FlacTag || tag instanceof VorbisCommentTag) return TagFormat.VORBIS;
        if (tag instanceof WavTag) return TagFormat.RIFF;
        return TagFormat.UNKNOWN;
    }

    private static Tag primaryTag(AudioFile audioFile) {
        if (audioFile instanceof MP3File mp3) {
            if (mp3.hasID3v2Tag()) {
                return mp3.getID3v2TagAsv24();
            }
            if (mp3.hasID3v1Tag()) {
                return new ID3v24Tag(mp3.getID3v1Tag());
            }
            return null;
        }
        return audioFile.getTag();
    }

    /**
     * A WAV can carry a LIST/INFO chunk, an ID3 chunk, or both, and jaudiotagger
     * may leave an empty INFO chunk beside a populated ID3 one. The first chunk
     * holding fields wins, INFO before ID3.
     */
    private static DecodedAudio decodeWav(WavTag wav, Double duration) {
        if (wav.isExistingInfoTag() && wav.getInfoTag().getFieldCount() > 0) {
            Map<String, List<Object>> tags = new LinkedHashMap<>();
            collect(wav.getInfoTag()).forEach((key, values) ->
                    tags.put(RIFF_IDS.getOrDefault(key, key), values));
            return new DecodedAudio(TagFormat.RIFF, tags, duration);
        }
        if (wav.isExistingId3Tag() && wav.getID3Tag() != null && wav.getID3Tag().getFieldCount() > 0) {
            return new DecodedAudio(TagFormat.ID3, collect(wav.getID3Tag()), duration);
        }
        return new DecodedAudio(TagFormat.RIFF, Map.of(), duration);
    }

    private static Map<String, List<Object>> collect(Tag tag) {
        Map<String, List<Object>> tags = new LinkedHashMap<>();
        if (tag == null) {
            return tags;
        }
        Iterator<TagField> fields = tag.getFields();
        while (fields.hasNext()) {
            TagField field = fields.next();
            Object value = valueOf(field);
            if (value != null) {
                tags.computeIfAbsent(field.getId(), k -> new ArrayList<>()).add(value);
            }
        }
        return tags;
    }

    private static Object valueOf(TagField field) {
        if (field instanceof Mp4TrackField track) {
            return Arrays.asList(track.getTrackNo(), track.getTrackTotal());
        }
        if (field instanceof Mp4DiscNoField disc) {
            return Arrays.asList(disc.getDiscNo(), disc.getDiscTotal());
        }
        if (field instanceof TagTextField text) {
            return text.getContent();
        }
        if (field.isBinary()) {
            try {
                return field.getRawContent();
            } catch (Exception e) {
                throw new DecodeException("Unreadable binary field " + field.getId(), e);
            }
        }
        return field.toString();
    }

    private static Double durationOf(AudioHeader header) {
        if (header == null) {
            return null;
        }
        double seconds = header.getPreciseTrackLength();
        return seconds > 0 ? seconds : null;
    }
}
