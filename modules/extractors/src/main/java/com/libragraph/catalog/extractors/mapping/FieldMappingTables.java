package com.libragraph.catalog.extractors.mapping;

import com.libragraph.catalog.types.TagFormat;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.libragraph.catalog.types.CanonicalField.*;

/**
 * Registry of the per-dialect key tables.
 * Defines how each tag dialect's keys map onto canonical fields.
 */
public final class FieldMappingTables {

    /** ID3v2 frame ids. The date frames are listed so that TYER beats TORY beats TDRC. */
    public static final FieldMappingTable ID3 = FieldMappingTable.builder(TagFormat.ID3)
            .map("TIT2", TITLE)
            .map("TPE1", ARTIST)
            .map("TALB", ALBUM)
            .map("TPE2", ALBUM_ARTIST)
            .map("TCON", GENRE)
            .map("TDRC", DATE)
            .map("TORY", DATE)
            .map("TYER", DATE)
            .map("TLAN", LANGUAGE)
            .map("TPUB", PUBLISHER)
            .map("TCOM", COMPOSER)
            .map("TENC", ENCODER)
            .map("USLT", LYRICS)
            .map("COMM", COMMENT)
            .notation("TRCK", TRACK, TRACK_TOTAL)
            .notation("TPOS", DISC, DISC_TOTAL)
            .build();

    /** iTunes-style MP4 atoms; trkn and disk carry (number, total) pairs. */
    public static final FieldMappingTable MP4 = FieldMappingTable.builder(TagFormat.MP4)
            .map("©nam", TITLE)
            .map("©ART", ARTIST)
            .map("©alb", ALBUM)
            .map("aART", ALBUM_ARTIST)
            .map("©gen", GENRE)
            .map("©day", DATE)
            .map("©lyr", LYRICS)
            .map("©too", ENCODER)
            .map("©wrt", COMPOSER)
            .map("©cmt", COMMENT)
            .notation("trkn", TRACK, TRACK_TOTAL)
            .notation("disk", DISC, DISC_TOTAL)
            .build();

    /** Vorbis comment names (FLAC, Ogg, Opus). Names are case-insensitive. */
    public static final FieldMappingTable VORBIS = FieldMappingTable.builder(TagFormat.VORBIS)
            .caseInsensitiveKeys()
            .map("TITLE", TITLE)
            .map("ARTIST", ARTIST)
            .map("ALBUM", ALBUM)
            .map("ALBUMARTIST", ALBUM_ARTIST)
            .map("GENRE", GENRE)
            .map("DATE", DATE)
            .map("TRACKNUMBER", TRACK)
            .map("TRACKTOTAL", TRACK_TOTAL)
            .map("DISCNUMBER", DISC)
            .map("DISCTOTAL", DISC_TOTAL)
            .map("LANGUAGE", LANGUAGE)
            .map("PUBLISHER", PUBLISHER)
            .map("COMPOSER", COMPOSER)
            .map("COMMENT", COMMENT)
            .map("LYRICS", LYRICS)
            .map("ENCODER", ENCODER)
            .build();

    /** APEv2 item keys follow the Vorbis comment names. */
    public static final FieldMappingTable APE = VORBIS.aliasFor(TagFormat.APE);

    /** RIFF LIST/INFO chunk ids in WAV files. */
    public static final FieldMappingTable RIFF = FieldMappingTable.builder(TagFormat.RIFF)
            .map("INAM", TITLE)
            .map("IART", ARTIST)
            .map("IPRD", ALBUM)
            .map("IGNR", GENRE)
            .map("ICRD", DATE)
            .map("ICMT", COMMENT)
            .build();

    /** Attributes of a video container's General track. */
    public static final FieldMappingTable MATROSKA = FieldMappingTable.builder(TagFormat.MATROSKA)
            .map("title", TITLE)
            .map("album", ALBUM)
            .map("performer", ARTIST)
            .map("genre", GENRE)
            .map("recorded_date", DATE)
            .build();

    /** Dublin Core terms of an EPUB package document. All creators are kept. */
    public static final FieldMappingTable OPF = FieldMappingTable.builder(TagFormat.OPF)
            .map("title", TITLE)
            .joined("creator", AUTHOR, ", ")
            .map("language", LANGUAGE)
            .map("publisher", PUBLISHER)
            .map("date", DATE)
            .map("identifier", IDENTIFIER)
            .build();

    private static final Map<TagFormat, FieldMappingTable> BY_DIALECT = new EnumMap<>(TagFormat.class);

    static {
        register(ID3);
        register(MP4);
        register(VORBIS);
        register(APE);
        register(RIFF);
        register(MATROSKA);
        register(OPF);
    }

    private FieldMappingTables() {
    }

    private static void register(FieldMappingTable table) {
        BY_DIALECT.put(table.dialect(), table);
    }

    /**
     * Gets the table for a dialect. {@link TagFormat#UNKNOWN} has none.
     */
    public static Optional<FieldMappingTable> forDialect(TagFormat dialect) {
        return Optional.ofNullable(BY_DIALECT.get(dialect));
    }
}
