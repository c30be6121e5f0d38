package com.libragraph.catalog.extractors.ebook;

import com.libragraph.catalog.extractors.api.DecodeException;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.Property;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.parser.epub.EpubParser;
import org.xml.sax.helpers.DefaultHandler;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@link EbookMetadataDecoder} backed by Apache Tika's EPUB parser.
 * Tika surfaces the OPF Dublin Core elements as {@code dc:*} properties
 * ({@code dc:date} as {@code dcterms:created}); element attributes are not exposed.
 */
@ApplicationScoped
public class TikaEbookMetadataDecoder implements EbookMetadataDecoder {

    private static final Map<DublinCoreTerm, Property> PROPERTIES = new EnumMap<>(DublinCoreTerm.class);

    static {
        PROPERTIES.put(DublinCoreTerm.TITLE, TikaCoreProperties.TITLE);
        PROPERTIES.put(DublinCoreTerm.CREATOR, TikaCoreProperties.CREATOR);
        PROPERTIES.put(DublinCoreTerm.LANGUAGE, TikaCoreProperties.LANGUAGE);
        PROPERTIES.put(DublinCoreTerm.PUBLISHER, TikaCoreProperties.PUBLISHER);
        PROPERTIES.put(DublinCoreTerm.DATE, TikaCoreProperties.CREATED);
        PROPERTIES.put(DublinCoreTerm.IDENTIFIER, TikaCoreProperties.IDENTIFIER);
    }

    private final Parser parser = new EpubParser();

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("org.apache.tika.parser.epub.EpubParser");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public Map<DublinCoreTerm, List<DublinCoreValue>> decode(Path path) {
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, path.getFileName().toString());

        try (TikaInputStream stream = TikaInputStream.get(path)) {
            parser.parse(stream, new DefaultHandler(), metadata, new ParseContext());
        } catch (Exception e) {
            throw new DecodeException("Failed to read EPUB metadata from " + path, e);
        }

        Map<DublinCoreTerm, List<DublinCoreValue>> groups = new EnumMap<>(DublinCoreTerm.class);
        PROPERTIES.forEach((term, property) -> {
            List<DublinCoreValue> values = new ArrayList<>();
            for (String value : metadata.getValues(property)) {
                if (value != null && !value.isBlank()) {
                    values.add(DublinCoreValue.of(value.trim()));
                }
            }
            if (!values.isEmpty()) {
                groups.put(term, values);
            }
        });
        return groups;
    }
}
