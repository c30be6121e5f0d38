package com.libragraph.catalog.extractors.ebook;

import com.libragraph.catalog.extractors.api.AbstractMetadataExtractor;
import com.libragraph.catalog.extractors.api.NormalizedRecord;
import com.libragraph.catalog.extractors.mapping.FieldMappingTables;
import com.libragraph.catalog.types.TagFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extractor for EPUB books, reading OPF Dublin Core metadata.
 * Priority 100 (lowest); only epub files are claimed so no overlap exists.
 */
@ApplicationScoped
public class EbookExtractor extends AbstractMetadataExtractor {

    public static final String NAME = "ebook";
    public static final int PRIORITY = 100;

    static final String CONTAINER = "epub";

    private final EbookMetadataDecoder decoder;

    EbookExtractor() {
        this.decoder = null;
    }

    @Inject
    public EbookExtractor(EbookMetadataDecoder decoder) {
        super(NAME, PRIORITY, Set.of(CONTAINER), checkAvailability(NAME, decoder::isAvailable));
        this.decoder = decoder;
    }

    @Override
    protected Optional<NormalizedRecord> doExtract(Path path) {
        Map<DublinCoreTerm, List<DublinCoreValue>> groups = decoder.decode(path);
        if (groups == null || groups.isEmpty()) {
            return Optional.empty();
        }

        Map<String, List<String>> tags = new LinkedHashMap<>();
        groups.forEach((term, values) -> tags.put(term.term(),
                values.stream().map(DublinCoreValue::value).toList()));

        return Optional.of(NormalizedRecord.builder(CONTAINER, TagFormat.OPF)
                .fields(FieldMappingTables.OPF.apply(tags))
                .build());
    }
}
