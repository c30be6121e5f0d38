package com.libragraph.catalog.extractors.ebook;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Adapter over an EPUB metadata library.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface EbookMetadataDecoder {

    boolean isAvailable();

    /**
     * Reads the Dublin Core metadata groups of the package document.
     * Terms without values are absent from the map.
     *
     * @throws com.libragraph.catalog.extractors.api.DecodeException if the book cannot be read
     */
    Map<DublinCoreTerm, List<DublinCoreValue>> decode(Path path);
}
