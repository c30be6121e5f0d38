package com.libragraph.catalog.api;

import com.libragraph.catalog.extractors.api.FileContext;
import com.libragraph.catalog.extractors.api.NormalizedRecord;
import com.libragraph.catalog.extractors.registry.ExtractorRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.nio.file.InvalidPathException;
import java.util.Optional;

/**
 * Reads normalized metadata for a file on the server's filesystem.
 * Answers 204 when no extractor produced a record.
 */
@Path("/api/metadata")
@Produces(MediaType.APPLICATION_JSON)
public class MetadataResource {

    private static final Logger log = Logger.getLogger(MetadataResource.class);

    @Inject
    ExtractorRegistry registry;

    @GET
    public Response extract(@QueryParam("path") String path, @QueryParam("mime") String mime) {
        if (path == null || path.isBlank()) {
            throw new BadRequestException("Query parameter 'path' is required");
        }

        java.nio.file.Path file;
        try {
            file = java.nio.file.Path.of(path);
        } catch (InvalidPathException e) {
            throw new BadRequestException("Invalid path: " + path, e);
        }

        Optional<NormalizedRecord> record = registry.extract(FileContext.of(file).withMimeType(mime));
        if (record.isEmpty()) {
            log.debugf("No metadata extracted from %s", file);
            return Response.noContent().build();
        }
        return Response.ok(record.get()).build();
    }
}
