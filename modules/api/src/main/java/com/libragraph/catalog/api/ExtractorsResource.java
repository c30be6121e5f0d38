package com.libragraph.catalog.api;

import com.libragraph.catalog.extractors.registry.ExtractorRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

@Path("/api/extractors")
@Produces(MediaType.APPLICATION_JSON)
public class ExtractorsResource {

    @Inject
    ExtractorRegistry registry;

    public record ExtractorInfo(String name, int priority, boolean available) {
    }

    /** Registered extractors in the order the registry consults them. */
    @GET
    public List<ExtractorInfo> list() {
        return registry.extractors().stream()
                .map(e -> new ExtractorInfo(e.name(), e.priority(), e.isAvailable()))
                .toList();
    }
}
