package com.libragraph.catalog.api.health;

import com.libragraph.catalog.extractors.api.MetadataExtractor;
import com.libragraph.catalog.extractors.registry.ExtractorRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports which extractors could load their decode library.
 * Stays UP when some are unavailable: their files are simply not extracted.
 */
@Readiness
@ApplicationScoped
public class ExtractorHealthCheck implements HealthCheck {

    @Inject
    ExtractorRegistry registry;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("extractors").up();
        for (MetadataExtractor extractor : registry.extractors()) {
            builder.withData(extractor.name(), extractor.isAvailable());
        }
        return builder.withData("registered", registry.size()).build();
    }
}
