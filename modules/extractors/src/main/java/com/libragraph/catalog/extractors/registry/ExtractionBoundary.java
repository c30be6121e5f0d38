package com.libragraph.catalog.extractors.registry;

import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Runs one extractor step and turns any failure into an empty result.
 * Every fault is logged at DEBUG so a batch scan can still be diagnosed.
 */
public final class ExtractionBoundary {

    private static final Logger log = Logger.getLogger(ExtractionBoundary.class);

    private ExtractionBoundary() {
    }

    /**
     * @param label     what is being attempted, for the log line
     * @param operation step to run; a null return is treated like empty
     */
    public static <T> Optional<T> isolate(String label, Callable<Optional<T>> operation) {
        try {
            Optional<T> result = operation.call();
            return result != null ? result : Optional.empty();
        } catch (Exception | LinkageError e) {
            log.debugf(e, "%s failed: %s", label, e.getMessage());
            return Optional.empty();
        }
    }

    /** Boolean variant: failure counts as false. */
    public static boolean test(String label, Callable<Boolean> predicate) {
        return isolate(label, () -> Optional.ofNullable(predicate.call())).orElse(false);
    }
}
