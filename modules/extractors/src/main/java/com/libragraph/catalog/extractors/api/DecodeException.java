package com.libragraph.catalog.extractors.api;

/**
 * Wraps checked exceptions thrown by an external decode library.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public DecodeException(String message) {
        super(message);
    }
}
