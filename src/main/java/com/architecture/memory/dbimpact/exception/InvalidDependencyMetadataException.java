package com.architecture.memory.dbimpact.exception;

/**
 * Dependency metadata that cannot be interpreted without guessing,
 * e.g. an entity type the engine does not know. Never swallowed.
 */
public class InvalidDependencyMetadataException extends RuntimeException {

    public InvalidDependencyMetadataException(String message) {
        super(message);
    }
}
