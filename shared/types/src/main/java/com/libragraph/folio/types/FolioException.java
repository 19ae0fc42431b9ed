package com.libragraph.folio.types;

import java.util.Optional;

/**
 * Base class of all Folio failures. Carries the taxonomy kind and, where one
 * applies, the package entry the failure is about.
 */
public abstract class FolioException extends RuntimeException {

    private final String path;

    protected FolioException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    protected FolioException(String message, String path) {
        this(message, path, null);
    }

    public abstract ErrorKind kind();

    /**
     * Offending entry path, if the failure concerns a single entry.
     */
    public Optional<String> path() {
        return Optional.ofNullable(path);
    }
}
