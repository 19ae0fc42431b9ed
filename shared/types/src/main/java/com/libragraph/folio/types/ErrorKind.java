package com.libragraph.folio.types;

/**
 * Failure taxonomy shared by every Folio component.
 * Single-package operations surface one of these through {@link FolioException};
 * batch runs record one per failed job.
 */
public enum ErrorKind {
    NOT_FOUND("NotFound"),
    CORRUPT_ARCHIVE("CorruptArchive"),
    IO_FAILURE("IOFailure"),
    MALFORMED_MARKUP("MalformedMarkup"),
    SERIALIZATION_MISMATCH("SerializationMismatch"),
    FILTER_FAILURE("FilterFailure"),
    AUTHENTICATION_FAILURE("AuthenticationFailure"),
    MANIFEST_INCONSISTENT("ManifestInconsistent"),
    CANCELLED("Cancelled"),
    TIMEOUT("Timeout");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
