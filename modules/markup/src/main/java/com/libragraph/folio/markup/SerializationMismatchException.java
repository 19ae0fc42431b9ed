package com.libragraph.folio.markup;

import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

/**
 * Thrown when a document is written in a mode its root element does not fit,
 * e.g. a content document written as a package document.
 */
public class SerializationMismatchException extends FolioException {

    public SerializationMismatchException(String message, String path) {
        super(message, path);
    }

    public SerializationMismatchException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SERIALIZATION_MISMATCH;
    }
}
