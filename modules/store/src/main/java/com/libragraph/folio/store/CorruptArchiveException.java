package com.libragraph.folio.store;

import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

/**
 * Thrown when an archive violates the container structure: unreadable central
 * directory, duplicate entries, or entry names escaping the package root.
 */
public class CorruptArchiveException extends FolioException {

    public CorruptArchiveException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }

    public CorruptArchiveException(String message, String path) {
        super(message, path);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CORRUPT_ARCHIVE;
    }
}
