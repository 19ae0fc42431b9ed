package com.libragraph.folio.store;

import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

/**
 * Wraps checked I/O exceptions from store operations.
 */
public class PackageIOException extends FolioException {

    public PackageIOException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }

    public PackageIOException(String message, Throwable cause) {
        super(message, null, cause);
    }

    public PackageIOException(String message) {
        super(message, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.IO_FAILURE;
    }
}
