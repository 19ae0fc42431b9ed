package com.libragraph.folio.core.opf;

import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

/**
 * Thrown when a package manifest (the package document or the protection manifest)
 * refers to entries that cannot be found or recovered.
 */
public class ManifestInconsistentException extends FolioException {

    public ManifestInconsistentException(String message, String path) {
        super(message, path);
    }

    public ManifestInconsistentException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MANIFEST_INCONSISTENT;
    }
}
