package com.libragraph.folio.store;

import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

/**
 * Thrown when a read or delete targets an entry that does not exist.
 */
public class EntryNotFoundException extends FolioException {

    public EntryNotFoundException(String path) {
        super("Entry not found: " + path, path);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
