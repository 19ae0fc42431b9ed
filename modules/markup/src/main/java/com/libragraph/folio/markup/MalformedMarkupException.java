package com.libragraph.folio.markup;

import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

/**
 * Thrown when an entry cannot be parsed as well-formed XML.
 */
public class MalformedMarkupException extends FolioException {

    public MalformedMarkupException(String path, Throwable cause) {
        super("Malformed markup in " + path + ": " + cause.getMessage(), path, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MALFORMED_MARKUP;
    }
}
