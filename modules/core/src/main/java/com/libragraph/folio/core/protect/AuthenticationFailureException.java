package com.libragraph.folio.core.protect;

import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

/**
 * The key given to {@link ProtectionCodec#unprotect} does not reproduce the recorded
 * checksum of a protected entry.
 */
public class AuthenticationFailureException extends FolioException {

    public AuthenticationFailureException(String path) {
        super("Checksum mismatch, wrong protection key: " + path, path);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTHENTICATION_FAILURE;
    }
}
