package com.libragraph.folio.core.filter;

import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

import java.util.Optional;

/**
 * A filter's failure, attributed to the filter by name. The original exception is the
 * cause, unchanged.
 */
public class FilterFailureException extends FolioException {

    private final String filterName;

    public FilterFailureException(String filterName, Throwable cause) {
        super("Filter '" + filterName + "' failed: " + cause.getMessage(), pathOf(cause), cause);
        this.filterName = filterName;
    }

    private static String pathOf(Throwable cause) {
        return cause instanceof FolioException fe ? fe.path().orElse(null) : null;
    }

    public String filterName() {
        return filterName;
    }

    /**
     * Taxonomy kind of the cause when it is a Folio failure.
     */
    public Optional<ErrorKind> causeKind() {
        return getCause() instanceof FolioException fe ? Optional.of(fe.kind()) : Optional.empty();
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FILTER_FAILURE;
    }
}
