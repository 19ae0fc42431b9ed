package com.libragraph.folio.core.filter;

/**
 * Thrown when a chain names a filter that is not registered.
 */
public class UnknownFilterException extends IllegalArgumentException {

    private final String filterName;

    public UnknownFilterException(String filterName) {
        super("Unknown filter: " + filterName);
        this.filterName = filterName;
    }

    public String filterName() {
        return filterName;
    }
}
