package com.libragraph.folio.core.filter;

/**
 * A named transform over one package.
 * <p>
 * Implementations read and write entries through the {@link FilterContext}; any
 * exception they throw is attributed to {@link #name()} by the {@link FilterChain}.
 */
public interface PackageFilter {

    String name();

    void apply(FilterContext context);
}
