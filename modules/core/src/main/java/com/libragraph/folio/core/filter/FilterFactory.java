package com.libragraph.folio.core.filter;

import java.util.Map;

/**
 * Creates configured instances of one filter.
 */
public interface FilterFactory {

    String name();

    /**
     * @throws IllegalArgumentException if an option is invalid
     */
    PackageFilter create(Map<String, String> options);
}
