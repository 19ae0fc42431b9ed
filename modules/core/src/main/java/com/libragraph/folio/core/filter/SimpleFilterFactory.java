package com.libragraph.folio.core.filter;

import java.util.Map;
import java.util.function.Function;

/**
 * Factory backed by a constructor reference.
 */
public record SimpleFilterFactory(String name, Function<Map<String, String>, PackageFilter> constructor)
        implements FilterFactory {

    @Override
    public PackageFilter create(Map<String, String> options) {
        return constructor.apply(options);
    }
}
