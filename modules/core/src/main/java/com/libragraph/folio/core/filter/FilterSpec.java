package com.libragraph.folio.core.filter;

import java.util.Map;
import java.util.Objects;

/**
 * A filter name with its resolved options.
 */
public record FilterSpec(String name, Map<String, String> options) {

    public FilterSpec {
        Objects.requireNonNull(name, "name cannot be null");
        options = Map.copyOf(options);
    }

    public static FilterSpec of(String name) {
        return new FilterSpec(name, Map.of());
    }

    public String option(String key, String defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }
}
