package com.libragraph.folio.core.filter;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Filter factories by name. Chains are resolved against the registry once, when they
 * are built; unknown and duplicate names are rejected there.
 */
public class FilterRegistry {

    private static final Logger log = Logger.getLogger(FilterRegistry.class);

    private final Map<String, FilterFactory> factories = new LinkedHashMap<>();

    public FilterRegistry register(FilterFactory factory) {
        FilterFactory existing = factories.putIfAbsent(factory.name(), factory);
        if (existing != null) {
            throw new IllegalStateException(
                    "Duplicate filter name '" + factory.name() + "': " +
                            existing.getClass().getName() + " and " + factory.getClass().getName());
        }
        log.debugf("Registered filter: %s → %s", factory.name(), factory.getClass().getSimpleName());
        return this;
    }

    public Optional<FilterFactory> lookup(String name) {
        return Optional.ofNullable(factories.get(name));
    }

    public List<String> names() {
        return List.copyOf(factories.keySet());
    }

    public FilterChain chain(List<FilterSpec> specs) {
        return chain(specs, FailurePolicy.FAIL_FAST);
    }

    /**
     * Resolves specs into a chain.
     *
     * @throws UnknownFilterException   if a name is not registered
     * @throws IllegalArgumentException if a name appears twice or an option is invalid
     */
    public FilterChain chain(List<FilterSpec> specs, FailurePolicy policy) {
        Set<String> seen = new HashSet<>();
        List<PackageFilter> filters = new ArrayList<>();
        for (FilterSpec spec : specs) {
            if (!seen.add(spec.name())) {
                throw new IllegalArgumentException("Duplicate filter in chain: " + spec.name());
            }
            FilterFactory factory = lookup(spec.name())
                    .orElseThrow(() -> new UnknownFilterException(spec.name()));
            filters.add(factory.create(spec.options()));
        }
        return new FilterChain(filters, policy);
    }
}
