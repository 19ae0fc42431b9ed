package com.libragraph.folio.core.filter;

import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.PackageStore;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, validated sequence of filters. Built by {@link FilterRegistry#chain}; an
 * instance holds no per-package state and can run against many stores.
 */
public class FilterChain {

    private static final Logger log = Logger.getLogger(FilterChain.class);

    private final List<PackageFilter> filters;
    private final FailurePolicy policy;

    FilterChain(List<PackageFilter> filters, FailurePolicy policy) {
        this.filters = List.copyOf(filters);
        this.policy = policy;
    }

    public static FilterChain empty() {
        return new FilterChain(List.of(), FailurePolicy.FAIL_FAST);
    }

    public List<String> names() {
        return filters.stream().map(PackageFilter::name).toList();
    }

    public FailurePolicy policy() {
        return policy;
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    /**
     * Runs every filter in order. On failure the store keeps whatever the earlier
     * filters (and the failing one, up to its failure) wrote; it is not rolled back.
     */
    public ChainOutcome run(PackageStore store, DocumentCache cache) {
        return run(new FilterContext(store, cache));
    }

    public ChainOutcome run(FilterContext context) {
        List<String> applied = new ArrayList<>();
        List<FilterFailureException> failures = new ArrayList<>();
        log.debugf("Running chain %s on %s", names(), context.store().description());

        for (PackageFilter filter : filters) {
            try {
                filter.apply(context);
                applied.add(filter.name());
                log.debugf("Filter %s completed on %s", filter.name(), context.store().description());
            } catch (RuntimeException e) {
                FilterFailureException failure = new FilterFailureException(filter.name(), e);
                failures.add(failure);
                log.warnf("Filter %s failed on %s: %s",
                        filter.name(), context.store().description(), e.getMessage());
                if (policy == FailurePolicy.FAIL_FAST) {
                    break;
                }
            }
        }

        if (failures.isEmpty()) {
            return new ChainOutcome.Completed(applied);
        }
        return new ChainOutcome.Failed(failures.get(0), failures, applied);
    }
}
