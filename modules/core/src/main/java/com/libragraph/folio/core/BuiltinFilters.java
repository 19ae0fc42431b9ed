package com.libragraph.folio.core;

import com.libragraph.folio.core.filter.FilterRegistry;
import com.libragraph.folio.core.layout.LayoutTransform;
import com.libragraph.folio.core.standardize.MarkupOptimizeFilter;
import com.libragraph.folio.core.standardize.MetadataNormalizeFilter;
import com.libragraph.folio.core.standardize.PrivacyScrubFilter;
import com.libragraph.folio.core.standardize.StructuralRepairFilter;
import com.libragraph.folio.core.standardize.StyleOptimizeFilter;
import com.libragraph.folio.core.standardize.VersionUpgradeFilter;

import java.time.Clock;

/**
 * The filters shipped with Folio.
 */
public final class BuiltinFilters {

    private BuiltinFilters() {
    }

    public static FilterRegistry registry() {
        return registry(Clock.systemUTC());
    }

    /**
     * @param clock source of the {@code dcterms:modified} stamp written by version-upgrade
     */
    public static FilterRegistry registry(Clock clock) {
        return new FilterRegistry()
                .register(StructuralRepairFilter.factory())
                .register(PrivacyScrubFilter.factory())
                .register(VersionUpgradeFilter.factory(clock))
                .register(MetadataNormalizeFilter.factory())
                .register(StyleOptimizeFilter.factory())
                .register(MarkupOptimizeFilter.factory())
                .register(LayoutTransform.factory());
    }
}
