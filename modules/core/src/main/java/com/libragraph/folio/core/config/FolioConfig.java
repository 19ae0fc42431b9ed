package com.libragraph.folio.core.config;

import com.libragraph.folio.core.filter.FailurePolicy;
import com.libragraph.folio.core.filter.FilterSpec;
import com.libragraph.folio.core.layout.LayoutPlatform;
import com.libragraph.folio.core.protect.ProtectionOptions;
import com.libragraph.folio.store.StoreBackend;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fully resolved engine configuration. Built once by {@link FolioConfigResolver};
 * components read it and never look anything up themselves.
 *
 * @param filters        chain specs in order, platform and default language already
 *                       merged into the layout and metadata-normalize options
 * @param protectionKey  key for the protection step; absent means no protection
 * @param batchTimeout   per-job limit; absent means jobs may run indefinitely
 */
public record FolioConfig(
        List<FilterSpec> filters,
        FailurePolicy failurePolicy,
        LayoutPlatform platform,
        StoreBackend backend,
        boolean xmlCache,
        ProtectionOptions protection,
        Optional<String> protectionKey,
        int batchWidth,
        Optional<Duration> batchTimeout,
        String defaultLanguage) {

    public FolioConfig {
        filters = List.copyOf(filters);
        if (batchWidth < 1) {
            throw new IllegalArgumentException("folio.batch.width must be at least 1: " + batchWidth);
        }
    }

    public static FolioConfig defaults() {
        return new FolioConfigResolver().resolve();
    }

    /**
     * Resolves {@code overrides} on top of the defaults.
     */
    public static FolioConfig of(Map<String, String> overrides) {
        return new FolioConfigResolver().overrides(overrides).resolve();
    }
}
