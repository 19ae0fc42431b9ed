package com.libragraph.folio.core.batch;

import com.libragraph.folio.core.filter.FilterChain;
import com.libragraph.folio.core.protect.ProtectionOptions;

/**
 * One stage of a {@link JobPipeline}. Protection is its own step and runs exactly
 * where the caller puts it.
 */
public sealed interface JobStep {

    record RunChain(FilterChain chain) implements JobStep {}

    record Protect(String key, ProtectionOptions options) implements JobStep {}

    record Unprotect(String key) implements JobStep {}

    static JobStep runChain(FilterChain chain) {
        return new RunChain(chain);
    }

    static JobStep protect(String key, ProtectionOptions options) {
        return new Protect(key, options);
    }

    static JobStep unprotect(String key) {
        return new Unprotect(key);
    }
}
