package com.libragraph.folio.core.protect;

import java.util.List;

/**
 * Entries changed by one protect or unprotect call.
 *
 * @param entries            the mappings applied or reverted
 * @param rewrittenReferrers entries whose references were rewritten
 */
public record ProtectionResult(List<ProtectedEntry> entries, List<String> rewrittenReferrers) {

    public ProtectionResult {
        entries = List.copyOf(entries);
        rewrittenReferrers = List.copyOf(rewrittenReferrers);
    }

    public static ProtectionResult none() {
        return new ProtectionResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
