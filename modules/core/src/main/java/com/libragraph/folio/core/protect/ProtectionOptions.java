package com.libragraph.folio.core.protect;

import java.util.EnumSet;
import java.util.Set;

public record ProtectionOptions(ProtectionAlgorithm algorithm, Set<ProtectionTarget> targets) {

    public ProtectionOptions {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("At least one protection target is required");
        }
        targets = Set.copyOf(targets);
    }

    public static ProtectionOptions defaults() {
        return new ProtectionOptions(ProtectionAlgorithm.BASIC, EnumSet.of(ProtectionTarget.FONT));
    }

    boolean selects(String path) {
        return targets.stream().anyMatch(t -> t.matches(path));
    }
}
