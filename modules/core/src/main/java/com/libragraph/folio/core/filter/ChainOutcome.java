package com.libragraph.folio.core.filter;

import java.util.List;

/**
 * Result of running a {@link FilterChain}.
 */
public sealed interface ChainOutcome {

    /** Names of the filters that completed, in order. */
    List<String> applied();

    record Completed(List<String> applied) implements ChainOutcome {
        public Completed {
            applied = List.copyOf(applied);
        }
    }

    /**
     * {@code failure} is the first failure; {@code failures} holds every failure,
     * which differs only under {@link FailurePolicy#CONTINUE}.
     */
    record Failed(FilterFailureException failure, List<FilterFailureException> failures,
                  List<String> applied) implements ChainOutcome {
        public Failed {
            failures = List.copyOf(failures);
            applied = List.copyOf(applied);
        }
    }

    default boolean succeeded() {
        return this instanceof Completed;
    }

    /**
     * Throws the first failure, if any.
     */
    default void orThrow() {
        if (this instanceof Failed failed) {
            throw failed.failure();
        }
    }
}
