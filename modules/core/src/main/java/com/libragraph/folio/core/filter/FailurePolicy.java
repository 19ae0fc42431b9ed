package com.libragraph.folio.core.filter;

public enum FailurePolicy {
    /** Stop at the first failing filter. */
    FAIL_FAST,
    /** Run every filter; the first failure is still the chain's failure. */
    CONTINUE
}
