package com.libragraph.folio.store;

/**
 * Backing chosen when a package is opened.
 */
public enum StoreBackend {
    /** Entire package held in memory; lowest latency, peak memory = package size. */
    ARCHIVE("archive"),
    /** Entries live in a directory tree and are read on demand. */
    DIRECTORY("directory");

    private final String label;

    StoreBackend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static StoreBackend fromLabel(String label) {
        for (StoreBackend b : values()) {
            if (b.label.equalsIgnoreCase(label)) return b;
        }
        throw new IllegalArgumentException("Unknown store backend: " + label);
    }
}
