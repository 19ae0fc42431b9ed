package com.libragraph.folio.types;

/**
 * Content flag of a package entry.
 */
public enum EntryKind {
    BINARY(0, "binary"),
    TEXT(1, "text"),
    MARKUP(2, "markup");

    private final int id;
    private final String label;

    EntryKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isTextual() {
        return this != BINARY;
    }

    public static EntryKind fromId(int id) {
        for (EntryKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown EntryKind id: " + id);
    }
}
