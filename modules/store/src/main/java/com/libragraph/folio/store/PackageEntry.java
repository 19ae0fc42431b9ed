package com.libragraph.folio.store;

import com.libragraph.folio.types.EntryKind;

import java.util.Objects;

/**
 * One entry of a package: its path, its bytes and its content flag.
 */
public record PackageEntry(String path, byte[] data, EntryKind kind) {

    public PackageEntry {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public int size() {
        return data.length;
    }
}
