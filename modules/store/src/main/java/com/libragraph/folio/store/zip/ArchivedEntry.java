package com.libragraph.folio.store.zip;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;

/**
 * An entry as read from an archive: decompressed bytes plus the original central
 * directory record and compressed bytes, kept so that an unmodified entry can be
 * written back without recompression.
 */
public record ArchivedEntry(String path, byte[] data, ZipArchiveEntry header, byte[] raw) {

    public static ArchivedEntry fresh(String path, byte[] data) {
        return new ArchivedEntry(path, data, null, null);
    }

    public boolean hasRaw() {
        return header != null && raw != null;
    }
}
