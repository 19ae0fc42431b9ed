package com.libragraph.folio.store;

import com.libragraph.folio.util.ContentHash;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Path-keyed byte storage for one package instance.
 *
 * <p>Two realizations exist: {@link ArchivePackageStore} (fully in memory, built from
 * and flattened to an archive blob) and {@link DirectoryPackageStore} (entries read and
 * written lazily against a base directory). Callers cannot tell them apart: both
 * normalize paths with {@link com.libragraph.folio.util.PackagePath#normalize}, both
 * raise the same exceptions.
 *
 * <p>A store is owned by exactly one job at a time and is not safe for concurrent
 * mutation.
 */
public interface PackageStore extends AutoCloseable {

    /**
     * Reads an entry's bytes.
     *
     * @throws EntryNotFoundException if the entry does not exist
     * @throws PackageIOException on I/O errors
     */
    byte[] get(String path);

    /**
     * Reads an entry together with its content flag.
     *
     * @throws EntryNotFoundException if the entry does not exist
     */
    PackageEntry entry(String path);

    /**
     * Creates or overwrites an entry. Listeners are notified after the write.
     *
     * @throws PackageIOException on I/O errors
     */
    void put(String path, byte[] data);

    /**
     * Deletes an entry. Listeners are notified after the delete.
     *
     * @throws EntryNotFoundException if the entry does not exist
     * @throws PackageIOException on I/O errors
     */
    void delete(String path);

    boolean exists(String path);

    /**
     * Lists entry paths: entries referenced by the package manifest first (spine reading
     * order, then manifest listing order), then every other entry in insertion order.
     */
    List<String> list();

    /**
     * BLAKE3-128 digest of an entry's bytes.
     *
     * @throws EntryNotFoundException if the entry does not exist
     */
    ContentHash contentHash(String path);

    void addListener(StoreListener listener);

    void removeListener(StoreListener listener);

    /**
     * Writes the package as a zip archive: the {@code mimetype} marker first and
     * uncompressed, unmodified entries of an archive-backed store copied without
     * recompression.
     */
    void exportArchive(OutputStream out);

    void exportArchive(Path target);

    /**
     * Writes every entry below {@code target}, creating directories as needed.
     */
    void exportDirectory(Path target);

    /**
     * Human-readable origin of this store, for logs and error messages.
     */
    String description();

    /**
     * Entry text decoded in its declared encoding; see {@link EntryText}.
     */
    default String getText(String path) {
        return EntryText.decode(get(path)).text();
    }

    default void putText(String path, String text) {
        put(path, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Releases backing resources. Stores that own a temporary work directory delete it.
     */
    @Override
    default void close() {
    }
}
