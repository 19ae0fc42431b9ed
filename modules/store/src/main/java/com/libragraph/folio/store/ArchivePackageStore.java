package com.libragraph.folio.store;

import com.libragraph.folio.store.zip.ArchivedEntry;
import com.libragraph.folio.store.zip.ZipArchiveCodec;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Package held entirely in memory.
 *
 * <p>Entries read from an archive keep their original compressed bytes until they are
 * overwritten with different content, so an unmodified entry is exported without
 * recompression.
 */
public class ArchivePackageStore extends AbstractPackageStore {

    private static final Logger log = Logger.getLogger(ArchivePackageStore.class);

    private final Map<String, ArchivedEntry> entries = new LinkedHashMap<>();
    private final String description;

    private ArchivePackageStore(String description) {
        this.description = description;
    }

    /**
     * Creates a store with no entries.
     */
    public static ArchivePackageStore empty() {
        return new ArchivePackageStore("<memory>");
    }

    /**
     * Loads an archive blob.
     *
     * @throws CorruptArchiveException on an unreadable central directory, duplicate entries
     *                                 or unsafe entry names
     */
    public static ArchivePackageStore fromArchive(byte[] blob, String description) {
        ArchivePackageStore store = new ArchivePackageStore(description);
        for (ArchivedEntry entry : ZipArchiveCodec.read(blob, description)) {
            store.entries.put(entry.path(), entry);
        }
        log.debugf("Loaded %s: %d entries", description, store.entries.size());
        return store;
    }

    /**
     * Reads every regular file below {@code dir} into memory, in sorted path order.
     *
     * @throws PackageIOException if the directory cannot be read
     */
    public static ArchivePackageStore fromDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new PackageIOException("Not a directory: " + dir);
        }
        ArchivePackageStore store = new ArchivePackageStore(dir.toString());
        for (String path : DirectoryPackageStore.scan(dir)) {
            try {
                store.entries.put(path, ArchivedEntry.fresh(path, Files.readAllBytes(dir.resolve(path))));
            } catch (IOException e) {
                throw new PackageIOException("Failed to read " + dir.resolve(path), path, e);
            }
        }
        log.debugf("Loaded %s: %d entries", dir, store.entries.size());
        return store;
    }

    @Override
    protected synchronized byte[] read(String path) {
        ArchivedEntry entry = entries.get(path);
        return entry == null ? null : entry.data().clone();
    }

    @Override
    protected synchronized void write(String path, byte[] data) {
        ArchivedEntry previous = entries.get(path);
        if (previous != null && previous.hasRaw() && Arrays.equals(previous.data(), data)) {
            return;
        }
        entries.put(path, ArchivedEntry.fresh(path, data));
    }

    @Override
    protected synchronized boolean remove(String path) {
        return entries.remove(path) != null;
    }

    @Override
    protected synchronized boolean contains(String path) {
        return entries.containsKey(path);
    }

    @Override
    protected synchronized List<String> insertionOrder() {
        return new ArrayList<>(entries.keySet());
    }

    @Override
    protected synchronized List<ArchivedEntry> archiveEntries() {
        return new ArrayList<>(entries.values());
    }

    /**
     * Entry count; cheaper than {@code list().size()}.
     */
    public synchronized int size() {
        return entries.size();
    }

    /**
     * Paths of entries that will be written back without recompression.
     */
    public synchronized List<String> untouchedEntries() {
        return entries.values().stream()
                .filter(ArchivedEntry::hasRaw)
                .map(ArchivedEntry::path)
                .toList();
    }

    @Override
    public String description() {
        return description;
    }
}
