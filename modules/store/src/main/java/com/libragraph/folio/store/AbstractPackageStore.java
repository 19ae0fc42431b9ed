package com.libragraph.folio.store;

import com.libragraph.folio.store.zip.ArchivedEntry;
import com.libragraph.folio.store.zip.ZipArchiveCodec;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.util.ContentHash;
import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Shared behavior of both backings: path normalization, listener notification,
 * manifest ordering and export. Subclasses supply raw entry access in insertion order.
 */
public abstract class AbstractPackageStore implements PackageStore {

    private static final Logger log = Logger.getLogger(AbstractPackageStore.class);

    private final List<StoreListener> listeners = new CopyOnWriteArrayList<>();
    private List<String> manifestOrder;

    /** Entry bytes, or null if the entry does not exist. */
    protected abstract byte[] read(String path);

    protected abstract void write(String path, byte[] data);

    /** Removes an entry; false if it did not exist. */
    protected abstract boolean remove(String path);

    protected abstract boolean contains(String path);

    /** All entry paths in insertion order. */
    protected abstract List<String> insertionOrder();

    /**
     * Entries handed to the archive writer, in insertion order. Archive-backed stores
     * override this to pass along the original compressed bytes of untouched entries.
     */
    protected List<ArchivedEntry> archiveEntries() {
        List<ArchivedEntry> entries = new ArrayList<>();
        for (String path : insertionOrder()) {
            entries.add(ArchivedEntry.fresh(path, read(path)));
        }
        return entries;
    }

    @Override
    public byte[] get(String path) {
        String p = PackagePath.normalize(path);
        byte[] data = read(p);
        if (data == null) {
            throw new EntryNotFoundException(p);
        }
        return data;
    }

    @Override
    public PackageEntry entry(String path) {
        String p = PackagePath.normalize(path);
        return new PackageEntry(p, get(p), MediaTypeResolver.kindOf(p));
    }

    @Override
    public void put(String path, byte[] data) {
        String p = PackagePath.normalize(path);
        write(p, data.clone());
        afterChange(p, StoreListener.Change.WRITTEN);
    }

    @Override
    public void delete(String path) {
        String p = PackagePath.normalize(path);
        if (!remove(p)) {
            throw new EntryNotFoundException(p);
        }
        afterChange(p, StoreListener.Change.DELETED);
    }

    @Override
    public boolean exists(String path) {
        return PackagePath.isValid(path) && contains(PackagePath.normalize(path));
    }

    @Override
    public synchronized List<String> list() {
        if (manifestOrder == null) {
            manifestOrder = ManifestIndex.readingOrder(this);
        }
        LinkedHashSet<String> result = new LinkedHashSet<>();
        for (String path : manifestOrder) {
            if (contains(path)) {
                result.add(path);
            }
        }
        result.addAll(insertionOrder());
        return List.copyOf(result);
    }

    @Override
    public ContentHash contentHash(String path) {
        return ContentHash.of(get(path));
    }

    @Override
    public void addListener(StoreListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(StoreListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void exportArchive(OutputStream out) {
        List<ArchivedEntry> entries = archiveEntries();
        try {
            ZipArchiveCodec.write(entries, out);
        } catch (IOException e) {
            throw new PackageIOException("Failed to export " + description(), e);
        }
        log.debugf("Exported %d entries of %s as archive", entries.size(), description());
    }

    @Override
    public void exportArchive(Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                exportArchive(out);
            }
        } catch (IOException e) {
            throw new PackageIOException("Failed to export " + description() + " to " + target, e);
        }
        log.infof("Exported %s to %s", description(), target);
    }

    @Override
    public void exportDirectory(Path target) {
        List<String> paths = insertionOrder();
        for (String path : paths) {
            Path file = target.resolve(path);
            try {
                Files.createDirectories(file.getParent());
                Files.write(file, read(path));
            } catch (IOException e) {
                throw new PackageIOException("Failed to export entry to " + file, path, e);
            }
        }
        log.infof("Exported %s to directory %s (%d entries)", description(), target, paths.size());
    }

    private void afterChange(String path, StoreListener.Change change) {
        if (path.equals(MediaTypes.CONTAINER_ENTRY) || PackagePath.extension(path).equals("opf")) {
            synchronized (this) {
                manifestOrder = null;
            }
        }
        for (StoreListener listener : listeners) {
            listener.entryChanged(path, change);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + description() + "]";
    }
}
