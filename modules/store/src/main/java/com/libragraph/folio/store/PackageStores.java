package com.libragraph.folio.store;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens packages from the filesystem and writes them back.
 */
public final class PackageStores {

    private static final Logger log = Logger.getLogger(PackageStores.class);

    private PackageStores() {
    }

    /**
     * Opens an archive file or a package directory.
     *
     * <p>With {@link StoreBackend#ARCHIVE} the package is read fully into memory. With
     * {@link StoreBackend#DIRECTORY} a directory is opened in place, while an archive is
     * first unpacked into a temporary work directory that {@link PackageStore#close()}
     * removes.
     *
     * @throws PackageIOException      if the input does not exist or cannot be read
     * @throws CorruptArchiveException if an archive input is not a valid package archive
     */
    public static PackageStore open(Path input, StoreBackend backend) {
        requireExists(input);
        if (Files.isDirectory(input)) {
            return backend == StoreBackend.ARCHIVE
                    ? ArchivePackageStore.fromDirectory(input)
                    : new DirectoryPackageStore(input, false);
        }
        ArchivePackageStore archive = ArchivePackageStore.fromArchive(readAll(input), input.toString());
        if (backend == StoreBackend.ARCHIVE) {
            return archive;
        }
        return unpack(archive);
    }

    /**
     * Like {@link #open}, but never mutates {@code input}: directory-backed stores always
     * work on a private copy. Batch jobs use this so that no two jobs share storage.
     */
    public static PackageStore openIsolated(Path input, StoreBackend backend) {
        requireExists(input);
        ArchivePackageStore loaded = Files.isDirectory(input)
                ? ArchivePackageStore.fromDirectory(input)
                : ArchivePackageStore.fromArchive(readAll(input), input.toString());
        return backend == StoreBackend.ARCHIVE ? loaded : unpack(loaded);
    }

    /**
     * Writes a store to {@code target}: as a directory tree when {@code target} is an
     * existing directory, otherwise as an archive file.
     */
    public static void export(PackageStore store, Path target) {
        if (Files.isDirectory(target)) {
            store.exportDirectory(target);
        } else {
            store.exportArchive(target);
        }
    }

    private static DirectoryPackageStore unpack(ArchivePackageStore archive) {
        Path workDir;
        try {
            workDir = Files.createTempDirectory("folio-");
        } catch (IOException e) {
            throw new PackageIOException("Failed to create work directory", e);
        }
        archive.exportDirectory(workDir);
        log.debugf("Unpacked %s into %s", archive.description(), workDir);
        return new DirectoryPackageStore(workDir, true);
    }

    private static void requireExists(Path input) {
        if (!Files.exists(input)) {
            throw new PackageIOException("Package does not exist: " + input);
        }
    }

    private static byte[] readAll(Path input) {
        try {
            return Files.readAllBytes(input);
        } catch (IOException e) {
            throw new PackageIOException("Failed to read package: " + input, e);
        }
    }
}
