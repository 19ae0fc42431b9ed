package com.libragraph.folio.store;

import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Package backed by a directory tree. Entry bytes are read and written on demand;
 * only the path index is kept in memory.
 *
 * <p>Layout: entry {@code a/b.xhtml} lives at {@code {root}/a/b.xhtml}. Deleting the last
 * file of a directory removes the directory.
 */
public class DirectoryPackageStore extends AbstractPackageStore {

    private static final Logger log = Logger.getLogger(DirectoryPackageStore.class);

    private final Path root;
    private final boolean ownsRoot;
    private final Set<String> index = new LinkedHashSet<>();

    /**
     * Opens an existing directory in place.
     *
     * @param ownsRoot delete the directory tree on {@link #close()}
     * @throws PackageIOException if the directory does not exist or cannot be listed
     */
    public DirectoryPackageStore(Path root, boolean ownsRoot) {
        if (!Files.isDirectory(root)) {
            throw new PackageIOException("Package directory does not exist: " + root);
        }
        this.root = root.toAbsolutePath().normalize();
        this.ownsRoot = ownsRoot;
        index.addAll(scan(this.root));
        log.debugf("Opened directory package %s: %d entries", this.root, index.size());
    }

    public DirectoryPackageStore(Path root) {
        this(root, false);
    }

    /**
     * Relative paths of all regular files below {@code dir}, sorted.
     */
    static List<String> scan(Path dir) {
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> dir.relativize(p).toString().replace('\\', '/'))
                    .filter(PackagePath::isValid)
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new PackageIOException("Failed to list package directory: " + dir, e);
        }
    }

    public Path root() {
        return root;
    }

    private Path resolve(String path) {
        return root.resolve(path);
    }

    @Override
    protected synchronized byte[] read(String path) {
        if (!index.contains(path)) {
            return null;
        }
        try {
            return Files.readAllBytes(resolve(path));
        } catch (NoSuchFileException e) {
            index.remove(path);
            return null;
        } catch (IOException e) {
            throw new PackageIOException("Failed to read entry: " + path, path, e);
        }
    }

    @Override
    protected synchronized void write(String path, byte[] data) {
        Path file = resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, data);
        } catch (IOException e) {
            throw new PackageIOException("Failed to write entry: " + path, path, e);
        }
        index.add(path);
    }

    @Override
    protected synchronized boolean remove(String path) {
        if (!index.remove(path)) {
            return false;
        }
        Path file = resolve(path);
        try {
            Files.deleteIfExists(file);
            pruneEmptyParents(file.getParent());
        } catch (IOException e) {
            throw new PackageIOException("Failed to delete entry: " + path, path, e);
        }
        return true;
    }

    private void pruneEmptyParents(Path dir) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(root)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }

    @Override
    protected synchronized boolean contains(String path) {
        return index.contains(path);
    }

    @Override
    protected synchronized List<String> insertionOrder() {
        return new ArrayList<>(index);
    }

    @Override
    public String description() {
        return root.toString();
    }

    @Override
    public void close() {
        if (ownsRoot) {
            deleteTree(root);
        }
    }

    /**
     * Recursively deletes a directory tree; missing trees are ignored.
     */
    static void deleteTree(Path dir) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                        throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc)
                        throws IOException {
                    Files.delete(d);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new PackageIOException("Failed to delete work directory: " + dir, e);
        }
    }
}
