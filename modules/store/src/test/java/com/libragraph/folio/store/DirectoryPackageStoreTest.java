package com.libragraph.folio.store;

import com.libragraph.folio.types.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class DirectoryPackageStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldIndexExistingFilesSorted() throws Exception {
        write("b/two.txt", "2");
        write("a/one.txt", "1");

        DirectoryPackageStore store = new DirectoryPackageStore(tempDir);

        assertThat(store.list()).containsExactly("a/one.txt", "b/two.txt");
        assertThat(store.getText("a/one.txt")).isEqualTo("1");
    }

    @Test
    void shouldWriteThroughToDisk() throws Exception {
        DirectoryPackageStore store = new DirectoryPackageStore(tempDir);

        store.putText("OEBPS/Text/ch1.xhtml", "<html/>");

        assertThat(Files.readString(tempDir.resolve("OEBPS/Text/ch1.xhtml"))).isEqualTo("<html/>");
        assertThat(store.list()).containsExactly("OEBPS/Text/ch1.xhtml");
    }

    @Test
    void shouldPruneEmptyDirectoriesOnDelete() throws Exception {
        write("keep.txt", "k");
        DirectoryPackageStore store = new DirectoryPackageStore(tempDir);
        store.putText("deep/nested/file.txt", "x");

        store.delete("deep/nested/file.txt");

        assertThat(tempDir.resolve("deep")).doesNotExist();
        assertThat(tempDir).isDirectory();
        assertThat(store.exists("keep.txt")).isTrue();
    }

    @Test
    void shouldBehaveLikeArchiveStoreForMissingEntries() {
        DirectoryPackageStore store = new DirectoryPackageStore(tempDir);

        assertThatThrownBy(() -> store.get("nope"))
                .isInstanceOf(EntryNotFoundException.class);
        assertThatThrownBy(() -> store.delete("nope"))
                .isInstanceOf(EntryNotFoundException.class);
        assertThatThrownBy(() -> store.put("../escape", new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFailWithIoFailureForMissingDirectory() {
        assertThatThrownBy(() -> new DirectoryPackageStore(tempDir.resolve("absent")))
                .isInstanceOf(PackageIOException.class)
                .extracting(e -> ((PackageIOException) e).kind())
                .isEqualTo(ErrorKind.IO_FAILURE);
    }

    @Test
    void shouldUseManifestOrder() throws Exception {
        ArchivePackageStore sample = TestPackages.sample();
        sample.exportDirectory(tempDir);

        DirectoryPackageStore store = new DirectoryPackageStore(tempDir);

        assertThat(store.list()).startsWith("OEBPS/Text/ch2.xhtml", "OEBPS/Text/ch1.xhtml");
    }

    @Test
    void shouldDeleteOwnedRootOnClose() throws Exception {
        Path work = Files.createDirectory(tempDir.resolve("work"));
        DirectoryPackageStore store = new DirectoryPackageStore(work, true);
        store.putText("a/b.txt", "x");

        store.close();

        assertThat(work).doesNotExist();
    }

    @Test
    void shouldLeaveUnownedRootOnClose() {
        DirectoryPackageStore store = new DirectoryPackageStore(tempDir);
        store.putText("a.txt", "x");

        store.close();

        assertThat(tempDir.resolve("a.txt")).exists();
    }

    @Test
    void shouldExportArchiveReadableByArchiveStore() {
        DirectoryPackageStore store = new DirectoryPackageStore(tempDir);
        store.putText("mimetype", "application/epub+zip");
        store.put("img/x.png", new byte[]{1, 2, 3});

        Path out = tempDir.resolve("out.epub");
        store.exportArchive(out);

        ArchivePackageStore reopened = ArchivePackageStore.fromArchive(readAll(out), "out");
        assertThat(reopened.get("img/x.png")).containsExactly(1, 2, 3);
        assertThat(reopened.getText("mimetype")).isEqualTo("application/epub+zip");
        assertThat(store.exists("out.epub")).isFalse();
    }

    private void write(String relative, String content) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static byte[] readAll(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
