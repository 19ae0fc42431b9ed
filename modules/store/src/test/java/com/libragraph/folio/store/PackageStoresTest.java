package com.libragraph.folio.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class PackageStoresTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldOpenArchiveInMemory() {
        Path epub = tempDir.resolve("book.epub");
        TestPackages.sample().exportArchive(epub);

        try (PackageStore store = PackageStores.open(epub, StoreBackend.ARCHIVE)) {
            assertThat(store).isInstanceOf(ArchivePackageStore.class);
            assertThat(store.getText("mimetype")).isEqualTo("application/epub+zip");
        }
    }

    @Test
    void shouldUnpackArchiveForDirectoryBackend() {
        Path epub = tempDir.resolve("book.epub");
        TestPackages.sample().exportArchive(epub);

        Path workDir;
        try (PackageStore store = PackageStores.open(epub, StoreBackend.DIRECTORY)) {
            assertThat(store).isInstanceOf(DirectoryPackageStore.class);
            workDir = ((DirectoryPackageStore) store).root();
            assertThat(workDir.resolve("OEBPS/content.opf")).exists();
            assertThat(store.list()).hasSize(6);
        }
        assertThat(workDir).doesNotExist();
    }

    @Test
    void shouldOpenDirectoryInPlace() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("book"));
        TestPackages.sample().exportDirectory(dir);

        try (PackageStore store = PackageStores.open(dir, StoreBackend.DIRECTORY)) {
            store.putText("added.txt", "x");
        }
        assertThat(dir.resolve("added.txt")).exists();
    }

    @Test
    void shouldNotTouchInputWhenIsolated() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("book"));
        TestPackages.sample().exportDirectory(dir);

        try (PackageStore store = PackageStores.openIsolated(dir, StoreBackend.DIRECTORY)) {
            store.delete("OEBPS/Styles/main.css");
            store.putText("added.txt", "x");
        }
        assertThat(dir.resolve("OEBPS/Styles/main.css")).exists();
        assertThat(dir.resolve("added.txt")).doesNotExist();
    }

    @Test
    void shouldExportToDirectoryWhenTargetIsDirectory() throws Exception {
        Path out = Files.createDirectory(tempDir.resolve("out"));

        PackageStores.export(TestPackages.sample(), out);

        assertThat(out.resolve("OEBPS/Text/ch1.xhtml")).exists();
    }

    @Test
    void shouldReproduceEntriesThroughBothBackings() {
        Path epub = tempDir.resolve("book.epub");
        ArchivePackageStore original = TestPackages.sample();
        original.exportArchive(epub);

        for (StoreBackend backend : StoreBackend.values()) {
            Path out = tempDir.resolve("copy-" + backend.label() + ".epub");
            try (PackageStore store = PackageStores.open(epub, backend)) {
                PackageStores.export(store, out);
            }
            try (PackageStore copy = PackageStores.open(out, StoreBackend.ARCHIVE)) {
                assertThat(copy.list()).containsExactlyInAnyOrderElementsOf(original.list());
                for (String path : original.list()) {
                    assertThat(copy.get(path)).as(backend + " " + path).isEqualTo(original.get(path));
                }
            }
        }
    }

    @Test
    void shouldFailForMissingInput() {
        assertThatThrownBy(() -> PackageStores.open(tempDir.resolve("none.epub"), StoreBackend.ARCHIVE))
                .isInstanceOf(PackageIOException.class);
    }
}
