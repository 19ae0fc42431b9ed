package com.libragraph.folio.store;

import com.libragraph.folio.types.EntryKind;
import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.util.ContentHash;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ArchivePackageStoreTest {

    @Test
    void shouldPutGetAndDelete() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.put("a/b.txt", new byte[]{1, 2, 3});

        assertThat(store.exists("a/b.txt")).isTrue();
        assertThat(store.get("a/b.txt")).containsExactly(1, 2, 3);

        store.put("a/b.txt", new byte[]{4});
        assertThat(store.get("a/b.txt")).containsExactly(4);

        store.delete("a/b.txt");
        assertThat(store.exists("a/b.txt")).isFalse();
    }

    @Test
    void shouldFailWithNotFoundForMissingEntry() {
        ArchivePackageStore store = ArchivePackageStore.empty();

        assertThatThrownBy(() -> store.get("missing.txt"))
                .isInstanceOf(EntryNotFoundException.class)
                .satisfies(e -> {
                    EntryNotFoundException nf = (EntryNotFoundException) e;
                    assertThat(nf.kind()).isEqualTo(ErrorKind.NOT_FOUND);
                    assertThat(nf.path()).contains("missing.txt");
                });
        assertThatThrownBy(() -> store.delete("missing.txt"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void shouldRejectEscapingPaths() {
        ArchivePackageStore store = ArchivePackageStore.empty();

        assertThatThrownBy(() -> store.put("../evil", new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.put("/abs", new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.exists("../evil")).isFalse();
    }

    @Test
    void shouldNormalizeBackslashes() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.putText("Text\\ch1.xhtml", "x");

        assertThat(store.exists("Text/ch1.xhtml")).isTrue();
    }

    @Test
    void shouldNotExposeInternalBuffers() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        byte[] data = {1, 2};
        store.put("x.bin", data);
        data[0] = 9;
        store.get("x.bin")[1] = 9;

        assertThat(store.get("x.bin")).containsExactly(1, 2);
    }

    @Test
    void shouldListManifestOrderFirst() {
        ArchivePackageStore store = TestPackages.sample();
        store.putText("extra.txt", "x");

        assertThat(store.list()).containsExactly(
                "OEBPS/Text/ch2.xhtml",
                "OEBPS/Text/ch1.xhtml",
                "OEBPS/Styles/main.css",
                "mimetype",
                "META-INF/container.xml",
                "OEBPS/content.opf",
                "extra.txt");
    }

    @Test
    void shouldRecomputeOrderAfterPackageDocumentWrite() {
        ArchivePackageStore store = TestPackages.sample();
        store.list();

        store.putText("OEBPS/content.opf", TestPackages.OPF.replace(
                "<itemref idref=\"c2\"/>\n    <itemref idref=\"c1\"/>",
                "<itemref idref=\"c1\"/>\n    <itemref idref=\"c2\"/>"));

        assertThat(store.list()).startsWith("OEBPS/Text/ch1.xhtml", "OEBPS/Text/ch2.xhtml");
    }

    @Test
    void shouldFallBackToInsertionOrderWithoutPackageDocument() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.putText("b", "1");
        store.putText("a", "2");

        assertThat(store.list()).containsExactly("b", "a");
    }

    @Test
    void shouldClassifyEntries() {
        ArchivePackageStore store = TestPackages.sample();
        store.put("OEBPS/Fonts/a.ttf", new byte[]{0});

        assertThat(store.entry("OEBPS/Text/ch1.xhtml").kind()).isEqualTo(EntryKind.MARKUP);
        assertThat(store.entry("OEBPS/Styles/main.css").kind()).isEqualTo(EntryKind.TEXT);
        assertThat(store.entry("OEBPS/Fonts/a.ttf").kind()).isEqualTo(EntryKind.BINARY);
    }

    @Test
    void shouldHashContent() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.putText("a.txt", "same");
        store.putText("b.txt", "same");

        assertThat(store.contentHash("a.txt"))
                .isEqualTo(store.contentHash("b.txt"))
                .isEqualTo(ContentHash.of("same".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldNotifyListeners() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        List<String> events = new ArrayList<>();
        StoreListener listener = (path, change) -> events.add(change + ":" + path);
        store.addListener(listener);

        store.putText("a.txt", "1");
        store.delete("a.txt");
        store.removeListener(listener);
        store.putText("b.txt", "2");

        assertThat(events).containsExactly("WRITTEN:a.txt", "DELETED:a.txt");
    }

    @Test
    void shouldRoundTripThroughArchive() {
        ArchivePackageStore store = TestPackages.sample();
        store.put("OEBPS/Images/empty.png", new byte[0]);

        ArchivePackageStore reopened = ArchivePackageStore.fromArchive(export(store), "roundtrip");

        assertThat(reopened.list()).containsExactlyInAnyOrderElementsOf(store.list());
        for (String path : store.list()) {
            assertThat(reopened.get(path)).as(path).isEqualTo(store.get(path));
        }
    }

    @Test
    void shouldWriteMimetypeFirstAndStored() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.putText("OEBPS/a.xhtml", "<html/>");
        store.putText("mimetype", "application/epub+zip");

        byte[] blob = export(store);

        // Local file header: method at 8, name length at 26, extra length at 28, name at 30
        assertThat(blob[8] | blob[9]).isZero();
        assertThat(blob[26]).isEqualTo((byte) 8);
        assertThat(blob[28] | blob[29]).isZero();
        assertThat(new String(blob, 30, 8, StandardCharsets.US_ASCII)).isEqualTo("mimetype");
        assertThat(new String(blob, 38, 20, StandardCharsets.US_ASCII)).isEqualTo("application/epub+zip");
    }

    @Test
    void shouldCopyUnmodifiedEntriesWithoutRecompression() throws Exception {
        byte[] original = TestPackages.zip(List.of(
                Map.entry("mimetype", "application/epub+zip"),
                Map.entry("OEBPS/a.xhtml", "<html>" + "text ".repeat(200) + "</html>"),
                Map.entry("OEBPS/b.css", "p { color: red; }")));

        ArchivePackageStore store = ArchivePackageStore.fromArchive(original, "original");
        store.putText("OEBPS/b.css", "p { color: blue; }");

        assertThat(store.untouchedEntries()).containsExactly("mimetype", "OEBPS/a.xhtml");

        Map<String, byte[]> before = rawEntries(original);
        Map<String, byte[]> after = rawEntries(export(store));
        assertThat(after.get("OEBPS/a.xhtml")).isEqualTo(before.get("OEBPS/a.xhtml"));
        assertThat(ArchivePackageStore.fromArchive(export(store), "again").getText("OEBPS/b.css"))
                .isEqualTo("p { color: blue; }");
    }

    @Test
    void shouldKeepRawBytesWhenRewrittenWithSameContent() throws Exception {
        byte[] original = TestPackages.zip(List.of(Map.entry("a.txt", "hello")));
        ArchivePackageStore store = ArchivePackageStore.fromArchive(original, "original");

        store.putText("a.txt", "hello");

        assertThat(store.untouchedEntries()).containsExactly("a.txt");
    }

    @Test
    void shouldRejectDuplicateEntries() throws Exception {
        byte[] blob = TestPackages.zip(List.of(
                Map.entry("a.txt", "one"),
                Map.entry("a.txt", "two")));

        assertThatThrownBy(() -> ArchivePackageStore.fromArchive(blob, "dup"))
                .isInstanceOf(CorruptArchiveException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void shouldRejectEscapingEntryNames() throws Exception {
        byte[] blob = TestPackages.zip(List.of(Map.entry("../evil.txt", "x")));

        assertThatThrownBy(() -> ArchivePackageStore.fromArchive(blob, "evil"))
                .isInstanceOf(CorruptArchiveException.class);
    }

    @Test
    void shouldRejectGarbage() {
        byte[] garbage = "definitely not a zip file".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ArchivePackageStore.fromArchive(garbage, "garbage"))
                .isInstanceOf(CorruptArchiveException.class)
                .extracting(e -> ((CorruptArchiveException) e).kind())
                .isEqualTo(ErrorKind.CORRUPT_ARCHIVE);
    }

    @Test
    void shouldSkipDirectoryEntries() throws Exception {
        byte[] blob = TestPackages.zip(List.of(
                Map.entry("OEBPS/", ""),
                Map.entry("OEBPS/a.txt", "x")));

        assertThat(ArchivePackageStore.fromArchive(blob, "dirs").list()).containsExactly("OEBPS/a.txt");
    }

    // --- helpers ---

    private static byte[] export(PackageStore store) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        store.exportArchive(out);
        return out.toByteArray();
    }

    private static Map<String, byte[]> rawEntries(byte[] blob) throws Exception {
        Map<String, byte[]> raw = new HashMap<>();
        try (ZipFile zip = ZipFile.builder().setSeekableByteChannel(new SeekableInMemoryByteChannel(blob)).get()) {
            for (ZipArchiveEntry entry : java.util.Collections.list(zip.getEntries())) {
                try (InputStream in = zip.getRawInputStream(entry)) {
                    raw.put(entry.getName(), in.readAllBytes());
                }
            }
        }
        return raw;
    }
}
