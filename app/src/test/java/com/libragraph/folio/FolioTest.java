package com.libragraph.folio;

import com.libragraph.folio.core.batch.BatchOrchestrator;
import com.libragraph.folio.core.batch.BatchResult;
import com.libragraph.folio.core.batch.BatchStatus;
import com.libragraph.folio.core.config.FolioConfig;
import com.libragraph.folio.core.filter.FilterFailureException;
import com.libragraph.folio.core.filter.UnknownFilterException;
import com.libragraph.folio.core.layout.LayoutPlatform;
import com.libragraph.folio.core.protect.ProtectionManifest;
import com.libragraph.folio.store.PackageIOException;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.store.StoreBackend;
import com.libragraph.folio.types.ErrorKind;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

class FolioTest {

    @TempDir
    Path tempDir;

    private static Map<String, String> digests(PackageStore store) {
        Map<String, String> digests = new TreeMap<>();
        for (String path : store.list()) {
            digests.put(path, DigestUtils.sha256Hex(store.get(path)));
        }
        return digests;
    }

    @Test
    void shouldReproducePackageWithEmptyChain() {
        Path input = SampleBooks.write(tempDir.resolve("in.epub"));
        Path output = tempDir.resolve("out.epub");
        Folio folio = new Folio(FolioConfig.defaults());

        try (PackageStore store = folio.open(input)) {
            folio.export(store, output);
        }

        try (PackageStore original = folio.open(input); PackageStore copy = folio.open(output)) {
            assertThat(copy.list()).containsExactlyElementsOf(original.list());
            assertThat(digests(copy)).isEqualTo(digests(original));
        }
    }

    @Test
    void shouldRunChainThenProtection() {
        Path input = SampleBooks.write(tempDir.resolve("in.epub"));
        Path output = tempDir.resolve("out.epub");
        Folio folio = new Folio(FolioConfig.of(Map.of(
                "folio.filters", "structural-repair,style-optimize,layout",
                "folio.platform", "duokan",
                "folio.protection.key", "pw")));

        folio.process(input, output);

        try (PackageStore result = folio.open(output)) {
            assertThat(result.exists(ProtectionManifest.PATH)).isTrue();
            assertThat(result.exists(SampleBooks.FONT)).isFalse();
            assertThat(result.getText("OEBPS/Styles/main.css")).doesNotContain(".gone");
            assertThat(result.getText(SampleBooks.CHAPTER)).contains("kobo.2.1");

            folio.protectionCodec().unprotect(result, "pw");

            assertThat(result.get(SampleBooks.FONT)).hasSize(64);
            assertThat(result.getText("OEBPS/Styles/fonts.css")).contains("url(\"../Fonts/kt.ttf\")");
        }
        try (PackageStore untouched = folio.open(input)) {
            assertThat(digests(untouched)).isEqualTo(digests(SampleBooks.store()));
        }
    }

    @Test
    void shouldWorkOnDirectoryBackend() throws Exception {
        Path input = SampleBooks.write(tempDir.resolve("in.epub"));
        Path output = Files.createDirectory(tempDir.resolve("unpacked"));
        Folio folio = new Folio(FolioConfig.of(Map.of(
                "folio.store.backend", "directory",
                "folio.filters", "metadata-normalize")));

        folio.process(input, output);

        assertThat(output.resolve("mimetype")).hasContent("application/epub+zip");
        assertThat(output.resolve(SampleBooks.OPF)).exists();
        assertThat(folio.config().backend()).isEqualTo(StoreBackend.DIRECTORY);
    }

    @Test
    void shouldLayerConfigurationFileUnderOverrides() throws Exception {
        Path file = tempDir.resolve("folio.properties");
        Files.writeString(file, """
                folio.platform=duokan
                folio.batch.width=2
                folio.xml-cache=false
                """);

        FolioConfig config = Folio.configure(file, Map.of("folio.batch.width", "8"));

        assertThat(config.platform()).isEqualTo(LayoutPlatform.DUOKAN);
        assertThat(config.xmlCache()).isFalse();
        assertThat(config.batchWidth()).isEqualTo(8);
    }

    @Test
    void shouldReportUnreadableConfigurationFile() {
        Path missing = tempDir.resolve("missing.properties");

        assertThatThrownBy(() -> Folio.configure(missing, Map.of()))
                .isInstanceOf(PackageIOException.class)
                .hasMessageContaining("missing.properties")
                .extracting(e -> ((PackageIOException) e).kind())
                .isEqualTo(ErrorKind.IO_FAILURE);
    }

    @Test
    void shouldRejectUnknownFilterAtConstruction() {
        FolioConfig config = FolioConfig.of(Map.of("folio.filters", "structural-repair,sparkle"));

        assertThatThrownBy(() -> new Folio(config))
                .isInstanceOf(UnknownFilterException.class)
                .hasMessageContaining("sparkle");
    }

    @Test
    void shouldNotWriteOutputWhenChainFails() {
        Path input = tempDir.resolve("in.epub");
        var store = SampleBooks.store();
        store.putText(SampleBooks.CHAPTER, "<html><body><p>unclosed</body></html>");
        store.exportArchive(input);
        Path output = tempDir.resolve("out.epub");
        Folio folio = new Folio(FolioConfig.of(Map.of("folio.filters", "markup-optimize")));

        assertThatThrownBy(() -> folio.process(input, output))
                .isInstanceOf(FilterFailureException.class);
        assertThat(output).doesNotExist();
    }

    @Test
    void shouldBatchWithConfiguredPipeline() {
        Folio folio = new Folio(FolioConfig.of(Map.of(
                "folio.filters", "metadata-normalize",
                "folio.batch.width", "2")));
        BatchOrchestrator batch = folio.batch();
        batch.submit(folio.job(SampleBooks.write(tempDir.resolve("a.epub")), tempDir.resolve("out/a.epub")));
        batch.submit(folio.job(tempDir.resolve("missing.epub"), tempDir.resolve("out/b.epub")));

        List<BatchResult> results = batch.runAll();

        assertThat(batch.width()).isEqualTo(2);
        assertThat(results).extracting(BatchResult::status)
                .containsExactly(BatchStatus.SUCCEEDED, BatchStatus.FAILED);
        assertThat(tempDir.resolve("out/a.epub")).exists();
    }
}
