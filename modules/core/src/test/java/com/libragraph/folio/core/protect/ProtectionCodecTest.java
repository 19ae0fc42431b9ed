package com.libragraph.folio.core.protect;

import com.libragraph.folio.core.Books;
import com.libragraph.folio.core.opf.ManifestInconsistentException;
import com.libragraph.folio.core.opf.ManifestItem;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.ArchivePackageStore;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.util.PackagePath;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ProtectionCodecTest {

    private static final String FONT_CSS = """
            @font-face { font-family: "kt"; src: url("../Fonts/kt.ttf"); }
            """;

    private static Map<String, String> snapshot(PackageStore store) {
        Map<String, String> digests = new LinkedHashMap<>();
        for (String path : store.list()) {
            digests.put(path, DigestUtils.sha256Hex(store.get(path)));
        }
        return digests;
    }

    private static ProtectionCodec codec(ProtectionAlgorithm algorithm, ProtectionTarget... targets) {
        EnumSet<ProtectionTarget> set = EnumSet.noneOf(ProtectionTarget.class);
        set.addAll(List.of(targets));
        return new ProtectionCodec(new ProtectionOptions(algorithm, set));
    }

    @Test
    void shouldProtectAndRestoreLooseEntries() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.put("fonts/a.ttf", Books.filled(16, 0xFF));
        store.put("images/b.png", new byte[0]);
        ProtectionCodec codec = codec(ProtectionAlgorithm.BASIC, ProtectionTarget.FONT, ProtectionTarget.IMAGE);

        ProtectionResult result = codec.protect(store, "pw");

        ProtectionManifest manifest = ProtectionManifest.read(store).orElseThrow();
        assertThat(manifest.entries()).hasSize(2);
        assertThat(result.entries()).isEqualTo(manifest.entries());
        assertThat(store.exists("fonts/a.ttf")).isFalse();
        assertThat(store.exists("images/b.png")).isFalse();
        ProtectedEntry font = manifest.entryFor("fonts/a.ttf").orElseThrow();
        assertThat(font.obfuscated()).matches("fonts/_[0-9a-f]{32}\\.ttf");
        assertThat(font.size()).isEqualTo(16);
        assertThat(store.get(font.obfuscated())).isNotEqualTo(Books.filled(16, 0xFF));

        codec.unprotect(store, "pw");

        assertThat(store.get("fonts/a.ttf")).isEqualTo(Books.filled(16, 0xFF));
        assertThat(store.get("images/b.png")).isEmpty();
        assertThat(store.list()).containsExactlyInAnyOrder("fonts/a.ttf", "images/b.png");
    }

    @Test
    void shouldRewriteReferencesBothWays() {
        ArchivePackageStore store = Books.epub2();
        store.putText("OEBPS/Styles/fonts.css", FONT_CSS);
        Map<String, String> before = snapshot(store);
        ProtectionCodec codec = new ProtectionCodec(ProtectionOptions.defaults());

        ProtectionResult result = codec.protect(store, "secret");

        String obfuscated = result.entries().get(0).obfuscated();
        String name = obfuscated.substring("OEBPS/Fonts/".length());
        assertThat(result.rewrittenReferrers()).containsExactlyInAnyOrder(Books.OPF_PATH, "OEBPS/Styles/fonts.css");
        assertThat(store.getText(Books.OPF_PATH)).contains("href=\"Fonts/" + name + "\"").doesNotContain("kt.ttf");
        assertThat(store.getText("OEBPS/Styles/fonts.css")).contains("url(\"../Fonts/" + name + "\")");

        codec.unprotect(store, "secret");

        assertThat(snapshot(store)).isEqualTo(before);
    }

    @Test
    void shouldRejectWrongKeyWithoutTouchingTheStore() {
        ArchivePackageStore store = Books.epub2();
        ProtectionCodec codec = codec(ProtectionAlgorithm.BASIC, ProtectionTarget.FONT, ProtectionTarget.STYLE);
        codec.protect(store, "right");
        Map<String, String> protectedState = snapshot(store);

        assertThatThrownBy(() -> codec.unprotect(store, "wrong"))
                .isInstanceOf(AuthenticationFailureException.class)
                .satisfies(e -> assertThat(((AuthenticationFailureException) e).kind())
                        .isEqualTo(ErrorKind.AUTHENTICATION_FAILURE));

        assertThat(snapshot(store)).isEqualTo(protectedState);
    }

    @Test
    void shouldRejectAddingEntriesUnderAnotherKey() {
        ArchivePackageStore store = Books.epub2();
        codec(ProtectionAlgorithm.BASIC, ProtectionTarget.FONT).protect(store, "first");
        Map<String, String> protectedState = snapshot(store);

        assertThatThrownBy(() -> codec(ProtectionAlgorithm.BASIC, ProtectionTarget.IMAGE).protect(store, "second"))
                .isInstanceOf(AuthenticationFailureException.class);
        assertThat(snapshot(store)).isEqualTo(protectedState);
    }

    @Test
    void shouldExtendExistingManifestWithSameKey() {
        ArchivePackageStore store = Books.epub2();
        Map<String, String> before = snapshot(store);
        codec(ProtectionAlgorithm.BASIC, ProtectionTarget.FONT).protect(store, "k");
        String salt = ProtectionManifest.read(store).orElseThrow().salt();

        ProtectionResult second = codec(ProtectionAlgorithm.AES, ProtectionTarget.FONT, ProtectionTarget.IMAGE)
                .protect(store, "k");

        assertThat(second.entries()).extracting(ProtectedEntry::path).containsExactly(Books.COVER);
        ProtectionManifest manifest = ProtectionManifest.read(store).orElseThrow();
        assertThat(manifest.salt()).isEqualTo(salt);
        assertThat(manifest.entries()).extracting(ProtectedEntry::algorithm)
                .containsExactly(ProtectionAlgorithm.BASIC, ProtectionAlgorithm.AES);

        new ProtectionCodec(ProtectionOptions.defaults()).unprotect(store, "k");

        assertThat(snapshot(store)).isEqualTo(before);
    }

    @Test
    void shouldRoundTripWithAes() {
        ArchivePackageStore store = Books.epub2();
        Map<String, String> before = snapshot(store);
        ProtectionCodec codec = codec(ProtectionAlgorithm.AES, ProtectionTarget.STYLE, ProtectionTarget.MARKUP);

        ProtectionResult result = codec.protect(store, "pass");

        assertThat(result.entries()).extracting(ProtectedEntry::path)
                .containsExactlyInAnyOrder(Books.CSS, Books.CH1, Books.CH2);
        assertThat(store.exists(Books.CH1)).isFalse();

        codec.unprotect(store, "pass");

        assertThat(snapshot(store)).isEqualTo(before);
    }

    @Test
    void shouldRecordIdpfEntriesInEncryptionDocument() {
        ArchivePackageStore store = Books.epub2();
        Map<String, String> before = snapshot(store);
        ProtectionCodec codec = codec(ProtectionAlgorithm.IDPF, ProtectionTarget.FONT);

        ProtectionResult result = codec.protect(store, "any");

        String obfuscated = result.entries().get(0).obfuscated();
        assertThat(store.getText(MediaTypes.ENCRYPTION_ENTRY))
                .contains("http://www.idpf.org/2008/embedding")
                .contains("URI=\"" + obfuscated + "\"");

        codec.unprotect(store, "any");

        assertThat(store.exists(MediaTypes.ENCRYPTION_ENTRY)).isFalse();
        assertThat(snapshot(store)).isEqualTo(before);
    }

    @Test
    void shouldRequireIdentifierForIdpf() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.put("fonts/a.ttf", Books.filled(8, 1));

        assertThatThrownBy(() -> codec(ProtectionAlgorithm.IDPF, ProtectionTarget.FONT).protect(store, "k"))
                .isInstanceOf(ManifestInconsistentException.class);
        assertThat(store.list()).containsExactly("fonts/a.ttf");
    }

    @Test
    void shouldFailWhenProtectedEntryIsMissing() {
        ArchivePackageStore store = Books.epub2();
        ProtectionCodec codec = new ProtectionCodec(ProtectionOptions.defaults());
        ProtectionResult result = codec.protect(store, "k");
        store.delete(result.entries().get(0).obfuscated());

        assertThatThrownBy(() -> codec.unprotect(store, "k"))
                .isInstanceOf(ManifestInconsistentException.class)
                .satisfies(e -> assertThat(((ManifestInconsistentException) e).path())
                        .contains(result.entries().get(0).obfuscated()));
        assertThat(store.exists(ProtectionManifest.PATH)).isTrue();
    }

    @Test
    void shouldLeaveUnprotectedPackageAlone() {
        ArchivePackageStore store = Books.epub2();
        Map<String, String> before = snapshot(store);

        assertThat(new ProtectionCodec(ProtectionOptions.defaults()).unprotect(store, "k").isEmpty()).isTrue();
        assertThat(snapshot(store)).isEqualTo(before);
    }

    @Test
    void shouldRejectEmptyKey() {
        assertThatThrownBy(() -> new ProtectionCodec(ProtectionOptions.defaults()).protect(Books.epub2(), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFollowEncodedAndDotPrefixedReferences() {
        ArchivePackageStore store = Books.epub2();
        store.putText(Books.OPF_PATH, Books.OPF2.replace("href=\"Fonts/kt.ttf\"", "href=\"Fonts/%E5%AE%8B%E4%BD%93.ttf\""));
        store.delete(Books.FONT);
        store.put("OEBPS/Fonts/宋体.ttf", Books.filled(16, 0x22));
        store.putText("OEBPS/Styles/fonts.css", "@font-face { src: url('./../Fonts/%E5%AE%8B%E4%BD%93.ttf'); }\n");
        ProtectionCodec codec = new ProtectionCodec(ProtectionOptions.defaults());

        codec.protect(store, "pw");

        assertThat(store.exists("OEBPS/Fonts/宋体.ttf")).isFalse();
        assertThat(manifestPaths(store)).allSatisfy(path -> assertThat(store.exists(path)).as(path).isTrue());
        String obfuscated = ProtectionManifest.read(store).orElseThrow()
                .entryFor("OEBPS/Fonts/宋体.ttf").orElseThrow().obfuscated();
        assertThat(store.getText("OEBPS/Styles/fonts.css"))
                .isEqualTo("@font-face { src: url('../Fonts/" + PackagePath.fileName(obfuscated) + "'); }\n");

        codec.unprotect(store, "pw");

        assertThat(store.get("OEBPS/Fonts/宋体.ttf")).isEqualTo(Books.filled(16, 0x22));
        assertThat(manifestPaths(store)).allSatisfy(path -> assertThat(store.exists(path)).as(path).isTrue());
    }

    @Test
    void shouldKeepStyleSheetEncodingWhenRewriting() {
        ArchivePackageStore store = Books.epub2();
        String css = "@charset \"GBK\";\n/* 字体 */\n@font-face { src: url(../Fonts/kt.ttf); }\n";
        store.put("OEBPS/Styles/fonts.css", css.getBytes(Charset.forName("GBK")));

        ProtectionResult result = new ProtectionCodec(ProtectionOptions.defaults()).protect(store, "pw");

        String name = PackagePath.fileName(result.entries().get(0).obfuscated());
        assertThat(new String(store.get("OEBPS/Styles/fonts.css"), Charset.forName("GBK")))
                .isEqualTo(css.replace("kt.ttf", name));
    }

    private static List<String> manifestPaths(PackageStore store) {
        try (DocumentCache cache = new DocumentCache(store, false)) {
            return PackageDocument.load(cache).items().stream().map(ManifestItem::path).toList();
        }
    }

    @Test
    void shouldWriteManifestInFixedOrder() {
        ProtectionManifest manifest = new ProtectionManifest("abc", List.of(
                new ProtectedEntry("fonts/a.ttf", "fonts/_x.ttf", ProtectionAlgorithm.BASIC, 16, "cafe")));

        String xml = new String(manifest.toBytes(), StandardCharsets.UTF_8);

        assertThat(xml).contains("<entry path=\"fonts/a.ttf\" obfuscated=\"fonts/_x.ttf\" algorithm=\"basic\" size=\"16\" checksum=\"cafe\"/>");
        assertThat(ProtectionManifest.parse(manifest.toBytes())).isEqualTo(manifest);
    }
}
