package com.libragraph.folio.core.opf;

import com.libragraph.folio.core.Books;
import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.ArchivePackageStore;
import com.libragraph.folio.types.MediaTypes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PackageDocumentTest {

    @Test
    void shouldResolveManifestAndSpine() {
        PackageDocument opf = PackageDocument.load(new DocumentCache(Books.epub2()));

        assertThat(opf.path()).isEqualTo(Books.OPF_PATH);
        assertThat(opf.version()).isEqualTo("2.0");
        assertThat(opf.isVersion3()).isFalse();
        assertThat(opf.itemById("ch1").map(ManifestItem::path)).contains(Books.CH1);
        assertThat(opf.itemByPath(Books.FONT).map(ManifestItem::id)).contains("font");
        assertThat(opf.spineItems()).extracting(ManifestItem::id).containsExactly("ch1", "ch2");
        assertThat(opf.uniqueIdentifier()).contains("urn:isbn:9780000000001");
        assertThat(opf.title()).contains("Sample Book");
    }

    @Test
    void shouldFallBackToFirstOpfEntryWithoutContainer() {
        ArchivePackageStore store = Books.epub2();
        store.delete("META-INF/container.xml");

        assertThat(PackageDocument.locate(store)).contains(Books.OPF_PATH);
    }

    @Test
    void shouldFailWithoutPackageDocument() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.putText("mimetype", "application/epub+zip");

        assertThatThrownBy(() -> PackageDocument.load(new DocumentCache(store)))
                .isInstanceOf(ManifestInconsistentException.class);
    }

    @Test
    void shouldAddItemsWithFreshIdsAndRelativeHrefs() {
        ArchivePackageStore store = Books.epub2();
        PackageDocument opf = PackageDocument.load(new DocumentCache(store));

        ManifestItem added = opf.addItem("OEBPS/Fonts/font", MediaTypes.CSS);
        ManifestItem again = opf.addItem("OEBPS/Misc/font", MediaTypes.CSS);

        assertThat(added.id()).isEqualTo("font_1");
        assertThat(again.id()).isEqualTo("font_2");
        assertThat(added.href()).isEqualTo("Fonts/font");
        assertThat(opf.sibling("Styles/fonts.css")).isEqualTo("OEBPS/Styles/fonts.css");
    }

    @Test
    void shouldRemoveItemAndItsSpineReferences() {
        ArchivePackageStore store = Books.epub2();
        PackageDocument opf = PackageDocument.load(new DocumentCache(store));

        opf.removeItem(opf.itemById("ch1").orElseThrow());
        opf.save();

        PackageDocument reloaded = PackageDocument.load(new DocumentCache(store, false));
        assertThat(reloaded.itemById("ch1")).isEmpty();
        assertThat(reloaded.spineItems()).extracting(ManifestItem::id).containsExactly("ch2");
    }
}
