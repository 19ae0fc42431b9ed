package com.libragraph.folio.core.standardize;

import com.libragraph.folio.core.Books;
import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.opf.ManifestInconsistentException;
import com.libragraph.folio.core.opf.ManifestItem;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.ArchivePackageStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StructuralRepairFilterTest {

    private static PackageDocument opf(ArchivePackageStore store) {
        return PackageDocument.load(new DocumentCache(store, false));
    }

    @Test
    void shouldRegenerateMimetypeAndContainer() {
        ArchivePackageStore store = Books.epub2();
        store.putText("mimetype", "application/zip\n");
        store.delete("META-INF/container.xml");

        new StructuralRepairFilter().apply(FilterContext.of(store, true));

        assertThat(store.getText("mimetype")).isEqualTo("application/epub+zip");
        assertThat(store.getText("META-INF/container.xml")).contains("full-path=\"OEBPS/content.opf\"");
    }

    @Test
    void shouldRepairManifestAndSpine() {
        ArchivePackageStore store = Books.epub2();
        store.putText(Books.OPF_PATH, Books.OPF2
                .replace("<item id=\"css\" href=\"Styles/main.css\" media-type=\"text/css\"/>",
                        "<item id=\"css\" href=\"Styles/main.css\" media-type=\"text/plain\"/>"
                                + "<item id=\"gone\" href=\"Text/gone.xhtml\" media-type=\"application/xhtml+xml\"/>")
                .replace("</manifest>",
                        "<item id=\"ch1\" href=\"Text/other.xhtml\" media-type=\"application/xhtml+xml\"/></manifest>")
                .replace("<itemref idref=\"ch2\"/>", "<itemref idref=\"ch2\"/><itemref idref=\"ghost\"/>"));
        store.putText("OEBPS/Text/other.xhtml", Books.page("<p>Other</p>"));
        store.put("OEBPS/Images/extra.png", new byte[]{1});

        new StructuralRepairFilter().apply(FilterContext.of(store, true));

        PackageDocument opf = opf(store);
        assertThat(opf.itemByPath("OEBPS/Text/gone.xhtml")).isEmpty();
        assertThat(opf.itemByPath(Books.CSS)).map(ManifestItem::mediaType).contains("text/css");
        assertThat(opf.itemByPath("OEBPS/Images/extra.png")).isPresent();
        assertThat(opf.items()).extracting(ManifestItem::id).doesNotHaveDuplicates();
        assertThat(opf.itemrefs()).hasSize(2);
        assertThat(opf.spineItems()).extracting(ManifestItem::path)
                .startsWith(Books.CH1, Books.CH2);
    }

    @Test
    void shouldNotRewritePackageDocumentWhenNothingIsWrong() {
        ArchivePackageStore store = Books.epub2();
        new StructuralRepairFilter().apply(FilterContext.of(store, true));
        byte[] once = store.get(Books.OPF_PATH);

        new StructuralRepairFilter().apply(FilterContext.of(store, true));

        assertThat(store.get(Books.OPF_PATH)).isEqualTo(once);
    }

    @Test
    void shouldFailWithoutPackageDocument() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.putText("OEBPS/Text/a.xhtml", Books.page("<p>a</p>"));

        assertThatThrownBy(() -> new StructuralRepairFilter().apply(FilterContext.of(store, true)))
                .isInstanceOf(ManifestInconsistentException.class);
    }
}
