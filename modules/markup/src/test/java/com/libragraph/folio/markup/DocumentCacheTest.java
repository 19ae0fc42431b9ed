package com.libragraph.folio.markup;

import com.libragraph.folio.store.ArchivePackageStore;
import com.libragraph.folio.store.EntryNotFoundException;
import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.Namespaces;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static org.assertj.core.api.Assertions.*;

class DocumentCacheTest {

    private static final String CHAPTER = """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE html PUBLIC "-//W3C//DTD XHTML 1.1//EN" "http://www.w3.org/TR/xhtml11/DTD/xhtml11.dtd">
            <html xmlns="http://www.w3.org/1999/xhtml"><head><title>One</title></head>
            <body><p>Caf&eacute;&nbsp;&mdash; &amp; more</p></body></html>
            """;

    private ArchivePackageStore store;
    private DocumentCache cache;

    @BeforeEach
    void setUp() {
        store = ArchivePackageStore.empty();
        store.putText("Text/ch1.xhtml", CHAPTER);
        cache = new DocumentCache(store);
    }

    @Test
    void shouldParseOnceAndMemoize() {
        ParsedDocument first = cache.readXml("Text/ch1.xhtml");
        ParsedDocument second = cache.readXml("Text/ch1.xhtml");

        assertThat(second).isSameAs(first);
        assertThat(cache.isCached("Text/ch1.xhtml")).isTrue();
    }

    @Test
    void shouldResolveHtmlEntitiesWithoutLoadingDtd() {
        ParsedDocument doc = cache.readXml("Text/ch1.xhtml");

        String text = doc.root().getElementsByTagNameNS(Namespaces.XHTML, "p").item(0).getTextContent();
        assertThat(text).isEqualTo("Caf\u00e9\u00a0\u2014 & more");
    }

    @Test
    void shouldEvictWhenEntryIsOverwrittenDirectly() {
        ParsedDocument stale = cache.readXml("Text/ch1.xhtml");

        store.putText("Text/ch1.xhtml", CHAPTER.replace("One", "Uno"));

        ParsedDocument fresh = cache.readXml("Text/ch1.xhtml");
        assertThat(fresh).isNotSameAs(stale);
        assertThat(fresh.root().getElementsByTagNameNS(Namespaces.XHTML, "title").item(0).getTextContent())
                .isEqualTo("Uno");
    }

    @Test
    void shouldKeepWrittenTreeWithoutReparse() {
        ParsedDocument doc = cache.readXml("Text/ch1.xhtml");
        Element p = (Element) doc.root().getElementsByTagNameNS(Namespaces.XHTML, "p").item(0);
        p.setAttribute("class", "x");

        cache.writeXml(doc, SerializationMode.MARKUP);

        assertThat(cache.readXml("Text/ch1.xhtml").document()).isSameAs(doc.document());
        String written = store.getText("Text/ch1.xhtml");
        assertThat(written).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<!DOCTYPE html>\n");
        assertThat(written).contains("class=\"x\"");
    }

    @Test
    void shouldRejectModeMismatchWithoutWriting() {
        ParsedDocument doc = cache.readXml("Text/ch1.xhtml");
        String before = store.getText("Text/ch1.xhtml");

        assertThatThrownBy(() -> cache.writeXml(doc, SerializationMode.PACKAGE))
                .isInstanceOf(SerializationMismatchException.class)
                .extracting(e -> ((SerializationMismatchException) e).kind())
                .isEqualTo(ErrorKind.SERIALIZATION_MISMATCH);
        assertThat(store.getText("Text/ch1.xhtml")).isEqualTo(before);
    }

    @Test
    void shouldWritePackageDocumentWithDeclarationOnly() {
        Document opf = XmlCodec.newDocument();
        Element pkg = opf.createElementNS(Namespaces.OPF, "package");
        pkg.setAttribute("version", "3.0");
        opf.appendChild(pkg);

        cache.writeXml("content.opf", opf, SerializationMode.PACKAGE);

        String written = store.getText("content.opf");
        assertThat(written).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<package");
        assertThat(written).contains("xmlns=\"http://www.idpf.org/2007/opf\"");
        assertThat(written).doesNotContain("DOCTYPE");
    }

    @Test
    void shouldDeclareEpubNamespaceWhenUsed() {
        ParsedDocument doc = cache.readXml("Text/ch1.xhtml");
        Element p = (Element) doc.root().getElementsByTagNameNS(Namespaces.XHTML, "p").item(0);
        p.setAttributeNS(Namespaces.OPS, "epub:type", "footnote");

        cache.writeXml(doc, SerializationMode.MARKUP);

        String written = store.getText("Text/ch1.xhtml");
        assertThat(written).contains("xmlns:epub=\"http://www.idpf.org/2007/ops\"");
        assertThat(XmlCodec.parse(store.get("Text/ch1.xhtml"), "Text/ch1.xhtml")).isNotNull();
    }

    @Test
    void shouldNotPoisonOtherPathsOnMalformedInput() {
        store.putText("Text/bad.xhtml", "<html><body><p>unclosed</body></html>");

        assertThatThrownBy(() -> cache.readXml("Text/bad.xhtml"))
                .isInstanceOf(MalformedMarkupException.class)
                .satisfies(e -> assertThat(((MalformedMarkupException) e).path()).contains("Text/bad.xhtml"));
        assertThat(cache.isCached("Text/bad.xhtml")).isFalse();
        assertThat(cache.readXml("Text/ch1.xhtml")).isNotNull();
    }

    @Test
    void shouldPropagateNotFound() {
        assertThatThrownBy(() -> cache.readXml("missing.xhtml"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void shouldParseEveryTimeWhenDisabled() {
        DocumentCache uncached = new DocumentCache(store, false);

        assertThat(uncached.readXml("Text/ch1.xhtml")).isNotSameAs(uncached.readXml("Text/ch1.xhtml"));
        assertThat(uncached.isCached("Text/ch1.xhtml")).isFalse();
    }

    @Test
    void shouldStopListeningAfterClose() {
        cache.readXml("Text/ch1.xhtml");
        cache.close();

        assertThat(cache.isCached("Text/ch1.xhtml")).isFalse();
        store.putText("Text/ch1.xhtml", CHAPTER);
        assertThat(cache.isCached("Text/ch1.xhtml")).isFalse();
    }
}
