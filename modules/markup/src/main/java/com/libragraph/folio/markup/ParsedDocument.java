package com.libragraph.folio.markup;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Objects;

/**
 * DOM tree of one package entry. Owned by the {@link DocumentCache} that produced it;
 * edits become visible to the store only through {@link DocumentCache#writeXml}.
 */
public record ParsedDocument(String path, Document document) {

    public ParsedDocument {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(document, "document cannot be null");
    }

    public Element root() {
        return document.getDocumentElement();
    }
}
