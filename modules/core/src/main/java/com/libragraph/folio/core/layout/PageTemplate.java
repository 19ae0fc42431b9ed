package com.libragraph.folio.core.layout;

import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.types.Namespaces;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Standard page frame: the body content inside
 * {@code <div id="book-columns"><div id="book-inner">}, plus the
 * {@code kobostylehacks} style element that removes the inner margins Kobo readers add.
 */
final class PageTemplate {

    static final String COLUMNS_ID = "book-columns";
    static final String INNER_ID = "book-inner";
    static final String STYLE_HACKS_CLASS = "kobostylehacks";
    static final String STYLE_HACKS = "div#book-inner { margin-top: 0; margin-bottom: 0; }";

    private PageTemplate() {
    }

    /**
     * Frames a document; returns false if it has no body or is framed already.
     */
    static boolean apply(Document doc) {
        Element html = doc.getDocumentElement();
        Element body = Dom.firstChild(html, Namespaces.XHTML, "body").orElse(null);
        if (body == null) {
            return false;
        }
        for (Element div : Dom.descendants(body, Namespaces.XHTML, "div")) {
            if (COLUMNS_ID.equals(Dom.attr(div, "id"))) {
                return false;
            }
        }

        Element columns = doc.createElementNS(Namespaces.XHTML, "div");
        columns.setAttribute("id", COLUMNS_ID);
        Element inner = doc.createElementNS(Namespaces.XHTML, "div");
        inner.setAttribute("id", INNER_ID);
        while (body.getFirstChild() != null) {
            inner.appendChild(body.getFirstChild());
        }
        columns.appendChild(inner);
        body.appendChild(columns);

        addStyleHacks(doc, html);
        return true;
    }

    private static void addStyleHacks(Document doc, Element html) {
        Element head = Dom.firstChild(html, Namespaces.XHTML, "head").orElse(null);
        if (head == null) {
            head = doc.createElementNS(Namespaces.XHTML, "head");
            html.insertBefore(head, html.getFirstChild());
        }
        for (Element style : Dom.children(head, Namespaces.XHTML, "style")) {
            if (Dom.hasToken(style, "class", STYLE_HACKS_CLASS)) {
                return;
            }
        }
        Element style = doc.createElementNS(Namespaces.XHTML, "style");
        style.setAttribute("type", "text/css");
        style.setAttribute("class", STYLE_HACKS_CLASS);
        style.setTextContent(STYLE_HACKS);
        head.appendChild(style);
    }
}
