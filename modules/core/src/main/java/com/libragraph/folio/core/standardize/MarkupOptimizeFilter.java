package com.libragraph.folio.core.standardize;

import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.filter.FilterFactory;
import com.libragraph.folio.core.filter.PackageFilter;
import com.libragraph.folio.core.filter.SimpleFilterFactory;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.markup.ParsedDocument;
import com.libragraph.folio.markup.SerializationMode;
import com.libragraph.folio.types.Namespaces;
import org.jboss.logging.Logger;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites content documents toward the canonical structure: HTML5 doctype,
 * {@code meta charset}, a non-empty title, aligned language attributes, no
 * attribute-less spans and no empty {@code class}/{@code style} attributes.
 */
public class MarkupOptimizeFilter implements PackageFilter {

    public static final String NAME = "markup-optimize";

    private static final Logger log = Logger.getLogger(MarkupOptimizeFilter.class);

    public static FilterFactory factory() {
        return new SimpleFilterFactory(NAME, options -> new MarkupOptimizeFilter());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(FilterContext context) {
        String language = packageLanguage(context).orElse(null);
        List<String> documents = context.contentDocuments();
        for (String path : documents) {
            ParsedDocument parsed = context.cache().readXml(path);
            optimize(parsed.document(), language);
            context.cache().writeXml(parsed, SerializationMode.MARKUP);
        }
        log.infof("Rewrote %d content documents in %s", documents.size(), context.store().description());
    }

    private static Optional<String> packageLanguage(FilterContext context) {
        if (PackageDocument.locate(context.store()).isEmpty()) {
            return Optional.empty();
        }
        return context.packageDocument().dc("language").stream()
                .map(Dom::text)
                .filter(s -> !s.isEmpty())
                .findFirst();
    }

    static void optimize(Document doc, String packageLanguage) {
        adoptXhtmlNamespace(doc, doc.getDocumentElement());
        Element html = doc.getDocumentElement();
        Element head = ensureChild(html, "head", true);
        Element body = ensureChild(html, "body", false);

        fixCharset(head);
        fixTitle(head, body);
        alignLanguage(html, packageLanguage);

        cleanAttributes(html);
        for (Element span : Dom.descendants(html, Namespaces.XHTML, "span")) {
            if (!span.hasAttributes()) {
                Dom.unwrap(span);
            }
        }
        html.normalize();
    }

    /**
     * Moves elements parsed without a namespace into the XHTML namespace.
     */
    private static void adoptXhtmlNamespace(Document doc, Element element) {
        Element current = element;
        if (current.getNamespaceURI() == null) {
            String local = current.getLocalName() != null ? current.getLocalName() : current.getTagName();
            current = (Element) doc.renameNode(current, Namespaces.XHTML, local);
        }
        for (Element child : Dom.children(current)) {
            adoptXhtmlNamespace(doc, child);
        }
    }

    private static Element ensureChild(Element html, String name, boolean first) {
        Optional<Element> existing = Dom.firstChild(html, Namespaces.XHTML, name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Element created = html.getOwnerDocument().createElementNS(Namespaces.XHTML, name);
        html.insertBefore(created, first ? html.getFirstChild() : null);
        return created;
    }

    private static void fixCharset(Element head) {
        for (Element meta : Dom.children(head, Namespaces.XHTML, "meta")) {
            String equiv = Dom.attr(meta, "http-equiv");
            if ((equiv != null && equiv.equalsIgnoreCase("content-type")) || meta.hasAttribute("charset")) {
                Dom.remove(meta);
            }
        }
        Element charset = head.getOwnerDocument().createElementNS(Namespaces.XHTML, "meta");
        charset.setAttribute("charset", "utf-8");
        head.insertBefore(charset, head.getFirstChild());
    }

    private static void fixTitle(Element head, Element body) {
        Element title = Dom.firstChild(head, Namespaces.XHTML, "title").orElse(null);
        if (title != null && !Dom.text(title).isEmpty()) {
            return;
        }
        String text = "Chapter";
        for (String h : new String[]{"h1", "h2", "h3", "h4", "h5", "h6"}) {
            Optional<String> heading = Dom.firstDescendant(body, Namespaces.XHTML, h)
                    .map(Dom::text).filter(s -> !s.isEmpty());
            if (heading.isPresent()) {
                text = heading.get();
                break;
            }
        }
        if (title == null) {
            title = head.getOwnerDocument().createElementNS(Namespaces.XHTML, "title");
            head.appendChild(title);
        }
        title.setTextContent(text);
    }

    private static void alignLanguage(Element html, String packageLanguage) {
        String xmlLang = html.hasAttributeNS(Namespaces.XML, "lang") ? html.getAttributeNS(Namespaces.XML, "lang") : null;
        String lang = Dom.attr(html, "lang");
        String chosen = firstNonBlank(xmlLang, lang, packageLanguage);
        if (chosen == null) {
            return;
        }
        html.setAttributeNS(Namespaces.XML, "xml:lang", chosen);
        html.setAttribute("lang", chosen);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    private static void cleanAttributes(Element element) {
        NamedNodeMap attrs = element.getAttributes();
        List<Attr> empty = new ArrayList<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            String name = attr.getLocalName() != null ? attr.getLocalName() : attr.getName();
            if (attr.getNamespaceURI() == null && (name.equals("class") || name.equals("style"))
                    && attr.getValue().isBlank()) {
                empty.add(attr);
            }
        }
        empty.forEach(element::removeAttributeNode);
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child) {
                cleanAttributes(child);
            }
        }
    }
}
