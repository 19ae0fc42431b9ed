package com.libragraph.folio.core.layout;

import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.types.Namespaces;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns {@code noteref} anchors and their targets into paired {@code A_n}/{@code B_n}
 * popup footnotes.
 */
final class FootnoteRewriter {

    static final String ICON_CLASS = "note-icon";

    private static final Set<String> BLOCKS = Set.of(
            "p", "div", "li", "h1", "h2", "h3", "h4", "h5", "h6", "blockquote",
            "td", "th", "dd", "dt", "figcaption", "section", "table", "body");

    private static final Set<String> CONTAINERS = Set.of("ol", "ul", "section", "aside", "div", "dl");

    private FootnoteRewriter() {
    }

    /**
     * Rewrites every resolvable footnote of a document.
     *
     * @param iconHref relative href of the note image, used by image-icon platforms
     * @return the number of footnotes rewritten
     */
    static int rewrite(Document doc, LayoutPlatform platform, String iconHref) {
        Element root = doc.getDocumentElement();
        Map<String, Element> byId = new HashMap<>();
        indexIds(root, byId);

        List<Element[]> pairs = new ArrayList<>();
        for (Element a : Dom.descendants(root, Namespaces.XHTML, "a")) {
            String href = Dom.attr(a, "href");
            if (href == null || !href.startsWith("#") || !Dom.hasToken(a, "epub:type", "noteref")) {
                continue;
            }
            Element target = byId.get(href.substring(1));
            if (target == null || target == a || isAncestor(target, a)) {
                continue;
            }
            pairs.add(new Element[]{a, target});
        }

        int n = 0;
        for (Element[] pair : pairs) {
            Element anchor = pair[0];
            Element target = pair[1];
            if (target.getParentNode() == null) {
                // already consumed by an earlier anchor
                continue;
            }
            n++;
            String oldAnchorId = Dom.attr(anchor, "id");
            rewriteAnchor(anchor, n, platform, iconHref);
            Element aside = buildAside(doc, target, n, platform);
            if (oldAnchorId != null) {
                relinkBacklinks(aside, "#" + oldAnchorId, "#A_" + n);
            }

            Node container = target.getParentNode();
            Dom.remove(target);
            pruneEmpty(container);

            Element block = blockAncestor(anchor);
            Node before = block.getNextSibling();
            while (before != null && isPlacedAside(before)) {
                before = before.getNextSibling();
            }
            if ("body".equals(block.getLocalName())) {
                block.appendChild(aside);
            } else {
                block.getParentNode().insertBefore(aside, before);
            }
        }
        return n;
    }

    private static void rewriteAnchor(Element anchor, int n, LayoutPlatform platform, String iconHref) {
        Document doc = anchor.getOwnerDocument();
        anchor.setAttribute("id", "A_" + n);
        anchor.setAttribute("href", "#B_" + n);
        if (platform.noterefClass() != null) {
            Dom.addToken(anchor, "class", platform.noterefClass());
        }
        while (anchor.getFirstChild() != null) {
            anchor.removeChild(anchor.getFirstChild());
        }

        Element sup = doc.createElementNS(Namespaces.XHTML, "sup");
        sup.setTextContent(Integer.toString(n));
        switch (platform.icon()) {
            case BARE -> anchor.appendChild(sup);
            case SUPERSCRIPT -> {
                Element span = iconSpan(doc);
                span.appendChild(sup);
                anchor.appendChild(span);
            }
            case IMAGE -> {
                Element span = iconSpan(doc);
                Element img = doc.createElementNS(Namespaces.XHTML, "img");
                img.setAttribute("alt", "note");
                img.setAttribute("src", iconHref);
                span.appendChild(img);
                anchor.appendChild(span);
            }
        }
    }

    private static Element iconSpan(Document doc) {
        Element span = doc.createElementNS(Namespaces.XHTML, "span");
        span.setAttribute("class", ICON_CLASS);
        return span;
    }

    private static Element buildAside(Document doc, Element target, int n, LayoutPlatform platform) {
        Element aside = doc.createElementNS(Namespaces.XHTML, "aside");
        aside.setAttributeNS(Namespaces.OPS, "epub:type", "footnote");
        aside.setAttribute("id", "B_" + n);
        if (platform.asideClass() != null) {
            aside.setAttribute("class", platform.asideClass());
        }
        if ("p".equals(target.getLocalName())) {
            target.removeAttribute("id");
            aside.appendChild(target.cloneNode(true));
        } else {
            while (target.getFirstChild() != null) {
                aside.appendChild(target.getFirstChild());
            }
        }
        return aside;
    }

    private static void relinkBacklinks(Element aside, String oldHref, String newHref) {
        for (Element a : Dom.descendants(aside, Namespaces.XHTML, "a")) {
            if (oldHref.equals(Dom.attr(a, "href"))) {
                a.setAttribute("href", newHref);
            }
        }
    }

    private static void pruneEmpty(Node node) {
        while (node instanceof Element e
                && CONTAINERS.contains(e.getLocalName())
                && isBlank(e)) {
            Node parent = e.getParentNode();
            Dom.remove(e);
            node = parent;
        }
    }

    private static boolean isBlank(Element e) {
        for (Node n = e.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element) return false;
            if (n instanceof Text t && !t.getData().isBlank()) return false;
        }
        return true;
    }

    private static boolean isPlacedAside(Node node) {
        if (node instanceof Text t) {
            return t.getData().isBlank();
        }
        if (node instanceof Element e && "aside".equals(e.getLocalName())) {
            String id = Dom.attr(e, "id");
            return id != null && id.startsWith("B_");
        }
        return false;
    }

    private static Element blockAncestor(Element anchor) {
        for (Node n = anchor.getParentNode(); n instanceof Element e; n = n.getParentNode()) {
            if (BLOCKS.contains(e.getLocalName())) {
                return e;
            }
        }
        return anchor.getOwnerDocument().getDocumentElement();
    }

    private static boolean isAncestor(Element candidate, Node node) {
        for (Node n = node.getParentNode(); n != null; n = n.getParentNode()) {
            if (n == candidate) return true;
        }
        return false;
    }

    private static void indexIds(Element e, Map<String, Element> byId) {
        String id = Dom.attr(e, "id");
        if (id != null) {
            byId.putIfAbsent(id, e);
        }
        for (Element child : Dom.children(e)) {
            indexIds(child, byId);
        }
    }
}
