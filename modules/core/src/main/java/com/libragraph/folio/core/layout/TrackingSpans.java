package com.libragraph.folio.core.layout;

import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.types.Namespaces;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps each sentence of paragraph text in {@code <span class="koboSpan" id="kobo.P.S">}.
 *
 * <p>P counts paragraph runs from 1 in document order and S counts sentences within a
 * run from 1. When a paragraph's own text resumes after a nested paragraph, the
 * resumed text starts a new run, so identifiers always increase in document order.
 *
 * <p>A sentence spanning inline elements gets one span, at its start; the text that
 * continues it past an inline boundary is left as it is.
 */
final class TrackingSpans {

    static final String CLASS = "koboSpan";

    private static final Set<String> PARAGRAPHS = Set.of(
            "p", "h1", "h2", "h3", "h4", "h5", "h6", "li", "dt", "dd",
            "blockquote", "figcaption", "td", "th", "div");

    private static final Set<String> SKIPPED = Set.of("script", "style", "head");

    private static final Pattern SENTENCE =
            Pattern.compile("[^.!?。！？…]*(?:[.!?。！？…]+[\"'”’」』）)]*|$)");
    private static final Pattern TERMINATED =
            Pattern.compile("[.!?。！？…]+[\"'”’」』）)]*\\s*$");

    private int paragraph;
    private int sentence;
    private Element owner;
    private boolean open;

    private TrackingSpans() {
    }

    /**
     * Tags a document; returns the number of spans created, or 0 if the document already
     * carries tracking spans.
     */
    static int apply(Document doc) {
        Element root = doc.getDocumentElement();
        for (Element span : Dom.descendants(root, Namespaces.XHTML, "span")) {
            if (Dom.hasToken(span, "class", CLASS)) {
                return 0;
            }
        }
        TrackingSpans tracker = new TrackingSpans();
        List<Text> texts = new ArrayList<>();
        collect(root, texts);
        int created = 0;
        for (Text text : texts) {
            created += tracker.wrap(text);
        }
        return created;
    }

    private static void collect(Node node, List<Text> texts) {
        for (Node n = node.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e) {
                if (!isSkipped(e)) {
                    collect(e, texts);
                }
            } else if (n instanceof Text t && n.getNodeType() == Node.TEXT_NODE && !t.getData().isBlank()) {
                texts.add(t);
            }
        }
    }

    private static boolean isSkipped(Element e) {
        return SKIPPED.contains(e.getLocalName())
                || Dom.hasToken(e, "class", FootnoteRewriter.ICON_CLASS)
                || ("a".equals(e.getLocalName()) && Dom.hasToken(e, "epub:type", "noteref"));
    }

    private int wrap(Text text) {
        Element paragraphOwner = paragraphAncestor(text);
        if (paragraphOwner == null) {
            return 0;
        }
        if (paragraphOwner != owner) {
            owner = paragraphOwner;
            paragraph++;
            sentence = 1;
            open = false;
        }

        Document doc = text.getOwnerDocument();
        Node parent = text.getParentNode();
        int created = 0;
        for (String piece : sentences(text.getData())) {
            String content = piece.stripLeading();
            String leading = piece.substring(0, piece.length() - content.length());
            if (!leading.isEmpty()) {
                parent.insertBefore(doc.createTextNode(leading), text);
            }
            if (content.isEmpty()) {
                continue;
            }
            boolean continuation = open;
            open = !TERMINATED.matcher(content).find();
            if (continuation) {
                parent.insertBefore(doc.createTextNode(content), text);
                continue;
            }
            Element span = doc.createElementNS(Namespaces.XHTML, "span");
            span.setAttribute("class", CLASS);
            span.setAttribute("id", "kobo." + paragraph + "." + sentence++);
            span.appendChild(doc.createTextNode(content));
            parent.insertBefore(span, text);
            created++;
        }
        parent.removeChild(text);
        return created;
    }

    private static Element paragraphAncestor(Node node) {
        for (Node n = node.getParentNode(); n instanceof Element e; n = n.getParentNode()) {
            if (Namespaces.XHTML.equals(e.getNamespaceURI()) && PARAGRAPHS.contains(e.getLocalName())) {
                return e;
            }
        }
        return null;
    }

    /**
     * Splits text after sentence terminators; a terminator keeps any closing quotes.
     * Concatenating the result yields the input.
     */
    static List<String> sentences(String text) {
        List<String> pieces = new ArrayList<>();
        Matcher m = SENTENCE.matcher(text);
        int end = 0;
        while (end < text.length() && m.find(end)) {
            if (m.end() == m.start()) {
                break;
            }
            pieces.add(m.group());
            end = m.end();
        }
        if (end < text.length()) {
            pieces.add(text.substring(end));
        }
        return pieces;
    }
}
