package com.libragraph.folio.markup;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM traversal helpers. Lists returned here are snapshots, safe to iterate while
 * the tree is being modified.
 */
public final class Dom {

    private Dom() {
    }

    /**
     * Direct element children with the given namespace and local name.
     */
    public static List<Element> children(Element parent, String ns, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e && matches(e, ns, localName)) {
                result.add(e);
            }
        }
        return result;
    }

    public static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e) {
                result.add(e);
            }
        }
        return result;
    }

    public static Optional<Element> firstChild(Element parent, String ns, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e && matches(e, ns, localName)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * All descendant elements with the given namespace and local name, in document order.
     */
    public static List<Element> descendants(Element root, String ns, String localName) {
        NodeList list = root.getElementsByTagNameNS(ns, localName);
        List<Element> result = new ArrayList<>(list.getLength());
        for (int i = 0; i < list.getLength(); i++) {
            result.add((Element) list.item(i));
        }
        return result;
    }

    public static Optional<Element> firstDescendant(Element root, String ns, String localName) {
        NodeList list = root.getElementsByTagNameNS(ns, localName);
        return list.getLength() == 0 ? Optional.empty() : Optional.of((Element) list.item(0));
    }

    public static boolean matches(Element e, String ns, String localName) {
        return localName.equals(e.getLocalName()) && ns.equals(e.getNamespaceURI());
    }

    /**
     * Attribute value or null when absent (DOM returns "" for absent attributes).
     */
    public static String attr(Element e, String name) {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }

    /**
     * Text content with whitespace runs collapsed and trimmed.
     */
    public static String text(Node node) {
        String t = node.getTextContent();
        return t == null ? "" : t.replaceAll("\\s+", " ").trim();
    }

    public static void remove(Node node) {
        if (node.getParentNode() != null) {
            node.getParentNode().removeChild(node);
        }
    }

    /**
     * Replaces {@code element} by its children.
     */
    public static void unwrap(Element element) {
        Node parent = element.getParentNode();
        while (element.getFirstChild() != null) {
            parent.insertBefore(element.getFirstChild(), element);
        }
        parent.removeChild(element);
    }

    /**
     * True if the space-separated token list in attribute {@code name} contains {@code token}.
     */
    public static boolean hasToken(Element e, String name, String token) {
        String value = attr(e, name);
        if (value == null) {
            return false;
        }
        for (String t : value.trim().split("\\s+")) {
            if (t.equals(token)) {
                return true;
            }
        }
        return false;
    }

    public static void addToken(Element e, String name, String token) {
        if (hasToken(e, name, token)) {
            return;
        }
        String value = attr(e, name);
        e.setAttribute(name, value == null || value.isBlank() ? token : value.trim() + " " + token);
    }
}
