package com.libragraph.folio.core.opf;

import com.libragraph.folio.markup.Dom;
import org.w3c.dom.Element;

/**
 * One {@code manifest/item} of a package document. {@code path} is the href resolved
 * against the package document, or null when the href does not name a package entry.
 */
public record ManifestItem(String id, String href, String path, String mediaType, Element element) {

    public boolean hasProperty(String property) {
        return Dom.hasToken(element, "properties", property);
    }

    public void addProperty(String property) {
        Dom.addToken(element, "properties", property);
    }
}
