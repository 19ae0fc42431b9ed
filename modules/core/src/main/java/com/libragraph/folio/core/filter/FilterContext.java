package com.libragraph.folio.core.filter;

import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.MediaTypeResolver;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.types.MediaTypes;

import java.util.List;

/**
 * The store and cache pair a chain runs against.
 */
public record FilterContext(PackageStore store, DocumentCache cache) {

    public FilterContext {
        if (cache.store() != store) {
            throw new IllegalArgumentException("Document cache is bound to a different store");
        }
    }

    public static FilterContext of(PackageStore store, boolean xmlCache) {
        return new FilterContext(store, new DocumentCache(store, xmlCache));
    }

    /**
     * Loads the package document.
     *
     * @throws com.libragraph.folio.core.opf.ManifestInconsistentException if there is none
     */
    public PackageDocument packageDocument() {
        return PackageDocument.load(cache);
    }

    /**
     * Paths of all XHTML content documents, in {@link PackageStore#list()} order.
     */
    public List<String> contentDocuments() {
        return store.list().stream()
                .filter(p -> MediaTypes.XHTML.equals(MediaTypeResolver.forPath(p)))
                .toList();
    }

    /**
     * Paths of all style sheets, in {@link PackageStore#list()} order.
     */
    public List<String> styleSheets() {
        return store.list().stream()
                .filter(p -> MediaTypes.CSS.equals(MediaTypeResolver.forPath(p)))
                .toList();
    }
}
