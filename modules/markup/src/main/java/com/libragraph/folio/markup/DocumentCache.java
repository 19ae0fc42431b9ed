package com.libragraph.folio.markup;

import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.store.StoreListener;
import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;
import org.w3c.dom.Document;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parsed-document cache bound to one {@link PackageStore}.
 *
 * <p>A document is parsed on first {@link #readXml} and memoized until its entry is
 * written or deleted through the store, at which point the cache drops it. Writing
 * through {@link #writeXml} stores the serialized bytes and keeps the written tree, so
 * the next read does not re-parse. Parse failures are not cached.
 */
public class DocumentCache implements StoreListener, AutoCloseable {

    private static final Logger log = Logger.getLogger(DocumentCache.class);

    private final PackageStore store;
    private final boolean enabled;
    private final Map<String, ParsedDocument> documents = new ConcurrentHashMap<>();

    public DocumentCache(PackageStore store, boolean enabled) {
        this.store = store;
        this.enabled = enabled;
        store.addListener(this);
    }

    public DocumentCache(PackageStore store) {
        this(store, true);
    }

    public PackageStore store() {
        return store;
    }

    /**
     * Returns the parsed form of an entry, parsing it on first access.
     *
     * @throws com.libragraph.folio.store.EntryNotFoundException if the entry does not exist
     * @throws MalformedMarkupException                          if the entry is not well-formed
     */
    public ParsedDocument readXml(String path) {
        String p = PackagePath.normalize(path);
        if (!enabled) {
            return parse(p);
        }
        return documents.computeIfAbsent(p, this::parse);
    }

    /**
     * Serializes {@code document} in {@code mode}, writes it to the store and caches the
     * written tree under {@code path}.
     *
     * @throws SerializationMismatchException if the document does not fit the mode;
     *                                        nothing is written in that case
     */
    public void writeXml(String path, Document document, SerializationMode mode) {
        String p = PackagePath.normalize(path);
        byte[] bytes = XmlCodec.serialize(document, mode, p);
        store.put(p, bytes);
        if (enabled) {
            documents.put(p, new ParsedDocument(p, document));
        }
    }

    public void writeXml(ParsedDocument document, SerializationMode mode) {
        writeXml(document.path(), document.document(), mode);
    }

    public boolean isCached(String path) {
        return documents.containsKey(path);
    }

    public void invalidate(String path) {
        documents.remove(path);
    }

    public void clear() {
        documents.clear();
    }

    @Override
    public void entryChanged(String path, Change change) {
        if (documents.remove(path) != null) {
            log.debugf("Evicted %s (%s)", path, change);
        }
    }

    /**
     * Detaches from the store and drops all cached documents.
     */
    @Override
    public void close() {
        store.removeListener(this);
        documents.clear();
    }

    private ParsedDocument parse(String path) {
        ParsedDocument parsed = new ParsedDocument(path, XmlCodec.parse(store.get(path), path));
        log.debugf("Parsed %s", path);
        return parsed;
    }
}
