package com.libragraph.folio.core.opf;

import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.markup.ParsedDocument;
import com.libragraph.folio.markup.SerializationMode;
import com.libragraph.folio.store.ManifestIndex;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.types.Namespaces;
import com.libragraph.folio.util.PackagePath;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Editable view of a package document (metadata, manifest, spine) on top of the
 * cached DOM tree. Changes are written back with {@link #save()}.
 */
public class PackageDocument {

    private final DocumentCache cache;
    private final ParsedDocument parsed;

    private PackageDocument(DocumentCache cache, ParsedDocument parsed) {
        this.cache = cache;
        this.parsed = parsed;
    }

    /**
     * Path of the package document: the container's rootfile when it exists, otherwise
     * the first {@code .opf} entry.
     */
    public static Optional<String> locate(PackageStore store) {
        Optional<String> declared = ManifestIndex.packageDocumentPath(store);
        if (declared.isPresent() && store.exists(declared.get())) {
            return declared;
        }
        return store.list().stream()
                .filter(p -> PackagePath.extension(p).equals("opf"))
                .findFirst();
    }

    /**
     * Loads the package document of the cache's store.
     *
     * @throws ManifestInconsistentException if the package has no package document
     */
    public static PackageDocument load(DocumentCache cache) {
        String path = locate(cache.store()).orElseThrow(() -> new ManifestInconsistentException(
                "No package document in " + cache.store().description(), null));
        ParsedDocument parsed = cache.readXml(path);
        Element root = parsed.root();
        if (!Dom.matches(root, Namespaces.OPF, "package")) {
            throw new ManifestInconsistentException("Not a package document: " + path, path);
        }
        return new PackageDocument(cache, parsed);
    }

    public String path() {
        return parsed.path();
    }

    public Document document() {
        return parsed.document();
    }

    public Element root() {
        return parsed.root();
    }

    public String version() {
        String v = Dom.attr(root(), "version");
        return v == null ? "" : v.trim();
    }

    public boolean isVersion3() {
        return version().startsWith("3");
    }

    public void setVersion(String version) {
        root().setAttribute("version", version);
    }

    public Element metadata() {
        return section("metadata");
    }

    public Element manifest() {
        return section("manifest");
    }

    public Element spine() {
        return section("spine");
    }

    private Element section(String name) {
        Optional<Element> existing = Dom.firstChild(root(), Namespaces.OPF, name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Element created = document().createElementNS(Namespaces.OPF, name);
        Element before = switch (name) {
            case "metadata" -> Dom.children(root()).stream().findFirst().orElse(null);
            case "manifest" -> Dom.firstChild(root(), Namespaces.OPF, "spine").orElse(null);
            default -> null;
        };
        root().insertBefore(created, before);
        return created;
    }

    public List<ManifestItem> items() {
        List<ManifestItem> items = new ArrayList<>();
        for (Element item : Dom.children(manifest(), Namespaces.OPF, "item")) {
            items.add(toItem(item));
        }
        return items;
    }

    private ManifestItem toItem(Element item) {
        String href = Dom.attr(item, "href");
        return new ManifestItem(
                Dom.attr(item, "id"),
                href,
                href == null ? null : PackagePath.resolve(path(), href),
                Dom.attr(item, "media-type"),
                item);
    }

    public Optional<ManifestItem> itemById(String id) {
        return items().stream().filter(i -> id.equals(i.id())).findFirst();
    }

    public Optional<ManifestItem> itemByPath(String entryPath) {
        return items().stream().filter(i -> entryPath.equals(i.path())).findFirst();
    }

    public Optional<ManifestItem> itemWithProperty(String property) {
        return items().stream().filter(i -> i.hasProperty(property)).findFirst();
    }

    /**
     * Adds a manifest item for {@code entryPath} with an id derived from its file name.
     */
    public ManifestItem addItem(String entryPath, String mediaType) {
        Element item = document().createElementNS(Namespaces.OPF, "item");
        item.setAttribute("id", uniqueId(PackagePath.fileName(entryPath)));
        item.setAttribute("href", hrefFor(entryPath));
        item.setAttribute("media-type", mediaType);
        manifest().appendChild(item);
        return toItem(item);
    }

    /**
     * Removes an item and every spine reference to it.
     */
    public void removeItem(ManifestItem item) {
        Dom.remove(item.element());
        if (item.id() != null) {
            for (Element ref : itemrefs()) {
                if (item.id().equals(Dom.attr(ref, "idref"))) {
                    Dom.remove(ref);
                }
            }
        }
    }

    public List<Element> itemrefs() {
        return Dom.children(spine(), Namespaces.OPF, "itemref");
    }

    public void addItemref(String idref) {
        Element ref = document().createElementNS(Namespaces.OPF, "itemref");
        ref.setAttribute("idref", idref);
        spine().appendChild(ref);
    }

    /**
     * Manifest items of the spine in reading order; unknown idrefs are skipped.
     */
    public List<ManifestItem> spineItems() {
        List<ManifestItem> all = items();
        List<ManifestItem> result = new ArrayList<>();
        for (Element ref : itemrefs()) {
            String idref = Dom.attr(ref, "idref");
            all.stream().filter(i -> i.id() != null && i.id().equals(idref)).findFirst().ifPresent(result::add);
        }
        return result;
    }

    /**
     * Relative href from the package document to an entry.
     */
    public String hrefFor(String entryPath) {
        return PackagePath.relativize(path(), entryPath);
    }

    /**
     * Entry path for a new file in the package document's directory.
     */
    public String sibling(String relative) {
        return PackagePath.parent(path()) + relative;
    }

    /**
     * An id not yet used by any element of the document, derived from {@code base}.
     */
    public String uniqueId(String base) {
        String candidate = base.replaceAll("[^A-Za-z0-9_.-]", "_");
        if (candidate.isEmpty() || !Character.isLetter(candidate.charAt(0)) && candidate.charAt(0) != '_') {
            candidate = "id_" + candidate;
        }
        Set<String> used = usedIds();
        String id = candidate;
        int n = 1;
        while (used.contains(id)) {
            id = candidate + "_" + n++;
        }
        return id;
    }

    private Set<String> usedIds() {
        Set<String> ids = new HashSet<>();
        collectIds(root(), ids);
        return ids;
    }

    private static void collectIds(Element e, Set<String> ids) {
        String id = Dom.attr(e, "id");
        if (id != null) {
            ids.add(id);
        }
        for (Node n = e.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child) {
                collectIds(child, ids);
            }
        }
    }

    public List<Element> dc(String localName) {
        return Dom.children(metadata(), Namespaces.DC, localName);
    }

    public Element addDc(String localName, String value) {
        Element e = document().createElementNS(Namespaces.DC, "dc:" + localName);
        e.setTextContent(value);
        metadata().appendChild(e);
        return e;
    }

    public List<Element> metas() {
        return Dom.children(metadata(), Namespaces.OPF, "meta");
    }

    /**
     * The {@code dc:identifier} named by the {@code unique-identifier} attribute, falling
     * back to the first identifier.
     */
    public Optional<Element> uniqueIdentifierElement() {
        List<Element> identifiers = dc("identifier");
        String ref = Dom.attr(root(), "unique-identifier");
        if (ref != null) {
            for (Element id : identifiers) {
                if (ref.equals(Dom.attr(id, "id"))) {
                    return Optional.of(id);
                }
            }
        }
        return identifiers.stream().findFirst();
    }

    public Optional<String> uniqueIdentifier() {
        return uniqueIdentifierElement().map(Dom::text).filter(s -> !s.isEmpty());
    }

    public Optional<String> title() {
        return dc("title").stream().map(Dom::text).filter(s -> !s.isEmpty()).findFirst();
    }

    /**
     * Writes the document back to the store.
     */
    public void save() {
        cache.writeXml(path(), document(), SerializationMode.PACKAGE);
    }
}
