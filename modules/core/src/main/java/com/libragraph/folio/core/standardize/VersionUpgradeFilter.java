package com.libragraph.folio.core.standardize;

import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.filter.FilterFactory;
import com.libragraph.folio.core.filter.PackageFilter;
import com.libragraph.folio.core.filter.SimpleFilterFactory;
import com.libragraph.folio.core.opf.ManifestItem;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.markup.SerializationMode;
import com.libragraph.folio.markup.XmlCodec;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.types.Namespaces;
import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Upgrades a version 2 package to version 3.0: metadata attributes become refining
 * {@code meta} elements, {@code dcterms:modified} is stamped, the cover image is
 * flagged and a navigation document is generated. A version 3 package that already
 * has a navigation document is left untouched.
 */
public class VersionUpgradeFilter implements PackageFilter {

    public static final String NAME = "version-upgrade";

    private static final Logger log = Logger.getLogger(VersionUpgradeFilter.class);

    private final Clock clock;

    public VersionUpgradeFilter(Clock clock) {
        this.clock = clock;
    }

    public VersionUpgradeFilter() {
        this(Clock.systemUTC());
    }

    public static FilterFactory factory() {
        return new SimpleFilterFactory(NAME, options -> new VersionUpgradeFilter());
    }

    public static FilterFactory factory(Clock clock) {
        return new SimpleFilterFactory(NAME, options -> new VersionUpgradeFilter(clock));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(FilterContext context) {
        PackageDocument opf = context.packageDocument();
        if (opf.isVersion3() && opf.itemWithProperty("nav").isPresent()) {
            log.debugf("%s is already version %s", opf.path(), opf.version());
            return;
        }
        String from = opf.version();

        opf.setVersion("3.0");
        convertMetadataAttributes(opf);
        stampModified(opf);
        flagCoverImage(opf);
        if (opf.itemWithProperty("nav").isEmpty()) {
            generateNav(context, opf);
        }
        opf.save();

        log.infof("Upgraded %s from version %s to 3.0", context.store().description(),
                from.isEmpty() ? "?" : from);
    }

    private void convertMetadataAttributes(PackageDocument opf) {
        for (Element dc : Dom.children(opf.metadata())) {
            if (!Namespaces.DC.equals(dc.getNamespaceURI())) {
                continue;
            }
            String role = opfAttribute(dc, "role");
            String fileAs = opfAttribute(dc, "file-as");
            String event = opfAttribute(dc, "event");

            if ("date".equals(dc.getLocalName()) && "modification".equals(event)) {
                Dom.remove(dc);
                continue;
            }
            if (role != null || fileAs != null) {
                String id = Dom.attr(dc, "id");
                if (id == null) {
                    id = opf.uniqueId(dc.getLocalName());
                    dc.setAttribute("id", id);
                }
                if (role != null) {
                    Element meta = refine(opf, id, "role", role);
                    meta.setAttribute("scheme", "marc:relators");
                }
                if (fileAs != null) {
                    refine(opf, id, "file-as", fileAs);
                }
            }
            stripOpfAttributes(dc);
        }
    }

    private static String opfAttribute(Element e, String localName) {
        Attr attr = e.getAttributeNodeNS(Namespaces.OPF, localName);
        return attr == null ? null : attr.getValue();
    }

    private static void stripOpfAttributes(Element e) {
        NamedNodeMap attrs = e.getAttributes();
        List<Attr> doomed = new ArrayList<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (Namespaces.OPF.equals(attr.getNamespaceURI())) {
                doomed.add(attr);
            }
        }
        doomed.forEach(e::removeAttributeNode);
    }

    private static Element refine(PackageDocument opf, String id, String property, String value) {
        Element meta = opf.document().createElementNS(Namespaces.OPF, "meta");
        meta.setAttribute("refines", "#" + id);
        meta.setAttribute("property", property);
        meta.setTextContent(value);
        opf.metadata().appendChild(meta);
        return meta;
    }

    private void stampModified(PackageDocument opf) {
        String now = DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
        for (Element meta : opf.metas()) {
            if ("dcterms:modified".equals(Dom.attr(meta, "property"))) {
                meta.setTextContent(now);
                return;
            }
        }
        Element meta = opf.document().createElementNS(Namespaces.OPF, "meta");
        meta.setAttribute("property", "dcterms:modified");
        meta.setTextContent(now);
        opf.metadata().appendChild(meta);
    }

    private static void flagCoverImage(PackageDocument opf) {
        if (opf.itemWithProperty("cover-image").isPresent()) {
            return;
        }
        for (Element meta : opf.metas()) {
            if ("cover".equals(Dom.attr(meta, "name"))) {
                String id = Dom.attr(meta, "content");
                opf.itemById(id == null ? "" : id)
                        .filter(item -> MediaTypes.isImage(item.mediaType()))
                        .ifPresent(item -> item.addProperty("cover-image"));
                return;
            }
        }
    }

    private void generateNav(FilterContext context, PackageDocument opf) {
        String navPath = opf.sibling("nav.xhtml");
        for (int n = 1; context.store().exists(navPath); n++) {
            navPath = opf.sibling("nav_" + n + ".xhtml");
        }

        Document nav = XmlCodec.newDocument();
        Element html = nav.createElementNS(Namespaces.XHTML, "html");
        html.setAttributeNS(Namespaces.XMLNS, "xmlns:epub", Namespaces.OPS);
        nav.appendChild(html);
        Element head = append(html, "head");
        append(head, "title").setTextContent("Contents");
        Element body = append(html, "body");
        Element tocNav = append(body, "nav");
        tocNav.setAttributeNS(Namespaces.OPS, "epub:type", "toc");
        tocNav.setAttribute("id", "toc");
        append(tocNav, "h1").setTextContent("Contents");
        Element ol = append(tocNav, "ol");

        Optional<ManifestItem> ncx = findNcx(opf);
        if (ncx.isPresent() && context.store().exists(ncx.get().path())) {
            Element navMap = Dom.firstDescendant(
                    context.cache().readXml(ncx.get().path()).root(), Namespaces.NCX, "navMap").orElse(null);
            if (navMap != null) {
                addNavPoints(ol, navMap, ncx.get().path(), navPath);
            }
        } else {
            addSpineEntries(ol, context.cache(), opf, navPath);
        }

        context.cache().writeXml(navPath, nav, SerializationMode.MARKUP);
        opf.addItem(navPath, MediaTypes.XHTML).addProperty("nav");
        log.debugf("Generated navigation document %s", navPath);
    }

    private static Optional<ManifestItem> findNcx(PackageDocument opf) {
        String tocId = Dom.attr(opf.spine(), "toc");
        if (tocId != null) {
            Optional<ManifestItem> byId = opf.itemById(tocId);
            if (byId.isPresent() && byId.get().path() != null) {
                return byId;
            }
        }
        return opf.items().stream()
                .filter(i -> MediaTypes.NCX.equals(i.mediaType()) && i.path() != null)
                .findFirst();
    }

    private static void addNavPoints(Element ol, Element parent, String ncxPath, String navPath) {
        for (Element point : Dom.children(parent, Namespaces.NCX, "navPoint")) {
            String label = Dom.firstChild(point, Namespaces.NCX, "navLabel").map(Dom::text).orElse("");
            String src = Dom.firstChild(point, Namespaces.NCX, "content").map(c -> Dom.attr(c, "src")).orElse(null);

            Element li = append(ol, "li");
            Element a = append(li, "a");
            a.setTextContent(label);
            String target = src == null ? null : PackagePath.resolve(ncxPath, src);
            if (target != null) {
                int hash = src.indexOf('#');
                a.setAttribute("href", PackagePath.relativize(navPath, target) + (hash >= 0 ? src.substring(hash) : ""));
            }
            if (!Dom.children(point, Namespaces.NCX, "navPoint").isEmpty()) {
                addNavPoints(append(li, "ol"), point, ncxPath, navPath);
            }
        }
    }

    private static void addSpineEntries(Element ol, DocumentCache cache, PackageDocument opf, String navPath) {
        for (ManifestItem item : opf.spineItems()) {
            if (item.path() == null || !MediaTypes.XHTML.equals(item.mediaType()) || !cache.store().exists(item.path())) {
                continue;
            }
            Element li = append(ol, "li");
            Element a = append(li, "a");
            a.setAttribute("href", PackagePath.relativize(navPath, item.path()));
            a.setTextContent(documentTitle(cache, item.path()));
        }
    }

    static String documentTitle(DocumentCache cache, String path) {
        Element root = cache.readXml(path).root();
        for (String heading : new String[]{"h1", "h2", "h3", "h4", "h5", "h6", "title"}) {
            Optional<String> text = Dom.firstDescendant(root, Namespaces.XHTML, heading)
                    .map(Dom::text)
                    .filter(t -> !t.isEmpty());
            if (text.isPresent()) {
                return text.get();
            }
        }
        return PackagePath.baseName(path);
    }

    private static Element append(Element parent, String localName) {
        Element child = parent.getOwnerDocument().createElementNS(Namespaces.XHTML, localName);
        parent.appendChild(child);
        return child;
    }
}
