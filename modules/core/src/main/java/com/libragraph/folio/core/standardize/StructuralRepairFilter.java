package com.libragraph.folio.core.standardize;

import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.filter.FilterFactory;
import com.libragraph.folio.core.filter.PackageFilter;
import com.libragraph.folio.core.filter.SimpleFilterFactory;
import com.libragraph.folio.core.opf.ManifestInconsistentException;
import com.libragraph.folio.core.opf.ManifestItem;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.store.ManifestIndex;
import com.libragraph.folio.store.MediaTypeResolver;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;
import org.w3c.dom.Element;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Repairs the container structure: the {@code mimetype} marker, the container document,
 * and manifest/spine references of the package document.
 */
public class StructuralRepairFilter implements PackageFilter {

    public static final String NAME = "structural-repair";

    private static final Logger log = Logger.getLogger(StructuralRepairFilter.class);

    private static final byte[] MIMETYPE = MediaTypes.EPUB.getBytes(StandardCharsets.US_ASCII);

    public static FilterFactory factory() {
        return new SimpleFilterFactory(NAME, options -> new StructuralRepairFilter());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(FilterContext context) {
        PackageStore store = context.store();
        repairMimetype(store);
        repairContainer(store);

        PackageDocument opf = context.packageDocument();
        int fixes = dropMissingItems(store, opf)
                + dedupeItems(opf)
                + dropUnknownItemrefs(opf)
                + correctMediaTypes(opf)
                + registerUnlisted(store, opf);

        if (fixes > 0) {
            opf.save();
            log.infof("Repaired %d manifest problems in %s", fixes, store.description());
        }
    }

    private void repairMimetype(PackageStore store) {
        if (store.exists(MediaTypes.MIMETYPE_ENTRY) && Arrays.equals(store.get(MediaTypes.MIMETYPE_ENTRY), MIMETYPE)) {
            return;
        }
        store.put(MediaTypes.MIMETYPE_ENTRY, MIMETYPE);
        log.debugf("Regenerated mimetype marker in %s", store.description());
    }

    private void repairContainer(PackageStore store) {
        Optional<String> declared = ManifestIndex.packageDocumentPath(store);
        if (declared.isPresent() && store.exists(declared.get())) {
            return;
        }
        String opfPath = store.list().stream()
                .filter(p -> p.endsWith(".opf"))
                .findFirst()
                .orElseThrow(() -> new ManifestInconsistentException(
                        "No package document in " + store.description(), MediaTypes.CONTAINER_ENTRY));
        store.putText(MediaTypes.CONTAINER_ENTRY, containerXml(opfPath));
        log.debugf("Regenerated container document pointing at %s", opfPath);
    }

    static String containerXml(String opfPath) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <container version="1.0" xmlns="urn:oasis:names:tc:opendocument:xmlns:container">
                  <rootfiles>
                    <rootfile full-path="%s" media-type="application/oebps-package+xml"/>
                  </rootfiles>
                </container>
                """.formatted(opfPath);
    }

    private int dropMissingItems(PackageStore store, PackageDocument opf) {
        int dropped = 0;
        for (ManifestItem item : opf.items()) {
            if (item.href() == null || item.href().isBlank()
                    || (item.path() != null && !store.exists(item.path()))) {
                opf.removeItem(item);
                log.debugf("Dropped manifest item %s (missing %s)", item.id(), item.href());
                dropped++;
            }
        }
        return dropped;
    }

    private int dedupeItems(PackageDocument opf) {
        int fixed = 0;
        Set<String> ids = new HashSet<>();
        Set<String> paths = new HashSet<>();
        for (ManifestItem item : opf.items()) {
            if (item.path() != null && !paths.add(item.path())) {
                Dom.remove(item.element());
                fixed++;
                continue;
            }
            if (item.id() == null || item.id().isBlank() || !ids.add(item.id())) {
                String id = opf.uniqueId(item.path() == null ? "item" : PackagePath.fileName(item.path()));
                item.element().setAttribute("id", id);
                ids.add(id);
                fixed++;
            }
        }
        return fixed;
    }

    private int dropUnknownItemrefs(PackageDocument opf) {
        Set<String> ids = new HashSet<>();
        for (ManifestItem item : opf.items()) {
            ids.add(item.id());
        }
        int dropped = 0;
        for (Element ref : opf.itemrefs()) {
            String idref = Dom.attr(ref, "idref");
            if (idref == null || !ids.contains(idref)) {
                Dom.remove(ref);
                dropped++;
            }
        }
        return dropped;
    }

    private int correctMediaTypes(PackageDocument opf) {
        int corrected = 0;
        for (ManifestItem item : opf.items()) {
            if (item.path() == null) {
                continue;
            }
            String detected = MediaTypeResolver.forPath(item.path());
            if (detected.equals(MediaTypes.OCTET_STREAM)) {
                continue;
            }
            if (!MediaTypeResolver.equivalent(item.mediaType(), detected)) {
                item.element().setAttribute("media-type", detected);
                log.debugf("Corrected media type of %s: %s → %s", item.path(), item.mediaType(), detected);
                corrected++;
            }
        }
        return corrected;
    }

    private int registerUnlisted(PackageStore store, PackageDocument opf) {
        Set<String> listed = new HashSet<>();
        for (ManifestItem item : opf.items()) {
            listed.add(item.path());
        }
        int added = 0;
        for (String path : store.list()) {
            if (listed.contains(path) || !isContent(path, opf)) {
                continue;
            }
            opf.addItem(path, MediaTypeResolver.forPath(path));
            added++;
        }
        return added;
    }

    private static boolean isContent(String path, PackageDocument opf) {
        return !path.equals(MediaTypes.MIMETYPE_ENTRY)
                && !path.startsWith("META-INF/")
                && !path.equals(opf.path())
                && !path.endsWith(".opf")
                && !PrivacyScrubFilter.isJunk(path);
    }
}
