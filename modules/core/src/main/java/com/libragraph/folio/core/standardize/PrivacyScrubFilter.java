package com.libragraph.folio.core.standardize;

import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.filter.FilterFactory;
import com.libragraph.folio.core.filter.PackageFilter;
import com.libragraph.folio.core.filter.SimpleFilterFactory;
import com.libragraph.folio.core.opf.ManifestItem;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;
import org.w3c.dom.Element;

import java.util.HashSet;
import java.util.Set;

/**
 * Removes reader state, vendor bookkeeping and operating-system junk from a package.
 */
public class PrivacyScrubFilter implements PackageFilter {

    public static final String NAME = "privacy-scrub";

    private static final Logger log = Logger.getLogger(PrivacyScrubFilter.class);

    private static final Set<String> JUNK_PATHS = Set.of(
            "META-INF/calibre_bookmarks.txt",
            "iTunesMetadata.plist",
            "iTunesMetadata-original.plist",
            "iTunesArtwork");

    private static final Set<String> JUNK_NAMES = Set.of(".DS_Store", "Thumbs.db", "desktop.ini");

    public static FilterFactory factory() {
        return new SimpleFilterFactory(NAME, options -> new PrivacyScrubFilter());
    }

    static boolean isJunk(String path) {
        return JUNK_PATHS.contains(path)
                || path.startsWith("__MACOSX/")
                || JUNK_NAMES.contains(PackagePath.fileName(path));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(FilterContext context) {
        PackageStore store = context.store();
        Set<String> deleted = new HashSet<>();
        for (String path : store.list()) {
            if (isJunk(path)) {
                store.delete(path);
                deleted.add(path);
            }
        }

        int metaRemoved = 0;
        int itemsRemoved = 0;
        if (PackageDocument.locate(store).isPresent()) {
            PackageDocument opf = context.packageDocument();
            for (Element meta : opf.metas()) {
                if (isVendorMeta(Dom.attr(meta, "name")) || isVendorMeta(Dom.attr(meta, "property"))) {
                    Dom.remove(meta);
                    metaRemoved++;
                }
            }
            for (ManifestItem item : opf.items()) {
                if (item.path() != null && deleted.contains(item.path())) {
                    opf.removeItem(item);
                    itemsRemoved++;
                }
            }
            if (metaRemoved + itemsRemoved > 0) {
                opf.save();
            }
        }

        log.infof("Privacy scrub of %s: %d entries, %d metadata elements removed",
                store.description(), deleted.size(), metaRemoved);
    }

    private static boolean isVendorMeta(String name) {
        return name != null && name.startsWith("calibre:");
    }
}
