package com.libragraph.folio.core.layout;

import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.opf.ManifestItem;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.core.opf.ReferenceRewriter;
import com.libragraph.folio.store.EntryText;
import com.libragraph.folio.store.MediaTypeResolver;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.types.EntryKind;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Moves manifest entries into the standard directories next to the package document:
 * {@code Text/}, {@code Styles/}, {@code Images/} and {@code Fonts/}.
 *
 * <p>Spine documents are renamed {@code f1.xhtml}, {@code f2.xhtml}, ... in reading
 * order and raster images {@code f1.jpg}, {@code f2.png}, ... in manifest order, with
 * {@code .jpeg} written as {@code .jpg}. Other entries keep their file names. Every
 * reference in the package, including the package document's own hrefs, follows the
 * move. Entries outside the manifest stay where they are.
 */
final class StandardStructure {

    private static final Logger log = Logger.getLogger(StandardStructure.class);

    static final String TEXT = "Text/";
    static final String STYLES = "Styles/";
    static final String IMAGES = "Images/";
    static final String FONTS = "Fonts/";

    private static final Set<String> RASTER = Set.of("jpg", "jpeg", "png", "gif", "webp");

    private StandardStructure() {
    }

    /**
     * Reorganizes the package; returns the number of entries moved.
     */
    static int apply(FilterContext context) {
        PackageStore store = context.store();
        Map<String, String> moves = plan(context.packageDocument(), store);
        if (moves.isEmpty()) {
            return 0;
        }

        ReferenceRewriter rewriter = new ReferenceRewriter(moves);
        Map<String, byte[]> writes = new LinkedHashMap<>();
        for (String path : store.list()) {
            String target = moves.getOrDefault(path, path);
            EntryKind kind = MediaTypeResolver.kindOf(path);
            if (!path.equals(MediaTypes.MIMETYPE_ENTRY) && (kind == EntryKind.MARKUP || kind == EntryKind.TEXT)) {
                EntryText entry = EntryText.decode(store.get(path));
                String updated = rewriter.rewrite(path, entry.text(), kind == EntryKind.MARKUP);
                if (!updated.equals(entry.text()) || !target.equals(path)) {
                    writes.put(target, entry.encode(updated));
                }
            } else if (!target.equals(path)) {
                writes.put(target, store.get(path));
            }
        }
        moves.keySet().forEach(store::delete);
        writes.forEach(store::put);
        log.debugf("Moved %d entries of %s into the standard structure", moves.size(), store.description());
        return moves.size();
    }

    /**
     * Old path to new path for every manifest entry that changes place.
     */
    static Map<String, String> plan(PackageDocument opf, PackageStore store) {
        String base = PackagePath.parent(opf.path());
        Set<String> spine = new LinkedHashSet<>();
        for (ManifestItem item : opf.spineItems()) {
            if (item.path() != null && MediaTypes.XHTML.equals(MediaTypeResolver.forPath(item.path()))) {
                spine.add(item.path());
            }
        }

        Map<String, String> targets = new LinkedHashMap<>();
        int page = 1;
        for (String path : spine) {
            if (store.exists(path)) {
                targets.put(path, base + TEXT + "f" + page++ + ".xhtml");
            }
        }
        int image = 1;
        for (ManifestItem item : opf.items()) {
            String path = item.path();
            if (path == null || targets.containsKey(path) || !store.exists(path)) {
                continue;
            }
            String mediaType = MediaTypeResolver.forPath(path);
            String extension = PackagePath.extension(path);
            if (MediaTypes.XHTML.equals(mediaType)) {
                targets.put(path, base + TEXT + PackagePath.fileName(path));
            } else if (MediaTypes.CSS.equals(mediaType)) {
                targets.put(path, base + STYLES + PackagePath.fileName(path));
            } else if (MediaTypes.isImage(mediaType) && RASTER.contains(extension)) {
                targets.put(path, base + IMAGES + "f" + image++ + "." + (extension.equals("jpeg") ? "jpg" : extension));
            } else if (MediaTypes.isImage(mediaType)) {
                targets.put(path, base + IMAGES + PackagePath.fileName(path));
            } else if (MediaTypes.isFont(mediaType)) {
                targets.put(path, base + FONTS + PackagePath.fileName(path));
            }
        }

        // entries that are not reorganized keep their paths; planned targets must avoid them
        Set<String> taken = new HashSet<>(store.list());
        taken.removeAll(targets.keySet());
        Map<String, String> moves = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : targets.entrySet()) {
            String target = available(entry.getValue(), taken);
            taken.add(target);
            if (!target.equals(entry.getKey())) {
                moves.put(entry.getKey(), target);
            }
        }
        return moves;
    }

    private static String available(String wanted, Set<String> taken) {
        if (!taken.contains(wanted)) {
            return wanted;
        }
        String dir = PackagePath.parent(wanted);
        String stem = PackagePath.baseName(wanted);
        String extension = PackagePath.extension(wanted);
        for (int n = 2; ; n++) {
            String candidate = dir + stem + "-" + n + (extension.isEmpty() ? "" : "." + extension);
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
    }
}
