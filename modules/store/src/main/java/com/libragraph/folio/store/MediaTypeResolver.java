package com.libragraph.folio.store;

import com.libragraph.folio.types.EntryKind;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.util.PackagePath;
import org.apache.tika.Tika;

import java.util.Map;

/**
 * Name-based media type detection for package entries.
 *
 * <p>EPUB-specific types that Tika reports under legacy names are overridden so that
 * manifest declarations can be compared against the detected type.
 */
public final class MediaTypeResolver {

    private static final Tika TIKA = new Tika();

    private static final Map<String, String> OVERRIDES = Map.ofEntries(
            Map.entry("xhtml", MediaTypes.XHTML),
            Map.entry("xht", MediaTypes.XHTML),
            Map.entry("html", MediaTypes.XHTML),
            Map.entry("htm", MediaTypes.XHTML),
            Map.entry("opf", MediaTypes.OPF),
            Map.entry("ncx", MediaTypes.NCX),
            Map.entry("css", MediaTypes.CSS),
            Map.entry("svg", MediaTypes.SVG),
            Map.entry("ttf", "font/ttf"),
            Map.entry("otf", "font/otf"),
            Map.entry("woff", "font/woff"),
            Map.entry("woff2", "font/woff2"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", MediaTypes.PNG),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("js", "application/javascript"),
            Map.entry("smil", "application/smil+xml"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("xml", "application/xml")
    );

    private MediaTypeResolver() {
    }

    public static String forPath(String path) {
        if (MediaTypes.MIMETYPE_ENTRY.equals(path)) {
            return "text/plain";
        }
        String override = OVERRIDES.get(PackagePath.extension(path));
        if (override != null) {
            return override;
        }
        return TIKA.detect(PackagePath.fileName(path));
    }

    public static EntryKind kindOf(String path) {
        String mediaType = forPath(path);
        if (mediaType.equals(MediaTypes.XHTML) || mediaType.equals("text/html")
                || mediaType.endsWith("+xml") || mediaType.endsWith("/xml")) {
            return EntryKind.MARKUP;
        }
        if (mediaType.startsWith("text/") || mediaType.equals("application/javascript")) {
            return EntryKind.TEXT;
        }
        return EntryKind.BINARY;
    }

    /**
     * True if two media types name the same format. Legacy aliases of fonts and
     * markup compare equal to their current names.
     */
    public static boolean equivalent(String declared, String detected) {
        if (declared == null || detected == null) {
            return false;
        }
        String a = declared.trim().toLowerCase();
        String b = detected.trim().toLowerCase();
        if (a.equals(b)) {
            return true;
        }
        if (MediaTypes.isFont(a) && MediaTypes.isFont(b)) {
            return true;
        }
        return (a.equals("text/html") && b.equals(MediaTypes.XHTML))
                || (a.equals("image/jpg") && b.equals("image/jpeg"))
                || (a.equals("text/javascript") && b.equals("application/javascript"));
    }
}
