package com.libragraph.folio.core.protect;

import com.libragraph.folio.store.MediaTypeResolver;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.util.PackagePath;

import java.util.EnumSet;
import java.util.Set;

/**
 * Entry classes that can be selected for protection.
 */
public enum ProtectionTarget {
    FONT("font"),
    IMAGE("image"),
    STYLE("style"),
    MARKUP("markup");

    private static final Set<String> FONT_EXTENSIONS = Set.of("ttf", "otf", "woff", "woff2");

    private final String label;

    ProtectionTarget(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean matches(String path) {
        String mediaType = MediaTypeResolver.forPath(path);
        switch (this) {
            case FONT:
                return MediaTypes.isFont(mediaType) || FONT_EXTENSIONS.contains(PackagePath.extension(path));
            case IMAGE:
                return MediaTypes.isImage(mediaType);
            case STYLE:
                return MediaTypes.CSS.equals(mediaType);
            case MARKUP:
                return MediaTypes.XHTML.equals(mediaType);
            default:
                return false;
        }
    }

    public static ProtectionTarget fromLabel(String label) {
        for (ProtectionTarget t : values()) {
            if (t.label.equalsIgnoreCase(label.trim())) return t;
        }
        throw new IllegalArgumentException("Unknown protection target: " + label);
    }

    /**
     * Parses a comma-separated target list.
     */
    public static Set<ProtectionTarget> parseList(String labels) {
        Set<ProtectionTarget> targets = EnumSet.noneOf(ProtectionTarget.class);
        for (String label : labels.split(",")) {
            if (!label.isBlank()) {
                targets.add(fromLabel(label));
            }
        }
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("Empty protection target list");
        }
        return targets;
    }
}
