package com.libragraph.folio.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Path arithmetic for package entries.
 *
 * <p>Entry paths are POSIX-style, case-sensitive and {@code /}-separated, relative to
 * the package root, with no empty, {@code .} or {@code ..} segments. Hrefs found inside
 * documents are resolved against the referencing entry with {@link #resolve}.
 */
public final class PackagePath {

    private PackagePath() {
    }

    /**
     * Validates an entry path, converting {@code \} separators to {@code /}.
     *
     * @throws IllegalArgumentException if the path is empty, absolute, or contains
     *                                  empty, {@code .} or {@code ..} segments
     */
    public static String normalize(String path) {
        Objects.requireNonNull(path, "path cannot be null");
        String p = path.replace('\\', '/');
        if (p.isEmpty()) {
            throw new IllegalArgumentException("Entry path cannot be empty");
        }
        if (p.startsWith("/")) {
            throw new IllegalArgumentException("Entry path must be relative: " + path);
        }
        for (String segment : p.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Invalid segment in entry path: " + path);
            }
        }
        return p;
    }

    /**
     * Returns true if {@link #normalize} would accept the path.
     */
    public static boolean isValid(String path) {
        try {
            normalize(path);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Directory part of an entry path including the trailing slash, or "" at the root.
     */
    public static String parent(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash + 1);
    }

    public static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * Lowercase extension without the dot, or "" if there is none.
     */
    public static String extension(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1).toLowerCase();
    }

    /**
     * File name without its extension.
     */
    public static String baseName(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /**
     * Resolves an href found in {@code referrer} to an entry path. Fragments and
     * queries are dropped and percent-escapes decoded. Returns null for external
     * URLs, pure fragments, and hrefs escaping the package root.
     */
    public static String resolve(String referrer, String href) {
        if (href == null) {
            return null;
        }
        String h = href.trim();
        int cut = indexOfAny(h, '#', '?');
        if (cut >= 0) {
            h = h.substring(0, cut);
        }
        if (h.isEmpty() || h.contains(":") || h.startsWith("/")) {
            return null;
        }
        h = URLDecoder.decode(h.replace("+", "%2B"), StandardCharsets.UTF_8);

        List<String> parts = new ArrayList<>();
        for (String s : parent(referrer).split("/")) {
            if (!s.isEmpty()) parts.add(s);
        }
        for (String s : h.split("/")) {
            if (s.isEmpty() || s.equals(".")) {
                continue;
            }
            if (s.equals("..")) {
                if (parts.isEmpty()) return null;
                parts.remove(parts.size() - 1);
            } else {
                parts.add(s);
            }
        }
        return parts.isEmpty() ? null : String.join("/", parts);
    }

    /**
     * Relative href from the entry {@code from} to the entry {@code to}.
     */
    public static String relativize(String from, String to) {
        String[] fromDirs = parent(from).split("/");
        String[] toParts = to.split("/");
        int fromLen = parent(from).isEmpty() ? 0 : fromDirs.length;

        int common = 0;
        while (common < fromLen && common < toParts.length - 1
                && fromDirs[common].equals(toParts[common])) {
            common++;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = common; i < fromLen; i++) {
            sb.append("../");
        }
        for (int i = common; i < toParts.length; i++) {
            if (i > common) sb.append('/');
            sb.append(toParts[i]);
        }
        return sb.toString();
    }

    private static int indexOfAny(String s, char a, char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }
}
