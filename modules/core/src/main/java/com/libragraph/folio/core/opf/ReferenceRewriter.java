package com.libragraph.folio.core.opf;

import com.libragraph.folio.util.PackagePath;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the references inside one entry after other entries, or the entry itself,
 * moved to new paths.
 *
 * <p>Every reference token is resolved against the referrer with
 * {@link PackagePath#resolve}, so percent-encoded and {@code ./}-prefixed hrefs match
 * the entry they name. Markup is scanned for {@code href}, {@code src},
 * {@code full-path}, {@code poster} and {@code data} attributes (with or without a
 * namespace prefix) and for CSS {@code url()} tokens; style sheets for {@code url()}
 * and {@code @import} strings. A token is rewritten only when its target or the
 * referrer moved. Fragments and queries are kept.
 */
public final class ReferenceRewriter {

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "(?<=\\s)((?:[A-Za-z_][-\\w.]*:)?(?:href|src|full-path|poster|data)\\s*=\\s*)(?:\"([^\"]*)\"|'([^']*)')");
    private static final Pattern URL = Pattern.compile(
            "(url\\(\\s*)(?:\"([^\"]*)\"|'([^']*)'|([^)\"'\\s]+))(\\s*\\))", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMPORT = Pattern.compile(
            "(@import\\s+)(?:\"([^\"]*)\"|'([^']*)')", Pattern.CASE_INSENSITIVE);

    private final Map<String, String> moves;

    /**
     * @param moves old entry path to new entry path
     */
    public ReferenceRewriter(Map<String, String> moves) {
        this.moves = Map.copyOf(moves);
    }

    /**
     * Rewrites {@code text} of the entry at {@code referrer}, which stays where it is
     * unless it is itself a key of the move map.
     *
     * @param markup true for XML documents, false for style sheets and other text
     * @return the rewritten text, or {@code text} itself when no token changed
     */
    public String rewrite(String referrer, String text, boolean markup) {
        String location = moves.getOrDefault(referrer, referrer);
        String result = text;
        if (markup) {
            result = replace(ATTRIBUTE, result, referrer, location, true);
        } else {
            result = replace(IMPORT, result, referrer, location, false);
        }
        return replace(URL, result, referrer, location, markup);
    }

    /**
     * New href for {@code href} written in {@code referrer}, or null when neither the
     * target nor the referrer moved.
     */
    String rewriteHref(String referrer, String location, String href) {
        String target = PackagePath.resolve(referrer, href);
        if (target == null) {
            return null;
        }
        String movedTarget = moves.get(target);
        if (movedTarget == null && location.equals(referrer)) {
            return null;
        }
        String newTarget = movedTarget == null ? target : movedTarget;
        return encode(PackagePath.relativize(location, newTarget)) + suffix(href);
    }

    private String replace(Pattern pattern, String text, String referrer, String location, boolean xml) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = null;
        int last = 0;
        while (m.find()) {
            int group = m.group(2) != null ? 2 : m.group(3) != null ? 3 : 4;
            String raw = m.group(group);
            String href = xml ? unescape(raw) : raw;
            String updated = rewriteHref(referrer, location, href);
            if (updated == null) {
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(text.length());
            }
            sb.append(text, last, m.start(group)).append(xml ? escape(updated) : updated);
            last = m.end(group);
        }
        if (sb == null) {
            return text;
        }
        return sb.append(text, last, text.length()).toString();
    }

    private static String suffix(String href) {
        int hash = href.indexOf('#');
        int query = href.indexOf('?');
        int cut = hash < 0 ? query : query < 0 ? hash : Math.min(hash, query);
        return cut < 0 ? "" : href.substring(cut).trim();
    }

    /**
     * Percent-encodes the characters an href cannot carry literally. Other non-ASCII
     * characters stay as they are, as IRIs allow.
     */
    static String encode(String path) {
        StringBuilder sb = new StringBuilder(path.length());
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            switch (c) {
                case ' ' -> sb.append("%20");
                case '%' -> sb.append("%25");
                case '#' -> sb.append("%23");
                case '?' -> sb.append("%3F");
                case '"' -> sb.append("%22");
                case '\'' -> sb.append("%27");
                case '(' -> sb.append("%28");
                case ')' -> sb.append("%29");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String unescape(String value) {
        if (value.indexOf('&') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            int semi = c == '&' ? value.indexOf(';', i) : -1;
            if (semi < 0) {
                sb.append(c);
                i++;
                continue;
            }
            String name = value.substring(i + 1, semi);
            String decoded = switch (name) {
                case "amp" -> "&";
                case "lt" -> "<";
                case "gt" -> ">";
                case "quot" -> "\"";
                case "apos" -> "'";
                default -> numeric(name);
            };
            if (decoded == null) {
                sb.append(c);
                i++;
            } else {
                sb.append(decoded);
                i = semi + 1;
            }
        }
        return sb.toString();
    }

    private static String numeric(String name) {
        if (!name.startsWith("#") || name.length() < 2) {
            return null;
        }
        try {
            int cp = name.charAt(1) == 'x' || name.charAt(1) == 'X'
                    ? Integer.parseInt(name.substring(2), 16)
                    : Integer.parseInt(name.substring(1));
            return new String(Character.toChars(cp));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace("\"", "&quot;");
    }
}
