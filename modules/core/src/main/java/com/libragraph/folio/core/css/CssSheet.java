package com.libragraph.folio.core.css;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tolerant style sheet tokenizer and canonical writer. Comments are dropped; text
 * that is not a rule is skipped.
 */
public final class CssSheet {

    private static final Set<String> GROUP_RULES = Set.of("media", "supports", "document", "layer");
    private static final Set<String> DECLARATION_RULES = Set.of("font-face", "page", "viewport");

    private CssSheet() {
    }

    public static List<CssNode> parse(String css) {
        return parseRules(stripComments(css));
    }

    /**
     * Parses a declaration block body or a {@code style} attribute. A property declared
     * more than once keeps its last value, at the position of its last occurrence.
     */
    public static List<Declaration> parseDeclarations(String body) {
        Map<String, Declaration> byProperty = new LinkedHashMap<>();
        for (String part : split(stripComments(body), ';')) {
            int colon = part.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String property = part.substring(0, colon).trim().toLowerCase();
            String value = collapse(part.substring(colon + 1));
            if (property.isEmpty() || value.isEmpty()) {
                continue;
            }
            byProperty.remove(property);
            byProperty.put(property, new Declaration(property, value));
        }
        return new ArrayList<>(byProperty.values());
    }

    public static String write(List<CssNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (CssNode node : nodes) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            write(node, sb);
        }
        return sb.toString();
    }

    private static void write(CssNode node, StringBuilder sb) {
        if (node instanceof CssNode.StyleRule rule) {
            sb.append(String.join(", ", rule.selectors())).append(" {\n");
            appendDeclarations(rule.declarations(), sb);
            sb.append("}\n");
        } else if (node instanceof CssNode.AtStatement statement) {
            sb.append(statement.text()).append(";\n");
        } else if (node instanceof CssNode.GroupRule group) {
            sb.append(header(group.name(), group.prelude())).append(" {\n");
            for (String line : write(group.children()).split("\n")) {
                sb.append(line.isEmpty() ? "" : "  " + line).append('\n');
            }
            sb.append("}\n");
        } else if (node instanceof CssNode.DeclarationRule rule) {
            sb.append(header(rule.name(), rule.prelude())).append(" {\n");
            appendDeclarations(rule.declarations(), sb);
            sb.append("}\n");
        } else if (node instanceof CssNode.RawRule raw) {
            sb.append(header(raw.name(), raw.prelude())).append(" {").append(raw.body()).append("}\n");
        }
    }

    private static String header(String name, String prelude) {
        return prelude.isEmpty() ? "@" + name : "@" + name + " " + prelude;
    }

    private static void appendDeclarations(List<Declaration> declarations, StringBuilder sb) {
        for (Declaration d : declarations) {
            sb.append("  ").append(d).append('\n');
        }
    }

    /**
     * Splits a selector list at top-level commas.
     */
    public static List<String> selectors(String selectorText) {
        List<String> result = new ArrayList<>();
        for (String s : split(selectorText, ',')) {
            String c = collapse(s);
            if (!c.isEmpty()) {
                result.add(c);
            }
        }
        return result;
    }

    private static List<CssNode> parseRules(String s) {
        List<CssNode> nodes = new ArrayList<>();
        int i = 0;
        int len = s.length();
        while (i < len) {
            while (i < len && Character.isWhitespace(s.charAt(i))) {
                i++;
            }
            if (i >= len) {
                break;
            }
            if (s.charAt(i) == '@') {
                int nameEnd = i + 1;
                while (nameEnd < len && (Character.isLetterOrDigit(s.charAt(nameEnd)) || s.charAt(nameEnd) == '-')) {
                    nameEnd++;
                }
                String name = s.substring(i + 1, nameEnd).toLowerCase();
                int stop = scan(s, nameEnd, ";{");
                if (stop >= len || s.charAt(stop) == ';') {
                    String text = collapse(s.substring(i, Math.min(stop, len)));
                    if (!text.isEmpty()) {
                        nodes.add(new CssNode.AtStatement(text));
                    }
                    i = stop + 1;
                    continue;
                }
                int close = matchingBrace(s, stop);
                String prelude = collapse(s.substring(nameEnd, stop));
                String body = s.substring(stop + 1, Math.min(close, len));
                if (GROUP_RULES.contains(name)) {
                    nodes.add(new CssNode.GroupRule(name, prelude, parseRules(body)));
                } else if (DECLARATION_RULES.contains(name)) {
                    nodes.add(new CssNode.DeclarationRule(name, prelude, parseDeclarations(body)));
                } else {
                    nodes.add(new CssNode.RawRule(name, prelude, body));
                }
                i = close + 1;
                continue;
            }
            int open = scan(s, i, "{}");
            if (open >= len) {
                break;
            }
            if (s.charAt(open) == '}') {
                i = open + 1;
                continue;
            }
            int close = matchingBrace(s, open);
            List<String> selectors = selectors(s.substring(i, open));
            List<Declaration> declarations = parseDeclarations(s.substring(open + 1, Math.min(close, len)));
            if (!selectors.isEmpty()) {
                nodes.add(new CssNode.StyleRule(selectors, declarations));
            }
            i = close + 1;
        }
        return nodes;
    }

    /**
     * Index of the first of {@code stops} at parenthesis depth 0 outside strings, or
     * {@code s.length()}.
     */
    private static int scan(String s, int from, String stops) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && stops.indexOf(c) >= 0) {
                return i;
            }
        }
        return s.length();
    }

    private static int matchingBrace(String s, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
        }
        return s.length();
    }

    private static List<String> split(String s, char separator) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (c == separator && depth == 0) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    static String stripComments(String css) {
        StringBuilder sb = new StringBuilder(css.length());
        char quote = 0;
        for (int i = 0; i < css.length(); i++) {
            char c = css.charAt(i);
            if (quote != 0) {
                sb.append(c);
                if (c == '\\' && i + 1 < css.length()) {
                    sb.append(css.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                sb.append(c);
            } else if (c == '/' && i + 1 < css.length() && css.charAt(i + 1) == '*') {
                int end = css.indexOf("*/", i + 2);
                i = end < 0 ? css.length() : end + 1;
                sb.append(' ');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String collapse(String s) {
        return s.replaceAll("\\s+", " ").trim();
    }
}
