package com.libragraph.folio.core.layout;

import com.libragraph.folio.core.css.CssNode;
import com.libragraph.folio.core.css.CssSheet;
import com.libragraph.folio.core.css.Declaration;
import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.types.Namespaces;
import com.libragraph.folio.util.PackagePath;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@code @font-face} sheet for every font family the package references and
 * embeds.
 */
final class FontSheet {

    private static final Set<String> GENERIC_FAMILIES = Set.of(
            "serif", "sans-serif", "monospace", "cursive", "fantasy", "system-ui", "emoji",
            "math", "fangsong", "ui-serif", "ui-sans-serif", "ui-monospace", "ui-rounded",
            "inherit", "initial", "unset", "revert");

    private static final Set<String> FONT_EXTENSIONS = Set.of("ttf", "otf", "woff", "woff2");

    private static final Pattern URL = Pattern.compile("url\\(\\s*['\"]?([^'\")]+)['\"]?\\s*\\)");

    private final FilterContext context;
    private final String sheetPath;
    private final Set<String> families = new LinkedHashSet<>();
    private final Map<String, String> declaredFaces = new HashMap<>();

    private FontSheet(FilterContext context, String sheetPath) {
        this.context = context;
        this.sheetPath = sheetPath;
    }

    /**
     * Generates the sheet text, or empty when no referenced family has an embedded file.
     */
    static Optional<String> build(FilterContext context, String sheetPath) {
        FontSheet sheet = new FontSheet(context, sheetPath);
        sheet.scan();
        return sheet.render();
    }

    private void scan() {
        for (String path : context.styleSheets()) {
            if (!path.equals(sheetPath)) {
                collect(CssSheet.parse(context.store().getText(path)), path);
            }
        }
        for (String path : context.contentDocuments()) {
            Element root = context.cache().readXml(path).root();
            for (Element style : Dom.descendants(root, Namespaces.XHTML, "style")) {
                collect(CssSheet.parse(style.getTextContent()), path);
            }
            collectInline(root);
        }
    }

    private void collectInline(Element e) {
        String style = Dom.attr(e, "style");
        if (style != null) {
            collectDeclarations(CssSheet.parseDeclarations(style));
        }
        for (Element child : Dom.children(e)) {
            collectInline(child);
        }
    }

    private void collect(List<CssNode> nodes, String origin) {
        for (CssNode node : nodes) {
            if (node instanceof CssNode.StyleRule rule) {
                collectDeclarations(rule.declarations());
            } else if (node instanceof CssNode.GroupRule group) {
                collect(group.children(), origin);
            } else if (node instanceof CssNode.DeclarationRule rule && "font-face".equals(rule.name())) {
                recordFace(rule.declarations(), origin);
            }
        }
    }

    private void collectDeclarations(List<Declaration> declarations) {
        for (Declaration d : declarations) {
            if ("font-family".equals(d.property())) {
                for (String family : familyNames(d.value())) {
                    if (!GENERIC_FAMILIES.contains(family.toLowerCase(Locale.ROOT))) {
                        families.add(family);
                    }
                }
            }
        }
    }

    private void recordFace(List<Declaration> declarations, String origin) {
        String family = null;
        String source = null;
        for (Declaration d : declarations) {
            if ("font-family".equals(d.property())) {
                List<String> names = familyNames(d.value());
                family = names.isEmpty() ? null : names.get(0);
            } else if ("src".equals(d.property())) {
                Matcher m = URL.matcher(d.value());
                if (m.find()) {
                    source = PackagePath.resolve(origin, m.group(1).trim());
                }
            }
        }
        if (family != null && source != null && context.store().exists(source)) {
            declaredFaces.putIfAbsent(family.toLowerCase(Locale.ROOT), source);
        }
    }

    private Optional<String> render() {
        Map<String, String> filesByName = new HashMap<>();
        for (String path : context.store().list()) {
            if (FONT_EXTENSIONS.contains(PackagePath.extension(path))) {
                filesByName.putIfAbsent(PackagePath.baseName(path).toLowerCase(Locale.ROOT), path);
            }
        }

        List<CssNode> faces = new ArrayList<>();
        for (String family : families) {
            String key = family.toLowerCase(Locale.ROOT);
            String file = declaredFaces.getOrDefault(key, filesByName.get(key));
            if (file == null) {
                continue;
            }
            StringBuilder src = new StringBuilder()
                    .append("url(\"").append(PackagePath.relativize(sheetPath, file)).append("\")")
                    .append(", local(\"").append(family).append("\")");
            for (String fallback : FontFallbacks.forFamily(family)) {
                src.append(", local(\"").append(fallback).append("\")");
            }
            faces.add(new CssNode.DeclarationRule("font-face", "", List.of(
                    new Declaration("font-family", "\"" + family + "\""),
                    new Declaration("src", src.toString()))));
        }
        return faces.isEmpty() ? Optional.empty() : Optional.of(CssSheet.write(faces));
    }

    static List<String> familyNames(String value) {
        List<String> names = new ArrayList<>();
        for (String part : value.split(",")) {
            String name = part.replace("!important", "").trim();
            if (name.length() >= 2 && (name.startsWith("\"") || name.startsWith("'"))) {
                name = name.substring(1, name.length() - 1).trim();
            }
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
