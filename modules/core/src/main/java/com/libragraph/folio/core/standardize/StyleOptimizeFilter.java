package com.libragraph.folio.core.standardize;

import com.libragraph.folio.core.css.CssNode;
import com.libragraph.folio.core.css.CssSheet;
import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.filter.FilterFactory;
import com.libragraph.folio.core.filter.PackageFilter;
import com.libragraph.folio.core.filter.SimpleFilterFactory;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.store.EntryText;
import org.jboss.logging.Logger;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites every style sheet in canonical form and drops rules that can never match.
 * A rule is dropped when each of its selectors names a class or id that no content
 * document uses.
 *
 * <p>Options: {@code remove-unused} ({@code true} by default).
 */
public class StyleOptimizeFilter implements PackageFilter {

    public static final String NAME = "style-optimize";

    private static final Logger log = Logger.getLogger(StyleOptimizeFilter.class);

    private static final Pattern REQUIRED_NAME =
            Pattern.compile("([.#])(-?[_a-zA-Z\\u00A0-\\uFFFF][-_a-zA-Z0-9\\u00A0-\\uFFFF]*)");
    private static final Pattern IGNORED_PARTS =
            Pattern.compile("\\[[^\\]]*\\]|\"[^\"]*\"|'[^']*'|\\([^)]*\\)");

    private final boolean removeUnused;

    public StyleOptimizeFilter(boolean removeUnused) {
        this.removeUnused = removeUnused;
    }

    public static FilterFactory factory() {
        return new SimpleFilterFactory(NAME, StyleOptimizeFilter::fromOptions);
    }

    static StyleOptimizeFilter fromOptions(Map<String, String> options) {
        String value = options.getOrDefault("remove-unused", "true").trim().toLowerCase();
        if (!value.equals("true") && !value.equals("false")) {
            throw new IllegalArgumentException("Option remove-unused must be true or false: " + value);
        }
        return new StyleOptimizeFilter(Boolean.parseBoolean(value));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(FilterContext context) {
        Set<String> classes = new HashSet<>();
        Set<String> ids = new HashSet<>();
        if (removeUnused) {
            for (String path : context.contentDocuments()) {
                collectNames(context.cache().readXml(path).root(), classes, ids);
            }
        }

        int rewritten = 0;
        for (String path : context.styleSheets()) {
            EntryText entry = EntryText.decode(context.store().get(path));
            String original = entry.text();
            List<CssNode> nodes = CssSheet.parse(original);
            if (removeUnused) {
                nodes = prune(nodes, classes, ids);
            }
            String optimized = CssSheet.write(nodes);
            if (!optimized.equals(original)) {
                context.store().put(path, entry.encode(optimized));
                rewritten++;
            }
        }
        log.infof("Optimized %d of %d style sheets in %s",
                rewritten, context.styleSheets().size(), context.store().description());
    }

    private static void collectNames(Element element, Set<String> classes, Set<String> ids) {
        String cls = Dom.attr(element, "class");
        if (cls != null) {
            for (String token : cls.trim().split("\\s+")) {
                if (!token.isEmpty()) {
                    classes.add(token);
                }
            }
        }
        String id = Dom.attr(element, "id");
        if (id != null) {
            ids.add(id.trim());
        }
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child) {
                collectNames(child, classes, ids);
            }
        }
    }

    static List<CssNode> prune(List<CssNode> nodes, Set<String> classes, Set<String> ids) {
        List<CssNode> kept = new ArrayList<>();
        for (CssNode node : nodes) {
            if (node instanceof CssNode.StyleRule rule) {
                if (rule.declarations().isEmpty()) {
                    continue;
                }
                if (rule.selectors().stream().allMatch(s -> isDead(s, classes, ids))) {
                    log.debugf("Dropped unused rule %s", rule.selectors());
                    continue;
                }
                kept.add(rule);
            } else if (node instanceof CssNode.GroupRule group) {
                List<CssNode> children = prune(group.children(), classes, ids);
                if (!children.isEmpty()) {
                    kept.add(new CssNode.GroupRule(group.name(), group.prelude(), children));
                }
            } else {
                kept.add(node);
            }
        }
        return kept;
    }

    /**
     * True if the selector requires a class or id that is used nowhere. Names inside
     * attribute selectors, strings and functional pseudo-classes are not requirements.
     */
    static boolean isDead(String selector, Set<String> classes, Set<String> ids) {
        Matcher m = REQUIRED_NAME.matcher(IGNORED_PARTS.matcher(selector).replaceAll(""));
        while (m.find()) {
            Set<String> used = m.group(1).equals(".") ? classes : ids;
            if (!used.contains(m.group(2))) {
                return true;
            }
        }
        return false;
    }
}
