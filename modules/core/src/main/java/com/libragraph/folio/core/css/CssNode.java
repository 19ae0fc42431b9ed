package com.libragraph.folio.core.css;

import java.util.List;

/**
 * Top-level or nested construct of a style sheet.
 */
public sealed interface CssNode {

    /** {@code a, b { ... }} */
    record StyleRule(List<String> selectors, List<Declaration> declarations) implements CssNode {
        public StyleRule {
            selectors = List.copyOf(selectors);
            declarations = List.copyOf(declarations);
        }
    }

    /** At-rule ending in a semicolon, e.g. {@code @import url(a.css)}; text excludes the semicolon. */
    record AtStatement(String text) implements CssNode {
    }

    /** Conditional group ({@code @media}, {@code @supports}) holding nested rules. */
    record GroupRule(String name, String prelude, List<CssNode> children) implements CssNode {
        public GroupRule {
            children = List.copyOf(children);
        }
    }

    /** At-rule whose block is a declaration list ({@code @font-face}, {@code @page}). */
    record DeclarationRule(String name, String prelude, List<Declaration> declarations) implements CssNode {
        public DeclarationRule {
            declarations = List.copyOf(declarations);
        }
    }

    /** Any other block at-rule, kept verbatim ({@code @keyframes}). */
    record RawRule(String name, String prelude, String body) implements CssNode {
    }
}
