package com.libragraph.folio.core.layout;

import com.libragraph.folio.core.css.CssNode;
import com.libragraph.folio.core.css.CssSheet;
import com.libragraph.folio.core.css.Declaration;

import java.util.ArrayList;
import java.util.List;

/**
 * The layout style sheet written next to the font sheet: heading, title-page and box
 * classes used by typeset books, and footnote presentation for the platform.
 */
final class LayoutStyleSheet {

    private LayoutStyleSheet() {
    }

    static String render(LayoutPlatform platform) {
        List<CssNode> rules = new ArrayList<>();
        rules.add(rule("h1",
                "text-indent", "0em",
                "font-weight", "normal",
                "line-height", "1.8"));
        rules.add(rule("h1.h1",
                "font-family", "\"ZY-KAITI\", \"kt\", serif",
                "color", "#2e5b60",
                "text-align", "left",
                "font-size", "1.3em",
                "margin", "-2em 0em 1.5em 0em"));
        rules.add(rule(".h1kt",
                "font-family", "\"ZY-KAITI\", \"kt\", serif",
                "font-size", "0.92em"));
        rules.add(rule("h1.h2",
                "font-family", "\"ZY-XIAOBIAOSONG\", \"h2\", serif",
                "font-size", "1.2em",
                "line-height", "1.8",
                "color", "#2e5b60",
                "margin-top", "47%",
                "padding-top", "1.3em",
                "padding-bottom", "1.25em",
                "text-align", "center",
                "background-color", "rgba(255,255,255,0.8)",
                "border-radius", "2px"));
        rules.add(rule("div.logo",
                "text-align", "right",
                "text-indent", "0em",
                "duokan-text-indent", "0em",
                "width", "70%",
                "margin", "0.5em -1em 0em auto",
                "duokan-bleed", "right"));
        rules.add(rule(".duokan-image-maintitle",
                "font-family", "\"ZY-KAITI\", \"kt\", serif",
                "font-size", "0.9em",
                "font-weight", "normal",
                "text-align", "center",
                "duokan-text-indent", "0em",
                "text-indent", "0em",
                "margin", "0.5em 0 0.5em 0",
                "color", "#412938"));
        rules.add(rule("div.red",
                "border", "solid 1px #a3adaf",
                "margin", "0.5em",
                "padding", "0.5em"));

        if (platform.noterefClass() != null) {
            rules.add(rule("a." + platform.noterefClass(),
                    "text-decoration", "none"));
        }
        if (platform.icon() == LayoutPlatform.NoteIcon.IMAGE) {
            rules.add(rule("." + FootnoteRewriter.ICON_CLASS + " img",
                    "width", "0.8em",
                    "vertical-align", "super"));
        }
        if (platform.asideClass() != null) {
            rules.add(rule("aside." + platform.asideClass(),
                    "font-size", "0.85em",
                    "text-indent", "0em"));
        }
        return CssSheet.write(rules);
    }

    private static CssNode rule(String selector, String... propertiesAndValues) {
        List<Declaration> declarations = new ArrayList<>();
        for (int i = 0; i < propertiesAndValues.length; i += 2) {
            declarations.add(new Declaration(propertiesAndValues[i], propertiesAndValues[i + 1]));
        }
        return new CssNode.StyleRule(List.of(selector), declarations);
    }
}
