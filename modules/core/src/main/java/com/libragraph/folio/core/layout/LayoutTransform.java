package com.libragraph.folio.core.layout;

import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.filter.FilterFactory;
import com.libragraph.folio.core.filter.PackageFilter;
import com.libragraph.folio.core.filter.SimpleFilterFactory;
import com.libragraph.folio.core.opf.ManifestItem;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.markup.ParsedDocument;
import com.libragraph.folio.markup.SerializationMode;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.types.Namespaces;
import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;

/**
 * Adapts a package to a reading platform: tags every sentence with a tracking span,
 * turns {@code noteref} links into popup footnotes and generates the font sheet.
 *
 * <p>Options:
 * <ul>
 *   <li>{@code platform}: {@code generic} by default; see {@link LayoutPlatform}.</li>
 *   <li>{@code reorganize}: move manifest entries into the standard directories first
 *       ({@link StandardStructure}); {@code false} by default.</li>
 *   <li>{@code template}: frame every page in the standard page template
 *       ({@link PageTemplate}); {@code false} by default.</li>
 *   <li>{@code style-sheet}: generate and link {@code Styles/style.css}
 *       ({@link LayoutStyleSheet}); {@code false} by default.</li>
 * </ul>
 */
public class LayoutTransform implements PackageFilter {

    public static final String NAME = "layout";

    static final String FONT_SHEET = "Styles/fonts.css";
    static final String STYLE_SHEET = "Styles/style.css";
    static final String NOTE_ICON = "Images/note.png";

    private static final Logger log = Logger.getLogger(LayoutTransform.class);

    private final LayoutPlatform platform;
    private final boolean reorganize;
    private final boolean template;
    private final boolean styleSheet;

    public LayoutTransform(LayoutPlatform platform) {
        this(platform, false, false, false);
    }

    public LayoutTransform(LayoutPlatform platform, boolean reorganize, boolean template, boolean styleSheet) {
        this.platform = platform;
        this.reorganize = reorganize;
        this.template = template;
        this.styleSheet = styleSheet;
    }

    public static FilterFactory factory() {
        return new SimpleFilterFactory(NAME, LayoutTransform::fromOptions);
    }

    static LayoutTransform fromOptions(Map<String, String> options) {
        return new LayoutTransform(
                LayoutPlatform.fromLabel(options.getOrDefault("platform", "generic")),
                flag(options, "reorganize"),
                flag(options, "template"),
                flag(options, "style-sheet"));
    }

    private static boolean flag(Map<String, String> options, String name) {
        String value = options.getOrDefault(name, "false").trim().toLowerCase();
        if (!value.equals("true") && !value.equals("false")) {
            throw new IllegalArgumentException("Option " + name + " must be true or false: " + value);
        }
        return Boolean.parseBoolean(value);
    }

    public LayoutPlatform platform() {
        return platform;
    }

    public boolean reorganize() {
        return reorganize;
    }

    public boolean template() {
        return template;
    }

    public boolean styleSheet() {
        return styleSheet;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(FilterContext context) {
        int moved = reorganize ? StandardStructure.apply(context) : 0;
        PackageDocument opf = context.packageDocument();
        String sheetPath = opf.sibling(FONT_SHEET);
        String stylePath = opf.sibling(STYLE_SHEET);
        String iconPath = opf.sibling(NOTE_ICON);
        String navPath = opf.itemWithProperty("nav").map(ManifestItem::path).orElse(null);
        boolean opfChanged = false;

        Optional<String> fontSheet = FontSheet.build(context, sheetPath);
        if (fontSheet.isPresent()) {
            context.store().putText(sheetPath, fontSheet.get());
            if (opf.itemByPath(sheetPath).isEmpty()) {
                opf.addItem(sheetPath, MediaTypes.CSS);
                opfChanged = true;
            }
        }
        if (styleSheet) {
            context.store().putText(stylePath, LayoutStyleSheet.render(platform));
            if (opf.itemByPath(stylePath).isEmpty()) {
                opf.addItem(stylePath, MediaTypes.CSS);
                opfChanged = true;
            }
        }

        int footnotes = 0;
        int framed = 0;
        int spans = 0;
        for (String path : context.contentDocuments()) {
            if (path.equals(navPath)) {
                continue;
            }
            ParsedDocument parsed = context.cache().readXml(path);
            Document doc = parsed.document();
            footnotes += FootnoteRewriter.rewrite(doc, platform, PackagePath.relativize(path, iconPath));
            spans += TrackingSpans.apply(doc);
            if (fontSheet.isPresent()) {
                linkStyleSheet(doc, PackagePath.relativize(path, sheetPath));
            }
            if (styleSheet) {
                linkStyleSheet(doc, PackagePath.relativize(path, stylePath));
            }
            if (template && PageTemplate.apply(doc)) {
                framed++;
            }
            context.cache().writeXml(parsed, SerializationMode.MARKUP);
        }

        if (footnotes > 0 && platform.icon() == LayoutPlatform.NoteIcon.IMAGE) {
            if (!context.store().exists(iconPath)) {
                context.store().put(iconPath, noteIcon());
            }
            if (opf.itemByPath(iconPath).isEmpty()) {
                opf.addItem(iconPath, MediaTypes.PNG);
                opfChanged = true;
            }
        }
        opfChanged |= addPlatformMetadata(opf);
        if (opfChanged) {
            opf.save();
        }
        log.infof("Layout for %s: %d entries moved, %d footnotes, %d tracking spans, %d pages framed, font sheet %s",
                platform.label(), moved, footnotes, spans, framed, fontSheet.isPresent() ? sheetPath : "skipped");
    }

    private boolean addPlatformMetadata(PackageDocument opf) {
        String name = platform.metadataName();
        if (name == null) {
            return false;
        }
        for (Element meta : opf.metas()) {
            if (name.equals(Dom.attr(meta, "name"))) {
                return false;
            }
        }
        Element meta = opf.document().createElementNS(Namespaces.OPF, "meta");
        meta.setAttribute("name", name);
        meta.setAttribute("content", "true");
        opf.metadata().appendChild(meta);
        return true;
    }

    private static void linkStyleSheet(Document doc, String href) {
        Element html = doc.getDocumentElement();
        Element head = Dom.firstChild(html, Namespaces.XHTML, "head").orElse(null);
        if (head == null) {
            head = doc.createElementNS(Namespaces.XHTML, "head");
            html.insertBefore(head, html.getFirstChild());
        }
        for (Element link : Dom.children(head, Namespaces.XHTML, "link")) {
            if (href.equals(Dom.attr(link, "href"))) {
                return;
            }
        }
        Element link = doc.createElementNS(Namespaces.XHTML, "link");
        link.setAttribute("rel", "stylesheet");
        link.setAttribute("type", MediaTypes.CSS);
        link.setAttribute("href", href);
        head.appendChild(link);
    }

    static byte[] noteIcon() {
        try (InputStream in = LayoutTransform.class.getResourceAsStream("note.png")) {
            if (in == null) {
                throw new IllegalStateException("note.png missing from the classpath");
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
