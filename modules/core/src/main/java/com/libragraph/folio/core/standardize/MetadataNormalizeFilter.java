package com.libragraph.folio.core.standardize;

import com.libragraph.folio.core.filter.FilterContext;
import com.libragraph.folio.core.filter.FilterFactory;
import com.libragraph.folio.core.filter.PackageFilter;
import com.libragraph.folio.core.filter.SimpleFilterFactory;
import com.libragraph.folio.core.opf.ManifestItem;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.types.Namespaces;
import org.jboss.logging.Logger;
import org.w3c.dom.Element;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Canonicalizes descriptive metadata: whitespace, empty and duplicate fields, language
 * tags, a missing title or language, and the unique identifier reference.
 *
 * <p>Options: {@code default-language} (BCP 47 tag used when the package declares none,
 * default {@code und}).
 */
public class MetadataNormalizeFilter implements PackageFilter {

    public static final String NAME = "metadata-normalize";
    public static final String OPTION_DEFAULT_LANGUAGE = "default-language";

    private static final Logger log = Logger.getLogger(MetadataNormalizeFilter.class);

    private final String defaultLanguage;

    public MetadataNormalizeFilter(String defaultLanguage) {
        this.defaultLanguage = canonicalLanguage(defaultLanguage);
    }

    public static FilterFactory factory() {
        return new SimpleFilterFactory(NAME, MetadataNormalizeFilter::fromOptions);
    }

    static MetadataNormalizeFilter fromOptions(Map<String, String> options) {
        String language = options.getOrDefault(OPTION_DEFAULT_LANGUAGE, "und");
        if (language.isBlank()) {
            throw new IllegalArgumentException("Option " + OPTION_DEFAULT_LANGUAGE + " cannot be blank");
        }
        return new MetadataNormalizeFilter(language);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void apply(FilterContext context) {
        PackageDocument opf = context.packageDocument();
        String before = serializedMetadata(opf);

        normalizeFields(opf);
        normalizeLanguages(opf);
        ensureTitle(context, opf);
        repairUniqueIdentifier(opf);

        if (!serializedMetadata(opf).equals(before)) {
            opf.save();
            log.infof("Normalized metadata of %s", context.store().description());
        }
    }

    private static String serializedMetadata(PackageDocument opf) {
        StringBuilder sb = new StringBuilder(Dom.attr(opf.root(), "unique-identifier") + "|");
        for (Element e : Dom.children(opf.metadata())) {
            sb.append(e.getLocalName()).append('=').append(e.getTextContent());
            if (e.hasAttribute("id")) {
                sb.append('#').append(e.getAttribute("id"));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private void normalizeFields(PackageDocument opf) {
        Set<String> seen = new HashSet<>();
        for (Element field : Dom.children(opf.metadata())) {
            if (!Namespaces.DC.equals(field.getNamespaceURI()) || !Dom.children(field).isEmpty()) {
                continue;
            }
            String text = Dom.text(field);
            if (text.isEmpty()) {
                Dom.remove(field);
                continue;
            }
            if (!text.equals(field.getTextContent())) {
                field.setTextContent(text);
            }
            String key = field.getLocalName() + '\u0000' + text;
            if (!seen.add(key) && !field.hasAttribute("id")) {
                Dom.remove(field);
            }
        }
    }

    private void normalizeLanguages(PackageDocument opf) {
        List<Element> languages = opf.dc("language");
        for (Element language : languages) {
            String canonical = canonicalLanguage(Dom.text(language));
            if (!canonical.equals(language.getTextContent())) {
                language.setTextContent(canonical);
            }
        }
        if (languages.isEmpty()) {
            opf.addDc("language", defaultLanguage);
        }
    }

    /**
     * BCP 47 form of a language tag ({@code zh_cn} → {@code zh-CN}); tags Java cannot
     * parse are returned trimmed.
     */
    static String canonicalLanguage(String tag) {
        String trimmed = tag.trim();
        String canonical = Locale.forLanguageTag(trimmed.replace('_', '-')).toLanguageTag();
        return canonical.equals("und") && !trimmed.equalsIgnoreCase("und") ? trimmed : canonical;
    }

    private void ensureTitle(FilterContext context, PackageDocument opf) {
        if (opf.title().isPresent()) {
            return;
        }
        String title = opf.spineItems().stream()
                .filter(i -> i.path() != null && MediaTypes.XHTML.equals(i.mediaType()))
                .filter(i -> context.store().exists(i.path()))
                .findFirst()
                .map(i -> VersionUpgradeFilter.documentTitle(context.cache(), i.path()))
                .orElse("Untitled");
        opf.addDc("title", title);
    }

    private void repairUniqueIdentifier(PackageDocument opf) {
        String ref = Dom.attr(opf.root(), "unique-identifier");
        List<Element> identifiers = opf.dc("identifier");
        if (ref != null && identifiers.stream().anyMatch(e -> ref.equals(Dom.attr(e, "id")))) {
            return;
        }

        Optional<Element> withId = identifiers.stream().filter(e -> e.hasAttribute("id")).findFirst();
        Element target;
        if (withId.isPresent()) {
            target = withId.get();
        } else if (!identifiers.isEmpty()) {
            target = identifiers.get(0);
            target.setAttribute("id", opf.uniqueId("BookId"));
        } else {
            target = opf.addDc("identifier", generatedIdentifier(opf));
            target.setAttribute("id", opf.uniqueId("BookId"));
        }
        opf.root().setAttribute("unique-identifier", target.getAttribute("id"));
    }

    /**
     * Name-based UUID over the title and the manifest, so reruns produce the same value.
     */
    private static String generatedIdentifier(PackageDocument opf) {
        StringBuilder seed = new StringBuilder(opf.title().orElse(""));
        for (ManifestItem item : opf.items()) {
            seed.append('\n').append(item.path());
        }
        return "urn:uuid:" + UUID.nameUUIDFromBytes(seed.toString().getBytes(StandardCharsets.UTF_8));
    }
}
