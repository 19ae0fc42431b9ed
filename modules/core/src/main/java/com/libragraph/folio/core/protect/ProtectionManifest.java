package com.libragraph.folio.core.protect;

import com.libragraph.folio.core.opf.ManifestInconsistentException;
import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.markup.MalformedMarkupException;
import com.libragraph.folio.markup.XmlCodec;
import com.libragraph.folio.store.PackageStore;
import org.w3c.dom.Element;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The {@code META-INF/folio-protection.xml} entry: the package salt and one
 * {@code entry} element per protected file, attributes in fixed order.
 */
public record ProtectionManifest(String salt, List<ProtectedEntry> entries) {

    public static final String PATH = "META-INF/folio-protection.xml";
    public static final String NAMESPACE = "urn:libragraph:folio:protection";
    static final String VERSION = "1";

    private static final XMLOutputFactory OUTPUTS = XMLOutputFactory.newFactory();

    public ProtectionManifest {
        entries = List.copyOf(entries);
    }

    public static Optional<ProtectionManifest> read(PackageStore store) {
        if (!store.exists(PATH)) {
            return Optional.empty();
        }
        return Optional.of(parse(store.get(PATH)));
    }

    /**
     * @throws ManifestInconsistentException if the document is unreadable or incomplete
     */
    static ProtectionManifest parse(byte[] data) {
        Element root;
        try {
            root = XmlCodec.parse(data, PATH).getDocumentElement();
        } catch (MalformedMarkupException e) {
            throw new ManifestInconsistentException("Unreadable protection manifest", PATH, e);
        }
        if (!Dom.matches(root, NAMESPACE, "protection")) {
            throw new ManifestInconsistentException("Not a protection manifest: " + root.getTagName(), PATH);
        }
        String salt = Dom.firstChild(root, NAMESPACE, "salt").map(Dom::text).orElse("");
        if (salt.isEmpty()) {
            throw new ManifestInconsistentException("Protection manifest has no salt", PATH);
        }
        List<ProtectedEntry> entries = new ArrayList<>();
        for (Element e : Dom.children(root, NAMESPACE, "entry")) {
            entries.add(parseEntry(e));
        }
        return new ProtectionManifest(salt, entries);
    }

    private static ProtectedEntry parseEntry(Element e) {
        String path = Dom.attr(e, "path");
        String obfuscated = Dom.attr(e, "obfuscated");
        String algorithm = Dom.attr(e, "algorithm");
        String size = Dom.attr(e, "size");
        String checksum = Dom.attr(e, "checksum");
        if (path == null || obfuscated == null || algorithm == null || size == null || checksum == null) {
            throw new ManifestInconsistentException("Incomplete protection entry", path != null ? path : PATH);
        }
        try {
            return new ProtectedEntry(path, obfuscated, ProtectionAlgorithm.fromLabel(algorithm),
                    Long.parseLong(size), checksum);
        } catch (IllegalArgumentException ex) {
            throw new ManifestInconsistentException("Invalid protection entry: " + ex.getMessage(), path, ex);
        }
    }

    public Optional<ProtectedEntry> entryFor(String path) {
        return entries.stream().filter(e -> e.path().equals(path)).findFirst();
    }

    public byte[] toBytes() {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = OUTPUTS.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeCharacters("\n");
            xml.writeStartElement("protection");
            xml.writeDefaultNamespace(NAMESPACE);
            xml.writeAttribute("version", VERSION);
            xml.writeCharacters("\n  ");
            xml.writeStartElement("salt");
            xml.writeCharacters(salt);
            xml.writeEndElement();
            for (ProtectedEntry entry : entries) {
                xml.writeCharacters("\n  ");
                xml.writeEmptyElement("entry");
                xml.writeAttribute("path", entry.path());
                xml.writeAttribute("obfuscated", entry.obfuscated());
                xml.writeAttribute("algorithm", entry.algorithm().label());
                xml.writeAttribute("size", Long.toString(entry.size()));
                xml.writeAttribute("checksum", entry.checksum());
            }
            xml.writeCharacters("\n");
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Cannot write protection manifest", e);
        }
        return (out + "\n").getBytes(StandardCharsets.UTF_8);
    }
}
