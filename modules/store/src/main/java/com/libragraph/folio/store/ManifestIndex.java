package com.libragraph.folio.store;

import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.types.Namespaces;
import com.libragraph.folio.util.PackagePath;
import org.jboss.logging.Logger;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Streams the container and package documents to find the reading order of a package.
 * Only the attributes needed for ordering are read; nothing is kept beyond the result.
 */
public final class ManifestIndex {

    private static final Logger log = Logger.getLogger(ManifestIndex.class);

    private static final XMLInputFactory FACTORY = newFactory();

    private ManifestIndex() {
    }

    private static XMLInputFactory newFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        return factory;
    }

    /**
     * Path of the package document named by the first {@code rootfile} of
     * {@code META-INF/container.xml}, if the container document exists and is readable.
     */
    public static Optional<String> packageDocumentPath(PackageStore store) {
        if (!store.exists(MediaTypes.CONTAINER_ENTRY)) {
            return Optional.empty();
        }
        try {
            return rootfile(store.get(MediaTypes.CONTAINER_ENTRY));
        } catch (XMLStreamException e) {
            log.debugf("Unreadable container document in %s: %s", store.description(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Manifest-referenced entry paths: spine items in reading order, then the remaining
     * manifest items in listing order. Empty when there is no readable package document.
     * Paths are resolved against the package document but not checked for existence.
     */
    public static List<String> readingOrder(PackageStore store) {
        Optional<String> opf = packageDocumentPath(store);
        if (opf.isEmpty() || !store.exists(opf.get())) {
            return List.of();
        }
        try {
            return readingOrder(opf.get(), store::get);
        } catch (XMLStreamException e) {
            log.debugf("Unreadable package document %s in %s: %s",
                    opf.get(), store.description(), e.getMessage());
            return List.of();
        }
    }

    static List<String> readingOrder(String opfPath, Function<String, byte[]> reader)
            throws XMLStreamException {
        Map<String, String> hrefsById = new HashMap<>();
        List<String> manifestOrder = new ArrayList<>();
        List<String> spineOrder = new ArrayList<>();

        XMLStreamReader xml = FACTORY.createXMLStreamReader(new ByteArrayInputStream(reader.apply(opfPath)));
        try {
            while (xml.hasNext()) {
                if (xml.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                String local = xml.getLocalName();
                if (local.equals("item")) {
                    String id = xml.getAttributeValue(null, "id");
                    String href = PackagePath.resolve(opfPath, xml.getAttributeValue(null, "href"));
                    if (href != null) {
                        manifestOrder.add(href);
                        if (id != null) {
                            hrefsById.putIfAbsent(id, href);
                        }
                    }
                } else if (local.equals("itemref")) {
                    String idref = xml.getAttributeValue(null, "idref");
                    if (idref != null) {
                        spineOrder.add(idref);
                    }
                }
            }
        } finally {
            xml.close();
        }

        LinkedHashSet<String> order = new LinkedHashSet<>();
        for (String idref : spineOrder) {
            String href = hrefsById.get(idref);
            if (href != null) {
                order.add(href);
            }
        }
        order.addAll(manifestOrder);
        return new ArrayList<>(order);
    }

    private static Optional<String> rootfile(byte[] containerXml) throws XMLStreamException {
        XMLStreamReader xml = FACTORY.createXMLStreamReader(new ByteArrayInputStream(containerXml));
        try {
            while (xml.hasNext()) {
                if (xml.next() == XMLStreamConstants.START_ELEMENT
                        && xml.getLocalName().equals("rootfile")
                        && (xml.getNamespaceURI() == null || xml.getNamespaceURI().isEmpty()
                        || Namespaces.CONTAINER.equals(xml.getNamespaceURI()))) {
                    String fullPath = xml.getAttributeValue(null, "full-path");
                    if (fullPath != null && PackagePath.isValid(fullPath.trim())) {
                        return Optional.of(PackagePath.normalize(fullPath.trim()));
                    }
                }
            }
            return Optional.empty();
        } finally {
            xml.close();
        }
    }
}
