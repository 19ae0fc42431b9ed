package com.libragraph.folio.core.protect;

import com.libragraph.folio.markup.Dom;
import com.libragraph.folio.markup.SerializationMode;
import com.libragraph.folio.markup.XmlCodec;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.types.Namespaces;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Collection;
import java.util.Set;

/**
 * Maintains the IDPF font obfuscation records in {@code META-INF/encryption.xml}.
 */
final class EncryptionDocument {

    static final String IDPF_ALGORITHM = "http://www.idpf.org/2008/embedding";

    private EncryptionDocument() {
    }

    /**
     * Renders the document with {@code uris} added, keeping existing records.
     */
    static byte[] withReferences(PackageStore store, Collection<String> uris) {
        Document doc = load(store);
        Element root = doc.getDocumentElement();
        for (String uri : uris) {
            Element data = doc.createElementNS(Namespaces.ENC, "enc:EncryptedData");
            Element method = doc.createElementNS(Namespaces.ENC, "enc:EncryptionMethod");
            method.setAttribute("Algorithm", IDPF_ALGORITHM);
            Element cipherData = doc.createElementNS(Namespaces.ENC, "enc:CipherData");
            Element reference = doc.createElementNS(Namespaces.ENC, "enc:CipherReference");
            reference.setAttribute("URI", uri);
            cipherData.appendChild(reference);
            data.appendChild(method);
            data.appendChild(cipherData);
            root.appendChild(data);
        }
        return XmlCodec.serialize(doc, SerializationMode.XML, MediaTypes.ENCRYPTION_ENTRY);
    }

    /**
     * Renders the document without records for {@code uris}, or returns null when no
     * record would remain.
     */
    static byte[] withoutReferences(PackageStore store, Set<String> uris) {
        Document doc = load(store);
        Element root = doc.getDocumentElement();
        for (Element data : Dom.children(root, Namespaces.ENC, "EncryptedData")) {
            for (Element reference : Dom.descendants(data, Namespaces.ENC, "CipherReference")) {
                if (uris.contains(Dom.attr(reference, "URI"))) {
                    Dom.remove(data);
                    break;
                }
            }
        }
        if (Dom.children(root).isEmpty()) {
            return null;
        }
        return XmlCodec.serialize(doc, SerializationMode.XML, MediaTypes.ENCRYPTION_ENTRY);
    }

    private static Document load(PackageStore store) {
        if (store.exists(MediaTypes.ENCRYPTION_ENTRY)) {
            return XmlCodec.parse(store.get(MediaTypes.ENCRYPTION_ENTRY), MediaTypes.ENCRYPTION_ENTRY);
        }
        Document doc = XmlCodec.newDocument();
        Element root = doc.createElementNS(Namespaces.CONTAINER, "encryption");
        root.setAttributeNS(Namespaces.XMLNS, "xmlns:enc", Namespaces.ENC);
        doc.appendChild(root);
        return doc;
    }
}
