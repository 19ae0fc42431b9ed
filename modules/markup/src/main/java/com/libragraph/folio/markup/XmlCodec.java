package com.libragraph.folio.markup;

import com.libragraph.folio.store.EntryText;
import com.libragraph.folio.types.Namespaces;
import org.jboss.logging.Logger;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * Parses entry bytes into DOM trees and writes them back in a {@link SerializationMode}.
 *
 * <p>Parsing is namespace-aware, never loads external DTDs and accepts HTML named
 * character references. Output is always UTF-8.
 */
public final class XmlCodec {

    private static final Logger log = Logger.getLogger(XmlCodec.class);

    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    public static final String HTML_DOCTYPE = "<!DOCTYPE html>";

    private static final DocumentBuilderFactory BUILDERS = newBuilderFactory();
    private static final TransformerFactory TRANSFORMERS = newTransformerFactory();

    private XmlCodec() {
    }

    private static TransformerFactory newTransformerFactory() {
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        return factory;
    }

    private static DocumentBuilderFactory newBuilderFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(true);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support required features", e);
        }
        return factory;
    }

    /**
     * Parses entry bytes.
     *
     * @throws MalformedMarkupException if the bytes are not well-formed XML
     */
    public static Document parse(byte[] data, String path) {
        String text = HtmlEntities.toNumeric(decode(data));
        DocumentBuilder builder = newBuilder();
        builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
        builder.setErrorHandler(new ParseErrors(path));
        try {
            return builder.parse(new InputSource(new StringReader(text)));
        } catch (SAXException | IOException e) {
            throw new MalformedMarkupException(path, e);
        }
    }

    /**
     * Creates an empty namespace-aware document.
     */
    public static Document newDocument() {
        return newBuilder().newDocument();
    }

    /**
     * Serializes a document after checking that its root fits {@code mode}.
     *
     * @throws SerializationMismatchException if the root element does not match the mode
     */
    public static byte[] serialize(Document document, SerializationMode mode, String path) {
        Element root = document.getDocumentElement();
        checkRoot(root, mode, path);
        if (mode == SerializationMode.MARKUP) {
            declareEpubNamespace(root);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StringBuilder header = new StringBuilder(XML_DECLARATION).append('\n');
        if (mode == SerializationMode.MARKUP) {
            header.append(HTML_DOCTYPE).append('\n');
        }
        out.writeBytes(header.toString().getBytes(StandardCharsets.UTF_8));

        try {
            Transformer transformer = newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.transform(new DOMSource(root), new StreamResult(out));
        } catch (TransformerException e) {
            throw new SerializationMismatchException("Failed to serialize " + path + ": " + e.getMessage(), path, e);
        }
        out.write('\n');
        return out.toByteArray();
    }

    private static void checkRoot(Element root, SerializationMode mode, String path) {
        if (root == null) {
            throw new SerializationMismatchException("Document has no root element: " + path, path);
        }
        String expectedName;
        String expectedNs;
        switch (mode) {
            case PACKAGE -> {
                expectedName = "package";
                expectedNs = Namespaces.OPF;
            }
            case MARKUP -> {
                expectedName = "html";
                expectedNs = Namespaces.XHTML;
            }
            default -> {
                return;
            }
        }
        if (!expectedName.equals(root.getLocalName()) || !expectedNs.equals(root.getNamespaceURI())) {
            throw new SerializationMismatchException(
                    "Cannot write {" + root.getNamespaceURI() + "}" + root.getLocalName()
                            + " as " + mode + " (expected {" + expectedNs + "}" + expectedName + ")",
                    path);
        }
    }

    private static void declareEpubNamespace(Element root) {
        if (root.hasAttributeNS(Namespaces.XMLNS, "epub")) {
            return;
        }
        NodeList all = root.getElementsByTagNameNS("*", "*");
        for (int i = 0; i < all.getLength(); i++) {
            NamedNodeMap attrs = all.item(i).getAttributes();
            for (int j = 0; j < attrs.getLength(); j++) {
                Attr attr = (Attr) attrs.item(j);
                if (Namespaces.OPS.equals(attr.getNamespaceURI())) {
                    root.setAttributeNS(Namespaces.XMLNS, "xmlns:epub", Namespaces.OPS);
                    return;
                }
            }
        }
    }

    static String decode(byte[] data) {
        return EntryText.decode(data).text();
    }

    private static DocumentBuilder newBuilder() {
        synchronized (BUILDERS) {
            try {
                return BUILDERS.newDocumentBuilder();
            } catch (ParserConfigurationException e) {
                throw new IllegalStateException(e);
            }
        }
    }

    private static Transformer newTransformer() throws TransformerException {
        synchronized (TRANSFORMERS) {
            return TRANSFORMERS.newTransformer();
        }
    }

    private record ParseErrors(String path) implements ErrorHandler {

        @Override
        public void warning(SAXParseException e) {
            log.debugf("XML warning in %s line %d: %s", path, e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
