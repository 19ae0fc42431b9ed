package com.libragraph.folio.types;

/**
 * XML namespace URIs used by package, navigation and markup documents.
 */
public final class Namespaces {

    public static final String OPF = "http://www.idpf.org/2007/opf";
    public static final String DC = "http://purl.org/dc/elements/1.1/";
    public static final String DCTERMS = "http://purl.org/dc/terms/";
    public static final String CONTAINER = "urn:oasis:names:tc:opendocument:xmlns:container";
    public static final String XHTML = "http://www.w3.org/1999/xhtml";
    public static final String OPS = "http://www.idpf.org/2007/ops";
    public static final String NCX = "http://www.daisy.org/z3986/2005/ncx/";
    public static final String XML = "http://www.w3.org/XML/1998/namespace";
    public static final String XMLNS = "http://www.w3.org/2000/xmlns/";
    public static final String ENC = "http://www.w3.org/2001/04/xmlenc#";

    private Namespaces() {
    }
}
