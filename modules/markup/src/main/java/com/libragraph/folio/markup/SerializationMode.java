package com.libragraph.folio.markup;

/**
 * How a parsed document is written back.
 */
public enum SerializationMode {
    /** Package document: XML declaration, root {@code package} in the OPF namespace. */
    PACKAGE,
    /** Content document: XML declaration, HTML5 doctype, root {@code html} in the XHTML namespace. */
    MARKUP,
    /** Any other well-formed XML (navigation, container, encryption); XML declaration only. */
    XML
}
