package com.libragraph.folio;

import com.libragraph.folio.store.ArchivePackageStore;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * A small version 2 package written to disk for end-to-end runs.
 */
final class SampleBooks {

    static final String OPF = "OEBPS/content.opf";
    static final String CHAPTER = "OEBPS/Text/ch1.xhtml";
    static final String FONT = "OEBPS/Fonts/kt.ttf";

    private SampleBooks() {
    }

    static ArchivePackageStore store() {
        ArchivePackageStore store = ArchivePackageStore.empty();
        store.putText("mimetype", "application/epub+zip");
        store.putText("META-INF/container.xml", """
                <?xml version="1.0" encoding="UTF-8"?>
                <container version="1.0" xmlns="urn:oasis:names:tc:opendocument:xmlns:container">
                  <rootfiles>
                    <rootfile full-path="OEBPS/content.opf" media-type="application/oebps-package+xml"/>
                  </rootfiles>
                </container>
                """);
        store.putText(OPF, """
                <?xml version="1.0" encoding="UTF-8"?>
                <package xmlns="http://www.idpf.org/2007/opf" version="2.0" unique-identifier="bookid">
                  <metadata xmlns:dc="http://purl.org/dc/elements/1.1/">
                    <dc:title>Sample</dc:title>
                    <dc:language>en</dc:language>
                    <dc:identifier id="bookid">urn:isbn:9780000000002</dc:identifier>
                  </metadata>
                  <manifest>
                    <item id="css" href="Styles/main.css" media-type="text/css"/>
                    <item id="ch1" href="Text/ch1.xhtml" media-type="application/xhtml+xml"/>
                    <item id="font" href="Fonts/kt.ttf" media-type="application/x-font-truetype"/>
                  </manifest>
                  <spine><itemref idref="ch1"/></spine>
                </package>
                """);
        store.putText("OEBPS/Styles/main.css", "body { font-family: \"kt\"; }\n.gone { color: red; }\n");
        store.putText(CHAPTER, """
                <?xml version="1.0" encoding="UTF-8"?>
                <html xmlns="http://www.w3.org/1999/xhtml">
                <head><title>One</title><link rel="stylesheet" type="text/css" href="../Styles/main.css"/></head>
                <body><h1>One</h1><p>Hello there. Bye.</p></body>
                </html>
                """);
        byte[] font = new byte[64];
        Arrays.fill(font, (byte) 0x2A);
        store.put(FONT, font);
        return store;
    }

    static Path write(Path target) {
        store().exportArchive(target);
        return target;
    }
}
