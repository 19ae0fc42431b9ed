package com.libragraph.folio.types;

/**
 * Media types and well-known entry names of the EPUB container format.
 */
public final class MediaTypes {

    public static final String EPUB = "application/epub+zip";
    public static final String OPF = "application/oebps-package+xml";
    public static final String XHTML = "application/xhtml+xml";
    public static final String NCX = "application/x-dtbncx+xml";
    public static final String CSS = "text/css";
    public static final String SVG = "image/svg+xml";
    public static final String PNG = "image/png";
    public static final String OCTET_STREAM = "application/octet-stream";

    /** Name of the uncompressed MIME marker entry; always the first archive entry. */
    public static final String MIMETYPE_ENTRY = "mimetype";
    public static final String CONTAINER_ENTRY = "META-INF/container.xml";
    public static final String ENCRYPTION_ENTRY = "META-INF/encryption.xml";

    private MediaTypes() {
    }

    public static boolean isFont(String mediaType) {
        return mediaType != null && (mediaType.startsWith("font/")
                || mediaType.startsWith("application/font-")
                || mediaType.startsWith("application/x-font-")
                || mediaType.equals("application/vnd.ms-opentype"));
    }

    public static boolean isImage(String mediaType) {
        return mediaType != null && mediaType.startsWith("image/");
    }
}
