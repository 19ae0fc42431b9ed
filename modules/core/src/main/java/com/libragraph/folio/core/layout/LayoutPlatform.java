package com.libragraph.folio.core.layout;

/**
 * Reading-system profiles. Profiles differ only in footnote markup and package
 * metadata; text tracking is the same everywhere.
 */
public enum LayoutPlatform {
    GENERIC("generic", "footnote-ref", "footnote", NoteIcon.SUPERSCRIPT, null),
    DUOKAN("duokan", "duokan-footnote", "duokan-footnote-content", NoteIcon.IMAGE, "duokan-body-font"),
    ZHANGYUE("zhangyue", "zhangyue-footnote", "zhangyue-footnote-content", NoteIcon.IMAGE, "zhangyue-popup-footnote"),
    KINDLE("kindle", null, null, NoteIcon.BARE, null);

    /** What the footnote anchor holds. */
    public enum NoteIcon {
        /** {@code <span class="note-icon"><sup>n</sup></span>} */
        SUPERSCRIPT,
        /** {@code <span class="note-icon"><img src="note.png"/></span>} */
        IMAGE,
        /** {@code <sup>n</sup>} with no popup icon. */
        BARE
    }

    private final String label;
    private final String noterefClass;
    private final String asideClass;
    private final NoteIcon icon;
    private final String metadataName;

    LayoutPlatform(String label, String noterefClass, String asideClass, NoteIcon icon, String metadataName) {
        this.label = label;
        this.noterefClass = noterefClass;
        this.asideClass = asideClass;
        this.icon = icon;
        this.metadataName = metadataName;
    }

    public String label() {
        return label;
    }

    /** Class added to footnote anchors, or null. */
    public String noterefClass() {
        return noterefClass;
    }

    /** Class added to footnote asides, or null. */
    public String asideClass() {
        return asideClass;
    }

    public NoteIcon icon() {
        return icon;
    }

    /** Name of the {@code meta} element this platform expects in the package metadata, or null. */
    public String metadataName() {
        return metadataName;
    }

    public static LayoutPlatform fromLabel(String label) {
        for (LayoutPlatform p : values()) {
            if (p.label.equalsIgnoreCase(label.trim())) return p;
        }
        throw new IllegalArgumentException("Unknown layout platform: " + label);
    }
}
