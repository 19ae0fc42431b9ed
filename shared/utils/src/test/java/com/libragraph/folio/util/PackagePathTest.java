package com.libragraph.folio.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PackagePathTest {

    @Test
    void normalizeConvertsBackslashes() {
        assertThat(PackagePath.normalize("OEBPS\\Text\\ch1.xhtml")).isEqualTo("OEBPS/Text/ch1.xhtml");
    }

    @Test
    void normalizeRejectsDotSegmentsAndAbsolutePaths() {
        assertThatIllegalArgumentException().isThrownBy(() -> PackagePath.normalize("../evil"));
        assertThatIllegalArgumentException().isThrownBy(() -> PackagePath.normalize("a/./b"));
        assertThatIllegalArgumentException().isThrownBy(() -> PackagePath.normalize("/abs"));
        assertThatIllegalArgumentException().isThrownBy(() -> PackagePath.normalize("a//b"));
        assertThatIllegalArgumentException().isThrownBy(() -> PackagePath.normalize(""));
        assertThat(PackagePath.isValid("a/b.css")).isTrue();
        assertThat(PackagePath.isValid("a/")).isFalse();
    }

    @Test
    void nameParts() {
        assertThat(PackagePath.parent("OEBPS/Text/ch1.xhtml")).isEqualTo("OEBPS/Text/");
        assertThat(PackagePath.parent("mimetype")).isEmpty();
        assertThat(PackagePath.fileName("OEBPS/Text/ch1.xhtml")).isEqualTo("ch1.xhtml");
        assertThat(PackagePath.extension("fonts/A.TTF")).isEqualTo("ttf");
        assertThat(PackagePath.extension("mimetype")).isEmpty();
        assertThat(PackagePath.baseName("fonts/kt.ttf")).isEqualTo("kt");
    }

    @Test
    void resolveAgainstReferrer() {
        assertThat(PackagePath.resolve("OEBPS/Text/ch1.xhtml", "../Images/a%20b.png#x"))
                .isEqualTo("OEBPS/Images/a b.png");
        assertThat(PackagePath.resolve("OEBPS/content.opf", "Text/ch1.xhtml"))
                .isEqualTo("OEBPS/Text/ch1.xhtml");
        assertThat(PackagePath.resolve("content.opf", "./c+d.css")).isEqualTo("c+d.css");
    }

    @Test
    void resolveIgnoresExternalAndEscapingHrefs() {
        assertThat(PackagePath.resolve("a.xhtml", "#note1")).isNull();
        assertThat(PackagePath.resolve("a.xhtml", "https://example.com/x")).isNull();
        assertThat(PackagePath.resolve("a.xhtml", "../outside.xhtml")).isNull();
    }

    @Test
    void relativizeBetweenEntries() {
        assertThat(PackagePath.relativize("OEBPS/Text/ch1.xhtml", "OEBPS/Images/p.png"))
                .isEqualTo("../Images/p.png");
        assertThat(PackagePath.relativize("OEBPS/content.opf", "OEBPS/Text/ch1.xhtml"))
                .isEqualTo("Text/ch1.xhtml");
        assertThat(PackagePath.relativize("content.opf", "fonts/a.ttf")).isEqualTo("fonts/a.ttf");
        assertThat(PackagePath.relativize("a/b/c.xhtml", "d.css")).isEqualTo("../../d.css");
    }

    @Test
    void resolveInvertsRelativize() {
        String from = "OEBPS/Text/sub/ch2.xhtml";
        String to = "OEBPS/Styles/main.css";
        assertThat(PackagePath.resolve(from, PackagePath.relativize(from, to))).isEqualTo(to);
    }
}
