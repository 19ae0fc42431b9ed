package com.libragraph.folio.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ContentHashTest {

    @Test
    void shouldHashContentDeterministically() {
        byte[] data = "chapter one".getBytes(StandardCharsets.UTF_8);

        ContentHash a = ContentHash.of(data);
        ContentHash b = ContentHash.of(data.clone());
        ContentHash c = ContentHash.of("chapter two".getBytes(StandardCharsets.UTF_8));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
        assertThat(a.toHex()).hasSize(32).isEqualTo(a.toString());
    }

    @Test
    void shouldHashEmptyEntries() {
        assertThat(ContentHash.of(new byte[0]).bytes()).hasSize(16);
    }

    @Test
    void shouldServeAsMapKey() {
        Map<ContentHash, String> byHash = Map.of(ContentHash.of(new byte[]{1, 2, 3}), "OEBPS/Fonts/kt.ttf");

        assertThat(byHash.get(ContentHash.of(new byte[]{1, 2, 3}))).isEqualTo("OEBPS/Fonts/kt.ttf");
    }

    @Test
    void shouldCopyBytesOnConstruction() {
        byte[] bytes = new byte[16];
        ContentHash hash = new ContentHash(bytes);

        bytes[0] = (byte) 0xFF;

        assertThat(hash.bytes()[0]).isZero();
    }

    @Test
    void shouldRejectDigestsOfWrongLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentHash(new byte[8]))
                .withMessageContaining("16 bytes");
    }
}
