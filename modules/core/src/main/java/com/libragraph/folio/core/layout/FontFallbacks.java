package com.libragraph.folio.core.layout;

import java.util.List;
import java.util.Locale;

/**
 * Locally installed faces that can stand in for common Chinese type classes on
 * e-reader platforms.
 */
final class FontFallbacks {

    private static final List<String> SONGTI = List.of(
            "宋体", "DK-SONGTI", "STSongti", "STSong", "Song S", "Songti", "Songti SC", "Songti TC");
    private static final List<String> KAITI = List.of(
            "楷体", "方正楷体", "方正楷体_GBK", "方正新楷体_GBK", "DK-KAITI", "STKaiti", "STKai",
            "MKai PRC", "Kaiti", "Kaiti SC", "Kaiti TC");
    private static final List<String> HEITI = List.of(
            "DK-XIHEITI", "黑体", "微软雅黑", "STHeiti", "STHei", "MYing Hei S", "Heiti", "Heiti SC", "Heiti TC");
    private static final List<String> FANGSONG = List.of(
            "DK-FANGSONG", "仿宋", "方正仿宋", "方正仿宋_GBK", "STKaiti", "STKai", "MKai PRC",
            "Kaiti", "Kaiti SC", "Kaiti TC");

    private FontFallbacks() {
    }

    /**
     * Fallback faces for a family name, or an empty list when the name matches no class.
     * The two-letter names {@code st}, {@code kt}, {@code ht} and {@code fs} are the
     * customary short names of the four classes.
     */
    static List<String> forFamily(String family) {
        String name = family.toLowerCase(Locale.ROOT);
        // fangsong names contain "song", so they are checked first
        if (name.equals("fs") || name.contains("fangsong") || name.contains("仿宋")) {
            return FANGSONG;
        }
        if (name.equals("st") || name.contains("song") || name.contains("宋")) {
            return SONGTI;
        }
        if (name.equals("kt") || name.contains("kai") || name.contains("楷")) {
            return KAITI;
        }
        if (name.equals("ht") || name.contains("hei") || name.contains("黑")) {
            return HEITI;
        }
        return List.of();
    }
}
