package com.libragraph.folio.store;

import org.jboss.logging.Logger;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text of an entry together with the encoding it was stored in.
 *
 * <p>The encoding comes from a byte order mark, an XML declaration or a leading CSS
 * {@code @charset} rule, in that order, and defaults to UTF-8. {@link #encode} writes
 * new text back in the same encoding, so a rewritten entry keeps its declaration valid.
 */
public record EntryText(String text, Charset charset, boolean byteOrderMark) {

    private static final Logger log = Logger.getLogger(EntryText.class);

    private static final Pattern XML_ENCODING =
            Pattern.compile("^\\s*<\\?xml[^>]*encoding\\s*=\\s*[\"']([A-Za-z0-9._-]+)[\"']");
    private static final Pattern CSS_CHARSET =
            Pattern.compile("^@charset\\s+[\"']([A-Za-z0-9._-]+)[\"']\\s*;");

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] UTF16BE_BOM = {(byte) 0xFE, (byte) 0xFF};
    private static final byte[] UTF16LE_BOM = {(byte) 0xFF, (byte) 0xFE};

    public static EntryText decode(byte[] data) {
        if (startsWith(data, UTF8_BOM)) {
            return new EntryText(new String(data, 3, data.length - 3, StandardCharsets.UTF_8),
                    StandardCharsets.UTF_8, true);
        }
        if (startsWith(data, UTF16BE_BOM)) {
            return new EntryText(new String(data, 2, data.length - 2, StandardCharsets.UTF_16BE),
                    StandardCharsets.UTF_16BE, true);
        }
        if (startsWith(data, UTF16LE_BOM)) {
            return new EntryText(new String(data, 2, data.length - 2, StandardCharsets.UTF_16LE),
                    StandardCharsets.UTF_16LE, true);
        }
        Charset charset = declared(data);
        return new EntryText(new String(data, charset), charset, false);
    }

    /**
     * Encodes {@code newText} in this entry's encoding, with its byte order mark if it had one.
     */
    public byte[] encode(String newText) {
        byte[] body = newText.getBytes(charset);
        if (!byteOrderMark) {
            return body;
        }
        byte[] bom = charset.equals(StandardCharsets.UTF_8) ? UTF8_BOM
                : charset.equals(StandardCharsets.UTF_16BE) ? UTF16BE_BOM : UTF16LE_BOM;
        byte[] out = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, out, 0, bom.length);
        System.arraycopy(body, 0, out, bom.length, body.length);
        return out;
    }

    private static Charset declared(byte[] data) {
        String head = new String(data, 0, Math.min(200, data.length), StandardCharsets.ISO_8859_1);
        Matcher m = XML_ENCODING.matcher(head);
        if (!m.find()) {
            m = CSS_CHARSET.matcher(head);
            if (!m.find()) {
                return StandardCharsets.UTF_8;
            }
        }
        try {
            return Charset.forName(m.group(1));
        } catch (IllegalArgumentException e) {
            log.debugf("Unsupported declared encoding %s, reading as UTF-8", m.group(1));
            return StandardCharsets.UTF_8;
        }
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
