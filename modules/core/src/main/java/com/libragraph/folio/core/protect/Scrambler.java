package com.libragraph.folio.core.protect;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Byte transforms behind each {@link ProtectionAlgorithm}. Every transform is an
 * involution over the same parameters, so one method both scrambles and restores.
 */
final class Scrambler {

    static final int IDPF_PREFIX = 1040;

    private static final int PBKDF2_ROUNDS = 10_000;
    private static final int AES_KEY_BITS = 128;

    private Scrambler() {
    }

    /**
     * @param uniqueIdentifier package identifier; required by {@code idpf} only
     */
    static byte[] apply(ProtectionAlgorithm algorithm, String key, String salt, String path,
                        String uniqueIdentifier, byte[] data) {
        switch (algorithm) {
            case BASIC:
                return basic(key, salt, data);
            case AES:
                return aes(key, salt, path, data);
            case IDPF:
                return idpf(uniqueIdentifier, data);
            default:
                throw new IllegalArgumentException("Unsupported algorithm: " + algorithm);
        }
    }

    private static byte[] basic(String key, String salt, byte[] data) {
        byte[] prefix = (key + salt).getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[data.length];
        byte[] block = null;
        for (int i = 0; i < data.length; i++) {
            if (i % 16 == 0) {
                block = DigestUtils.md5(ByteBuffer.allocate(prefix.length + 4)
                        .put(prefix)
                        .putInt(i / 16)
                        .array());
            }
            out[i] = (byte) (data[i] ^ block[i % 16]);
        }
        return out;
    }

    private static byte[] aes(String key, String salt, String path, byte[] data) {
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            byte[] derived = factory.generateSecret(new PBEKeySpec(
                    key.toCharArray(), salt.getBytes(StandardCharsets.UTF_8), PBKDF2_ROUNDS, AES_KEY_BITS))
                    .getEncoded();
            byte[] iv = DigestUtils.md5((salt + path).getBytes(StandardCharsets.UTF_8));
            Cipher cipher = Cipher.getInstance("AES/CTR/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(derived, "AES"), new IvParameterSpec(iv));
            return cipher.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES/CTR unavailable", e);
        }
    }

    private static byte[] idpf(String uniqueIdentifier, byte[] data) {
        byte[] mask = idpfKey(uniqueIdentifier);
        byte[] out = data.clone();
        int limit = Math.min(IDPF_PREFIX, out.length);
        for (int i = 0; i < limit; i++) {
            out[i] ^= mask[i % mask.length];
        }
        return out;
    }

    static byte[] idpfKey(String uniqueIdentifier) {
        String stripped = uniqueIdentifier.replaceAll("[\\u0020\\u0009\\u000D\\u000A]", "");
        return DigestUtils.sha1(stripped.getBytes(StandardCharsets.UTF_8));
    }

    static String checksum(String key, String path, byte[] plaintext) {
        ByteArrayOutputStream message = new ByteArrayOutputStream(path.length() + 1 + plaintext.length);
        message.writeBytes(path.getBytes(StandardCharsets.UTF_8));
        message.write(0);
        message.writeBytes(plaintext);
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, key.getBytes(StandardCharsets.UTF_8))
                .hmacHex(message.toByteArray());
    }
}
