package com.libragraph.folio.core.protect;

/**
 * One mapping of the protection manifest.
 *
 * @param size     plaintext length in bytes
 * @param checksum HMAC-SHA256 hex of the path and plaintext under the protection key
 */
public record ProtectedEntry(String path, String obfuscated, ProtectionAlgorithm algorithm,
                             long size, String checksum) {
}
