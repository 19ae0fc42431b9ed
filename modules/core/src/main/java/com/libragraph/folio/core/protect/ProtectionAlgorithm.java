package com.libragraph.folio.core.protect;

public enum ProtectionAlgorithm {
    /** XOR with an MD5 keystream derived from key, salt and block counter. */
    BASIC("basic"),
    /** AES/CTR with a PBKDF2-derived key. */
    AES("aes"),
    /** IDPF font obfuscation, readable by any conforming reading system. */
    IDPF("idpf");

    private final String label;

    ProtectionAlgorithm(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ProtectionAlgorithm fromLabel(String label) {
        for (ProtectionAlgorithm a : values()) {
            if (a.label.equalsIgnoreCase(label.trim())) return a;
        }
        throw new IllegalArgumentException("Unknown protection algorithm: " + label);
    }
}
