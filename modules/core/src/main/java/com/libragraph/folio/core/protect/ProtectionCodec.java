package com.libragraph.folio.core.protect;

import com.libragraph.folio.core.opf.ManifestInconsistentException;
import com.libragraph.folio.core.opf.PackageDocument;
import com.libragraph.folio.core.opf.ReferenceRewriter;
import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.EntryText;
import com.libragraph.folio.store.MediaTypeResolver;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.types.EntryKind;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.util.PackagePath;
import org.apache.commons.codec.digest.DigestUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reversible protection of selected package entries.
 *
 * <p>{@link #protect} moves every selected entry to an obfuscated path, scrambles its
 * bytes and records the mapping in {@link ProtectionManifest}; {@link #unprotect} is the
 * exact inverse. References to moved entries in the package document and in every
 * other markup or text entry follow the move. Both directions compute every change
 * and run every check before the first write, so a failed call leaves the store as
 * it found it.
 */
public class ProtectionCodec {

    private static final Logger log = Logger.getLogger(ProtectionCodec.class);

    private final ProtectionOptions options;

    public ProtectionCodec(ProtectionOptions options) {
        this.options = options;
    }

    public ProtectionOptions options() {
        return options;
    }

    /**
     * Protects every selected entry not yet protected.
     *
     * @throws AuthenticationFailureException if the package already holds entries
     *                                        protected under another key
     * @throws ManifestInconsistentException  if an obfuscated path is taken, or the
     *                                        {@code idpf} algorithm has no package identifier
     */
    public ProtectionResult protect(PackageStore store, String key) {
        requireKey(key);
        Optional<ProtectionManifest> existing = ProtectionManifest.read(store);
        existing.ifPresent(manifest -> verifyExisting(store, manifest, key));

        String packageDocument = PackageDocument.locate(store).orElse(null);
        String uid = uniqueIdentifier(store, packageDocument);
        String salt = existing.map(ProtectionManifest::salt).orElseGet(() -> computeSalt(store, uid));
        Set<String> alreadyProtected = new HashSet<>();
        existing.ifPresent(m -> m.entries().forEach(e -> alreadyProtected.add(e.obfuscated())));

        List<String> selected = new ArrayList<>();
        for (String path : store.list()) {
            if (!isProtectable(path, packageDocument) || alreadyProtected.contains(path)) {
                continue;
            }
            if (options.selects(path)) {
                selected.add(path);
            }
        }
        if (selected.isEmpty()) {
            log.infof("Nothing to protect in %s", store.description());
            return ProtectionResult.none();
        }
        if (options.algorithm() == ProtectionAlgorithm.IDPF && uid == null) {
            throw new ManifestInconsistentException(
                    "Algorithm idpf needs a package unique identifier", packageDocument);
        }

        Map<String, String> moves = new LinkedHashMap<>();
        for (String path : selected) {
            String obfuscated = obfuscatedPath(salt, path);
            if (store.exists(obfuscated) || moves.containsValue(obfuscated)) {
                throw new ManifestInconsistentException("Obfuscated path already taken", obfuscated);
            }
            moves.put(path, obfuscated);
        }

        Map<String, byte[]> rewritten = rewriteReferences(store, moves, alreadyProtected);
        Map<String, byte[]> scrambled = new LinkedHashMap<>();
        List<ProtectedEntry> entries = new ArrayList<>();
        for (Map.Entry<String, String> move : moves.entrySet()) {
            String path = move.getKey();
            byte[] plain = rewritten.containsKey(path) ? rewritten.remove(path) : store.get(path);
            scrambled.put(move.getValue(),
                    Scrambler.apply(options.algorithm(), key, salt, path, uid, plain));
            entries.add(new ProtectedEntry(path, move.getValue(), options.algorithm(), plain.length,
                    Scrambler.checksum(key, path, plain)));
        }
        List<ProtectedEntry> allEntries = new ArrayList<>(existing.map(ProtectionManifest::entries).orElse(List.of()));
        allEntries.addAll(entries);
        ProtectionManifest manifest = new ProtectionManifest(salt, allEntries);
        byte[] encryption = options.algorithm() == ProtectionAlgorithm.IDPF
                ? EncryptionDocument.withReferences(store, moves.values())
                : null;

        scrambled.forEach(store::put);
        rewritten.forEach(store::put);
        store.put(ProtectionManifest.PATH, manifest.toBytes());
        if (encryption != null) {
            store.put(MediaTypes.ENCRYPTION_ENTRY, encryption);
        }
        moves.keySet().forEach(store::delete);

        log.infof("Protected %d entries in %s with %s (%d referrers rewritten)",
                entries.size(), store.description(), options.algorithm().label(), rewritten.size());
        return new ProtectionResult(entries, List.copyOf(rewritten.keySet()));
    }

    /**
     * Restores every entry listed in the protection manifest and removes the manifest.
     * A package without a manifest is left unchanged.
     *
     * @throws AuthenticationFailureException if {@code key} does not match a checksum
     * @throws ManifestInconsistentException  if a listed entry cannot be recovered
     */
    public ProtectionResult unprotect(PackageStore store, String key) {
        requireKey(key);
        Optional<ProtectionManifest> read = ProtectionManifest.read(store);
        if (read.isEmpty()) {
            log.debugf("No protection manifest in %s", store.description());
            return ProtectionResult.none();
        }
        ProtectionManifest manifest = read.get();
        String uid = uniqueIdentifier(store, PackageDocument.locate(store).orElse(null));

        Map<String, String> moves = new LinkedHashMap<>();
        Map<String, byte[]> restored = new LinkedHashMap<>();
        Set<String> idpfUris = new HashSet<>();
        for (ProtectedEntry entry : manifest.entries()) {
            restored.put(entry.path(), recover(store, manifest, entry, key, uid));
            moves.put(entry.obfuscated(), entry.path());
            if (entry.algorithm() == ProtectionAlgorithm.IDPF) {
                idpfUris.add(entry.obfuscated());
            }
        }

        Map<String, byte[]> rewritten = rewriteReferences(store, moves, moves.keySet());
        for (Map.Entry<String, byte[]> entry : restored.entrySet()) {
            if (isText(entry.getKey())) {
                rewrite(entry.getKey(), entry.getValue(), moves).ifPresent(entry::setValue);
            }
        }
        byte[] encryption = null;
        boolean dropEncryption = false;
        if (!idpfUris.isEmpty() && store.exists(MediaTypes.ENCRYPTION_ENTRY)) {
            encryption = EncryptionDocument.withoutReferences(store, idpfUris);
            dropEncryption = encryption == null;
        }

        restored.forEach(store::put);
        rewritten.forEach(store::put);
        moves.keySet().forEach(store::delete);
        if (dropEncryption) {
            store.delete(MediaTypes.ENCRYPTION_ENTRY);
        } else if (encryption != null) {
            store.put(MediaTypes.ENCRYPTION_ENTRY, encryption);
        }
        store.delete(ProtectionManifest.PATH);

        log.infof("Unprotected %d entries in %s", manifest.entries().size(), store.description());
        return new ProtectionResult(manifest.entries(), List.copyOf(rewritten.keySet()));
    }

    private byte[] recover(PackageStore store, ProtectionManifest manifest, ProtectedEntry entry,
                           String key, String uid) {
        if (!store.exists(entry.obfuscated())) {
            throw new ManifestInconsistentException("Protected entry missing", entry.obfuscated());
        }
        if (store.exists(entry.path())) {
            throw new ManifestInconsistentException("Original path of a protected entry is occupied", entry.path());
        }
        if (entry.algorithm() == ProtectionAlgorithm.IDPF && uid == null) {
            throw new ManifestInconsistentException(
                    "Algorithm idpf needs a package unique identifier", entry.path());
        }
        byte[] plain = Scrambler.apply(entry.algorithm(), key, manifest.salt(), entry.path(), uid,
                store.get(entry.obfuscated()));
        if (plain.length != entry.size()) {
            throw new ManifestInconsistentException(
                    "Size mismatch: expected " + entry.size() + " bytes, found " + plain.length, entry.obfuscated());
        }
        if (!Scrambler.checksum(key, entry.path(), plain).equals(entry.checksum())) {
            throw new AuthenticationFailureException(entry.path());
        }
        return plain;
    }

    private static void verifyExisting(PackageStore store, ProtectionManifest manifest, String key) {
        String uid = uniqueIdentifier(store, PackageDocument.locate(store).orElse(null));
        for (ProtectedEntry entry : manifest.entries()) {
            if (!store.exists(entry.obfuscated())) {
                throw new ManifestInconsistentException("Protected entry missing", entry.obfuscated());
            }
            if (entry.algorithm() == ProtectionAlgorithm.IDPF && uid == null) {
                throw new ManifestInconsistentException(
                        "Algorithm idpf needs a package unique identifier", entry.path());
            }
            // idpf output does not depend on the key; the checksum still does
            byte[] plain = Scrambler.apply(entry.algorithm(), key, manifest.salt(), entry.path(), uid,
                    store.get(entry.obfuscated()));
            if (!Scrambler.checksum(key, entry.path(), plain).equals(entry.checksum())) {
                throw new AuthenticationFailureException(entry.path());
            }
        }
    }

    /**
     * New content for every stored text entry, other than {@code skipped}, that mentions
     * a moved entry.
     */
    private static Map<String, byte[]> rewriteReferences(PackageStore store, Map<String, String> moves,
                                                         Set<String> skipped) {
        Map<String, byte[]> rewritten = new LinkedHashMap<>();
        for (String path : store.list()) {
            if (!skipped.contains(path) && isText(path)) {
                rewrite(path, store.get(path), moves).ifPresent(bytes -> rewritten.put(path, bytes));
            }
        }
        return rewritten;
    }

    private static Optional<byte[]> rewrite(String referrer, byte[] data, Map<String, String> moves) {
        EntryText entry = EntryText.decode(data);
        boolean markup = MediaTypeResolver.kindOf(referrer) == EntryKind.MARKUP;
        String updated = new ReferenceRewriter(moves).rewrite(referrer, entry.text(), markup);
        return updated.equals(entry.text()) ? Optional.empty() : Optional.of(entry.encode(updated));
    }

    private static boolean isText(String path) {
        if (path.equals(MediaTypes.MIMETYPE_ENTRY) || path.equals(ProtectionManifest.PATH)) {
            return false;
        }
        EntryKind kind = MediaTypeResolver.kindOf(path);
        return kind == EntryKind.MARKUP || kind == EntryKind.TEXT;
    }

    private static boolean isProtectable(String path, String packageDocument) {
        return !path.equals(MediaTypes.MIMETYPE_ENTRY)
                && !path.startsWith("META-INF/")
                && !path.equals(packageDocument);
    }

    /**
     * Same directory; file name {@code _} + MD5 hex of {@code salt:path} + the original
     * extension in lowercase.
     */
    static String obfuscatedPath(String salt, String path) {
        String extension = PackagePath.extension(path);
        String name = "_" + DigestUtils.md5Hex(salt + ":" + path) + (extension.isEmpty() ? "" : "." + extension);
        return PackagePath.parent(path) + name;
    }

    /**
     * MD5 hex of the package's unique identifier, or of the sorted entry paths joined by
     * newlines when the package has none.
     */
    static String computeSalt(PackageStore store, String uniqueIdentifier) {
        if (uniqueIdentifier != null) {
            return DigestUtils.md5Hex(uniqueIdentifier);
        }
        List<String> paths = new ArrayList<>(store.list());
        paths.sort(null);
        return DigestUtils.md5Hex(String.join("\n", paths));
    }

    private static String uniqueIdentifier(PackageStore store, String packageDocument) {
        if (packageDocument == null) {
            return null;
        }
        try (DocumentCache cache = new DocumentCache(store, false)) {
            return PackageDocument.load(cache).uniqueIdentifier().orElse(null);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Protection key must not be empty");
        }
    }
}
