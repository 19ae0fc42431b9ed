package com.libragraph.folio.store.zip;

import com.libragraph.folio.store.CorruptArchiveException;
import com.libragraph.folio.types.MediaTypes;
import com.libragraph.folio.util.PackagePath;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.CRC32;

/**
 * Reads and writes package archives.
 *
 * <p>Reading keeps each entry's compressed bytes alongside the decompressed ones.
 * Writing places the {@code mimetype} marker first, STORED and without extra fields,
 * copies untouched entries raw and DEFLATEs everything else.
 */
public final class ZipArchiveCodec {

    private static final Logger log = Logger.getLogger(ZipArchiveCodec.class);

    private ZipArchiveCodec() {
    }

    /**
     * Parses an archive blob into entries in central directory order. Directory
     * entries are skipped.
     *
     * @throws CorruptArchiveException on unreadable archives, duplicate names, unsafe
     *                                 names or undecodable entry data
     */
    public static List<ArchivedEntry> read(byte[] blob, String description) {
        List<ArchivedEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        try (ZipFile zipFile = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(blob))
                .get()) {
            Enumeration<ZipArchiveEntry> all = zipFile.getEntries();
            while (all.hasMoreElements()) {
                ZipArchiveEntry entry = all.nextElement();
                String name = entry.getName();
                if (!seen.add(name)) {
                    throw new CorruptArchiveException(
                            "Duplicate archive entry in " + description + ": " + name, name);
                }
                if (entry.isDirectory()) {
                    continue;
                }
                String path;
                try {
                    path = PackagePath.normalize(name);
                } catch (IllegalArgumentException e) {
                    throw new CorruptArchiveException(
                            "Unsafe archive entry name in " + description + ": " + name, name, e);
                }
                if (!zipFile.canReadEntryData(entry)) {
                    throw new CorruptArchiveException(
                            "Unsupported compression for entry " + name + " in " + description, name);
                }

                byte[] data;
                try (InputStream in = zipFile.getInputStream(entry)) {
                    data = in.readAllBytes();
                }
                byte[] raw;
                try (InputStream in = zipFile.getRawInputStream(entry)) {
                    raw = in.readAllBytes();
                }
                if (path.equals(name)) {
                    entries.add(new ArchivedEntry(path, data, entry, raw));
                } else {
                    entries.add(ArchivedEntry.fresh(path, data));
                }
            }
        } catch (IOException e) {
            throw new CorruptArchiveException("Unreadable archive: " + description, null, e);
        }

        log.debugf("Read %d entries from %s", entries.size(), description);
        return entries;
    }

    /**
     * Writes entries as an archive. The {@code mimetype} entry, when present, is
     * always written first regardless of its position in {@code entries}.
     */
    public static void write(List<ArchivedEntry> entries, OutputStream output) throws IOException {
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(output)) {
            zos.setEncoding("UTF-8");

            for (ArchivedEntry entry : entries) {
                if (MediaTypes.MIMETYPE_ENTRY.equals(entry.path())) {
                    writeMimetype(zos, entry.data());
                }
            }

            for (ArchivedEntry entry : entries) {
                if (MediaTypes.MIMETYPE_ENTRY.equals(entry.path())) {
                    continue;
                }
                if (entry.hasRaw()) {
                    ZipArchiveEntry copy = new ZipArchiveEntry(entry.header());
                    copy.getGeneralPurposeBit().useDataDescriptor(false);
                    zos.addRawArchiveEntry(copy, new ByteArrayInputStream(entry.raw()));
                } else {
                    ZipArchiveEntry ze = new ZipArchiveEntry(entry.path());
                    ze.setMethod(ZipArchiveEntry.DEFLATED);
                    if (entry.header() != null) {
                        ze.setTime(entry.header().getTime());
                    }
                    zos.putArchiveEntry(ze);
                    zos.write(entry.data());
                    zos.closeArchiveEntry();
                }
            }
            zos.finish();
        }
    }

    private static void writeMimetype(ZipArchiveOutputStream zos, byte[] data) throws IOException {
        CRC32 crc = new CRC32();
        crc.update(data);

        ZipArchiveEntry ze = new ZipArchiveEntry(MediaTypes.MIMETYPE_ENTRY);
        ze.setMethod(ZipArchiveEntry.STORED);
        ze.setSize(data.length);
        ze.setCompressedSize(data.length);
        ze.setCrc(crc.getValue());

        zos.putArchiveEntry(ze);
        zos.write(data);
        zos.closeArchiveEntry();
    }
}
