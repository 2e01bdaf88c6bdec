package com.meshci.orchestrator.artifact;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Zip packing and unpacking for build archives and log bundles.
 */
public final class ArchiveCodec {

    private ArchiveCodec() {}

    /** Pack the given files, each stored under its map key as entry name. */
    public static byte[] pack(Map<String, Path> entries) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, Path> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                Files.copy(entry.getValue(), zip);
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to pack archive", e);
        }
        return bytes.toByteArray();
    }

    /**
     * Pack every regular file under {@code root} that matches {@code filter},
     * using root-relative paths as entry names.
     *
     * @return the archive, or an empty zip if nothing matched
     */
    public static byte[] packTree(Path root, Predicate<Path> filter) {
        Map<String, Path> entries = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile)
                .filter(filter)
                .forEach(p -> entries.put(root.relativize(p).toString().replace('\\', '/'), p));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }
        return pack(entries);
    }

    /**
     * Unpack into {@code target}. Entries that would land outside the
     * target directory are rejected.
     *
     * @return the extracted files
     */
    public static List<Path> unpack(byte[] archive, Path target) {
        Path root = target.toAbsolutePath().normalize();
        List<Path> extracted = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            Files.createDirectories(root);
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path out = root.resolve(entry.getName()).normalize();
                if (!out.startsWith(root)) {
                    throw new IOException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                    continue;
                }
                Files.createDirectories(out.getParent());
                Files.copy(zip, out, StandardCopyOption.REPLACE_EXISTING);
                extracted.add(out);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to unpack archive into " + target, e);
        }
        return extracted;
    }

    /** Matches {@code *.log*} file names, i.e. current and rotated logs. */
    public static boolean isLogFile(Path path) {
        return path.getFileName().toString().contains(".log");
    }
}
