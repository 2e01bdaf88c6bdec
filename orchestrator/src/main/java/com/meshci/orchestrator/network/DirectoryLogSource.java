package com.meshci.orchestrator.network;

import com.meshci.orchestrator.artifact.ArchiveCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Log source over a directory laid out as {@code <root>/<node-id>/...*.log*}.
 * Files are re-read on every call; nodes keep appending while they run.
 */
public class DirectoryLogSource implements LogSource {

    private final Path root;

    public DirectoryLogSource(Path root) {
        this.root = root;
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public List<Path> files() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                       .filter(ArchiveCodec::isLogFile)
                       .sorted()
                       .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list logs under " + root, e);
        }
    }

    @Override
    public List<LogLine> lines() {
        List<LogLine> lines = new ArrayList<>();
        for (Path file : files()) {
            String source = sourceOf(file);
            String content;
            try {
                content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                continue;   // rotated away between listing and reading
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file, e);
            }
            content.lines().forEach(text -> lines.add(new LogLine(source, text)));
        }
        return lines;
    }

    private String sourceOf(Path file) {
        Path relative = root.relativize(file);
        return relative.getNameCount() > 1 ? relative.getName(0).toString() : relative.toString();
    }
}
