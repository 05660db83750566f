package com.codegraph.builder.adapter;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects source files by extension under a root, skipping excluded directories.
 * Results are absolute, sorted, and cut to the filter's limit.
 */
public final class SourceFileWalker {

    private SourceFileWalker() {}

    public static List<Path> collect(Path root, Set<String> extensions, SourceFilter filter) {
        if (!Files.isDirectory(root)) return Collections.emptyList();

        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && filter.excludedDirectories().contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && hasExtension(file, extensions)) {
                        files.add(file.toAbsolutePath());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    System.err.println("[graph-builder] WARNING: cannot read " + file + ": " + e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            System.err.println("[graph-builder] WARNING: could not walk source tree " + root + ": " + e.getMessage());
            return Collections.emptyList();
        }

        Collections.sort(files);
        if (filter.limit() > 0 && files.size() > filter.limit()) {
            return new ArrayList<>(files.subList(0, filter.limit()));
        }
        return files;
    }

    /** Project-relative path with '/' separators: the canonical file identity in the graph. */
    public static String relativize(Path root, Path file) {
        Path abs = file.toAbsolutePath().normalize();
        Path base = root.toAbsolutePath().normalize();
        Path rel = abs.startsWith(base) ? base.relativize(abs) : abs;
        return rel.toString().replace('\\', '/');
    }

    private static boolean hasExtension(Path file, Set<String> extensions) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith(ext.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }
}
