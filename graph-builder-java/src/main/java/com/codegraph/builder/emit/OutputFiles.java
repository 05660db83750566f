package com.codegraph.builder.emit;

import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.EdgeKey;
import com.codegraph.builder.graph.GraphModel.GraphData;
import com.google.gson.JsonIOException;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared output plumbing: sorted copies for byte-stable documents and
 * temp-file-then-move writes so readers never see a partial file.
 */
final class OutputFiles {

    interface Content {
        void writeTo(Writer writer) throws IOException;
    }

    private OutputFiles() {}

    static void createDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new EmitException("Could not create output directory: " + dir, e);
        }
    }

    static void writeAtomically(Path target, Content content) {
        Map<Path, Content> single = new LinkedHashMap<>();
        single.put(target, content);
        writeAllAtomically(single);
    }

    /**
     * Writes every document to a temp file next to its target, then moves them all into
     * place. A failure while writing leaves every target untouched.
     */
    static void writeAllAtomically(Map<Path, Content> documents) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        Path current = null;
        try {
            for (Map.Entry<Path, Content> doc : documents.entrySet()) {
                current = doc.getKey();
                Path dir = current.toAbsolutePath().getParent();
                createDirectory(dir);
                Path tmp = Files.createTempFile(dir, "." + current.getFileName(), ".tmp");
                staged.put(current, tmp);
                try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                    doc.getValue().writeTo(w);
                }
            }
            for (Path target : staged.keySet()) {
                current = target;
                if (Files.isDirectory(target)) {
                    throw new IOException("target is a directory");
                }
            }
            for (Map.Entry<Path, Path> e : staged.entrySet()) {
                current = e.getKey();
                move(e.getValue(), e.getKey());
            }
        } catch (IOException | JsonIOException e) {
            staged.values().forEach(OutputFiles::deleteQuietly);
            throw new EmitException("Failed to write " + current + ": " + e.getMessage(), e);
        } catch (EmitException e) {
            staged.values().forEach(OutputFiles::deleteQuietly);
            throw e;
        }
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            System.err.println("[graph-builder] WARNING: could not remove temp file " + tmp + ": " + e.getMessage());
        }
    }

    static List<CodeNode> sortedNodes(List<CodeNode> nodes) {
        List<CodeNode> copy = new ArrayList<>(nodes);
        copy.sort(Comparator.comparing(CodeNode::id));
        return copy;
    }

    static List<CodeEdge> sortedEdges(List<CodeEdge> edges) {
        List<CodeEdge> copy = new ArrayList<>(edges);
        copy.sort(Comparator.comparing(CodeEdge::key, EdgeKey.ORDER));
        return copy;
    }

    static GraphData sorted(GraphData graph) {
        return new GraphData(sortedNodes(graph.nodes()), sortedEdges(graph.edges()));
    }
}
