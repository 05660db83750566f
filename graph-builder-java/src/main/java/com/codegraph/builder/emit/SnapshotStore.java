package com.codegraph.builder.emit;

import com.codegraph.builder.graph.GraphModel.GraphData;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * The last scan's graph, kept as {@code graph-data.json} in the output directory.
 * It feeds the emit commands and is the previous snapshot of the next diff.
 */
public class SnapshotStore {

    public static final String FILE_NAME = "graph-data.json";

    private final Path file;

    public SnapshotStore(Path outputDir) {
        this.file = outputDir.resolve(FILE_NAME);
    }

    public Path path() {
        return file;
    }

    public void write(GraphData graph) {
        GraphData sorted = OutputFiles.sorted(graph);
        OutputFiles.writeAtomically(file, w -> GraphJson.PRETTY.toJson(sorted, w));
        System.err.println("[graph-builder] Snapshot written: " + file);
    }

    /**
     * @return empty if no snapshot was written yet
     * @throws EmitException if the snapshot exists but cannot be read
     */
    public Optional<GraphData> read() {
        if (!Files.exists(file)) return Optional.empty();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            GraphData graph = GraphJson.PRETTY.fromJson(reader, GraphData.class);
            if (graph == null) {
                throw new EmitException("Snapshot is empty: " + file);
            }
            return Optional.of(graph);
        } catch (JsonParseException e) {
            throw new EmitException("Snapshot is not valid JSON: " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new EmitException("Failed to read snapshot " + file + ": " + e.getMessage(), e);
        }
    }
}
