package com.codegraph.builder;

import com.codegraph.builder.emit.GraphJson;
import com.codegraph.builder.emit.JsonEmitter;
import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.DiffData;
import com.codegraph.builder.graph.GraphModel.DiffMeta;
import com.codegraph.builder.graph.GraphModel.EdgeKey;
import com.codegraph.builder.graph.GraphModel.EdgeType;
import com.codegraph.builder.graph.GraphModel.GraphData;
import com.codegraph.builder.graph.GraphModel.NodeKind;
import com.codegraph.builder.graph.GraphModel.Removed;
import com.codegraph.builder.graph.GraphModel.Tag;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonEmitterTest {

    @TempDir
    Path outputDir;

    private static CodeNode fn(String id, String fqname) {
        return new CodeNode(id, NodeKind.FUNCTION, fqname, "()->any", "run", 1, 3, List.of(Tag.PURE), false,
            "src/a.ts", 1, 2);
    }

    @Test
    void batchUsesTheGivenTagAndSortsNodes() throws IOException {
        GraphData graph = new GraphData(List.of(fn("b2", "src/a.ts:b"), fn("a1", "src/a.ts:a")), List.of());
        Path written = new JsonEmitter().emitBatch(graph, outputDir, "nightly");

        assertEquals(outputDir.resolve("batch-nightly.json"), written);
        GraphData read = GraphJson.PRETTY.fromJson(Files.readString(written, StandardCharsets.UTF_8), GraphData.class);
        assertEquals("a1", read.nodes().get(0).id());
        assertEquals("b2", read.nodes().get(1).id());
        assertEquals(List.of(Tag.PURE), read.nodes().get(0).tags());
    }

    @Test
    void batchUsesSnakeCaseFields() throws IOException {
        GraphData graph = new GraphData(List.of(fn("a1", "src/a.ts:a")), List.of());
        Path written = new JsonEmitter().emitBatch(graph, outputDir, "t");

        JsonObject node = GraphJson.PRETTY.fromJson(Files.readString(written), JsonObject.class)
            .getAsJsonArray("nodes").get(0).getAsJsonObject();
        assertEquals("Function", node.get("kind").getAsString());
        assertEquals(3, node.get("tokens_est").getAsInt());
        assertEquals("run", node.get("short").getAsString());
        assertEquals(1, node.get("start_line").getAsInt());
    }

    @Test
    void batchWithoutTagIsNamedByTimestamp() throws IOException {
        Path written = new JsonEmitter().emitBatch(GraphData.empty(), outputDir, null);
        String name = written.getFileName().toString();
        assertTrue(name.startsWith("batch-"));
        assertTrue(name.endsWith(".json"));
        assertFalse(name.contains(":"));
    }

    @Test
    void diffIsNamedByShortCommit() throws IOException {
        DiffData diff = new DiffData(new DiffMeta("abcdef1234567890", List.of("src/a.ts"), "2024-01-01T00:00:00Z"),
            null, null, new Removed(List.of("z9", "a1"),
                List.of(new EdgeKey("b", "c", EdgeType.CALLS), new EdgeKey("a", "c", EdgeType.CALLS))));

        Path written = new JsonEmitter().emitDiff(diff, outputDir);

        assertEquals(outputDir.resolve("diff-abcdef12.json"), written);
        DiffData read = GraphJson.PRETTY.fromJson(Files.readString(written), DiffData.class);
        assertEquals(List.of("a1", "z9"), read.removed().nodes());
        assertEquals("a", read.removed().edges().get(0).from());
        assertEquals(List.of("src/a.ts"), read.meta().files());
        assertTrue(read.added().nodes().isEmpty());
    }

    @Test
    void diffWithoutCommitIsLatest() {
        DiffData diff = new DiffData(new DiffMeta(null, List.of(), "2024-01-01T00:00:00Z"), null, null, null);
        assertEquals(outputDir.resolve("diff-latest.json"), new JsonEmitter().emitDiff(diff, outputDir));
    }

    @Test
    void noTempFilesAreLeftBehind() throws IOException {
        JsonEmitter emitter = new JsonEmitter();
        emitter.emitBatch(GraphData.empty(), outputDir, "one");
        emitter.emitBatch(new GraphData(List.of(fn("a1", "src/a.ts:a")),
            List.of(new CodeEdge("a1", "a1", EdgeType.CALLS, 1, List.of()))), outputDir, "one");

        try (Stream<Path> files = Files.list(outputDir)) {
            assertEquals(List.of("batch-one.json"), files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList()));
        }
    }
}
