package com.codegraph.builder;

import com.codegraph.builder.emit.CsvEmitter;
import com.codegraph.builder.emit.EmitException;
import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.EdgeType;
import com.codegraph.builder.graph.GraphModel.GraphData;
import com.codegraph.builder.graph.GraphModel.Location;
import com.codegraph.builder.graph.GraphModel.NodeKind;
import com.codegraph.builder.graph.GraphModel.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CsvEmitterTest {

    @TempDir
    Path outputDir;

    private static final CodeNode SAVE = new CodeNode("bbbb000000000002", NodeKind.METHOD, "src/Repo.java:Repo.save",
        "(String,int)->void", "saves \"user\"\nrecord", 1, 12, List.of(Tag.IO, Tag.DB), false,
        "src/Repo.java", 10, 14);
    private static final CodeNode FILE = new CodeNode("aaaa000000000001", NodeKind.FILE, "src/Repo.java", "",
        "File: src/Repo.java", 0, 5, List.of(), false, "src/Repo.java", null, null);

    private GraphData graph() {
        CodeEdge contains = new CodeEdge(FILE.id(), SAVE.id(), EdgeType.CONTAINS, 1, List.of());
        CodeEdge calls = new CodeEdge(SAVE.id(), FILE.id(), EdgeType.CALLS, 2,
            List.of(new Location("src/Repo.java", 11), new Location("src/Repo.java", 12)));
        return new GraphData(List.of(SAVE, FILE), List.of(calls, contains));
    }

    @Test
    void writesBothFilesWithHeaders() throws IOException {
        List<Path> written = new CsvEmitter().write(graph(), outputDir);

        assertEquals(List.of(outputDir.resolve(CsvEmitter.NODES_FILE), outputDir.resolve(CsvEmitter.RELS_FILE)), written);
        List<String> nodes = Files.readAllLines(written.get(0), StandardCharsets.UTF_8);
        List<String> rels = Files.readAllLines(written.get(1), StandardCharsets.UTF_8);

        assertEquals("id:ID,kind,fqname,sig,short,complexity:int,tokens_est:int,tags,file,start_line:int,end_line:int",
            nodes.get(0));
        assertEquals(":START_ID,:END_ID,type,count:int,locations", rels.get(0));
        assertEquals(3, nodes.size());
        assertEquals(3, rels.size());
    }

    @Test
    void nodeRowsAreSortedAndEscaped() throws IOException {
        new CsvEmitter().write(graph(), outputDir);
        List<String> nodes = Files.readAllLines(outputDir.resolve(CsvEmitter.NODES_FILE), StandardCharsets.UTF_8);

        assertEquals("aaaa000000000001,File,src/Repo.java,,File: src/Repo.java,0,5,,src/Repo.java,,", nodes.get(1));
        assertEquals("bbbb000000000002,Method,src/Repo.java:Repo.save,\"(String,int)->void\","
            + "\"saves \"\"user\"\" record\",1,12,\"IO;DB\",src/Repo.java,10,14", nodes.get(2));
    }

    @Test
    void edgeRowsCarryLocationsAsJson() throws IOException {
        new CsvEmitter().write(graph(), outputDir);
        List<String> rels = Files.readAllLines(outputDir.resolve(CsvEmitter.RELS_FILE), StandardCharsets.UTF_8);

        assertEquals("aaaa000000000001,bbbb000000000002,CONTAINS,1,[]", rels.get(1));
        assertEquals("bbbb000000000002,aaaa000000000001,CALLS,2,"
            + "\"[{\"\"file\"\":\"\"src/Repo.java\"\",\"\"line\"\":11},{\"\"file\"\":\"\"src/Repo.java\"\",\"\"line\"\":12}]\"",
            rels.get(2));
    }

    @Test
    void emptyGraphWritesHeadersOnly() throws IOException {
        new CsvEmitter().write(GraphData.empty(), outputDir.resolve("nested"));
        assertEquals(1, Files.readAllLines(outputDir.resolve("nested").resolve(CsvEmitter.NODES_FILE)).size());
        assertEquals(1, Files.readAllLines(outputDir.resolve("nested").resolve(CsvEmitter.RELS_FILE)).size());
    }

    @Test
    void outputIsByteStable() throws IOException {
        CsvEmitter emitter = new CsvEmitter();
        emitter.write(graph(), outputDir.resolve("one"));
        emitter.write(new GraphData(List.of(FILE, SAVE), graph().edges()), outputDir.resolve("two"));
        assertArrayEquals(Files.readAllBytes(outputDir.resolve("one").resolve(CsvEmitter.NODES_FILE)),
            Files.readAllBytes(outputDir.resolve("two").resolve(CsvEmitter.NODES_FILE)));
    }

    @Test
    void tagsReadBackAsWritten() throws IOException {
        Map<String, CodeNode> byId = new LinkedHashMap<>();
        List<List<Tag>> tagSets = List.of(List.of(), List.of(Tag.PURE), List.of(Tag.IO, Tag.DB, Tag.NETWORK, Tag.ASYNC),
            List.of(Tag.NETWORK, Tag.ASYNC));
        for (int i = 0; i < tagSets.size(); i++) {
            String id = "cccc00000000000" + i;
            byId.put(id, new CodeNode(id, NodeKind.FUNCTION, "src/a.ts:f" + i, "(a,b)->void", "f" + i, 1, 3,
                tagSets.get(i), false, "src/a.ts", i + 1, i + 2));
        }
        new CsvEmitter().write(new GraphData(new ArrayList<>(byId.values()), List.of()), outputDir);

        List<String> rows = Files.readAllLines(outputDir.resolve(CsvEmitter.NODES_FILE), StandardCharsets.UTF_8);
        assertEquals(byId.size() + 1, rows.size());
        for (String row : rows.subList(1, rows.size())) {
            List<String> fields = csvFields(row);
            String tags = fields.get(7);
            List<Tag> parsed = tags.isEmpty() ? List.of()
                : Arrays.stream(tags.split(CsvEmitter.LIST_DELIMITER)).map(Tag::valueOf).collect(Collectors.toList());
            assertEquals(byId.get(fields.get(0)).tags(), parsed, row);
        }
    }

    @Test
    void failedWriteLeavesBothFilesUntouched() throws IOException {
        Path nodes = outputDir.resolve(CsvEmitter.NODES_FILE);
        Files.writeString(nodes, "previous");
        Path rels = outputDir.resolve(CsvEmitter.RELS_FILE);
        Files.createDirectories(rels);
        Files.writeString(rels.resolve("keep.txt"), "x");

        assertThrows(EmitException.class, () -> new CsvEmitter().write(graph(), outputDir));

        assertEquals("previous", Files.readString(nodes));
        try (Stream<Path> files = Files.list(outputDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    private static List<String> csvFields(String row) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < row.length(); i++) {
            char c = row.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < row.length() && row.charAt(i + 1) == '"') {
                    field.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        fields.add(field.toString());
        return fields;
    }
}
