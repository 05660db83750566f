package com.codegraph.builder;

import com.codegraph.builder.diff.GraphDiffer;
import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.DiffData;
import com.codegraph.builder.graph.GraphModel.EdgeKey;
import com.codegraph.builder.graph.GraphModel.EdgeType;
import com.codegraph.builder.graph.GraphModel.GraphData;
import com.codegraph.builder.graph.GraphModel.Location;
import com.codegraph.builder.graph.GraphModel.NodeKind;
import com.codegraph.builder.graph.GraphModel.Tag;
import com.codegraph.builder.identity.NodeIds;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GraphDifferTest {

    private static final String TS = "2024-05-01T10:00:00Z";

    private final GraphDiffer differ = new GraphDiffer();

    private static CodeNode fn(String file, String name, String sig) {
        String fqname = file + ":" + name;
        return new CodeNode(NodeIds.forDeclaration(fqname, sig), NodeKind.FUNCTION, fqname, sig, name, 1, 3,
            List.of(Tag.PURE), false, file, 1, 5);
    }

    private static CodeEdge calls(CodeNode from, CodeNode to, int count) {
        return new CodeEdge(from.id(), to.id(), EdgeType.CALLS, count, List.of(new Location(from.file(), 2)));
    }

    @Test
    void addedUpdatedAndRemovedNodes() {
        CodeNode a = fn("src/a.ts", "a", "()->any");
        CodeNode b = fn("src/a.ts", "b", "()->any");
        CodeNode aChanged = fn("src/a.ts", "a", "(x)->any");
        CodeNode c = fn("src/a.ts", "c", "()->any");

        DiffData diff = differ.diff(
            new GraphData(List.of(a, b), List.of()),
            new GraphData(List.of(aChanged, c), List.of()),
            Set.of("src/a.ts"), "abc123", TS);

        assertEquals(List.of(c), diff.added().nodes());
        assertEquals(List.of(aChanged), diff.updated().nodes());
        assertEquals(List.of(b.id()), diff.removed().nodes());
        assertEquals("abc123", diff.meta().commit());
        assertEquals(List.of("src/a.ts"), diff.meta().files());
        assertEquals(TS, diff.meta().timestamp());
    }

    @Test
    void unchangedFilesAreOutOfScope() {
        CodeNode a = fn("src/a.ts", "a", "()->any");
        CodeNode other = fn("src/other.ts", "o", "()->any");
        CodeNode otherChanged = fn("src/other.ts", "o", "(y)->any");

        DiffData diff = differ.diff(
            new GraphData(List.of(a, other), List.of()),
            new GraphData(List.of(a, otherChanged), List.of()),
            Set.of("src/a.ts"), null, TS);

        assertTrue(diff.added().nodes().isEmpty());
        assertTrue(diff.updated().nodes().isEmpty());
        assertTrue(diff.removed().nodes().isEmpty());
    }

    @Test
    void identicalNodesAreNotReported() {
        CodeNode a = fn("src/a.ts", "a", "()->any");
        DiffData diff = differ.diff(new GraphData(List.of(a), List.of()), new GraphData(List.of(a), List.of()),
            Set.of("src/a.ts"), null, TS);
        assertTrue(diff.updated().nodes().isEmpty());
        assertTrue(diff.added().nodes().isEmpty());
    }

    @Test
    void edgesAreAddedUpdatedAndRemoved() {
        CodeNode x = fn("src/a.ts", "x", "()->any");
        CodeNode y = fn("src/b.ts", "y", "()->any");
        CodeNode z = fn("src/c.ts", "z", "()->any");
        CodeNode w = fn("src/d.ts", "w", "()->any");

        GraphData previous = new GraphData(List.of(x, y, z, w),
            List.of(calls(x, y, 1), calls(x, z, 1), calls(z, w, 1)));
        GraphData current = new GraphData(List.of(x, y, z, w),
            List.of(calls(x, y, 2), calls(y, x, 1), calls(z, w, 5)));

        DiffData diff = differ.diff(previous, current, Set.of("src/a.ts"), null, TS);

        assertEquals(List.of(calls(y, x, 1)), diff.added().edges());
        assertEquals(List.of(calls(x, y, 2)), diff.updated().edges());
        assertEquals(List.of(new EdgeKey(x.id(), z.id(), EdgeType.CALLS)), diff.removed().edges());
    }

    @Test
    void removedFileRemovesItsNodes() {
        CodeNode gone = fn("src/gone.ts", "g", "()->any");
        CodeNode file = new CodeNode(NodeIds.forFile("src/gone.ts"), NodeKind.FILE, "src/gone.ts", "",
            "File: src/gone.ts", 0, 5, List.of(), false, "src/gone.ts", null, null);

        DiffData diff = differ.diff(
            new GraphData(List.of(file, gone), List.of(new CodeEdge(file.id(), gone.id(), EdgeType.CONTAINS, 1, List.of()))),
            GraphData.empty(), Set.of("src/gone.ts"), null, TS);

        assertEquals(2, diff.removed().nodes().size());
        assertEquals(1, diff.removed().edges().size());
    }

    @Test
    void outputsAreSorted() {
        CodeNode n1 = fn("src/a.ts", "n1", "()->any");
        CodeNode n2 = fn("src/a.ts", "n2", "()->any");
        CodeNode n3 = fn("src/a.ts", "n3", "()->any");

        DiffData diff = differ.diff(GraphData.empty(), new GraphData(List.of(n3, n1, n2), List.of()),
            List.of("src/z.ts", "src/a.ts"), null, TS);

        List<CodeNode> added = diff.added().nodes();
        for (int i = 1; i < added.size(); i++) {
            assertTrue(added.get(i - 1).id().compareTo(added.get(i).id()) < 0);
        }
        assertEquals(List.of("src/a.ts", "src/z.ts"), diff.meta().files());
    }
}
