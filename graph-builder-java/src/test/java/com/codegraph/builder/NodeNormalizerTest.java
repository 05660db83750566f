package com.codegraph.builder;

import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.NodeKind;
import com.codegraph.builder.graph.GraphModel.Tag;
import com.codegraph.builder.identity.NodeIds;
import com.codegraph.builder.normalize.NodeDraft;
import com.codegraph.builder.normalize.NodeNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeNormalizerTest {

    private final NodeNormalizer normalizer = new NodeNormalizer();

    @Test
    void fillsDefaults() {
        CodeNode node = normalizer.normalize(new NodeDraft(NodeKind.FUNCTION, "src/a.ts:run", "()->any"));

        assertEquals(NodeIds.forDeclaration("src/a.ts:run", "()->any"), node.id());
        assertEquals("", node.shortSummary());
        assertEquals(1, node.complexity());
        assertEquals(List.of(), node.tags());
        assertFalse(node.unresolved());
        assertNull(node.file());
        assertNull(node.startLine());
    }

    @Test
    void tokensEstimateIsAlwaysRecomputed() {
        NodeDraft draft = new NodeDraft(NodeKind.METHOD, "src/U.java:U.getUser", "(String)->User");
        draft.shortSummary = "gets user";
        assertEquals(7, normalizer.normalize(draft).tokensEst());
    }

    @Test
    void executableComplexityIsAtLeastOne() {
        NodeDraft draft = new NodeDraft(NodeKind.METHOD, "src/U.java:U.m", "()->void");
        draft.complexity = 0;
        assertEquals(1, normalizer.normalize(draft).complexity());

        draft.complexity = 4;
        assertEquals(4, normalizer.normalize(draft).complexity());
    }

    @Test
    void declarativeComplexityIsZero() {
        NodeDraft draft = new NodeDraft(NodeKind.CLASS, "src/U.java:U", "class U");
        draft.complexity = 5;
        assertEquals(0, normalizer.normalize(draft).complexity());
    }

    @Test
    void fileNodesUseFileId() {
        CodeNode node = normalizer.normalize(new NodeDraft(NodeKind.FILE, "src/user.ts", ""));
        assertEquals(NodeIds.forFile("src/user.ts"), node.id());
        assertEquals(0, node.complexity());
    }

    @Test
    void tagsAreCanonicalAndPureIsExclusive() {
        NodeDraft draft = new NodeDraft(NodeKind.FUNCTION, "src/a.ts:f", "()->any");
        draft.tags = List.of(Tag.ASYNC, Tag.PURE, Tag.IO, Tag.IO);
        assertEquals(List.of(Tag.IO, Tag.ASYNC), normalizer.normalize(draft).tags());

        draft.tags = List.of(Tag.PURE);
        assertEquals(List.of(Tag.PURE), normalizer.normalize(draft).tags());
    }

    @Test
    void requiredFieldsAreEnforced() {
        assertThrows(IllegalArgumentException.class,
            () -> normalizer.normalize(new NodeDraft(null, "src/a.ts:f", "()->any")));
        assertThrows(IllegalArgumentException.class,
            () -> normalizer.normalize(new NodeDraft(NodeKind.FUNCTION, "", "()->any")));
        assertThrows(IllegalArgumentException.class,
            () -> normalizer.normalize(new NodeDraft(NodeKind.FUNCTION, "src/a.ts:f", null)));
    }

    @Test
    void sameDraftGivesEqualNodes() {
        NodeDraft draft = new NodeDraft(NodeKind.METHOD, "src/U.java:U.m", "()->void");
        draft.shortSummary = "m";
        assertEquals(normalizer.normalize(draft), normalizer.normalize(draft));
    }
}
