package com.codegraph.builder.normalize;

import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.NodeKind;
import com.codegraph.builder.graph.GraphModel.Tag;
import com.codegraph.builder.heuristics.TokenEstimator;
import com.codegraph.builder.identity.NodeIds;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a {@link NodeDraft} into a canonical {@link CodeNode}.
 *
 * This is the only place where id and tokens_est are computed. Caller-supplied
 * values for derived fields are never trusted:
 * <ul>
 *   <li>id comes from {@link NodeIds} (file derivation for File nodes)</li>
 *   <li>tokens_est is always recomputed from short + sig</li>
 *   <li>complexity is 0 for declarative kinds and at least 1 for callables</li>
 *   <li>tags are put in canonical order and PURE never coexists with another tag</li>
 * </ul>
 */
public class NodeNormalizer {

    public CodeNode normalize(NodeDraft draft) {
        if (draft == null || draft.kind == null) {
            throw new IllegalArgumentException("Node draft requires a kind");
        }
        if (draft.fqname == null || draft.fqname.isEmpty()) {
            throw new IllegalArgumentException("Node draft requires an fqname (kind " + draft.kind + ")");
        }
        if (draft.sig == null) {
            throw new IllegalArgumentException("Node draft requires a sig: " + draft.fqname);
        }

        String id = draft.kind == NodeKind.FILE
                ? NodeIds.forFile(draft.fqname)
                : NodeIds.forDeclaration(draft.fqname, draft.sig);
        String shortSummary = draft.shortSummary != null ? draft.shortSummary : "";

        return new CodeNode(
                id,
                draft.kind,
                draft.fqname,
                draft.sig,
                shortSummary,
                complexityOf(draft),
                TokenEstimator.forNode(shortSummary, draft.sig),
                canonicalTags(draft.tags),
                draft.unresolved,
                draft.file,
                draft.startLine,
                draft.endLine
        );
    }

    private int complexityOf(NodeDraft draft) {
        if (!draft.kind.isExecutable()) return 0;
        if (draft.complexity == null) return 1;
        return Math.max(1, draft.complexity);
    }

    static List<Tag> canonicalTags(List<Tag> tags) {
        if (tags == null || tags.isEmpty()) return List.of();
        Set<Tag> set = EnumSet.noneOf(Tag.class);
        for (Tag t : tags) {
            if (t != null) set.add(t);
        }
        if (set.size() > 1) set.remove(Tag.PURE);
        return List.copyOf(set);
    }
}
