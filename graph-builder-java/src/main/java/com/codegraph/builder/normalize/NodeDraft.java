package com.codegraph.builder.normalize;

import com.codegraph.builder.graph.GraphModel.NodeKind;
import com.codegraph.builder.graph.GraphModel.Tag;

import java.util.List;

/**
 * Partially filled node as produced by an extractor.
 * Only kind, fqname and sig are required; {@link NodeNormalizer} fills the rest.
 */
public class NodeDraft {
    public NodeKind kind;
    public String fqname;
    public String sig;
    public String shortSummary;   // nullable
    public Integer complexity;    // nullable
    public List<Tag> tags;        // nullable
    public boolean unresolved;
    public String file;           // nullable
    public Integer startLine;     // nullable
    public Integer endLine;       // nullable

    public NodeDraft() {}

    public NodeDraft(NodeKind kind, String fqname, String sig) {
        this.kind = kind;
        this.fqname = fqname;
        this.sig = sig;
    }
}
