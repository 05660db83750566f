package com.codegraph.builder.extract;

import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.EdgeType;
import com.codegraph.builder.graph.GraphModel.Location;

import java.util.List;
import java.util.Map;

/**
 * Everything one source file contributes to the graph before cross-file resolution.
 *
 * @param path        project-relative path of the file
 * @param language    adapter language; scopes the symbol keys
 * @param nodes       file node first, then declarations in source order
 * @param containment CONTAINS edges, complete within the file
 * @param symbols     adapter symbol key to node id
 * @param references  CALLS, IMPORTS, EXTENDS and IMPLEMENTS awaiting resolution
 */
public record FileExtraction(
    String path,
    String language,
    List<CodeNode> nodes,
    List<CodeEdge> containment,
    Map<String, String> symbols,
    List<PendingReference> references
) {
    public FileExtraction {
        nodes = List.copyOf(nodes);
        containment = List.copyOf(containment);
        symbols = Map.copyOf(symbols);
        references = List.copyOf(references);
    }

    /**
     * A reference from a node to a symbol or file that may live in another file.
     * A null target (both fields) means the adapter already knows it is unresolvable.
     */
    public record PendingReference(
        String from,
        EdgeType type,
        String targetSymbol,   // nullable
        String targetPath,     // nullable, IMPORTS only
        Location location      // nullable
    ) {}
}
