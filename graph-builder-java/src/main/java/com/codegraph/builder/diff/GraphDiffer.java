package com.codegraph.builder.diff;

import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.DiffData;
import com.codegraph.builder.graph.GraphModel.DiffMeta;
import com.codegraph.builder.graph.GraphModel.EdgeKey;
import com.codegraph.builder.graph.GraphModel.GraphData;
import com.codegraph.builder.graph.GraphModel.NodeKind;
import com.codegraph.builder.graph.GraphModel.Removed;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the change set between two snapshots, restricted to a set of changed files.
 *
 * Nodes are matched by (kind, fqname) rather than id, so a declaration whose
 * signature changed shows up as updated, carrying its new id. Edges are matched by
 * (from, to, type) and are in scope when either endpoint lives in a changed file.
 */
public class GraphDiffer {

    public DiffData diff(GraphData previous, GraphData current, Collection<String> changedFiles,
                         String commit, String timestamp) {
        Set<String> changed = new TreeSet<>(changedFiles);

        Map<NodeIdentity, CodeNode> previousNodes = nodesInScope(previous, changed);
        Map<NodeIdentity, CodeNode> currentNodes = nodesInScope(current, changed);

        List<CodeNode> addedNodes = new ArrayList<>();
        List<CodeNode> updatedNodes = new ArrayList<>();
        List<String> removedNodes = new ArrayList<>();

        for (Map.Entry<NodeIdentity, CodeNode> e : currentNodes.entrySet()) {
            CodeNode before = previousNodes.get(e.getKey());
            if (before == null) {
                addedNodes.add(e.getValue());
            } else if (nodeChanged(before, e.getValue())) {
                updatedNodes.add(e.getValue());
            }
        }
        for (Map.Entry<NodeIdentity, CodeNode> e : previousNodes.entrySet()) {
            if (!currentNodes.containsKey(e.getKey())) {
                removedNodes.add(e.getValue().id());
            }
        }

        Map<EdgeKey, CodeEdge> previousEdges = edgesInScope(previous, changed);
        Map<EdgeKey, CodeEdge> currentEdges = edgesInScope(current, changed);

        List<CodeEdge> addedEdges = new ArrayList<>();
        List<CodeEdge> updatedEdges = new ArrayList<>();
        List<EdgeKey> removedEdges = new ArrayList<>();

        for (Map.Entry<EdgeKey, CodeEdge> e : currentEdges.entrySet()) {
            CodeEdge before = previousEdges.get(e.getKey());
            if (before == null) {
                addedEdges.add(e.getValue());
            } else if (before.count() != e.getValue().count() || !before.locations().equals(e.getValue().locations())) {
                updatedEdges.add(e.getValue());
            }
        }
        for (EdgeKey key : previousEdges.keySet()) {
            if (!currentEdges.containsKey(key)) removedEdges.add(key);
        }

        addedNodes.sort(Comparator.comparing(CodeNode::id));
        updatedNodes.sort(Comparator.comparing(CodeNode::id));
        removedNodes.sort(Comparator.naturalOrder());
        addedEdges.sort(Comparator.comparing(CodeEdge::key, EdgeKey.ORDER));
        updatedEdges.sort(Comparator.comparing(CodeEdge::key, EdgeKey.ORDER));
        removedEdges.sort(EdgeKey.ORDER);

        return new DiffData(
            new DiffMeta(commit, new ArrayList<>(changed), timestamp),
            new GraphData(addedNodes, addedEdges),
            new GraphData(updatedNodes, updatedEdges),
            new Removed(removedNodes, removedEdges)
        );
    }

    private record NodeIdentity(NodeKind kind, String fqname) {}

    private static Map<NodeIdentity, CodeNode> nodesInScope(GraphData graph, Set<String> changed) {
        Map<NodeIdentity, CodeNode> result = new LinkedHashMap<>();
        for (CodeNode node : graph.nodes()) {
            if (node.file() != null && changed.contains(node.file())) {
                result.putIfAbsent(new NodeIdentity(node.kind(), node.fqname()), node);
            }
        }
        return result;
    }

    private static Map<EdgeKey, CodeEdge> edgesInScope(GraphData graph, Set<String> changed) {
        Map<String, String> fileById = new HashMap<>();
        for (CodeNode node : graph.nodes()) {
            if (node.file() != null) fileById.put(node.id(), node.file());
        }
        Map<EdgeKey, CodeEdge> result = new LinkedHashMap<>();
        for (CodeEdge edge : graph.edges()) {
            String fromFile = fileById.get(edge.from());
            String toFile = fileById.get(edge.to());
            if ((fromFile != null && changed.contains(fromFile)) || (toFile != null && changed.contains(toFile))) {
                result.putIfAbsent(edge.key(), edge);
            }
        }
        return result;
    }

    static boolean nodeChanged(CodeNode before, CodeNode after) {
        return !Objects.equals(before.sig(), after.sig())
            || !Objects.equals(before.shortSummary(), after.shortSummary())
            || before.complexity() != after.complexity()
            || !Objects.equals(before.tags(), after.tags())
            || before.unresolved() != after.unresolved()
            || !Objects.equals(before.startLine(), after.startLine())
            || !Objects.equals(before.endLine(), after.endLine());
    }
}
