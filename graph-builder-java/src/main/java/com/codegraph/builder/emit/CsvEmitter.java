package com.codegraph.builder.emit;

import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.GraphData;
import com.codegraph.builder.graph.GraphModel.Tag;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a snapshot as bulk-import CSV: {@code nodes.csv} and {@code rels.csv}.
 *
 * Free-text newlines become spaces. A field containing a comma, quote or
 * semicolon is wrapped in quotes with inner quotes doubled. Tags are joined
 * with {@value #LIST_DELIMITER}; edge locations are a JSON array.
 */
public class CsvEmitter {

    public static final String NODES_FILE = "nodes.csv";
    public static final String RELS_FILE = "rels.csv";
    public static final String LIST_DELIMITER = ";";

    static final String NODES_HEADER =
        "id:ID,kind,fqname,sig,short,complexity:int,tokens_est:int,tags,file,start_line:int,end_line:int";
    static final String RELS_HEADER = ":START_ID,:END_ID,type,count:int,locations";

    /**
     * @return the two written files, nodes first
     */
    public List<Path> write(GraphData graph, Path outputDir) {
        OutputFiles.createDirectory(outputDir);
        Path nodesPath = outputDir.resolve(NODES_FILE);
        Path relsPath = outputDir.resolve(RELS_FILE);

        List<CodeNode> nodes = OutputFiles.sortedNodes(graph.nodes());
        List<CodeEdge> edges = OutputFiles.sortedEdges(graph.edges());

        // both files or neither
        Map<Path, OutputFiles.Content> documents = new LinkedHashMap<>();
        documents.put(nodesPath, w -> writeNodes(nodes, w));
        documents.put(relsPath, w -> writeEdges(edges, w));
        OutputFiles.writeAllAtomically(documents);

        System.err.println("[graph-builder] CSV written: " + nodesPath + " (" + nodes.size() + " nodes), "
            + relsPath + " (" + edges.size() + " edges)");
        return List.of(nodesPath, relsPath);
    }

    private void writeNodes(List<CodeNode> nodes, Writer w) throws IOException {
        w.write(NODES_HEADER);
        w.write('\n');
        for (CodeNode n : nodes) {
            w.write(row(
                n.id(),
                n.kind().label(),
                n.fqname(),
                n.sig(),
                n.shortSummary(),
                String.valueOf(n.complexity()),
                String.valueOf(n.tokensEst()),
                joinTags(n.tags()),
                n.file(),
                n.startLine() == null ? "" : String.valueOf(n.startLine()),
                n.endLine() == null ? "" : String.valueOf(n.endLine())
            ));
            w.write('\n');
        }
    }

    private void writeEdges(List<CodeEdge> edges, Writer w) throws IOException {
        w.write(RELS_HEADER);
        w.write('\n');
        for (CodeEdge e : edges) {
            w.write(row(
                e.from(),
                e.to(),
                e.type().name(),
                String.valueOf(e.count()),
                GraphJson.COMPACT.toJson(e.locations())
            ));
            w.write('\n');
        }
    }

    static String joinTags(List<Tag> tags) {
        return tags.stream().map(Tag::name).collect(Collectors.joining(LIST_DELIMITER));
    }

    static String row(String... fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(escape(fields[i]));
        }
        return sb.toString();
    }

    static String escape(String value) {
        if (value == null) return "";
        String v = value.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        if (v.indexOf(',') >= 0 || v.indexOf('"') >= 0 || v.contains(LIST_DELIMITER)) {
            return '"' + v.replace("\"", "\"\"") + '"';
        }
        return v;
    }
}
