package com.codegraph.builder.graph;

import com.google.gson.annotations.SerializedName;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Records making up a code graph snapshot and a snapshot diff.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class GraphModel {

    private GraphModel() {}

    public enum NodeKind {
        @SerializedName("File")      FILE(false),
        @SerializedName("Module")    MODULE(false),
        @SerializedName("Function")  FUNCTION(true),
        @SerializedName("Method")    METHOD(true),
        @SerializedName("Class")     CLASS(false),
        @SerializedName("Interface") INTERFACE(false),
        @SerializedName("Type")      TYPE(false);

        private final boolean executable;

        NodeKind(boolean executable) {
            this.executable = executable;
        }

        /** Functions and methods carry control flow; every other kind has complexity 0. */
        public boolean isExecutable() { return executable; }

        /** Capitalized name as written to every output format. */
        public String label() {
            String name = name();
            return name.charAt(0) + name.substring(1).toLowerCase();
        }
    }

    /** Side-effect markers, declared in canonical output order. */
    public enum Tag { IO, DB, NETWORK, ASYNC, PURE }

    public enum EdgeType { IMPORTS, CALLS, CONTAINS, EXTENDS, IMPLEMENTS }

    public record CodeNode(
            @SerializedName("id")         String id,
            @SerializedName("kind")       NodeKind kind,
            @SerializedName("fqname")     String fqname,
            @SerializedName("sig")        String sig,
            @SerializedName("short")      String shortSummary,
            @SerializedName("complexity") int complexity,
            @SerializedName("tokens_est") int tokensEst,
            @SerializedName("tags")       List<Tag> tags,
            @SerializedName("unresolved") boolean unresolved,
            @SerializedName("file")       String file,
            @SerializedName("start_line") Integer startLine,
            @SerializedName("end_line")   Integer endLine
    ) {
        public CodeNode {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        public CodeNode withUnresolved(boolean value) {
            if (value == unresolved) return this;
            return new CodeNode(id, kind, fqname, sig, shortSummary, complexity, tokensEst,
                    tags, value, file, startLine, endLine);
        }
    }

    public record Location(
            @SerializedName("file") String file,
            @SerializedName("line") int line
    ) {}

    public record CodeEdge(
            @SerializedName("from")      String from,
            @SerializedName("to")        String to,
            @SerializedName("type")      EdgeType type,
            @SerializedName("count")     int count,
            @SerializedName("locations") List<Location> locations
    ) {
        public CodeEdge {
            locations = locations == null ? List.of() : List.copyOf(locations);
        }

        public EdgeKey key() {
            return new EdgeKey(from, to, type);
        }
    }

    /** Identity of an edge: one edge record exists per (from, to, type). */
    public record EdgeKey(
            @SerializedName("from") String from,
            @SerializedName("to")   String to,
            @SerializedName("type") EdgeType type
    ) {
        public static final Comparator<EdgeKey> ORDER = Comparator
                .comparing(EdgeKey::from)
                .thenComparing(EdgeKey::to)
                .thenComparing(EdgeKey::type);
    }

    public record GraphData(
            @SerializedName("nodes") List<CodeNode> nodes,
            @SerializedName("edges") List<CodeEdge> edges
    ) {
        public GraphData {
            nodes = nodes == null ? List.of() : List.copyOf(nodes);
            edges = edges == null ? List.of() : List.copyOf(edges);
        }

        public static GraphData empty() {
            return new GraphData(List.of(), List.of());
        }
    }

    public record DiffMeta(
            @SerializedName("commit")    String commit,
            @SerializedName("files")     List<String> files,
            @SerializedName("timestamp") String timestamp
    ) {
        public DiffMeta {
            files = files == null ? List.of() : List.copyOf(files);
        }
    }

    public record Removed(
            @SerializedName("nodes") List<String> nodes,
            @SerializedName("edges") List<EdgeKey> edges
    ) {
        public Removed {
            nodes = nodes == null ? List.of() : List.copyOf(nodes);
            edges = edges == null ? List.of() : List.copyOf(edges);
        }
    }

    public record DiffData(
            @SerializedName("meta")    DiffMeta meta,
            @SerializedName("added")   GraphData added,
            @SerializedName("updated") GraphData updated,
            @SerializedName("removed") Removed removed
    ) {
        public DiffData {
            Objects.requireNonNull(meta, "meta");
            added = added == null ? GraphData.empty() : added;
            updated = updated == null ? GraphData.empty() : updated;
            removed = removed == null ? new Removed(List.of(), List.of()) : removed;
        }
    }
}
