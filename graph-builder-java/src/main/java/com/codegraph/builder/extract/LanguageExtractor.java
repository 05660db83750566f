package com.codegraph.builder.extract;

import com.codegraph.builder.adapter.ParsedFile;
import com.codegraph.builder.adapter.ParsedFile.RawCall;
import com.codegraph.builder.adapter.ParsedFile.RawDeclaration;
import com.codegraph.builder.adapter.ParsedFile.RawImport;
import com.codegraph.builder.adapter.ParsedFile.RawParameter;
import com.codegraph.builder.adapter.ParsedFile.RawSupertype;
import com.codegraph.builder.adapter.ParserAdapter;
import com.codegraph.builder.adapter.SourceFileWalker;
import com.codegraph.builder.extract.FileExtraction.PendingReference;
import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.EdgeType;
import com.codegraph.builder.graph.GraphModel.Location;
import com.codegraph.builder.graph.GraphModel.NodeKind;
import com.codegraph.builder.heuristics.CyclomaticComplexity;
import com.codegraph.builder.heuristics.Summaries;
import com.codegraph.builder.heuristics.TagDetector;
import com.codegraph.builder.normalize.NodeDraft;
import com.codegraph.builder.normalize.NodeNormalizer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns one language adapter's raw output into normalized nodes, containment edges
 * and pending cross-file references. Stateless per file; safe to call from several
 * worker threads when the adapter is.
 */
public class LanguageExtractor {

    private static final String ANY = "any";

    private final ParserAdapter adapter;
    private final NodeNormalizer normalizer = new NodeNormalizer();

    public LanguageExtractor(ParserAdapter adapter) {
        this.adapter = adapter;
    }

    public String language() {
        return adapter.language();
    }

    /**
     * @throws com.codegraph.builder.adapter.ParseException if the adapter cannot parse the file
     */
    public FileExtraction extract(Path projectRoot, Path file) {
        String path = SourceFileWalker.relativize(projectRoot, file);
        ParsedFile parsed = adapter.parse(projectRoot, file);

        List<CodeNode> nodes = new ArrayList<>();
        List<CodeEdge> containment = new ArrayList<>();
        Map<String, String> symbols = new LinkedHashMap<>();
        List<PendingReference> references = new ArrayList<>();

        NodeDraft fileDraft = new NodeDraft(NodeKind.FILE, path, "");
        fileDraft.shortSummary = "File: " + path;
        fileDraft.file = path;
        CodeNode fileNode = normalizer.normalize(fileDraft);
        nodes.add(fileNode);

        Map<String, RawDeclaration> bySymbol = new HashMap<>();
        for (RawDeclaration d : parsed.getDeclarations()) {
            if (d.symbol != null) bySymbol.putIfAbsent(d.symbol, d);
        }
        Map<String, Long> fqnameCounts = parsed.getDeclarations().stream()
            .filter(d -> d.symbol != null)
            .collect(Collectors.groupingBy(d -> qualifiedName(d, bySymbol), Collectors.counting()));

        for (RawDeclaration decl : parsed.getDeclarations()) {
            NodeKind kind = kindOf(decl.kind);
            if (kind == null || decl.symbol == null || decl.name == null) {
                System.err.println("[graph-builder] WARNING: " + path + ": skipping declaration "
                    + decl.name + " of unknown kind " + decl.kind);
                continue;
            }
            if (symbols.containsKey(decl.symbol)) continue;

            String qualified = qualifiedName(decl, bySymbol);
            if (kind.isExecutable() && fqnameCounts.getOrDefault(qualified, 0L) > 1) {
                qualified += "(" + paramTypes(decl) + ")";
            }
            CodeNode node = normalizer.normalize(draftOf(decl, kind, path, path + ":" + qualified));
            nodes.add(node);
            symbols.put(decl.symbol, node.id());

            for (RawSupertype st : decl.getSupertypes()) {
                EdgeType type = supertypeEdge(st.relation);
                if (type != null) {
                    references.add(new PendingReference(node.id(), type, st.symbol, null, null));
                }
            }
        }

        // CONTAINS once every declaration of the file has an id
        for (RawDeclaration decl : parsed.getDeclarations()) {
            String childId = decl.symbol == null ? null : symbols.get(decl.symbol);
            if (childId == null || bySymbol.get(decl.symbol) != decl) continue;
            String parentId = decl.parent == null ? null : symbols.get(decl.parent);
            String from = parentId != null ? parentId : fileNode.id();
            containment.add(new CodeEdge(from, childId, EdgeType.CONTAINS, 1, List.of()));
        }

        for (RawCall call : parsed.getCalls()) {
            String callerId = call.caller == null ? null : symbols.get(call.caller);
            String from = callerId != null ? callerId : fileNode.id();
            references.add(new PendingReference(from, EdgeType.CALLS, call.callee, null, new Location(path, call.line)));
        }

        for (RawImport imp : parsed.getImports()) {
            references.add(new PendingReference(fileNode.id(), EdgeType.IMPORTS, imp.targetSymbol, imp.targetPath, null));
        }

        return new FileExtraction(path, adapter.language(), nodes, containment, symbols, references);
    }

    private NodeDraft draftOf(RawDeclaration decl, NodeKind kind, String path, String fqname) {
        NodeDraft draft = new NodeDraft(kind, fqname, signatureOf(decl, kind));
        draft.file = path;
        draft.startLine = decl.startLine > 0 ? decl.startLine : null;
        draft.endLine = decl.endLine > 0 ? decl.endLine : draft.startLine;

        if (kind.isExecutable()) {
            List<String> paramNames = decl.getParams().stream().map(p -> p.name).collect(Collectors.toList());
            draft.shortSummary = Summaries.synthesize(decl.doc, decl.name, paramNames);
            draft.complexity = decl.complexity != null ? decl.complexity : CyclomaticComplexity.count(decl.body);
            draft.tags = TagDetector.detect(decl.body, draft.sig);
        } else {
            draft.shortSummary = Summaries.describe(decl.doc, kind.label(), decl.name);
        }
        return draft;
    }

    /** {@code (t1,t2)->R} for callables, {@code <keyword> Name} for everything else. */
    static String signatureOf(RawDeclaration decl, NodeKind kind) {
        if (kind.isExecutable()) {
            String ret = decl.returnType == null || decl.returnType.isBlank() ? ANY : decl.returnType.trim();
            return "(" + paramTypes(decl) + ")->" + ret;
        }
        return kind.name().toLowerCase(Locale.ROOT) + " " + decl.name;
    }

    private static String paramTypes(RawDeclaration decl) {
        return decl.getParams().stream()
            .map(LanguageExtractor::paramLabel)
            .collect(Collectors.joining(","));
    }

    private static String paramLabel(RawParameter p) {
        if (p.type != null && !p.type.isBlank()) return p.type.trim();
        return p.name != null ? p.name : ANY;
    }

    /** Name nested through its parents with '.', e.g. {@code Outer.Inner.method}. */
    static String qualifiedName(RawDeclaration decl, Map<String, RawDeclaration> bySymbol) {
        StringBuilder sb = new StringBuilder(decl.name == null ? "" : decl.name);
        RawDeclaration current = decl;
        int depth = 0;
        while (current.parent != null && depth++ < 64) {
            RawDeclaration parent = bySymbol.get(current.parent);
            if (parent == null || parent == current) break;
            sb.insert(0, parent.name + ".");
            current = parent;
        }
        return sb.toString();
    }

    static NodeKind kindOf(String rawKind) {
        if (rawKind == null) return null;
        switch (rawKind.toLowerCase(Locale.ROOT)) {
            case "function":
                return NodeKind.FUNCTION;
            case "method":
            case "constructor":
                return NodeKind.METHOD;
            case "class":
            case "enum":
            case "record":
                return NodeKind.CLASS;
            case "interface":
                return NodeKind.INTERFACE;
            case "type":
                return NodeKind.TYPE;
            case "module":
                return NodeKind.MODULE;
            default:
                return null;
        }
    }

    private static EdgeType supertypeEdge(String relation) {
        if ("extends".equalsIgnoreCase(relation)) return EdgeType.EXTENDS;
        if ("implements".equalsIgnoreCase(relation)) return EdgeType.IMPLEMENTS;
        return null;
    }
}
