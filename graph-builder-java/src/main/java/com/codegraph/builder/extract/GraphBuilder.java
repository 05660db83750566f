package com.codegraph.builder.extract;

import com.codegraph.builder.adapter.ParseException;
import com.codegraph.builder.adapter.ParserAdapter;
import com.codegraph.builder.adapter.SourceFileWalker;
import com.codegraph.builder.adapter.SourceFilter;
import com.codegraph.builder.extract.FileExtraction.PendingReference;
import com.codegraph.builder.extract.ScanResult.Failure;
import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.CodeNode;
import com.codegraph.builder.graph.GraphModel.EdgeType;
import com.codegraph.builder.graph.GraphModel.GraphData;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates a full scan: lists files per language, extracts them on a bounded
 * worker pool, and aggregates the results on the calling thread in file order.
 *
 * Aggregation happens in two passes. The first collects nodes (first occurrence of an
 * id wins), CONTAINS edges and the symbol/path indexes. The second resolves pending
 * references against those indexes; a reference that cannot be resolved produces no
 * edge and marks its source node unresolved.
 */
public class GraphBuilder {

    private final int parallelism;
    private final int timeoutSeconds;
    private final int maxLocationsPerEdge;

    public GraphBuilder(int parallelism, int timeoutSeconds, int maxLocationsPerEdge) {
        this.parallelism = Math.max(1, parallelism);
        this.timeoutSeconds = Math.max(0, timeoutSeconds);
        this.maxLocationsPerEdge = maxLocationsPerEdge;
    }

    public ScanResult scan(Path projectRoot, List<ParserAdapter> adapters, SourceFilter filter) {
        Path root = projectRoot.toAbsolutePath().normalize();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, daemonThreads());
        List<Task> tasks = new ArrayList<>();
        Aggregation aggregation = new Aggregation(maxLocationsPerEdge);
        List<Failure> failures = new ArrayList<>();
        boolean timedOut = false;

        try {
            for (ParserAdapter adapter : adapters) {
                LanguageExtractor extractor = new LanguageExtractor(adapter);
                List<Path> files = adapter.listSourceFiles(root, filter);
                System.err.println("[graph-builder] " + adapter.language() + ": " + files.size() + " source files");
                for (Path file : files) {
                    String path = SourceFileWalker.relativize(root, file);
                    tasks.add(new Task(path, pool.submit(() -> extractor.extract(root, file))));
                }
            }

            long deadline = timeoutSeconds > 0 ? System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds) : Long.MAX_VALUE;
            int outstanding = 0;
            for (Task task : tasks) {
                if (timedOut && !task.future.isDone()) {
                    // past the deadline only finished work is collected
                    task.future.cancel(true);
                    outstanding++;
                    continue;
                }
                try {
                    aggregation.accept(await(task, deadline));
                } catch (TimeoutException e) {
                    timedOut = true;
                    task.future.cancel(true);
                    outstanding++;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof ParseException) {
                        System.err.println("[graph-builder] WARNING: failed to parse " + task.path + ": " + cause.getMessage());
                    } else {
                        System.err.println("[graph-builder] ERROR: extraction of " + task.path + " failed: " + cause);
                    }
                    failures.add(new Failure(task.path, String.valueOf(cause.getMessage())));
                } catch (CancellationException e) {
                    failures.add(new Failure(task.path, "cancelled"));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    timedOut = true;
                    task.future.cancel(true);
                    outstanding++;
                }
            }

            if (timedOut) {
                System.err.println("[graph-builder] WARNING: scan timed out after " + timeoutSeconds
                    + "s; " + outstanding + " file(s) not processed, keeping partial results");
            }
        } finally {
            pool.shutdownNow();
        }

        GraphData graph = aggregation.resolve();
        System.err.println("[graph-builder] Scan complete: " + graph.nodes().size() + " nodes, "
            + graph.edges().size() + " edges, " + failures.size() + " failed file(s)");
        return new ScanResult(graph, failures, aggregation.filesAccepted, timedOut);
    }

    private record Task(String path, Future<FileExtraction> future) {}

    private FileExtraction await(Task task, long deadline)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (task.future.isDone() || timeoutSeconds == 0) {
            return task.future.get();
        }
        return task.future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "graph-builder-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Single-threaded accumulator owned by the scanning thread.
     */
    static final class Aggregation {

        private final Map<String, CodeNode> nodesById = new LinkedHashMap<>();
        private final EdgeAggregator edges;
        private final Map<String, String> symbolIndex = new HashMap<>();   // language + symbol -> node id
        private final Map<String, String> pathIndex = new HashMap<>();     // file path -> file node id
        private final List<PendingReference> pending = new ArrayList<>();
        private int filesAccepted;

        Aggregation(int maxLocationsPerEdge) {
            this.edges = new EdgeAggregator(maxLocationsPerEdge);
        }

        void accept(FileExtraction extraction) {
            filesAccepted++;
            for (CodeNode node : extraction.nodes()) {
                if (nodesById.putIfAbsent(node.id(), node) != null) {
                    System.err.println("[graph-builder] WARNING: duplicate node ID ignored: " + node.id()
                        + " (" + node.fqname() + ")");
                }
            }
            if (!extraction.nodes().isEmpty()) {
                pathIndex.putIfAbsent(extraction.path(), extraction.nodes().get(0).id());
            }
            for (Map.Entry<String, String> e : extraction.symbols().entrySet()) {
                symbolIndex.putIfAbsent(symbolKey(extraction.language(), e.getKey()), e.getValue());
            }
            for (CodeEdge edge : extraction.containment()) {
                edges.add(edge);
            }
            for (PendingReference ref : extraction.references()) {
                pending.add(new PendingReference(ref.from(), ref.type(),
                    ref.targetSymbol() == null ? null : symbolKey(extraction.language(), ref.targetSymbol()),
                    ref.targetPath(), ref.location()));
            }
        }

        GraphData resolve() {
            Set<String> unresolved = new HashSet<>();
            for (PendingReference ref : pending) {
                String target = targetOf(ref);
                if (target == null) {
                    unresolved.add(ref.from());
                    continue;
                }
                if (ref.type() == EdgeType.IMPORTS && target.equals(ref.from())) continue;
                edges.add(new CodeEdge(ref.from(), target, ref.type(), 1,
                    ref.location() == null ? List.of() : List.of(ref.location())));
            }

            List<CodeNode> nodes = new ArrayList<>(nodesById.size());
            for (CodeNode node : nodesById.values()) {
                nodes.add(unresolved.contains(node.id()) ? node.withUnresolved(true) : node);
            }
            return new GraphData(nodes, edges.edges());
        }

        private String targetOf(PendingReference ref) {
            if (ref.type() != EdgeType.IMPORTS) {
                return ref.targetSymbol() == null ? null : symbolIndex.get(ref.targetSymbol());
            }
            if (ref.targetPath() != null) {
                String fileId = pathIndex.get(ref.targetPath());
                if (fileId != null) return fileId;
            }
            if (ref.targetSymbol() == null) return null;
            String nodeId = symbolIndex.get(ref.targetSymbol());
            CodeNode node = nodeId == null ? null : nodesById.get(nodeId);
            return node == null || node.file() == null ? null : pathIndex.get(node.file());
        }

        private static String symbolKey(String language, String symbol) {
            return language + "\u0000" + symbol;
        }
    }
}
