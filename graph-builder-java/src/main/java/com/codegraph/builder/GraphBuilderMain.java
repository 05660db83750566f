package com.codegraph.builder;

import com.codegraph.builder.adapter.ParserAdapter;
import com.codegraph.builder.adapter.ParserAdapterRegistry;
import com.codegraph.builder.config.ConfigReader;
import com.codegraph.builder.config.GraphBuilderConfig;
import com.codegraph.builder.diff.GraphDiffer;
import com.codegraph.builder.emit.CsvEmitter;
import com.codegraph.builder.emit.EmitException;
import com.codegraph.builder.emit.JsonEmitter;
import com.codegraph.builder.emit.SnapshotStore;
import com.codegraph.builder.extract.GraphBuilder;
import com.codegraph.builder.extract.ScanResult;
import com.codegraph.builder.graph.GraphModel.DiffData;
import com.codegraph.builder.graph.GraphModel.GraphData;
import com.codegraph.builder.vcs.ChangeSource;
import com.codegraph.builder.vcs.GitChangeSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for the graph-builder command line.
 *
 * Usage:
 *   java -jar graph-builder-java.jar scan      --project <dir> --out <dir> [--languages java,ts] [--limit n] [--config file]
 *   java -jar graph-builder-java.jar emit-csv  --out <dir>
 *   java -jar graph-builder-java.jar emit-json --out <dir> [--tag t]
 *   java -jar graph-builder-java.jar diff      --project <dir> --out <dir> [--since ref] [--config file]
 */
public class GraphBuilderMain {

    static final String DEFAULT_SINCE = "HEAD~1";

    private static final String USAGE = "Usage: java -jar graph-builder-java.jar "
            + "scan --project <dir> --out <dir> [--languages a,b] [--limit n] [--config file] | "
            + "emit-csv --out <dir> | emit-json --out <dir> [--tag t] | "
            + "diff --project <dir> --out <dir> [--since ref] [--config file]";

    private static final Set<String> SCAN_FLAGS = Set.of("--project", "--out", "--languages", "--limit", "--config");
    private static final Set<String> DIFF_FLAGS = Set.of("--project", "--out", "--since", "--languages", "--limit", "--config");

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[graph-builder] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[graph-builder] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        run(args, new GitChangeSource());
    }

    static void run(String[] args, ChangeSource changeSource) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        switch (args[0]) {
            case "scan" -> scan(parseFlags(rest, SCAN_FLAGS));
            case "emit-csv" -> emitCsv(parseFlags(rest, Set.of("--out")));
            case "emit-json" -> emitJson(parseFlags(rest, Set.of("--out", "--tag")));
            case "diff" -> diff(parseFlags(rest, DIFF_FLAGS), changeSource);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    // --- Commands ---

    static ScanResult scan(Map<String, String> flags) {
        Path project = requireProject(flags);
        Path out = Paths.get(require(flags, "--out"));

        ScanResult result = buildGraph(project, flags);
        new SnapshotStore(out).write(result.graph());
        System.err.println("[graph-builder] Done.");
        return result;
    }

    private static void emitCsv(Map<String, String> flags) {
        Path out = Paths.get(require(flags, "--out"));
        new CsvEmitter().write(readSnapshot(out), out);
    }

    private static void emitJson(Map<String, String> flags) {
        Path out = Paths.get(require(flags, "--out"));
        new JsonEmitter().emitBatch(readSnapshot(out), out, flags.get("--tag"));
    }

    static DiffData diff(Map<String, String> flags, ChangeSource changeSource) {
        Path project = requireProject(flags);
        Path out = Paths.get(require(flags, "--out"));
        String since = flags.getOrDefault("--since", DEFAULT_SINCE);

        List<String> changed = changeSource.changedFiles(project, since);
        String commit = changeSource.headCommit(project);
        System.err.println("[graph-builder] " + changed.size() + " file(s) changed since " + since + " (HEAD " + commit + ")");

        SnapshotStore store = new SnapshotStore(out);
        GraphData previous = store.read().orElseGet(() -> {
            System.err.println("[graph-builder] WARNING: no previous snapshot at " + store.path() + ", diffing against an empty graph");
            return GraphData.empty();
        });

        GraphData current = buildGraph(project, flags).graph();
        DiffData diff = new GraphDiffer().diff(previous, current, changed, commit, Instant.now().toString());
        System.err.println("[graph-builder] Diff: " + diff.added().nodes().size() + " added, "
                + diff.updated().nodes().size() + " updated, " + diff.removed().nodes().size() + " removed nodes");

        new JsonEmitter().emitDiff(diff, out);
        store.write(current);
        System.err.println("[graph-builder] Done.");
        return diff;
    }

    // --- Helpers ---

    private static ScanResult buildGraph(Path project, Map<String, String> flags) {
        GraphBuilderConfig config = flags.containsKey("--config")
                ? new ConfigReader().read(Paths.get(flags.get("--config")))
                : new ConfigReader().readProject(project);
        if (flags.containsKey("--languages")) {
            config.setLanguages(splitList(flags.get("--languages")));
        }
        if (flags.containsKey("--limit")) {
            config.setLimit(parseInt(flags.get("--limit"), "--limit"));
        }

        List<ParserAdapter> adapters = new ParserAdapterRegistry(config).enabled(config.getLanguages(), project);
        if (adapters.isEmpty()) {
            System.err.println("[graph-builder] WARNING: no language enabled, the graph will be empty");
        }

        System.err.println("[graph-builder] Scanning " + project + " with " + config.getParallelism() + " worker(s)");
        GraphBuilder builder = new GraphBuilder(config.getParallelism(), config.getTimeoutSeconds(), config.getMaxLocationsPerEdge());
        return builder.scan(project, adapters, config.sourceFilter());
    }

    private static GraphData readSnapshot(Path out) {
        SnapshotStore store = new SnapshotStore(out);
        return store.read().orElseThrow(() ->
                new EmitException("No snapshot found at " + store.path() + "; run scan first"));
    }

    private static Path requireProject(Map<String, String> flags) {
        Path project = Paths.get(require(flags, "--project")).toAbsolutePath().normalize();
        if (!Files.isDirectory(project)) {
            throw new UsageException("--project is not a directory: " + project);
        }
        return project;
    }

    static Map<String, String> parseFlags(String[] args, Set<String> allowed) {
        Map<String, String> flags = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (!allowed.contains(flag)) {
                throw new UsageException("Unknown flag: " + flag);
            }
            flags.put(flag, requireNext(args, i++, flag));
        }
        return flags;
    }

    private static String require(Map<String, String> flags, String flag) {
        String value = flags.get(flag);
        if (value == null) throw new UsageException(flag + " is required");
        return value;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static int parseInt(String value, String flag) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects a number, got: " + value);
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String s : value.split(",")) {
            if (!s.isBlank()) items.add(s.trim());
        }
        return items;
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
