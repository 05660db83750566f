package com.codegraph.builder.emit;

import com.codegraph.builder.graph.GraphModel.DiffData;
import com.codegraph.builder.graph.GraphModel.EdgeKey;
import com.codegraph.builder.graph.GraphModel.GraphData;
import com.codegraph.builder.graph.GraphModel.Removed;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes batch snapshots ({@code batch-<tag>.json}) and diffs ({@code diff-<commit>.json}).
 * Every array is sorted on a copy before writing; inputs are never modified.
 */
public class JsonEmitter {

    static final int COMMIT_PREFIX_LENGTH = 8;
    static final String LATEST = "latest";

    /**
     * @param tag file name tag; null or blank means the current time
     */
    public Path emitBatch(GraphData graph, Path outputDir, String tag) {
        String effectiveTag = tag == null || tag.isBlank() ? timestampTag(Instant.now()) : tag;
        Path target = outputDir.resolve("batch-" + effectiveTag + ".json");
        GraphData sorted = OutputFiles.sorted(graph);
        OutputFiles.writeAtomically(target, w -> GraphJson.PRETTY.toJson(sorted, w));
        System.err.println("[graph-builder] Batch written: " + target);
        return target;
    }

    public Path emitDiff(DiffData diff, Path outputDir) {
        String commit = diff.meta().commit();
        String suffix = commit == null || commit.isBlank()
            ? LATEST
            : commit.substring(0, Math.min(COMMIT_PREFIX_LENGTH, commit.length()));
        Path target = outputDir.resolve("diff-" + suffix + ".json");

        List<String> removedNodes = new ArrayList<>(diff.removed().nodes());
        Collections.sort(removedNodes);
        DiffData sorted = new DiffData(
            diff.meta(),
            OutputFiles.sorted(diff.added()),
            OutputFiles.sorted(diff.updated()),
            new Removed(removedNodes, sortedKeys(diff))
        );
        OutputFiles.writeAtomically(target, w -> GraphJson.PRETTY.toJson(sorted, w));
        System.err.println("[graph-builder] Diff written: " + target);
        return target;
    }

    private static List<EdgeKey> sortedKeys(DiffData diff) {
        List<EdgeKey> keys = new ArrayList<>(diff.removed().edges());
        keys.sort(EdgeKey.ORDER);
        return keys;
    }

    /** ISO-8601 instant with ':' and '.' replaced so it is safe in file names. */
    static String timestampTag(Instant instant) {
        return instant.toString().replace(':', '-').replace('.', '-');
    }
}
