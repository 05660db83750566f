package com.codegraph.builder.extract;

import com.codegraph.builder.graph.GraphModel.GraphData;

import java.util.List;

/**
 * Outcome of one scan: the graph plus the files that contributed nothing.
 */
public record ScanResult(
    GraphData graph,
    List<Failure> failures,
    int filesScanned,
    boolean timedOut
) {
    public ScanResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public record Failure(String path, String message) {}
}
