package com.codegraph.builder.extract;

import com.codegraph.builder.graph.GraphModel.CodeEdge;
import com.codegraph.builder.graph.GraphModel.EdgeKey;
import com.codegraph.builder.graph.GraphModel.Location;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges edge drafts by (from, to, type): counts add up and call-site locations are
 * appended in arrival order, up to a per-edge cap. Past the cap only the count grows.
 */
public class EdgeAggregator {

    private final int maxLocationsPerEdge;
    private final Map<EdgeKey, Accumulator> edges = new LinkedHashMap<>();

    public EdgeAggregator(int maxLocationsPerEdge) {
        if (maxLocationsPerEdge < 1) {
            throw new IllegalArgumentException("maxLocationsPerEdge must be positive: " + maxLocationsPerEdge);
        }
        this.maxLocationsPerEdge = maxLocationsPerEdge;
    }

    public synchronized void add(CodeEdge draft) {
        Accumulator acc = edges.computeIfAbsent(draft.key(), k -> new Accumulator());
        acc.count += Math.max(1, draft.count());
        for (Location location : draft.locations()) {
            if (acc.locations.size() >= maxLocationsPerEdge) break;
            acc.locations.add(location);
        }
    }

    /** Immutable snapshot in first-seen order. */
    public synchronized List<CodeEdge> edges() {
        List<CodeEdge> result = new ArrayList<>(edges.size());
        for (Map.Entry<EdgeKey, Accumulator> e : edges.entrySet()) {
            EdgeKey key = e.getKey();
            Accumulator acc = e.getValue();
            result.add(new CodeEdge(key.from(), key.to(), key.type(), acc.count, acc.locations));
        }
        return List.copyOf(result);
    }

    public synchronized int size() {
        return edges.size();
    }

    private static final class Accumulator {
        int count;
        final List<Location> locations = new ArrayList<>();
    }
}
