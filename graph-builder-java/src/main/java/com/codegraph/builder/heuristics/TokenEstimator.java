package com.codegraph.builder.heuristics;

/**
 * chars/4 token estimate, rounded up.
 */
public final class TokenEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static int forNode(String shortSummary, String sig) {
        return estimate(shortSummary) + estimate(sig);
    }
}
