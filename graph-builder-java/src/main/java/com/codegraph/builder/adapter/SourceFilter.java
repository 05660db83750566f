package com.codegraph.builder.adapter;

import java.util.Set;

/**
 * Which files an adapter may hand out: directory names never descended into, and an
 * optional cap on the number of files per language (0 = unlimited).
 */
public record SourceFilter(
    Set<String> excludedDirectories,
    int limit
) {
    public static final Set<String> DEFAULT_EXCLUSIONS = Set.of(
        ".git", ".hg", ".svn",
        "node_modules", "target", "build", "dist", "out", ".gradle", ".idea",
        ".next", ".svelte-kit",
        "__pycache__", ".pytest_cache", ".mypy_cache",
        "venv", ".venv", "env", "site-packages"
    );

    public SourceFilter {
        excludedDirectories = excludedDirectories == null ? Set.of() : Set.copyOf(excludedDirectories);
        limit = Math.max(0, limit);
    }

    public static SourceFilter defaults() {
        return new SourceFilter(DEFAULT_EXCLUSIONS, 0);
    }
}
