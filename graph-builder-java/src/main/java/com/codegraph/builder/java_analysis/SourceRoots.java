package com.codegraph.builder.java_analysis;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of source root resolution: every Java source directory of the project and the
 * dependency JARs available for symbol resolution.
 */
public record SourceRoots(
    List<Path> sourceRoots,     // absolute, existing directories only
    List<Path> classpathJars    // absolute paths of dependency JARs
) {
    public SourceRoots {
        sourceRoots = sourceRoots == null ? List.of() : List.copyOf(sourceRoots);
        classpathJars = classpathJars == null ? List.of() : List.copyOf(classpathJars);
    }
}
