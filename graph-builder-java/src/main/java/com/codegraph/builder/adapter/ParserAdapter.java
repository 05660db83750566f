package com.codegraph.builder.adapter;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-language parsing capability. Implementations turn source text into raw
 * declarations; they never build graph nodes themselves.
 */
public interface ParserAdapter {

    /** Language name as used in configuration, e.g. {@code java}. */
    String language();

    /**
     * @throws AdapterUnavailableException if this adapter cannot run in the current environment
     */
    void checkAvailable(Path projectRoot);

    /**
     * Source files this adapter handles under {@code projectRoot}, sorted by path.
     */
    List<Path> listSourceFiles(Path projectRoot, SourceFilter filter);

    /**
     * @param projectRoot absolute project root
     * @param file        absolute path of a file returned by {@link #listSourceFiles}
     * @throws ParseException if this file cannot be parsed
     */
    ParsedFile parse(Path projectRoot, Path file);
}
