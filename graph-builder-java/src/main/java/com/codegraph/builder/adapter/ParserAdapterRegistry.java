package com.codegraph.builder.adapter;

import com.codegraph.builder.config.GraphBuilderConfig;
import com.codegraph.builder.config.GraphBuilderConfig.AdapterCommand;
import com.codegraph.builder.java_analysis.JavaParserAdapter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Known parser adapters by language: the built-in Java adapter plus one
 * {@link ProcessParserAdapter} per configured command. A configured command
 * replaces a built-in adapter for the same language.
 */
public class ParserAdapterRegistry {

    private final Map<String, ParserAdapter> adapters = new LinkedHashMap<>();

    public ParserAdapterRegistry(GraphBuilderConfig config) {
        register(new JavaParserAdapter());
        for (AdapterCommand cmd : config.getAdapters()) {
            if (cmd.language == null || cmd.getCommand().isEmpty() || cmd.getExtensions().isEmpty()) {
                System.err.println("[graph-builder] WARNING: ignoring incomplete adapter entry for language " + cmd.language);
                continue;
            }
            register(new ProcessParserAdapter(normalize(cmd.language),
                new LinkedHashSet<>(cmd.getExtensions()), cmd.getCommand()));
        }
    }

    public ParserAdapterRegistry(List<ParserAdapter> adapters) {
        for (ParserAdapter adapter : adapters) register(adapter);
    }

    public void register(ParserAdapter adapter) {
        adapters.put(normalize(adapter.language()), adapter);
    }

    public List<String> knownLanguages() {
        return new ArrayList<>(adapters.keySet());
    }

    /**
     * Adapters for the requested languages (all known ones when empty) that can run
     * against {@code projectRoot}. Unknown or unavailable languages are logged and skipped.
     */
    public List<ParserAdapter> enabled(List<String> requested, Path projectRoot) {
        List<String> languages = requested == null || requested.isEmpty() ? knownLanguages() : requested;
        List<ParserAdapter> result = new ArrayList<>();
        for (String language : new LinkedHashSet<>(languages)) {
            ParserAdapter adapter = adapters.get(normalize(language));
            if (adapter == null) {
                System.err.println("[graph-builder] WARNING: no parser adapter for language '" + language + "', skipping");
                continue;
            }
            try {
                adapter.checkAvailable(projectRoot);
                result.add(adapter);
            } catch (AdapterUnavailableException e) {
                System.err.println("[graph-builder] WARNING: " + language + " disabled: " + e.getMessage());
            }
        }
        return result;
    }

    private static String normalize(String language) {
        return language.trim().toLowerCase(Locale.ROOT);
    }
}
