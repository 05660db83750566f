package com.codegraph.builder.config;

import com.codegraph.builder.adapter.SourceFilter;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deserialized form of the optional graph-builder.json at the project root.
 * Every field is optional; getters supply the defaults.
 */
public class GraphBuilderConfig {

    public static final String FILE_NAME = "graph-builder.json";

    public static final int DEFAULT_MAX_LOCATIONS_PER_EDGE = 100;

    /** Languages to scan (default: every language with an adapter). */
    @SerializedName("languages")
    private List<String> languages;

    /** Directory names added to the default exclusion set. */
    @SerializedName("exclude_dirs")
    private List<String> excludeDirs;

    /** Max files per language, 0 = unlimited (default: 0). */
    @SerializedName("limit")
    private Integer limit;

    /** Extraction worker threads (default: available processors). */
    @SerializedName("parallelism")
    private Integer parallelism;

    /** Whole-scan timeout, 0 = none (default: 0). */
    @SerializedName("timeout_seconds")
    private Integer timeoutSeconds;

    @SerializedName("max_locations_per_edge")
    private Integer maxLocationsPerEdge;

    /** External parser commands for languages without a built-in adapter. */
    @SerializedName("adapters")
    private List<AdapterCommand> adapters;

    public static class AdapterCommand {
        @SerializedName("language")   public String language;
        @SerializedName("extensions") public List<String> extensions;
        /** Command line; the absolute path of the file to parse is appended. */
        @SerializedName("command")    public List<String> command;

        public List<String> getExtensions() { return extensions != null ? extensions : Collections.emptyList(); }
        public List<String> getCommand()    { return command    != null ? command    : Collections.emptyList(); }
    }

    public List<String> getLanguages()   { return languages   != null ? languages   : Collections.emptyList(); }
    public List<String> getExcludeDirs() { return excludeDirs != null ? excludeDirs : Collections.emptyList(); }
    public int getLimit()                { return limit != null ? Math.max(0, limit) : 0; }
    public int getParallelism() {
        return parallelism != null && parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }
    public int getTimeoutSeconds()       { return timeoutSeconds != null ? Math.max(0, timeoutSeconds) : 0; }
    public int getMaxLocationsPerEdge() {
        return maxLocationsPerEdge != null && maxLocationsPerEdge > 0 ? maxLocationsPerEdge : DEFAULT_MAX_LOCATIONS_PER_EDGE;
    }
    public List<AdapterCommand> getAdapters() { return adapters != null ? adapters : Collections.emptyList(); }

    public void setLanguages(List<String> languages) { this.languages = languages; }
    public void setLimit(Integer limit)              { this.limit = limit; }
    public void setParallelism(Integer parallelism)  { this.parallelism = parallelism; }
    public void setTimeoutSeconds(Integer seconds)   { this.timeoutSeconds = seconds; }

    /** Default exclusions plus the configured extra directory names. */
    public SourceFilter sourceFilter() {
        Set<String> excluded = new LinkedHashSet<>(SourceFilter.DEFAULT_EXCLUSIONS);
        excluded.addAll(getExcludeDirs());
        return new SourceFilter(excluded, getLimit());
    }
}
