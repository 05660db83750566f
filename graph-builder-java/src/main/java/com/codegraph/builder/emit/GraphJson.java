package com.codegraph.builder.emit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Gson configured for every JSON document this tool writes.
 */
public final class GraphJson {

    public static final Gson PRETTY = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    public static final Gson COMPACT = new GsonBuilder()
        .disableHtmlEscaping()
        .create();

    private GraphJson() {}
}
