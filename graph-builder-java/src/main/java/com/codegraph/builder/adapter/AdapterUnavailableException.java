package com.codegraph.builder.adapter;

/**
 * A parser adapter cannot run at all; its language is skipped for the run.
 */
public class AdapterUnavailableException extends RuntimeException {
    public AdapterUnavailableException(String message) { super(message); }
    public AdapterUnavailableException(String message, Throwable cause) { super(message, cause); }
}
