package com.codegraph.builder.adapter;

/**
 * A single source file could not be parsed. Never fatal for the run.
 */
public class ParseException extends RuntimeException {
    public ParseException(String message) { super(message); }
    public ParseException(String message, Throwable cause) { super(message, cause); }
}
