package com.codegraph.builder.vcs;

/**
 * Version-control information could not be obtained.
 */
public class VcsException extends RuntimeException {
    public VcsException(String msg) { super(msg); }
    public VcsException(String msg, Throwable cause) { super(msg, cause); }
}
