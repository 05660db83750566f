package com.codegraph.builder.emit;

/**
 * An output document could not be written or read back.
 */
public class EmitException extends RuntimeException {
    public EmitException(String msg) { super(msg); }
    public EmitException(String msg, Throwable cause) { super(msg, cause); }
}
