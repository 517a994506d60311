package com.visual.vgc.codegen;

/**
 * Raised when a graph cannot be turned into source: an unknown declaring type or
 * method, a data cycle, a conflicting variable, or an unresolved input under the
 * strict policy. No partial source is produced.
 */
public class CodeGenerationException extends RuntimeException {

    public CodeGenerationException(String message) {
        super(message);
    }

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
