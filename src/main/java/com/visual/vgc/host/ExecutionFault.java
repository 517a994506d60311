package com.visual.vgc.host;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Why a run failed: the entry point could not be found or invoked, or the
 * generated code threw.
 *
 * @param exceptionType class name of the underlying throwable, null when the
 *                      host itself rejected the request
 */
public record ExecutionFault(String message, String exceptionType, String stackTrace) {

    static ExecutionFault of(String message) {
        return new ExecutionFault(message, null, null);
    }

    static ExecutionFault of(String message, Throwable cause) {
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        String detail = cause.getMessage() == null ? message : message + ": " + cause.getMessage();
        return new ExecutionFault(detail, cause.getClass().getName(), trace.toString());
    }
}
