package com.visual.vgc.host;

/**
 * One compiler message. Line and column are 1-based, or -1 when the message is
 * not tied to a position.
 */
public record CompilerDiagnostic(Severity severity, String message, long line, long column) {

    public enum Severity {
        ERROR, WARNING, NOTE
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + (line > 0 ? " (" + line + ":" + column + ")" : "") + ": " + message;
    }
}
