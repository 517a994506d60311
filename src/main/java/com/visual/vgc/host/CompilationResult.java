package com.visual.vgc.host;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link GraphCompiler#compile}.
 *
 * @param unit        the loadable unit, null on failure
 * @param diagnostics compiler messages in the order javac reported them
 * @param artifact    the persisted jar, null when not requested or when writing
 *                    it failed
 */
public record CompilationResult(boolean success, CompiledUnit unit, List<CompilerDiagnostic> diagnostics,
        Path artifact) {

    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    static CompilationResult failure(List<CompilerDiagnostic> diagnostics) {
        return new CompilationResult(false, null, diagnostics, null);
    }

    public List<CompilerDiagnostic> errors() {
        return diagnostics.stream().filter(CompilerDiagnostic::isError).toList();
    }
}
