package com.visual.vgc;

import com.visual.vgc.codegen.GeneratedSource;
import com.visual.vgc.host.CompilerDiagnostic;
import com.visual.vgc.host.RunResult;

import java.util.List;

/**
 * Generate, compile and run in one go.
 *
 * @param run null when compilation failed
 */
public record GraphRun(GeneratedSource source, List<CompilerDiagnostic> diagnostics, RunResult run) {
    public GraphRun {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean compiled() {
        return run != null;
    }

    public boolean success() {
        return run != null && run.success();
    }
}
