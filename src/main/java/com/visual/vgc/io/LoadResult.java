package com.visual.vgc.io;

import com.visual.vgc.model.Graph;

import java.util.List;

/**
 * A rebuilt graph plus what could not be restored.
 */
public record LoadResult(Graph graph, List<String> warnings, List<GraphDocument.LibraryDef> externalLibraries) {
    public LoadResult {
        warnings = List.copyOf(warnings);
        externalLibraries = List.copyOf(externalLibraries);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
