package com.visual.vgc.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of {@link Graph#validate()}.
 *
 * @param errorsByNode node id to messages. Graph-wide problems are keyed by the
 *                     graph id.
 */
public record GraphValidationResult(boolean valid, Map<UUID, List<String>> errorsByNode) {
    public GraphValidationResult {
        errorsByNode = Map.copyOf(errorsByNode);
    }
}
