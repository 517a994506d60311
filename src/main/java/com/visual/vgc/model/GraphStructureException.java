package com.visual.vgc.model;

import java.util.UUID;

/**
 * Raised when an operation would break the graph's structure: a duplicate node
 * id, or a cycle in the execution flow.
 */
public class GraphStructureException extends IllegalStateException {

    public GraphStructureException(String message) {
        super(message);
    }

    public static GraphStructureException duplicateId(UUID id) {
        return new GraphStructureException("Node with ID " + id + " already exists");
    }

    public static GraphStructureException cycle(Node node) {
        return new GraphStructureException("Cycle detected in execution graph at node '" + node.title()
                + "' (" + node.id() + ")");
    }
}
