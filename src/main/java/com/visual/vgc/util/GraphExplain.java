package com.visual.vgc.util;

import com.visual.vgc.engine.ExecutionOrderResolver;
import com.visual.vgc.model.Connection;
import com.visual.vgc.model.Graph;
import com.visual.vgc.model.Node;
import com.visual.vgc.model.Pin;

import java.util.List;
import java.util.UUID;

/**
 * Diagnostic views of a graph: one node's wiring, the execution order, and a
 * Mermaid diagram.
 *
 * <p>
 * Intended for debugging and the explain endpoint. Allocates freely.
 */
public final class GraphExplain {
    private final Graph graph;
    private final ExecutionOrderResolver resolver = new ExecutionOrderResolver();

    public GraphExplain(Graph graph) {
        this.graph = graph;
    }

    /**
     * Dumps the pins of a single node and what each is connected to.
     *
     * @throws IllegalArgumentException if the node is not in the graph
     */
    public String explainNode(UUID nodeId) {
        Node node = graph.findNode(nodeId);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.title()).append('\n')
                .append("  Id: ").append(node.id()).append('\n')
                .append("  Type: ").append(node.getClass().getSimpleName()).append('\n')
                .append("  Category: ").append(node.category()).append('\n');
        if (!node.properties().isEmpty())
            sb.append("  Properties: ").append(node.properties()).append('\n');
        for (Pin p : node.allPins()) {
            sb.append("  ").append(p.isInput() ? "in  " : "out ").append(p.name())
                    .append(" [").append(p.kind()).append(p.type() != null ? " " + p.type().sourceName() : "")
                    .append(']');
            List<Connection> conns = graph.getConnectionsFromPin(p.id());
            if (!conns.isEmpty()) {
                sb.append(p.isInput() ? " <- " : " -> ");
                for (int i = 0; i < conns.size(); i++) {
                    Connection c = conns.get(i);
                    Pin other = graph.findPin(p.isInput() ? c.sourcePinId() : c.targetPinId());
                    sb.append(graph.ownerOf(other.id()).title()).append('.').append(other.name());
                    if (i < conns.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Lists the execution order. Throws like the resolver if the execution flow
     * has a cycle.
     */
    public String dumpExecutionOrder() {
        List<Node> order = resolver.resolve(graph);
        StringBuilder sb = new StringBuilder(512);
        sb.append("Execution order (").append(order.size()).append(" of ").append(graph.nodeCount())
                .append(" nodes):\n");
        for (int i = 0; i < order.size(); i++) {
            Node node = order.get(i);
            sb.append("  [").append(i).append("] ").append(node.title());
            List<Node> next = graph.executionSuccessors(node);
            if (!next.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < next.size(); j++) {
                    sb.append(next.get(j).title());
                    if (j < next.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart. Execution edges are solid and labelled with
     * the output pin, data edges are dotted.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");
        for (Node node : graph.nodes()) {
            sb.append("  ").append(id(node)).append("[\"").append(escape(node.title())).append("\"];\n");
        }
        for (Connection c : graph.connections()) {
            Pin source = graph.findPin(c.sourcePinId());
            Pin target = graph.findPin(c.targetPinId());
            String from = id(graph.ownerOf(source.id()));
            String to = id(graph.ownerOf(target.id()));
            if (source.isExecution()) {
                sb.append("  ").append(from).append(" -- \"").append(escape(source.name())).append("\" --> ")
                        .append(to).append(";\n");
            } else {
                sb.append("  ").append(from).append(" -.-> |").append(escape(target.name())).append("| ")
                        .append(to).append(";\n");
            }
        }
        return sb.toString();
    }

    private static String id(Node node) {
        return sanitize(node.getClass().getSimpleName() + "_" + node.id().toString().substring(0, 8));
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;").replace("|", "#124;");
    }
}
