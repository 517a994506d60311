package com.visual.vgc.engine;

import com.visual.vgc.model.Graph;
import com.visual.vgc.model.GraphStructureException;
import com.visual.vgc.model.Node;

import java.util.*;

/**
 * Orders the nodes that take part in control flow.
 *
 * <p>
 * Depth-first search seeded in graph storage order, producing reverse
 * post-order: for every execution edge A to B, A comes before B. Nodes without
 * any execution pin are left out; the source generator pulls them in through
 * data edges when it needs their value.
 *
 * <p>
 * Stateless, so one instance can be shared.
 */
public final class ExecutionOrderResolver {

    private enum Mark {
        IN_PROGRESS, DONE
    }

    /**
     * @throws GraphStructureException if execution edges form a cycle. No partial
     *                                 order is returned.
     */
    public List<Node> resolve(Graph graph) {
        Map<UUID, Mark> marks = new HashMap<>();
        Deque<Node> order = new ArrayDeque<>();
        for (Node node : graph.nodes()) {
            if (!marks.containsKey(node.id()))
                visit(graph, node, marks, order);
        }

        List<Node> result = new ArrayList<>(order.size());
        for (Node n : order)
            if (n.hasExecutionPins())
                result.add(n);
        return result;
    }

    private void visit(Graph graph, Node node, Map<UUID, Mark> marks, Deque<Node> order) {
        Mark mark = marks.get(node.id());
        if (mark == Mark.IN_PROGRESS)
            throw GraphStructureException.cycle(node);
        if (mark == Mark.DONE)
            return;

        marks.put(node.id(), Mark.IN_PROGRESS);
        for (Node next : graph.executionSuccessors(node))
            visit(graph, next, marks, order);
        marks.put(node.id(), Mark.DONE);
        order.addFirst(node);
    }
}
