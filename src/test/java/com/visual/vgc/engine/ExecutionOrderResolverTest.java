package com.visual.vgc.engine;

import com.visual.vgc.model.Graph;
import com.visual.vgc.model.GraphStructureException;
import com.visual.vgc.model.Node;
import com.visual.vgc.node.BranchNode;
import com.visual.vgc.node.LiteralNode;
import com.visual.vgc.node.PinNames;
import com.visual.vgc.node.PrintNode;
import com.visual.vgc.node.StartNode;
import com.visual.vgc.types.TypeCatalog;
import com.visual.vgc.types.TypeCompatibilityChecker;
import com.visual.vgc.types.Types;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ExecutionOrderResolverTest {

    private final ExecutionOrderResolver resolver = new ExecutionOrderResolver();
    private Graph graph;

    @Before
    public void setUp() {
        graph = new Graph("order", new TypeCompatibilityChecker(TypeCatalog.standard()));
    }

    private void link(Node from, String output, Node to) {
        assertNotNull(graph.addConnection(from.output(output).id(), to.input(PinNames.EXEC).id()));
    }

    @Test
    public void testEmptyGraph() {
        assertTrue(resolver.resolve(graph).isEmpty());
    }

    @Test
    public void testLinearChainRegardlessOfInsertionOrder() {
        PrintNode c = new PrintNode();
        PrintNode b = new PrintNode();
        StartNode a = new StartNode();
        graph.addNode(c);
        graph.addNode(b);
        graph.addNode(a);
        link(a, PinNames.START, b);
        link(b, PinNames.EXEC, c);

        assertEquals(List.of(a, b, c), resolver.resolve(graph));
    }

    @Test
    public void testEveryEdgeRespected() {
        StartNode start = new StartNode();
        BranchNode branch = new BranchNode();
        PrintNode yes = new PrintNode();
        PrintNode no = new PrintNode();
        PrintNode after = new PrintNode();
        for (Node n : List.of(after, no, yes, branch, start))
            graph.addNode(n);
        link(start, PinNames.START, branch);
        link(branch, PinNames.TRUE, yes);
        link(branch, PinNames.FALSE, no);
        link(yes, PinNames.EXEC, after);
        link(no, PinNames.EXEC, after);

        List<Node> order = resolver.resolve(graph);
        assertEquals(5, order.size());
        for (Node n : order) {
            for (Node next : graph.executionSuccessors(n))
                assertTrue(order.indexOf(n) < order.indexOf(next));
        }
    }

    @Test
    public void testPureDataNodesAreLeftOut() {
        StartNode start = new StartNode();
        LiteralNode literal = new LiteralNode(Types.STRING, "hi");
        graph.addNode(literal);
        graph.addNode(start);

        assertEquals(List.of(start), resolver.resolve(graph));
    }

    @Test(expected = GraphStructureException.class)
    public void testCycleFails() {
        PrintNode a = new PrintNode();
        PrintNode b = new PrintNode();
        graph.addNode(a);
        graph.addNode(b);
        link(a, PinNames.EXEC, b);
        link(b, PinNames.EXEC, a);
        resolver.resolve(graph);
    }
}
