package com.visual.vgc.node;

import com.visual.vgc.model.Pin;
import com.visual.vgc.types.Types;
import org.junit.Test;

import static org.junit.Assert.*;

public class NodeTemplatesTest {

    @Test
    public void testForLoopPins() {
        ForLoopNode loop = new ForLoopNode();

        assertTrue(loop.input(PinNames.EXEC).isExecution());
        assertEquals(0, loop.input(PinNames.START).defaultValue());
        assertEquals(10, loop.input(PinNames.END).defaultValue());
        assertEquals(Types.INT, loop.output(PinNames.INDEX).type());
        assertTrue(loop.output(PinNames.LOOP_BODY).isExecution());
        assertTrue(loop.output(PinNames.COMPLETED).isExecution());
    }

    @Test
    public void testSequenceOutputCount() {
        SequenceNode seq = new SequenceNode(3);

        assertEquals(3, seq.outputCount());
        assertEquals(3, seq.outputs().size());
        assertNotNull(seq.output("Then 2"));
        assertNull(seq.output("Then 3"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSequenceNeedsOutput() {
        new SequenceNode(0);
    }

    @Test
    public void testStartNeedsNoIncomingExec() {
        StartNode start = new StartNode();

        assertTrue(start.hasExecutionPins());
        assertTrue(start.validate().isEmpty());
        assertNotNull(start.output(PinNames.START));
    }

    @Test
    public void testUnconnectedExecInputIsReported() {
        ForLoopNode loop = new ForLoopNode();

        assertEquals(1, loop.validate().size());
        assertEquals("Execution input 'Exec' must be connected", loop.validate().get(0));
    }

    @Test
    public void testComparisonYieldsBoolean() {
        BinaryOperatorNode gt = new BinaryOperatorNode(BinaryOperatorNode.Operator.GREATER_THAN, Types.INT);

        assertEquals(Types.INT, gt.input(PinNames.A).type());
        assertEquals(Types.BOOLEAN, gt.output(PinNames.RESULT).type());
        assertFalse(gt.hasExecutionPins());
    }

    @Test
    public void testLogicalOperatorIgnoresOperandType() {
        BinaryOperatorNode and = new BinaryOperatorNode(BinaryOperatorNode.Operator.AND, Types.INT);

        assertEquals(Types.BOOLEAN, and.operandType());
        assertEquals(Types.BOOLEAN, and.input(PinNames.B).type());
    }

    @Test
    public void testArithmeticKeepsOperandType() {
        BinaryOperatorNode add = new BinaryOperatorNode(BinaryOperatorNode.Operator.ADD);

        assertEquals(Types.DOUBLE, add.output(PinNames.RESULT).type());
        assertEquals(BinaryOperatorNode.Operator.MODULO, BinaryOperatorNode.Operator.fromSymbol("%"));
    }

    @Test
    public void testLiteralCarriesValue() {
        LiteralNode lit = new LiteralNode(Types.STRING, "Hello");

        assertEquals("Hello", lit.value());
        assertEquals(Types.STRING, lit.literalType());
        Pin out = lit.output(PinNames.VALUE);
        assertEquals(lit.id(), out.nodeId());
        assertTrue(out.isOutput());
    }
}
