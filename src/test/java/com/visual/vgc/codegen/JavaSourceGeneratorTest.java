package com.visual.vgc.codegen;

import com.visual.vgc.api.OutputKind;
import com.visual.vgc.method.MethodDescriptor;
import com.visual.vgc.method.MethodRegistry;
import com.visual.vgc.model.Graph;
import com.visual.vgc.model.GraphStructureException;
import com.visual.vgc.model.Node;
import com.visual.vgc.node.*;
import com.visual.vgc.types.TypeCatalog;
import com.visual.vgc.types.TypeCompatibilityChecker;
import com.visual.vgc.types.Types;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.Assert.*;

public class JavaSourceGeneratorTest {

    private MethodRegistry registry;
    private Graph graph;
    private StartNode start;

    @Before
    public void setUp() {
        registry = MethodRegistry.standard(TypeCatalog.standard());
        graph = new Graph("demo", new TypeCompatibilityChecker(registry.catalog()));
        start = new StartNode();
        graph.addNode(start);
    }

    private String generate() {
        return generate(GenerationOptions.defaults());
    }

    private String generate(GenerationOptions options) {
        return new JavaSourceGenerator(registry, options).generate(graph).text();
    }

    private <T extends Node> T add(T node) {
        graph.addNode(node);
        return node;
    }

    private void exec(Node from, String output, Node to) {
        assertNotNull(graph.addConnection(from.output(output).id(), to.input(PinNames.EXEC).id()));
    }

    private void data(Node from, String output, Node to, String input) {
        assertNotNull(graph.addConnection(from.output(output).id(), to.input(input).id()));
    }

    @Test
    public void testHelloWorld() {
        LiteralNode hello = add(new LiteralNode(UUID.fromString("0badcafe-0000-4000-8000-000000000001"),
                Types.STRING, "Hello"));
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, print);
        data(hello, PinNames.VALUE, print, PinNames.VALUE);

        GeneratedSource source = new JavaSourceGenerator(registry, GenerationOptions.defaults()).generate(graph);
        String text = source.text();

        assertEquals("generated.VisualGraphProgram", source.qualifiedName());
        assertEquals("VisualGraphProgram.java", source.fileName());
        assertTrue(text.startsWith("package generated;"));
        assertTrue(text.contains("// Generated from graph 'demo'"));
        assertTrue(text.contains("public class VisualGraphProgram {"));
        assertTrue(text.contains("public void execute() {"));
        assertTrue(text.contains("final java.lang.String literal_0badcafe = \"Hello\";"));
        assertTrue(text.contains("System.out.println(literal_0badcafe);"));
        assertFalse(text.contains("public static void main"));
        assertTrue(text.indexOf("literal_0badcafe =") < text.indexOf("System.out.println"));
    }

    @Test
    public void testConsoleOutputAddsMain() {
        String text = generate(GenerationOptions.defaults().withOutputKind(OutputKind.CONSOLE));
        assertTrue(text.contains("public static void main(String[] args) {"));
        assertTrue(text.contains("new VisualGraphProgram().execute();"));
    }

    @Test
    public void testUnconnectedPrintPrintsEmptyLine() {
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, print);
        assertTrue(generate().contains("System.out.println(\"\");"));
    }

    @Test
    public void testBranchOmitsEmptyElse() {
        BranchNode branch = add(new BranchNode());
        PrintNode yes = add(new PrintNode());
        exec(start, PinNames.START, branch);
        exec(branch, PinNames.TRUE, yes);

        String text = generate();
        assertTrue(text.contains("if (false) {"));
        assertFalse(text.contains("else"));
    }

    @Test
    public void testBranchWithBothArms() {
        BranchNode branch = add(new BranchNode());
        LiteralNode flag = add(new LiteralNode(Types.BOOLEAN, true));
        PrintNode yes = add(new PrintNode());
        PrintNode no = add(new PrintNode());
        exec(start, PinNames.START, branch);
        exec(branch, PinNames.TRUE, yes);
        exec(branch, PinNames.FALSE, no);
        data(flag, PinNames.VALUE, branch, PinNames.CONDITION);

        String text = generate();
        assertTrue(text.contains("} else {"));
        assertEquals(2, count(text, "System.out.println"));
    }

    @Test
    public void testForLoopBindsIndex() {
        ForLoopNode loop = add(new ForLoopNode());
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, loop);
        exec(loop, PinNames.LOOP_BODY, print);
        data(loop, PinNames.INDEX, print, PinNames.VALUE);

        String text = generate();
        assertTrue(text.contains("for (int index0 = 0; index0 < 10; index0++) {"));
        assertTrue(text.contains("System.out.println(index0);"));
    }

    @Test
    public void testIndexOutsideLoopIsUnresolved() {
        ForLoopNode loop = add(new ForLoopNode());
        PrintNode after = add(new PrintNode());
        exec(start, PinNames.START, loop);
        exec(loop, PinNames.COMPLETED, after);
        data(loop, PinNames.INDEX, after, PinNames.VALUE);

        assertTrue(generate().contains("System.out.println(\"\");"));
        try {
            generate(GenerationOptions.defaults().withPolicy(UnresolvedPinPolicy.STRICT));
            fail("Strict policy must reject an out-of-scope index");
        } catch (CodeGenerationException e) {
            assertTrue(e.getMessage().contains("no value at this point"));
        }
    }

    @Test
    public void testNarrowingInsertsCast() {
        ForLoopNode loop = add(new ForLoopNode());
        LiteralNode end = add(new LiteralNode(UUID.fromString("00000000-0000-4000-8000-0000000000e0"),
                Types.DOUBLE, 3.9));
        exec(start, PinNames.START, loop);
        data(end, PinNames.VALUE, loop, PinNames.END);

        assertTrue(generate().contains("index0 < ((int) (literal_00000000));"));
    }

    @Test
    public void testWhileLoop() {
        WhileLoopNode loop = add(new WhileLoopNode());
        exec(start, PinNames.START, loop);

        String text = generate();
        assertTrue(text.contains("while (true) {"));
        assertTrue(text.contains("if (!(false)) {"));
        assertTrue(text.contains("break;"));
    }

    @Test
    public void testVariables() {
        SetVariableNode set = add(new SetVariableNode("count", Types.INT));
        GetVariableNode get = add(new GetVariableNode("count", Types.INT));
        LiteralNode five = add(new LiteralNode(Types.INT, 5));
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, set);
        exec(set, PinNames.EXEC, print);
        data(five, PinNames.VALUE, set, "count");
        data(get, "count", print, PinNames.VALUE);

        String text = generate();
        assertTrue(text.contains("int count = 0;"));
        assertTrue(text.matches("(?s).*count = literal_\\w{8};.*"));
        assertTrue(text.contains("System.out.println(count);"));
        assertTrue(text.indexOf("int count = 0;") < text.indexOf("final int literal_"));
    }

    @Test
    public void testVariableNamedLikeExecPin() {
        SetVariableNode set = add(new SetVariableNode("Exec", Types.INT));
        LiteralNode seven = add(new LiteralNode(UUID.fromString("50e70000-0000-4000-8000-000000000007"),
                Types.INT, 7));
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, set);
        exec(set, PinNames.EXEC, print);
        assertNotNull(graph.addConnection(seven.output(PinNames.VALUE).id(), set.valuePin().id()));

        String text = generate();
        assertTrue(text.contains("int Exec = 0;"));
        assertTrue(text.contains("Exec = literal_50e70000;"));
        assertEquals(1, count(text, "System.out.println"));
    }

    @Test(expected = CodeGenerationException.class)
    public void testConflictingVariableTypes() {
        add(new SetVariableNode("x", Types.INT));
        add(new GetVariableNode("x", Types.STRING));
        generate();
    }

    @Test(expected = CodeGenerationException.class)
    public void testVariableNameMustBeIdentifier() {
        add(new GetVariableNode("not valid", Types.INT));
        generate();
    }

    @Test
    public void testStrictPolicyRejectsUnsetVariableInput() {
        SetVariableNode set = add(new SetVariableNode("x", Types.INT));
        exec(start, PinNames.START, set);
        assertTrue(generate().contains("x = 0;"));
        try {
            generate(GenerationOptions.defaults().withPolicy(UnresolvedPinPolicy.STRICT));
            fail("Unset input must be rejected");
        } catch (CodeGenerationException e) {
            assertTrue(e.getMessage().contains("Unresolved input 'x'"));
        }
    }

    @Test
    public void testOperatorsAreInlined() {
        LiteralNode a = add(new LiteralNode(UUID.fromString("aaaaaaaa-0000-4000-8000-000000000000"), Types.INT, 2));
        LiteralNode b = add(new LiteralNode(UUID.fromString("bbbbbbbb-0000-4000-8000-000000000000"), Types.INT, 3));
        BinaryOperatorNode plus = add(new BinaryOperatorNode(BinaryOperatorNode.Operator.ADD, Types.INT));
        NotNode not = add(new NotNode());
        BinaryOperatorNode less = add(new BinaryOperatorNode(BinaryOperatorNode.Operator.LESS_THAN, Types.INT));
        PrintNode print = add(new PrintNode());
        PrintNode print2 = add(new PrintNode());
        exec(start, PinNames.START, print);
        exec(print, PinNames.EXEC, print2);
        data(a, PinNames.VALUE, plus, PinNames.A);
        data(b, PinNames.VALUE, plus, PinNames.B);
        data(plus, PinNames.RESULT, print, PinNames.VALUE);
        data(a, PinNames.VALUE, less, PinNames.A);
        data(b, PinNames.VALUE, less, PinNames.B);
        data(less, PinNames.RESULT, not, PinNames.VALUE);
        data(not, PinNames.RESULT, print2, PinNames.VALUE);

        String text = generate();
        assertTrue(text.contains("System.out.println((literal_aaaaaaaa + literal_bbbbbbbb));"));
        assertTrue(text.contains("System.out.println((!(literal_aaaaaaaa < literal_bbbbbbbb)));"));
    }

    @Test
    public void testReferenceEqualityUsesObjectsEquals() {
        LiteralNode a = add(new LiteralNode(Types.STRING, "x"));
        BinaryOperatorNode eq = add(new BinaryOperatorNode(BinaryOperatorNode.Operator.EQUALS));
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, print);
        data(a, PinNames.VALUE, eq, PinNames.A);
        data(eq, PinNames.RESULT, print, PinNames.VALUE);

        assertTrue(generate().contains("java.util.Objects.equals(literal_"));
    }

    @Test
    public void testPureCallIsInlined() {
        MethodCallNode max = add(new MethodCallNode(registry.resolve("java.lang.Math", "max",
                List.of("int", "int"))));
        LiteralNode a = add(new LiteralNode(UUID.fromString("aaaaaaaa-0000-4000-8000-000000000000"), Types.INT, 2));
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, print);
        data(a, PinNames.VALUE, max, max.parameterPins().get(0).name());
        data(max, PinNames.RETURN_VALUE, print, PinNames.VALUE);

        assertTrue(generate().contains("System.out.println(java.lang.Math.max(literal_aaaaaaaa, 0));"));
    }

    @Test
    public void testImpureCallResultIsDeclaredUpFront() {
        MethodCallNode parse = add(new MethodCallNode(UUID.fromString("cccccccc-0000-4000-8000-000000000000"),
                registry.resolve("java.lang.Integer", "parseInt", List.of("java.lang.String"))));
        LiteralNode text = add(new LiteralNode(UUID.fromString("dddddddd-0000-4000-8000-000000000000"),
                Types.STRING, "41"));
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, parse);
        exec(parse, PinNames.EXEC, print);
        data(text, PinNames.VALUE, parse, parse.parameterPins().get(0).name());
        data(parse, PinNames.RETURN_VALUE, print, PinNames.VALUE);

        String generated = generate();
        assertTrue(generated.contains("int result_cccccccc = 0;"));
        assertTrue(generated.contains("result_cccccccc = java.lang.Integer.parseInt(literal_dddddddd);"));
        assertTrue(generated.contains("System.out.println(result_cccccccc);"));
    }

    @Test
    public void testInstanceTargetDefaultsToNewInstance() {
        MethodCallNode append = add(new MethodCallNode(registry.resolve("java.util.ArrayList", "clear",
                List.of())));
        exec(start, PinNames.START, append);
        assertTrue(generate().contains("new java.util.ArrayList().clear();"));
    }

    @Test
    public void testReferenceParameterFallsBackToTypedNull() {
        MethodCallNode parse = add(new MethodCallNode(registry.resolve("java.lang.Integer", "parseInt",
                List.of("java.lang.String"))));
        exec(start, PinNames.START, parse);
        assertTrue(generate().contains("java.lang.Integer.parseInt(((java.lang.String) null));"));
    }

    @Test
    public void testDeclaredParameterDefault() {
        MethodDescriptor greet = new MethodDescriptor(Types.named("com.acme.Greeter"), "greet", true,
                List.of(com.visual.vgc.method.ParameterDescriptor.withDefault("name", Types.STRING, "world")),
                Types.VOID, false);
        registry.register(greet);
        MethodCallNode call = add(new MethodCallNode(greet));
        exec(start, PinNames.START, call);

        String text = generate(GenerationOptions.defaults().withPolicy(UnresolvedPinPolicy.STRICT));
        assertTrue(text.contains("com.acme.Greeter.greet(\"world\");"));
    }

    @Test
    public void testUnknownMethodFails() {
        MethodDescriptor ghost = new MethodDescriptor(Types.named("com.acme.Ghost"), "boo", true, List.of(),
                Types.VOID, false);
        add(new MethodCallNode(ghost));
        try {
            generate();
            fail("Unregistered method must not generate");
        } catch (CodeGenerationException e) {
            assertTrue(e.getMessage().startsWith("Unknown declaring type"));
        }
    }

    @Test
    public void testSequenceAndReturn() {
        SequenceNode seq = add(new SequenceNode(3));
        ReturnNode ret = add(new ReturnNode());
        PrintNode first = add(new PrintNode());
        PrintNode unreachable = add(new PrintNode());
        exec(start, PinNames.START, seq);
        exec(seq, PinNames.then(0), first);
        exec(seq, PinNames.then(1), ret);
        exec(seq, PinNames.then(2), unreachable);

        String text = generate();
        assertEquals(1, count(text, "System.out.println"));
        assertTrue(text.indexOf("System.out.println") < text.indexOf("return;"));
    }

    @Test
    public void testSharedNodeRunsOnEverySequenceOutput() {
        SequenceNode seq = add(new SequenceNode(2));
        PrintNode shared = add(new PrintNode());
        exec(start, PinNames.START, seq);
        exec(seq, PinNames.then(0), shared);
        exec(seq, PinNames.then(1), shared);

        assertEquals(2, count(generate(), "System.out.println"));
    }

    @Test
    public void testRejoinedNodeEmittedInBothArms() {
        BranchNode branch = add(new BranchNode());
        PrintNode yes = add(new PrintNode());
        PrintNode no = add(new PrintNode());
        PrintNode after = add(new PrintNode());
        LiteralNode tail = add(new LiteralNode(UUID.fromString("c0c0c0c0-0000-4000-8000-000000000003"),
                Types.STRING, "C"));
        exec(start, PinNames.START, branch);
        exec(branch, PinNames.TRUE, yes);
        exec(branch, PinNames.FALSE, no);
        exec(yes, PinNames.EXEC, after);
        exec(no, PinNames.EXEC, after);
        data(tail, PinNames.VALUE, after, PinNames.VALUE);

        String text = generate();
        assertEquals(2, count(text, "System.out.println(literal_c0c0c0c0);"));
        assertTrue(text.indexOf("} else {") < text.lastIndexOf("System.out.println(literal_c0c0c0c0);"));
    }

    @Test
    public void testNodeAfterLoopAndInBodyEmittedTwice() {
        ForLoopNode loop = add(new ForLoopNode());
        PrintNode shared = add(new PrintNode());
        exec(start, PinNames.START, loop);
        exec(loop, PinNames.LOOP_BODY, shared);
        exec(loop, PinNames.COMPLETED, shared);

        String text = generate();
        assertEquals(2, count(text, "System.out.println"));
        assertTrue(text.indexOf("for (") < text.indexOf("System.out.println"));
    }

    @Test
    public void testBranchOnTrueLiteralPrintsA() {
        BranchNode branch = add(new BranchNode());
        LiteralNode flag = add(new LiteralNode(UUID.fromString("7e57f1a9-0000-4000-8000-000000000001"),
                Types.BOOLEAN, true));
        LiteralNode letter = add(new LiteralNode(UUID.fromString("a0a0a0a0-0000-4000-8000-000000000002"),
                Types.STRING, "A"));
        PrintNode print = add(new PrintNode());
        exec(start, PinNames.START, branch);
        exec(branch, PinNames.TRUE, print);
        data(flag, PinNames.VALUE, branch, PinNames.CONDITION);
        data(letter, PinNames.VALUE, print, PinNames.VALUE);

        String text = generate();
        assertTrue(text.contains("final boolean literal_7e57f1a9 = true;"));
        assertTrue(text.contains("final java.lang.String literal_a0a0a0a0 = \"A\";"));
        assertTrue(text.contains("        if (literal_7e57f1a9) {\n"
                + "            System.out.println(literal_a0a0a0a0);\n"
                + "        }\n"));
        assertEquals(1, count(text, "System.out.println"));
        assertFalse(text.contains("else"));
    }

    @Test(expected = GraphStructureException.class)
    public void testExecutionCycleFails() {
        PrintNode a = add(new PrintNode());
        PrintNode b = add(new PrintNode());
        exec(a, PinNames.EXEC, b);
        exec(b, PinNames.EXEC, a);
        generate();
    }

    @Test
    public void testAdapt() {
        assertEquals("String.valueOf(x)", JavaSourceGenerator.adapt("x", Types.INT, Types.STRING));
        assertEquals("((short) (x))", JavaSourceGenerator.adapt("x", Types.LONG, Types.SHORT));
        assertEquals("x", JavaSourceGenerator.adapt("x", Types.INT, Types.LONG));
        assertEquals("x", JavaSourceGenerator.adapt("x", Types.STRING, Types.OBJECT));
    }

    @Test
    public void testGraphNameCannotBreakOutOfComment() {
        graph.setName("evil\n}");
        assertTrue(generate().contains("// Generated from graph 'evil }'"));
    }

    private static int count(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1))
            n++;
        return n;
    }
}
