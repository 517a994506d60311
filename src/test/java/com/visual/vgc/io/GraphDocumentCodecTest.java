package com.visual.vgc.io;

import com.visual.vgc.method.MethodRegistry;
import com.visual.vgc.model.Graph;
import com.visual.vgc.model.Node;
import com.visual.vgc.model.Pin;
import com.visual.vgc.model.Position;
import com.visual.vgc.node.*;
import com.visual.vgc.types.TypeCatalog;
import com.visual.vgc.types.TypeCompatibilityChecker;
import com.visual.vgc.types.Types;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class GraphDocumentCodecTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private MethodRegistry registry;
    private GraphDocumentCodec codec;
    private Graph graph;

    @Before
    public void setUp() {
        registry = MethodRegistry.standard(TypeCatalog.standard());
        codec = new GraphDocumentCodec(registry);
        graph = new Graph("hello", new TypeCompatibilityChecker(registry.catalog()));
    }

    private Graph helloGraph() {
        StartNode start = new StartNode();
        LiteralNode text = new LiteralNode(Types.STRING, "Hello");
        PrintNode print = new PrintNode();
        print.setPosition(new Position(120.5, -40));
        graph.addNode(start);
        graph.addNode(text);
        graph.addNode(print);
        graph.addConnection(start.output(PinNames.START).id(), print.input(PinNames.EXEC).id());
        graph.addConnection(text.output(PinNames.VALUE).id(), print.input(PinNames.VALUE).id());
        return graph;
    }

    private static <T extends Node> T only(Graph g, Class<T> type) {
        List<Node> matches = g.nodes().stream().filter(type::isInstance).toList();
        assertEquals(1, matches.size());
        return type.cast(matches.get(0));
    }

    @Test
    public void testHelloRoundTrip() {
        String json = codec.write(helloGraph());
        LoadResult loaded = codec.read(json);
        Graph copy = loaded.graph();

        assertFalse(loaded.hasWarnings());
        assertEquals(graph.id(), copy.id());
        assertEquals("hello", copy.name());
        assertEquals(3, copy.nodeCount());
        assertEquals(2, copy.connectionCount());
        assertEquals("Hello", only(copy, LiteralNode.class).value());

        PrintNode print = only(copy, PrintNode.class);
        assertEquals(new Position(120.5, -40), print.position());
        Pin source = copy.sourceOf(print.input(PinNames.VALUE));
        assertSame(only(copy, LiteralNode.class), copy.ownerOf(source.id()));
        assertTrue(print.input(PinNames.EXEC).isConnected());
    }

    @Test
    public void testNodePropertiesSurvive() {
        graph.addNode(new SequenceNode(4));
        graph.addNode(new SetVariableNode("total", Types.LONG));
        graph.addNode(new GetVariableNode("total", Types.LONG));
        graph.addNode(new BinaryOperatorNode(BinaryOperatorNode.Operator.MODULO, Types.LONG));
        graph.addNode(new LiteralNode(Types.LONG, 5L));
        graph.addNode(new MethodCallNode(registry.resolve("java.lang.Math", "abs", List.of("double"))));
        graph.metadata().put("author", "someone");

        Graph copy = codec.read(codec.write(graph)).graph();

        assertEquals(4, only(copy, SequenceNode.class).outputCount());
        assertEquals("total", only(copy, SetVariableNode.class).variableName());
        assertEquals(Types.LONG, only(copy, GetVariableNode.class).variableType());
        BinaryOperatorNode op = only(copy, BinaryOperatorNode.class);
        assertEquals(BinaryOperatorNode.Operator.MODULO, op.operator());
        assertEquals(Types.LONG, op.operandType());
        assertEquals(5L, only(copy, LiteralNode.class).value());
        assertEquals("java.lang.Math#abs(double)", only(copy, MethodCallNode.class).method().signature());
        assertEquals("someone", copy.metadata().get("author"));
    }

    @Test
    public void testUnknownNodeTypeIsSkippedWithWarnings() {
        String json = codec.write(helloGraph()).replace("\"PRINT\"", "\"TELEPORT\"");
        LoadResult loaded = codec.read(json);

        assertEquals(2, loaded.graph().nodeCount());
        assertEquals(0, loaded.graph().connectionCount());
        assertTrue(loaded.warnings().get(0).contains("Unknown NodeType: TELEPORT"));
        assertEquals(3, loaded.warnings().size());
    }

    @Test
    public void testUnknownMethodIsSkipped() {
        graph.addNode(new MethodCallNode(registry.resolve("java.lang.Math", "abs", List.of("double"))));
        String json = codec.write(graph).replace("\"abs\"", "\"absolutely\"");

        LoadResult loaded = codec.read(json);
        assertEquals(0, loaded.graph().nodeCount());
        assertTrue(loaded.warnings().get(0).contains("Unknown method"));
    }

    @Test
    public void testUnknownFieldsAreIgnored() {
        String json = "{\"id\":\"not-a-uuid\",\"name\":\"x\",\"editorZoom\":2.5,"
                + "\"nodes\":[{\"id\":\"7f000000-0000-4000-8000-000000000001\",\"type\":\"start\",\"color\":\"red\"}]}";
        LoadResult loaded = codec.read(json);
        assertEquals("x", loaded.graph().name());
        assertEquals(1, loaded.graph().nodeCount());
        assertTrue(loaded.graph().nodes().get(0) instanceof StartNode);
    }

    @Test
    public void testNullListsReadAsEmpty() {
        String json = "{\"name\":\"sparse\",\"connections\":null,\"externalLibraries\":null,\"nodes\":["
                + "{\"id\":\"7f000000-0000-4000-8000-000000000001\",\"type\":\"START\",\"pins\":null},"
                + "{\"id\":\"7f000000-0000-4000-8000-000000000002\",\"type\":\"METHOD_CALL\","
                + "\"method\":{\"declaringTypeName\":\"java.lang.Math\",\"methodName\":\"random\","
                + "\"parameterTypeNames\":null}},"
                + "null]}";
        LoadResult loaded = codec.read(json);

        assertEquals(2, loaded.graph().nodeCount());
        assertEquals(0, loaded.graph().connectionCount());
        assertTrue(loaded.externalLibraries().isEmpty());
        assertEquals("java.lang.Math#random()", only(loaded.graph(), MethodCallNode.class).method().signature());
        assertEquals(1, loaded.warnings().size());

        assertEquals(0, codec.read("{\"name\":\"empty\",\"nodes\":null}").graph().nodeCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedDocument() {
        codec.read("{ nodes: [");
    }

    @Test
    public void testSaveAndLoadFileWithLibraries() throws Exception {
        GraphDocument.LibraryDef lib = new GraphDocument.LibraryDef();
        lib.setName("acme");
        lib.setFilePath("/opt/acme.jar");
        Path file = tmp.getRoot().toPath().resolve("graphs").resolve("hello.json");

        codec.save(helloGraph(), List.of(lib), file);
        LoadResult loaded = codec.load(file);

        assertEquals(3, loaded.graph().nodeCount());
        assertEquals(1, loaded.externalLibraries().size());
        assertEquals("/opt/acme.jar", loaded.externalLibraries().get(0).getFilePath());
    }
}
