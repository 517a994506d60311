package com.visual.vgc.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visual.vgc.GraphPipeline;
import com.visual.vgc.VisualGraph;
import com.visual.vgc.config.VgcConfig;
import com.visual.vgc.model.Graph;
import com.visual.vgc.node.LiteralNode;
import com.visual.vgc.node.PinNames;
import com.visual.vgc.node.PrintNode;
import com.visual.vgc.node.StartNode;
import com.visual.vgc.types.Types;
import org.junit.Before;
import org.junit.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.Assert.*;

public class GraphApiTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private GraphPipeline pipeline;
    private GraphApi api;

    @Before
    public void setUp() {
        pipeline = VisualGraph.pipeline(new VgcConfig());
        api = new GraphApi(pipeline);
    }

    private String helloDocument() {
        Graph graph = pipeline.newGraph("hello");
        StartNode start = new StartNode();
        LiteralNode text = new LiteralNode(Types.STRING, "Hello");
        PrintNode print = new PrintNode();
        graph.addNode(start);
        graph.addNode(text);
        graph.addNode(print);
        graph.addConnection(start.output(PinNames.START).id(), print.input(PinNames.EXEC).id());
        graph.addConnection(text.output(PinNames.VALUE).id(), print.input(PinNames.VALUE).id());
        return pipeline.codec().write(graph);
    }

    private String cyclicDocument() {
        Graph graph = pipeline.newGraph("loop");
        PrintNode a = new PrintNode();
        PrintNode b = new PrintNode();
        graph.addNode(a);
        graph.addNode(b);
        graph.addConnection(a.output(PinNames.EXEC).id(), b.input(PinNames.EXEC).id());
        graph.addConnection(b.output(PinNames.EXEC).id(), a.input(PinNames.EXEC).id());
        return pipeline.codec().write(graph);
    }

    @Test
    public void testHealth() throws Exception {
        ApiResponse response = api.health();
        assertEquals(200, response.status());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("ok", body.get("status").asText());
        assertTrue(body.get("knownMethods").asInt() > 0);
    }

    @Test
    public void testSource() throws Exception {
        ApiResponse response = api.source(helloDocument());
        assertEquals(200, response.status());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("generated.VisualGraphProgram", body.get("className").asText());
        assertTrue(body.get("source").asText().contains("\"Hello\""));
        assertEquals(0, body.get("warnings").size());
    }

    @Test
    public void testRun() throws Exception {
        ApiResponse response = api.run(helloDocument());
        assertEquals(200, response.status());
        JsonNode body = mapper.readTree(response.body());
        assertTrue(body.get("compiled").asBoolean());
        assertEquals("Hello", body.get("output").asText().trim());
    }

    @Test
    public void testExplain() throws Exception {
        ApiResponse response = api.explain(helloDocument());
        assertEquals(200, response.status());
        JsonNode body = mapper.readTree(response.body());
        assertTrue(body.get("valid").asBoolean());
        assertTrue(body.get("mermaid").asText().startsWith("graph TD;"));
        assertTrue(body.get("executionOrder").asText().contains("Start -> Print"));
    }

    @Test
    public void testCyclicGraphIsRejected() throws Exception {
        ApiResponse response = api.source(cyclicDocument());
        assertEquals(422, response.status());
        assertTrue(mapper.readTree(response.body()).get("error").asText().startsWith("Cycle detected"));

        assertEquals(422, api.explain(cyclicDocument()).status());
    }

    @Test
    public void testNullListsAreAccepted() throws Exception {
        ApiResponse response = api.source("{\"name\":\"empty\",\"nodes\":null,\"connections\":null}");
        assertEquals(200, response.status());
        assertTrue(mapper.readTree(response.body()).get("source").asText().contains("public void execute()"));
    }

    @Test
    public void testMalformedDocument() throws Exception {
        ApiResponse response = api.run("not json");
        assertEquals(400, response.status());
        assertTrue(mapper.readTree(response.body()).get("error").asText().startsWith("Malformed graph document"));
    }

    @Test
    public void testServerRoutes() throws Exception {
        GraphApiServer server = new GraphApiServer(pipeline);
        server.start(0);
        try {
            HttpClient client = HttpClient.newHttpClient();
            String base = "http://localhost:" + server.port();

            HttpResponse<String> health = client.send(HttpRequest.newBuilder(URI.create(base + "/api/health"))
                    .GET().build(), HttpResponse.BodyHandlers.ofString());
            assertEquals(200, health.statusCode());

            HttpResponse<String> run = client.send(HttpRequest.newBuilder(URI.create(base + "/api/run"))
                    .POST(HttpRequest.BodyPublishers.ofString(helloDocument())).build(),
                    HttpResponse.BodyHandlers.ofString());
            assertEquals(200, run.statusCode());
            assertEquals("Hello", mapper.readTree(run.body()).get("output").asText().trim());
        } finally {
            server.stop();
        }
    }
}
