package com.visual.vgc.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visual.vgc.GraphPipeline;
import com.visual.vgc.GraphRun;
import com.visual.vgc.codegen.CodeGenerationException;
import com.visual.vgc.codegen.GeneratedSource;
import com.visual.vgc.host.CompilerDiagnostic;
import com.visual.vgc.io.LoadResult;
import com.visual.vgc.model.Graph;
import com.visual.vgc.model.GraphStructureException;
import com.visual.vgc.model.GraphValidationResult;
import com.visual.vgc.util.GraphExplain;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Request handling behind {@link GraphApiServer}, free of any HTTP types.
 *
 * <p>
 * Every operation takes a graph document as JSON and answers with a JSON
 * object. Malformed documents give 400; graphs that cannot be generated or
 * ordered give 422 with the reason; load warnings are passed through.
 */
@Log4j2
public final class GraphApi {
    private final GraphPipeline pipeline;
    private final ObjectMapper mapper = new ObjectMapper();

    public GraphApi(GraphPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public ApiResponse health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("knownMethods", pipeline.methods().size());
        return json(200, body);
    }

    public ApiResponse source(String document) {
        return withGraph(document, (loaded, body) -> {
            GeneratedSource source = pipeline.generate(loaded.graph());
            body.put("className", source.qualifiedName());
            body.put("source", source.text());
            return 200;
        });
    }

    public ApiResponse run(String document) {
        return withGraph(document, (loaded, body) -> {
            GraphRun run = pipeline.run(loaded.graph());
            body.put("compiled", run.compiled());
            body.put("diagnostics", diagnostics(run.diagnostics()));
            if (run.compiled()) {
                body.put("output", run.run().output());
                if (run.run().fault() != null)
                    body.put("fault", run.run().fault().message());
            }
            return run.success() ? 200 : 422;
        });
    }

    public ApiResponse explain(String document) {
        return withGraph(document, (loaded, body) -> {
            Graph graph = loaded.graph();
            GraphValidationResult validation = graph.validate();
            Map<String, List<String>> errors = new LinkedHashMap<>();
            validation.errorsByNode().forEach((id, list) -> errors.put(id.toString(), list));
            body.put("valid", validation.valid());
            body.put("errors", errors);
            GraphExplain explain = new GraphExplain(graph);
            body.put("mermaid", explain.toMermaid());
            body.put("executionOrder", explain.dumpExecutionOrder());
            return 200;
        });
    }

    // ── Helpers ─────────────────────────────────────────────────

    @FunctionalInterface
    private interface Handler {
        int handle(LoadResult loaded, Map<String, Object> body);
    }

    private ApiResponse withGraph(String document, Handler handler) {
        LoadResult loaded;
        try {
            loaded = pipeline.codec().read(document);
        } catch (IllegalArgumentException e) {
            return error(400, e.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("graph", loaded.graph().name());
        body.put("warnings", loaded.warnings());
        try {
            int status = handler.handle(loaded, body);
            return json(status, body);
        } catch (CodeGenerationException | GraphStructureException e) {
            log.info("Rejected graph '{}': {}", loaded.graph().name(), e.getMessage());
            body.put("error", e.getMessage());
            return json(422, body);
        }
    }

    private static List<String> diagnostics(List<CompilerDiagnostic> diagnostics) {
        List<String> out = new ArrayList<>(diagnostics.size());
        for (CompilerDiagnostic d : diagnostics)
            out.add(d.toString());
        return out;
    }

    private ApiResponse error(int status, String message) {
        return json(status, Map.of("error", message == null ? "" : message));
    }

    private ApiResponse json(int status, Object body) {
        try {
            return new ApiResponse(status, mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize response", e);
        }
    }
}
