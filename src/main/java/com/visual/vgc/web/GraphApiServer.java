package com.visual.vgc.web;

import com.visual.vgc.GraphPipeline;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * HTTP front end for the editor: posts a graph document, gets back source,
 * run output or an explanation.
 */
public class GraphApiServer {
    private static final Logger log = LogManager.getLogger(GraphApiServer.class);

    private final GraphApi api;
    private Javalin app;

    public GraphApiServer(GraphPipeline pipeline) {
        this.api = new GraphApi(pipeline);
    }

    /**
     * Starts the server.
     *
     * @param port the port to listen on, 0 for any free port
     */
    public void start(int port) {
        log.info("Starting graph API server on port {}", port);

        app = Javalin.create().start(port);

        app.get("/api/health", ctx -> send(ctx, api.health()));
        app.post("/api/source", ctx -> send(ctx, api.source(ctx.body())));
        app.post("/api/run", ctx -> send(ctx, api.run(ctx.body())));
        app.post("/api/explain", ctx -> send(ctx, api.explain(ctx.body())));
    }

    /** The bound port, useful after starting on port 0. */
    public int port() {
        return app == null ? -1 : app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    private static void send(Context ctx, ApiResponse response) {
        ctx.status(response.status());
        ctx.contentType("application/json");
        ctx.result(response.body());
    }
}
