package com.visual.vgc;

import com.visual.vgc.config.VgcConfig;
import com.visual.vgc.method.MethodRegistry;
import com.visual.vgc.types.TypeCatalog;
import com.visual.vgc.web.GraphApiServer;

/**
 * Visual Graph Compiler: turns node graphs into Java source, then compiles,
 * loads, runs and unloads that source as an isolated unit.
 *
 * <h2>Stages</h2>
 * <ul>
 * <li><b>Model:</b> nodes with typed pins, wired by validated connections
 * ({@link com.visual.vgc.model.Graph}).</li>
 * <li><b>Order:</b> execution nodes sorted along execution edges
 * ({@link com.visual.vgc.engine.ExecutionOrderResolver}).</li>
 * <li><b>Generate:</b> one Java class per graph
 * ({@link com.visual.vgc.codegen.JavaSourceGenerator}).</li>
 * <li><b>Host:</b> in-process compilation, a class loader per unit, captured
 * output ({@link com.visual.vgc.host.GraphCompiler},
 * {@link com.visual.vgc.host.ExecutionHost}).</li>
 * </ul>
 */
public final class VisualGraph {

    private VisualGraph() {
        // Prevent instantiation of utility class
    }

    /** A pipeline over the JDK's standard types and {@code vgc.json} settings. */
    public static GraphPipeline pipeline() {
        return pipeline(VgcConfig.load());
    }

    public static GraphPipeline pipeline(VgcConfig config) {
        return new GraphPipeline(config, MethodRegistry.standard(TypeCatalog.standard()));
    }

    /** Starts the HTTP API on the configured port. */
    public static void main(String[] args) {
        GraphPipeline pipeline = pipeline();
        new GraphApiServer(pipeline).start(pipeline.config().getServerPort());
    }
}
