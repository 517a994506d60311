package com.visual.vgc;

import com.visual.vgc.api.OutputKind;
import com.visual.vgc.codegen.GeneratedSource;
import com.visual.vgc.codegen.GenerationOptions;
import com.visual.vgc.codegen.JavaSourceGenerator;
import com.visual.vgc.config.VgcConfig;
import com.visual.vgc.host.CompilationResult;
import com.visual.vgc.host.CompiledUnit;
import com.visual.vgc.host.ExecutionHost;
import com.visual.vgc.host.GraphCompiler;
import com.visual.vgc.host.RunResult;
import com.visual.vgc.host.packaging.NativePackager;
import com.visual.vgc.host.packaging.PackagingRequest;
import com.visual.vgc.host.packaging.PackagingResult;
import com.visual.vgc.host.packaging.ProcessNativePackager;
import com.visual.vgc.io.GraphDocumentCodec;
import com.visual.vgc.method.MethodRegistry;
import com.visual.vgc.model.Graph;
import com.visual.vgc.types.TypeCompatibilityChecker;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Wires the stages together: graph to source, source to a loaded unit, unit to
 * captured output, or source to a native executable.
 *
 * <p>
 * One pipeline serves many graphs. It holds the method registry (and through it
 * the type catalog), so graphs it creates and documents it loads share the same
 * type facts.
 */
@Log4j2
public final class GraphPipeline {
    private final VgcConfig config;
    private final MethodRegistry methods;
    private final TypeCompatibilityChecker checker;
    private final GraphCompiler compiler;
    private final ExecutionHost host = new ExecutionHost();
    private final NativePackager packager;
    private final GraphDocumentCodec codec;

    public GraphPipeline(VgcConfig config, MethodRegistry methods) {
        this(config, methods, new GraphCompiler(),
                config.getPackagingCommand().isEmpty() ? null : new ProcessNativePackager(config.getPackagingCommand()));
    }

    /** @param packager null disables {@link #publish} */
    public GraphPipeline(VgcConfig config, MethodRegistry methods, GraphCompiler compiler, NativePackager packager) {
        this.config = Objects.requireNonNull(config, "config");
        this.methods = Objects.requireNonNull(methods, "methods");
        this.checker = new TypeCompatibilityChecker(methods.catalog());
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.packager = packager;
        this.codec = new GraphDocumentCodec(methods);
    }

    public VgcConfig config() {
        return config;
    }

    public MethodRegistry methods() {
        return methods;
    }

    public TypeCompatibilityChecker checker() {
        return checker;
    }

    public GraphDocumentCodec codec() {
        return codec;
    }

    public Graph newGraph(String name) {
        return new Graph(name, checker);
    }

    public GeneratedSource generate(Graph graph) {
        return generate(graph, config.generationOptions());
    }

    public GeneratedSource generate(Graph graph, GenerationOptions options) {
        return new JavaSourceGenerator(methods, options).generate(graph);
    }

    /**
     * Generates and compiles. The caller owns the returned unit and must close it.
     */
    public CompilationResult compile(Graph graph) {
        GeneratedSource source = generate(graph);
        return compiler.compile(source.text(), config.referencePaths(), config.getOutputKind(), config.getUnitName(),
                config.outputPath());
    }

    /**
     * Generates, compiles, runs the entry method and unloads the unit again.
     *
     * @throws com.visual.vgc.codegen.CodeGenerationException if no source can be
     *         generated
     */
    public GraphRun run(Graph graph) {
        GeneratedSource source = generate(graph);
        CompilationResult compiled = compiler.compile(source.text(), config.referencePaths(), config.getOutputKind());
        if (!compiled.success()) {
            log.warn("Graph '{}' did not compile: {}", graph.name(), compiled.errors());
            return new GraphRun(source, compiled.diagnostics(), null);
        }
        try (CompiledUnit unit = compiled.unit()) {
            RunResult result = host.run(unit, source.qualifiedName(), source.entryMethod());
            return new GraphRun(source, compiled.diagnostics(), result);
        }
    }

    /**
     * Builds a standalone executable. The graph is compiled as a console unit
     * into {@code destination} first; that jar is the fallback artifact if the
     * packaging tool fails or none is configured.
     */
    public PackagingResult publish(Graph graph, Path destination) {
        GenerationOptions options = config.generationOptions().withOutputKind(OutputKind.CONSOLE);
        GeneratedSource source = generate(graph, options);
        CompilationResult compiled = compiler.compile(source.text(), config.referencePaths(), OutputKind.CONSOLE,
                config.getUnitName(), destination);
        if (!compiled.success())
            return new PackagingResult(false, null, "Compilation failed: " + compiled.errors(), "");
        compiled.unit().unload();

        PackagingRequest request = new PackagingRequest(config.getUnitName(), source.qualifiedName(), source.text(),
                manifest(), destination, compiled.artifact());
        if (packager == null)
            return PackagingResult.failed(request, "No packaging command configured", "");
        return packager.pack(request);
    }

    private Map<String, Object> manifest() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("entryMethod", config.getEntryMethod());
        m.put("references", config.getReferences());
        m.put("javaVersion", Runtime.version().feature());
        return m;
    }
}
