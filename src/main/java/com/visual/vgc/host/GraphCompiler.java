package com.visual.vgc.host;

import com.visual.vgc.api.OutputKind;

import javax.tools.*;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles generated source in process with the platform Java compiler.
 *
 * <p>
 * Class files stay in memory and are loaded through a fresh
 * {@link CompiledUnit}. When a destination directory is given the unit is also
 * written out as {@code <unit>.jar} (compiled with debug information) next to
 * {@code <unit>-sources.jar}; a failure there is logged and does not affect the
 * in-memory result.
 *
 * <p>
 * Thread-safe: each call uses its own file manager, so distinct units may be
 * compiled concurrently.
 */
@Log4j2
public final class GraphCompiler {
    private static final Pattern PACKAGE = Pattern.compile("^\\s*package\\s+([\\w.]+)\\s*;", Pattern.MULTILINE);
    private static final Pattern PUBLIC_CLASS = Pattern.compile(
            "^\\s*public\\s+(?:final\\s+|abstract\\s+)*class\\s+(\\w+)", Pattern.MULTILINE);

    private final JavaCompiler compiler;
    private final ClassLoader parent;

    public GraphCompiler() {
        this(ToolProvider.getSystemJavaCompiler(), GraphCompiler.class.getClassLoader());
    }

    /** @param compiler null when the runtime ships without one; every compile then fails with a diagnostic */
    public GraphCompiler(JavaCompiler compiler, ClassLoader parent) {
        this.compiler = compiler;
        this.parent = parent;
    }

    public CompilationResult compile(String sourceText, List<Path> references, OutputKind outputKind) {
        return compile(sourceText, references, outputKind, null, null);
    }

    /**
     * @param unitName    name of the unit and its artifacts; defaults to the
     *                    public class's simple name
     * @param destination directory for the jar artifacts, or null to stay in
     *                    memory
     */
    public CompilationResult compile(String sourceText, List<Path> references, OutputKind outputKind,
            String unitName, Path destination) {
        if (compiler == null) {
            log.error("No system Java compiler available; running on a JRE?");
            return CompilationResult.failure(List.of(new CompilerDiagnostic(CompilerDiagnostic.Severity.ERROR,
                    "No Java compiler is available in this runtime", -1, -1)));
        }

        String mainClass = primaryClassName(sourceText);
        String simpleName = mainClass == null ? "Unit" : mainClass.substring(mainClass.lastIndexOf('.') + 1);
        String name = unitName != null && !unitName.isBlank() ? unitName : simpleName;
        String fileName = (mainClass == null ? simpleName : mainClass.replace('.', '/')) + ".java";

        long t0 = System.nanoTime();
        DiagnosticCollector<JavaFileObject> collector = new DiagnosticCollector<>();
        Map<String, byte[]> classes;
        boolean ok;
        try (InMemoryFileManager files = new InMemoryFileManager(
                compiler.getStandardFileManager(collector, Locale.ROOT, StandardCharsets.UTF_8))) {
            List<String> options = List.of("-g", "-proc:none", "-Xlint:none",
                    "-classpath", classpath(references));
            JavaCompiler.CompilationTask task = compiler.getTask(null, files, collector, options, null,
                    List.of(InMemoryFileManager.source(fileName, sourceText)));
            ok = task.call();
            classes = files.classFiles();
        } catch (IOException e) {
            log.error("Compiler file manager failed for unit '{}'", name, e);
            return CompilationResult.failure(List.of(new CompilerDiagnostic(CompilerDiagnostic.Severity.ERROR,
                    "Compiler I/O failure: " + e.getMessage(), -1, -1)));
        }

        List<CompilerDiagnostic> diagnostics = convert(collector.getDiagnostics());
        if (!ok || classes.isEmpty()) {
            if (diagnostics.stream().noneMatch(CompilerDiagnostic::isError))
                diagnostics = append(diagnostics, "Compilation produced no classes");
            log.warn("Compilation of unit '{}' failed with {} diagnostics", name, diagnostics.size());
            return CompilationResult.failure(diagnostics);
        }

        CompiledUnit unit = new CompiledUnit(name, mainClass, outputKind, classes, sourceText, toUrls(references),
                parent);
        log.info("Compiled unit '{}' ({} classes) in {} ms", name, classes.size(), (System.nanoTime() - t0) / 1_000_000);

        Path artifact = null;
        if (destination != null)
            artifact = persist(unit, fileName, destination);
        return new CompilationResult(true, unit, diagnostics, artifact);
    }

    // ── Persistence ─────────────────────────────────────────────

    private Path persist(CompiledUnit unit, String sourceFileName, Path destination) {
        Path jar = destination.resolve(unit.name() + ".jar");
        Path sources = destination.resolve(unit.name() + "-sources.jar");
        try {
            Files.createDirectories(destination);
            writeClassesJar(unit, jar);
            try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(sources))) {
                writeEntry(out, sourceFileName, unit.sourceText().getBytes(StandardCharsets.UTF_8));
            }
            log.info("Wrote {} and {}", jar, sources);
            return jar;
        } catch (IOException e) {
            log.warn("Could not persist unit '{}' to {}: {}", unit.name(), destination, e.getMessage());
            return null;
        }
    }

    private static void writeClassesJar(CompiledUnit unit, Path jar) throws IOException {
        Manifest manifest = new Manifest();
        Attributes main = manifest.getMainAttributes();
        main.put(Attributes.Name.MANIFEST_VERSION, "1.0");
        if (unit.outputKind() == OutputKind.CONSOLE && unit.mainClassName() != null)
            main.put(Attributes.Name.MAIN_CLASS, unit.mainClassName());
        try (OutputStream os = Files.newOutputStream(jar); JarOutputStream out = new JarOutputStream(os, manifest)) {
            for (var e : unit.classFiles().entrySet())
                writeEntry(out, e.getKey().replace('.', '/') + ".class", e.getValue());
        }
    }

    private static void writeEntry(JarOutputStream out, String name, byte[] bytes) throws IOException {
        out.putNextEntry(new JarEntry(name));
        out.write(bytes);
        out.closeEntry();
    }

    // ── Helpers ─────────────────────────────────────────────────

    /** Fully qualified name of the first public class in the source, or null. */
    static String primaryClassName(String sourceText) {
        Matcher cls = PUBLIC_CLASS.matcher(sourceText);
        if (!cls.find())
            return null;
        Matcher pkg = PACKAGE.matcher(sourceText);
        return pkg.find() ? pkg.group(1) + "." + cls.group(1) : cls.group(1);
    }

    private static String classpath(List<Path> references) {
        StringJoiner cp = new StringJoiner(File.pathSeparator);
        for (Path p : references)
            cp.add(p.toAbsolutePath().toString());
        String inherited = System.getProperty("java.class.path");
        if (inherited != null && !inherited.isEmpty())
            cp.add(inherited);
        return cp.toString();
    }

    private static URL[] toUrls(List<Path> references) {
        URL[] urls = new URL[references.size()];
        for (int i = 0; i < urls.length; i++) {
            try {
                urls[i] = references.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new IllegalArgumentException("Bad reference path: " + references.get(i), e);
            }
        }
        return urls;
    }

    private static List<CompilerDiagnostic> convert(List<Diagnostic<? extends JavaFileObject>> diagnostics) {
        List<CompilerDiagnostic> result = new ArrayList<>(diagnostics.size());
        for (Diagnostic<? extends JavaFileObject> d : diagnostics) {
            CompilerDiagnostic.Severity severity = switch (d.getKind()) {
                case ERROR -> CompilerDiagnostic.Severity.ERROR;
                case WARNING, MANDATORY_WARNING -> CompilerDiagnostic.Severity.WARNING;
                default -> CompilerDiagnostic.Severity.NOTE;
            };
            long line = d.getLineNumber() == Diagnostic.NOPOS ? -1 : d.getLineNumber();
            long column = d.getColumnNumber() == Diagnostic.NOPOS ? -1 : d.getColumnNumber();
            result.add(new CompilerDiagnostic(severity, d.getMessage(Locale.ROOT), line, column));
        }
        return result;
    }

    private static List<CompilerDiagnostic> append(List<CompilerDiagnostic> diagnostics, String message) {
        List<CompilerDiagnostic> result = new ArrayList<>(diagnostics);
        result.add(new CompilerDiagnostic(CompilerDiagnostic.Severity.ERROR, message, -1, -1));
        return result;
    }
}
