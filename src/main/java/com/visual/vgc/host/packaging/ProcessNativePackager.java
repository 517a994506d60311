package com.visual.vgc.host.packaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.stream.Stream;

import lombok.extern.log4j.Log4j2;

/**
 * Runs a configured command line to build a native executable.
 *
 * <p>
 * The source and a {@code build-manifest.json} are written to a scratch
 * directory, the command is run there, and on exit code 0 the file it produced
 * is moved to the request's destination. Command arguments may use these
 * placeholders:
 * <ul>
 * <li>{@code {scratch}} the scratch directory</li>
 * <li>{@code {name}} the unit name</li>
 * <li>{@code {main}} the main class</li>
 * <li>{@code {source}} the source file</li>
 * <li>{@code {manifest}} the manifest file</li>
 * <li>{@code {output}} where the tool must write the executable</li>
 * </ul>
 */
@Log4j2
public final class ProcessNativePackager implements NativePackager {
    static final String MANIFEST_FILE = "build-manifest.json";

    private final List<String> command;
    private final ObjectMapper mapper;

    public ProcessNativePackager(List<String> command) {
        this(command, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ProcessNativePackager(List<String> command, ObjectMapper mapper) {
        if (command == null || command.isEmpty())
            throw new IllegalArgumentException("Packaging command must not be empty");
        this.command = List.copyOf(command);
        this.mapper = mapper;
    }

    @Override
    public PackagingResult pack(PackagingRequest request) {
        Path scratch = null;
        StringBuilder toolLog = new StringBuilder();
        try {
            scratch = Files.createTempDirectory("vgc-pack-" + request.unitName() + "-");
            Path source = writeSource(scratch, request);
            Path manifest = scratch.resolve(MANIFEST_FILE);
            mapper.writeValue(manifest.toFile(), manifestOf(request));
            Path output = scratch.resolve("out").resolve(request.unitName());
            Files.createDirectories(output.getParent());

            Map<String, String> vars = Map.of(
                    "{scratch}", scratch.toString(),
                    "{name}", request.unitName(),
                    "{main}", request.mainClassName(),
                    "{source}", source.toString(),
                    "{manifest}", manifest.toString(),
                    "{output}", output.toString());
            int exit = runTool(expand(vars), scratch, toolLog);
            if (exit != 0)
                throw new PackagingException("Packaging tool exited with code " + exit);
            if (!Files.exists(output))
                throw new PackagingException("Packaging tool did not produce " + output);

            Files.createDirectories(request.destination());
            Path target = request.destination().resolve(output.getFileName());
            Files.move(output, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Packaged unit '{}' as {}", request.unitName(), target);
            return PackagingResult.succeeded(target, toolLog.toString());
        } catch (PackagingException | IOException e) {
            log.warn("Packaging unit '{}' failed, falling back to {}: {}", request.unitName(),
                    request.fallbackArtifact(), e.getMessage());
            return PackagingResult.failed(request, e.getMessage(), toolLog.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PackagingResult.failed(request, "Interrupted while packaging", toolLog.toString());
        } finally {
            if (scratch != null)
                deleteQuietly(scratch);
        }
    }

    private static Path writeSource(Path scratch, PackagingRequest request) throws IOException {
        String main = request.mainClassName();
        Path source = scratch.resolve("src").resolve(main.replace('.', '/') + ".java");
        Files.createDirectories(source.getParent());
        Files.writeString(source, request.sourceText(), StandardCharsets.UTF_8);
        return source;
    }

    private static Map<String, Object> manifestOf(PackagingRequest request) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", request.unitName());
        m.put("mainClass", request.mainClassName());
        m.putAll(request.manifest());
        return m;
    }

    private List<String> expand(Map<String, String> vars) {
        List<String> result = new ArrayList<>(command.size());
        for (String arg : command) {
            String expanded = arg;
            for (var e : vars.entrySet())
                expanded = expanded.replace(e.getKey(), e.getValue());
            result.add(expanded);
        }
        return result;
    }

    private static int runTool(List<String> cmd, Path workDir, StringBuilder toolLog)
            throws PackagingException, InterruptedException {
        log.info("Running packaging tool: {}", String.join(" ", cmd));
        ProcessBuilder pb = new ProcessBuilder(cmd).directory(workDir.toFile()).redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new PackagingException("Could not start packaging tool '" + cmd.get(0) + "'", e);
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[pack] {}", line);
                toolLog.append(line).append('\n');
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new PackagingException("Lost packaging tool output", e);
        }
        return process.waitFor();
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not clean scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
