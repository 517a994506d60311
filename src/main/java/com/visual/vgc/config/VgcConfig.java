package com.visual.vgc.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visual.vgc.api.OutputKind;
import com.visual.vgc.codegen.GenerationOptions;
import com.visual.vgc.codegen.UnresolvedPinPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Settings for generation, compilation, packaging and the HTTP surface.
 *
 * <p>
 * Read from {@code vgc.json} on the classpath, or from a file. Missing keys keep
 * their defaults.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class VgcConfig {
    public static final String RESOURCE = "vgc.json";

    private String generatedPackage = GenerationOptions.DEFAULT_PACKAGE;
    private String className = GenerationOptions.DEFAULT_CLASS;
    private String entryMethod = GenerationOptions.DEFAULT_ENTRY;
    private String unitName = "graph";
    private OutputKind outputKind = OutputKind.LIBRARY;
    /** Where compiled jars are written. Null keeps units in memory only. */
    private String outputDirectory;
    private UnresolvedPinPolicy unresolvedPinPolicy = UnresolvedPinPolicy.LENIENT;
    /** External native packaging command with placeholders. Empty disables publishing. */
    private List<String> packagingCommand = new ArrayList<>();
    /** Jars added to the compile classpath and unit class loader. */
    private List<String> references = new ArrayList<>();
    private int serverPort = 7070;

    /** Loads {@value #RESOURCE} from the classpath, or the defaults if absent. */
    public static VgcConfig load() {
        try (InputStream in = VgcConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", RESOURCE);
                return new VgcConfig();
            }
            return new ObjectMapper().readValue(in, VgcConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
    }

    public static VgcConfig load(Path file) throws IOException {
        VgcConfig config = new ObjectMapper().readValue(file.toFile(), VgcConfig.class);
        log.info("Loaded configuration from {}", file);
        return config;
    }

    @JsonIgnore
    public GenerationOptions generationOptions() {
        return new GenerationOptions(generatedPackage, className, entryMethod, outputKind, unresolvedPinPolicy);
    }

    @JsonIgnore
    public List<Path> referencePaths() {
        return references.stream().map(Path::of).toList();
    }

    @JsonIgnore
    public Path outputPath() {
        return outputDirectory == null || outputDirectory.isBlank() ? null : Path.of(outputDirectory);
    }
}
