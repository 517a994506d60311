package com.visual.vgc.host.packaging;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a packager needs to turn generated source into a standalone
 * executable.
 *
 * @param manifest         build settings written next to the source for the
 *                         external tool
 * @param fallbackArtifact the in-process artifact handed back if packaging fails
 */
public record PackagingRequest(
        String unitName,
        String mainClassName,
        String sourceText,
        Map<String, Object> manifest,
        Path destination,
        Path fallbackArtifact) {

    public PackagingRequest {
        Objects.requireNonNull(unitName, "unitName");
        Objects.requireNonNull(mainClassName, "mainClassName");
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(destination, "destination");
        manifest = manifest == null ? Map.of() : Map.copyOf(manifest);
    }
}
