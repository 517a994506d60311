package com.visual.vgc.host.packaging;

import java.nio.file.Path;

/**
 * @param artifact the produced executable, or the request's fallback artifact
 *                 when packaging failed
 * @param error    null on success
 * @param toolLog  combined output of the external tool
 */
public record PackagingResult(boolean success, Path artifact, String error, String toolLog) {

    public static PackagingResult succeeded(Path artifact, String toolLog) {
        return new PackagingResult(true, artifact, null, toolLog);
    }

    public static PackagingResult failed(PackagingRequest request, String error, String toolLog) {
        return new PackagingResult(false, request.fallbackArtifact(), error, toolLog);
    }
}
