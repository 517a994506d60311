package com.visual.vgc.host.packaging;

/**
 * Turns generated source into a standalone native executable with an external
 * tool. Implementations never throw; failures come back as a result carrying
 * the fallback artifact.
 */
public interface NativePackager {

    PackagingResult pack(PackagingRequest request);
}
