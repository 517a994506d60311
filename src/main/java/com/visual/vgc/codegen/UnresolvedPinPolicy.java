package com.visual.vgc.codegen;

/**
 * What the generator does with a data input it cannot resolve.
 */
public enum UnresolvedPinPolicy {
    /** Fall back to the pin's default literal, then the type's zero value. */
    LENIENT,
    /** Fail generation with a {@link CodeGenerationException}. */
    STRICT
}
