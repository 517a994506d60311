package com.visual.vgc.codegen;

/**
 * One emitted compilation unit.
 *
 * @param qualifiedName the generated class, used to load and run it
 */
public record GeneratedSource(String qualifiedName, String entryMethod, String text) {

    public String simpleName() {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    /** File name javac expects for this unit. */
    public String fileName() {
        return simpleName() + ".java";
    }
}
