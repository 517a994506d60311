package com.visual.vgc.codegen;

import com.visual.vgc.api.OutputKind;

import javax.lang.model.SourceVersion;
import java.util.Objects;

/**
 * Shape of the emitted compilation unit.
 *
 * @param packageName empty for the unnamed package
 */
public record GenerationOptions(
        String packageName,
        String className,
        String entryMethod,
        OutputKind outputKind,
        UnresolvedPinPolicy unresolvedPinPolicy) {

    public static final String DEFAULT_PACKAGE = "generated";
    public static final String DEFAULT_CLASS = "VisualGraphProgram";
    public static final String DEFAULT_ENTRY = "execute";

    public GenerationOptions {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(outputKind, "outputKind");
        Objects.requireNonNull(unresolvedPinPolicy, "unresolvedPinPolicy");
        if (!packageName.isEmpty() && !SourceVersion.isName(packageName))
            throw new IllegalArgumentException("Invalid package name: " + packageName);
        if (!isIdentifier(className))
            throw new IllegalArgumentException("Invalid class name: " + className);
        if (!isIdentifier(entryMethod))
            throw new IllegalArgumentException("Invalid entry method name: " + entryMethod);
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(DEFAULT_PACKAGE, DEFAULT_CLASS, DEFAULT_ENTRY, OutputKind.LIBRARY,
                UnresolvedPinPolicy.LENIENT);
    }

    public GenerationOptions withOutputKind(OutputKind kind) {
        return new GenerationOptions(packageName, className, entryMethod, kind, unresolvedPinPolicy);
    }

    public GenerationOptions withPolicy(UnresolvedPinPolicy policy) {
        return new GenerationOptions(packageName, className, entryMethod, outputKind, policy);
    }

    public GenerationOptions withClassName(String name) {
        return new GenerationOptions(packageName, name, entryMethod, outputKind, unresolvedPinPolicy);
    }

    public String qualifiedClassName() {
        return packageName.isEmpty() ? className : packageName + "." + className;
    }

    static boolean isIdentifier(String name) {
        return name != null && SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name);
    }
}
