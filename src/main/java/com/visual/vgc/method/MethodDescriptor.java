package com.visual.vgc.method;

import com.visual.vgc.types.TypeDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * A resolved method: what a method-call node calls.
 *
 * <p>
 * Descriptors come from a {@link MethodRegistry}; a node never refers to a
 * method by loose name. {@code pure} methods have no execution pins and are
 * inlined into the expressions that use them.
 */
public record MethodDescriptor(
        TypeDescriptor declaringType,
        String name,
        boolean isStatic,
        List<ParameterDescriptor> parameters,
        TypeDescriptor returnType,
        boolean pure) {

    public MethodDescriptor {
        Objects.requireNonNull(declaringType, "declaringType");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        parameters = List.copyOf(parameters);
    }

    public boolean returnsValue() {
        return !returnType.isVoid();
    }

    public List<String> parameterTypeNames() {
        return parameters.stream().map(p -> p.type().typeName()).toList();
    }

    /** Registry key, e.g. {@code java.lang.Math#max(int,int)}. */
    public String signature() {
        return signature(declaringType.typeName(), name, parameterTypeNames());
    }

    static String signature(String declaringTypeName, String methodName, List<String> parameterTypeNames) {
        return declaringTypeName + "#" + methodName + "(" + String.join(",", parameterTypeNames) + ")";
    }

    @Override
    public String toString() {
        return signature();
    }
}
