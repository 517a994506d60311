package com.visual.vgc.node;

import com.visual.vgc.method.MethodDescriptor;
import com.visual.vgc.method.ParameterDescriptor;
import com.visual.vgc.model.Node;
import com.visual.vgc.model.Pin;
import com.visual.vgc.types.TypeDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Calls a resolved method.
 *
 * <p>
 * Pin layout: execution in/out unless the method is pure, then {@code Target}
 * for instance methods, one input per parameter in declaration order, and
 * {@code Return Value} when the method returns something.
 */
public final class MethodCallNode extends Node {
    public static final String METHOD = "Method";

    private final List<Pin> parameterPins = new ArrayList<>();

    public MethodCallNode(MethodDescriptor method) {
        this(UUID.randomUUID(), method);
    }

    public MethodCallNode(UUID id, MethodDescriptor method) {
        super(id, title(method), "Methods/" + simpleName(method.declaringType()),
                "Call " + simpleName(method.declaringType()) + "." + method.name());
        setProperty(METHOD, method);

        if (!method.pure()) {
            addExecInput(PinNames.EXEC);
            addExecOutput(PinNames.EXEC);
        }
        if (!method.isStatic())
            addInput(PinNames.TARGET, method.declaringType(), null);
        for (ParameterDescriptor p : method.parameters()) {
            // Reflection without -parameters yields arg0, arg1, ... which never collide with Target.
            parameterPins.add(addInput(p.name(), p.type(), p.hasDefault() ? p.defaultValue() : null));
        }
        if (method.returnsValue())
            addOutput(PinNames.RETURN_VALUE, method.returnType());
    }

    public MethodDescriptor method() {
        return (MethodDescriptor) property(METHOD);
    }

    /** The target pin, or null for static methods. */
    public Pin targetPin() {
        return method().isStatic() ? null : input(PinNames.TARGET);
    }

    /** Parameter pins in declaration order. */
    public List<Pin> parameterPins() {
        return List.copyOf(parameterPins);
    }

    public Pin returnPin() {
        return output(PinNames.RETURN_VALUE);
    }

    private static String title(MethodDescriptor method) {
        Objects.requireNonNull(method, "method");
        String base = simpleName(method.declaringType()) + "." + method.name();
        return method.isStatic() ? base : base + " (inst)";
    }

    private static String simpleName(TypeDescriptor type) {
        String s = type.sourceName();
        int generic = s.indexOf('<');
        if (generic >= 0)
            s = s.substring(0, generic);
        return s.substring(s.lastIndexOf('.') + 1);
    }
}
