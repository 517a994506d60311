package com.visual.vgc.method;

import com.visual.vgc.codegen.CodeGenerationException;
import com.visual.vgc.types.TypeCatalog;
import com.visual.vgc.types.TypeDescriptor;
import com.visual.vgc.types.Types;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * The methods graphs may call, keyed by declaring type, name and parameter
 * types.
 *
 * <p>
 * Reflected classes are also registered with the {@link TypeCatalog}, so every
 * type a method mentions is known to the compatibility checker. A method is pure
 * when its declaring type is marked pure in the catalog.
 */
@Log4j2
public final class MethodRegistry {
    private final TypeCatalog catalog;
    private final Map<String, MethodDescriptor> methods = new LinkedHashMap<>();
    private final Set<String> knownTypes = new HashSet<>();

    public MethodRegistry(TypeCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /** A registry with the public methods of the JDK types in {@link TypeCatalog#standard()}. */
    public static MethodRegistry standard(TypeCatalog catalog) {
        MethodRegistry r = new MethodRegistry(catalog);
        for (Class<?> type : new Class<?>[] {
                Math.class, String.class, StringBuilder.class, Integer.class, Long.class, Double.class,
                Boolean.class, Character.class, java.math.BigDecimal.class, java.util.UUID.class,
                java.util.ArrayList.class, java.util.HashMap.class, System.class }) {
            r.registerClass(type);
        }
        return r;
    }

    public TypeCatalog catalog() {
        return catalog;
    }

    /**
     * Registers every public, non-synthetic method visible on {@code type}.
     * Inherited methods are recorded against {@code type} itself.
     */
    public MethodRegistry registerClass(Class<?> type) {
        catalog.registerClass(type);
        TypeDescriptor declaring = Types.of(type);
        knownTypes.add(declaring.typeName());
        boolean pure = catalog.isPure(declaring);

        int count = 0;
        for (Method m : type.getMethods()) {
            if (m.isSynthetic() || m.isBridge())
                continue;
            List<ParameterDescriptor> params = new ArrayList<>();
            for (Parameter p : m.getParameters()) {
                catalog.registerClass(p.getType());
                params.add(ParameterDescriptor.of(p.getName(), Types.of(p.getType())));
            }
            catalog.registerClass(m.getReturnType());
            MethodDescriptor d = new MethodDescriptor(declaring, m.getName(), Modifier.isStatic(m.getModifiers()),
                    params, Types.of(m.getReturnType()), pure);
            if (methods.putIfAbsent(d.signature(), d) == null)
                count++;
        }
        log.debug("Registered {} methods of {}", count, type.getName());
        return this;
    }

    /** Registers a hand-built descriptor, replacing any with the same signature. */
    public MethodRegistry register(MethodDescriptor descriptor) {
        knownTypes.add(descriptor.declaringType().typeName());
        methods.put(descriptor.signature(), descriptor);
        return this;
    }

    public boolean isKnownType(String typeName) {
        return knownTypes.contains(typeName);
    }

    public boolean contains(MethodDescriptor descriptor) {
        return descriptor.equals(methods.get(descriptor.signature()));
    }

    /** Returns the descriptor with this exact signature, or null. */
    public MethodDescriptor find(String declaringTypeName, String methodName, List<String> parameterTypeNames) {
        return methods.get(MethodDescriptor.signature(declaringTypeName, methodName, parameterTypeNames));
    }

    /**
     * Like {@link #find} but fails with a message naming what could not be
     * resolved.
     */
    public MethodDescriptor resolve(String declaringTypeName, String methodName, List<String> parameterTypeNames) {
        if (!isKnownType(declaringTypeName))
            throw new CodeGenerationException("Unknown declaring type: " + declaringTypeName);
        MethodDescriptor d = find(declaringTypeName, methodName, parameterTypeNames);
        if (d == null)
            throw new CodeGenerationException("Unknown method: "
                    + MethodDescriptor.signature(declaringTypeName, methodName, parameterTypeNames));
        return d;
    }

    /** All overloads of a method name on a type, in registration order. */
    public List<MethodDescriptor> overloads(String declaringTypeName, String methodName) {
        List<MethodDescriptor> result = new ArrayList<>();
        for (MethodDescriptor d : methods.values())
            if (d.declaringType().typeName().equals(declaringTypeName) && d.name().equals(methodName))
                result.add(d);
        return result;
    }

    public int size() {
        return methods.size();
    }
}
