package com.visual.vgc.types;

import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Registry of facts about named types: supertypes, numeric-ness, declared
 * conversions, enum constants, constructibility and purity.
 *
 * <p>
 * A catalog is built once and handed to every component that needs type facts
 * (the compatibility checker, the literal formatter, the method registry).
 * Tests build their own instances, so nothing here is process-wide.
 *
 * <p>
 * Not thread-safe for concurrent registration. Reads after construction are safe.
 */
public final class TypeCatalog {
    private static final Set<String> ARRAY_SUPERTYPES = Set.of(
            "java.lang.Object", "java.lang.Cloneable", "java.io.Serializable");

    private final Map<String, Set<String>> supertypes = new HashMap<>();
    private final Set<String> numericTypes = new HashSet<>();
    private final Map<String, Set<String>> conversionsTo = new HashMap<>();
    private final Map<String, Set<String>> acceptedFrom = new HashMap<>();
    private final Map<String, List<String>> enumConstants = new HashMap<>();
    private final Set<String> constructible = new HashSet<>();
    private final Set<String> pureTypes = new HashSet<>();

    /** An empty catalog that only knows {@code java.lang.Object}. */
    public TypeCatalog() {
        supertypes.put(Types.OBJECT.qualifiedName(), new LinkedHashSet<>());
        constructible.add(Types.OBJECT.qualifiedName());
    }

    /**
     * A catalog pre-populated with the JDK types graphs commonly use.
     */
    public static TypeCatalog standard() {
        TypeCatalog c = new TypeCatalog();
        for (Class<?> type : new Class<?>[] {
                String.class, StringBuilder.class, Boolean.class, Character.class,
                Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
                BigDecimal.class, BigInteger.class, UUID.class, Optional.class,
                ArrayList.class, LinkedList.class, HashMap.class, LinkedHashMap.class, HashSet.class,
                Math.class, StrictMath.class, System.class }) {
            c.registerClass(type);
        }
        c.declareNumeric(BigDecimal.class.getName());
        c.declareNumeric(BigInteger.class.getName());
        c.declarePure(Math.class.getName());
        c.declarePure(StrictMath.class.getName());
        c.declarePure(String.class.getName());
        return c;
    }

    // ── Registration ────────────────────────────────────────────

    /**
     * Records a class and, transitively, its superclass and interfaces. Enum
     * constants and public parameterless constructors are recorded as well.
     */
    public TypeCatalog registerClass(Class<?> type) {
        if (type.isPrimitive() || type.isArray())
            return this;
        String name = type.getName();
        if (supertypes.containsKey(name) && !name.equals(Types.OBJECT.qualifiedName()))
            return this;

        Set<String> direct = supertypes.computeIfAbsent(name, k -> new LinkedHashSet<>());
        if (type.getSuperclass() != null) {
            direct.add(type.getSuperclass().getName());
            registerClass(type.getSuperclass());
        }
        for (Class<?> iface : type.getInterfaces()) {
            direct.add(iface.getName());
            registerClass(iface);
        }

        if (type.isEnum()) {
            List<String> constants = new ArrayList<>();
            for (Object constant : type.getEnumConstants())
                constants.add(((Enum<?>) constant).name());
            enumConstants.put(name, constants);
        }

        int mods = type.getModifiers();
        if (Modifier.isPublic(mods) && !Modifier.isAbstract(mods) && !type.isInterface()) {
            for (var ctor : type.getConstructors()) {
                if (ctor.getParameterCount() == 0)
                    constructible.add(name);
            }
        }
        return this;
    }

    /** Declares that {@code type} directly extends or implements {@code supertype}. */
    public TypeCatalog declareSupertype(String type, String supertype) {
        supertypes.computeIfAbsent(type, k -> new LinkedHashSet<>()).add(supertype);
        supertypes.computeIfAbsent(supertype, k -> new LinkedHashSet<>());
        return this;
    }

    public TypeCatalog declareNumeric(String qualifiedName) {
        numericTypes.add(qualifiedName);
        return this;
    }

    /** A conversion that the source type declares towards the target type. */
    public TypeCatalog declareConversion(TypeDescriptor from, TypeDescriptor to) {
        conversionsTo.computeIfAbsent(from.typeName(), k -> new HashSet<>()).add(to.typeName());
        return this;
    }

    /** A conversion that the target type declares from the source type. */
    public TypeCatalog declareAcceptance(TypeDescriptor target, TypeDescriptor from) {
        acceptedFrom.computeIfAbsent(target.typeName(), k -> new HashSet<>()).add(from.typeName());
        return this;
    }

    public TypeCatalog declareEnum(String qualifiedName, List<String> constants) {
        enumConstants.put(qualifiedName, List.copyOf(constants));
        supertypes.computeIfAbsent(qualifiedName, k -> new LinkedHashSet<>()).add("java.lang.Enum");
        return this;
    }

    public TypeCatalog declareConstructible(String qualifiedName) {
        constructible.add(qualifiedName);
        return this;
    }

    /** Marks a type whose methods are side-effect free and may be inlined. */
    public TypeCatalog declarePure(String qualifiedName) {
        pureTypes.add(qualifiedName);
        return this;
    }

    // ── Queries ─────────────────────────────────────────────────

    public boolean isKnown(TypeDescriptor type) {
        if (type instanceof TypeDescriptor.Primitive)
            return true;
        if (type instanceof TypeDescriptor.ArrayOf a)
            return isKnown(a.element());
        return supertypes.containsKey(baseName(type));
    }

    /**
     * True when {@code target} is {@code source} itself or one of its supertypes
     * or interfaces.
     */
    public boolean isSubtype(TypeDescriptor source, TypeDescriptor target) {
        if (source.equals(target))
            return true;
        if (source instanceof TypeDescriptor.Primitive || target instanceof TypeDescriptor.Primitive)
            return false;
        if (target.equals(Types.OBJECT))
            return true;

        if (source instanceof TypeDescriptor.ArrayOf sa) {
            if (target instanceof TypeDescriptor.ArrayOf ta) {
                if (sa.element().isPrimitive() || ta.element().isPrimitive())
                    return sa.element().equals(ta.element());
                return isSubtype(sa.element(), ta.element());
            }
            return target instanceof TypeDescriptor.Named n && ARRAY_SUPERTYPES.contains(n.qualifiedName());
        }
        if (target instanceof TypeDescriptor.ArrayOf)
            return false;

        if (target instanceof TypeDescriptor.Generic tg) {
            if (!(source instanceof TypeDescriptor.Generic sg))
                return false;
            return sg.arguments().equals(tg.arguments()) && isNamedSubtype(sg.base().qualifiedName(),
                    tg.base().qualifiedName());
        }
        return isNamedSubtype(baseName(source), baseName(target));
    }

    private boolean isNamedSubtype(String source, String target) {
        if (source.equals(target))
            return true;
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        queue.add(source);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!seen.add(current))
                continue;
            for (String sup : supertypes.getOrDefault(current, Set.of())) {
                if (sup.equals(target))
                    return true;
                queue.add(sup);
            }
        }
        return false;
    }

    /**
     * Unwraps a nullable wrapper: a boxed primitive yields the primitive and
     * {@code Optional<T>} yields {@code T}. Returns null for anything else.
     */
    public TypeDescriptor unwrapNullable(TypeDescriptor type) {
        if (type instanceof TypeDescriptor.Named n) {
            PrimitiveKind kind = PrimitiveKind.fromBoxedName(n.qualifiedName());
            return kind == null ? null : new TypeDescriptor.Primitive(kind);
        }
        if (type instanceof TypeDescriptor.Generic g && g.base().equals(Types.OPTIONAL) && g.arguments().size() == 1)
            return g.arguments().get(0);
        return null;
    }

    public boolean isNumeric(TypeDescriptor type) {
        if (type instanceof TypeDescriptor.Primitive p)
            return p.kind().isNumeric();
        return type instanceof TypeDescriptor.Named n && numericTypes.contains(n.qualifiedName());
    }

    public boolean hasDeclaredConversion(TypeDescriptor source, TypeDescriptor target) {
        return conversionsTo.getOrDefault(source.typeName(), Set.of()).contains(target.typeName())
                || acceptedFrom.getOrDefault(target.typeName(), Set.of()).contains(source.typeName());
    }

    public boolean isEnum(TypeDescriptor type) {
        return type instanceof TypeDescriptor.Named n && enumConstants.containsKey(n.qualifiedName());
    }

    /** Constants of an enum type, in declaration order. Empty if not an enum. */
    public List<String> enumConstants(TypeDescriptor type) {
        return type instanceof TypeDescriptor.Named n
                ? enumConstants.getOrDefault(n.qualifiedName(), List.of())
                : List.of();
    }

    public boolean hasParameterlessConstructor(TypeDescriptor type) {
        return constructible.contains(baseName(type));
    }

    public boolean isPure(TypeDescriptor type) {
        return pureTypes.contains(baseName(type));
    }

    private static String baseName(TypeDescriptor type) {
        if (type instanceof TypeDescriptor.Generic g)
            return g.base().qualifiedName();
        if (type instanceof TypeDescriptor.Named n)
            return n.qualifiedName();
        return type.typeName();
    }
}
