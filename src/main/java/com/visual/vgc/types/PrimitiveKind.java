package com.visual.vgc.types;

/**
 * The Java primitive kinds, with their boxed wrapper names.
 */
public enum PrimitiveKind {
    BOOLEAN("boolean", "java.lang.Boolean", false, false),
    BYTE("byte", "java.lang.Byte", true, false),
    SHORT("short", "java.lang.Short", true, false),
    INT("int", "java.lang.Integer", true, false),
    LONG("long", "java.lang.Long", true, false),
    FLOAT("float", "java.lang.Float", true, true),
    DOUBLE("double", "java.lang.Double", true, true),
    CHAR("char", "java.lang.Character", false, false),
    VOID("void", "java.lang.Void", false, false);

    private final String keyword;
    private final String boxedName;
    private final boolean numeric;
    private final boolean floating;

    PrimitiveKind(String keyword, String boxedName, boolean numeric, boolean floating) {
        this.keyword = keyword;
        this.boxedName = boxedName;
        this.numeric = numeric;
        this.floating = floating;
    }

    public String keyword() {
        return keyword;
    }

    public String boxedName() {
        return boxedName;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public boolean isFloating() {
        return floating;
    }

    /** Returns the kind for a keyword such as {@code "int"}, or null. */
    public static PrimitiveKind fromKeyword(String keyword) {
        for (PrimitiveKind k : values()) {
            if (k.keyword.equals(keyword))
                return k;
        }
        return null;
    }

    /** Returns the kind whose wrapper class has the given name, or null. */
    public static PrimitiveKind fromBoxedName(String qualifiedName) {
        for (PrimitiveKind k : values()) {
            if (k != VOID && k.boxedName.equals(qualifiedName))
                return k;
        }
        return null;
    }
}
