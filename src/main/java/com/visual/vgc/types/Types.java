package com.visual.vgc.types;

import java.util.ArrayList;
import java.util.List;

/**
 * Common type descriptors and the textual type parser.
 */
public final class Types {
    public static final TypeDescriptor BOOLEAN = new TypeDescriptor.Primitive(PrimitiveKind.BOOLEAN);
    public static final TypeDescriptor BYTE = new TypeDescriptor.Primitive(PrimitiveKind.BYTE);
    public static final TypeDescriptor SHORT = new TypeDescriptor.Primitive(PrimitiveKind.SHORT);
    public static final TypeDescriptor INT = new TypeDescriptor.Primitive(PrimitiveKind.INT);
    public static final TypeDescriptor LONG = new TypeDescriptor.Primitive(PrimitiveKind.LONG);
    public static final TypeDescriptor FLOAT = new TypeDescriptor.Primitive(PrimitiveKind.FLOAT);
    public static final TypeDescriptor DOUBLE = new TypeDescriptor.Primitive(PrimitiveKind.DOUBLE);
    public static final TypeDescriptor CHAR = new TypeDescriptor.Primitive(PrimitiveKind.CHAR);
    public static final TypeDescriptor VOID = new TypeDescriptor.Primitive(PrimitiveKind.VOID);

    public static final TypeDescriptor.Named OBJECT = named("java.lang.Object");
    public static final TypeDescriptor.Named STRING = named("java.lang.String");
    public static final TypeDescriptor.Named OPTIONAL = named("java.util.Optional");

    private Types() {
        // Utility class
    }

    public static TypeDescriptor.Named named(String qualifiedName) {
        return new TypeDescriptor.Named(qualifiedName);
    }

    public static TypeDescriptor arrayOf(TypeDescriptor element) {
        return new TypeDescriptor.ArrayOf(element);
    }

    public static TypeDescriptor generic(String base, TypeDescriptor... arguments) {
        return new TypeDescriptor.Generic(named(base), List.of(arguments));
    }

    /** Describes a runtime class. Generic signatures are erased. */
    public static TypeDescriptor of(Class<?> type) {
        if (type.isArray())
            return arrayOf(of(type.getComponentType()));
        if (type.isPrimitive())
            return new TypeDescriptor.Primitive(PrimitiveKind.fromKeyword(type.getName()));
        return named(type.getName());
    }

    /**
     * Parses type text such as {@code int}, {@code java.lang.String[]} or
     * {@code java.util.Map<java.lang.String, java.lang.Integer>}.
     *
     * @throws IllegalArgumentException if the text is not a well-formed type.
     */
    public static TypeDescriptor parse(String text) {
        if (text == null || text.isBlank())
            throw new IllegalArgumentException("Empty type name");
        var parser = new TypeParser(text);
        TypeDescriptor t = parser.parseType();
        parser.skipWS();
        if (!parser.atEnd())
            throw parser.err("Unexpected trailing input");
        return t;
    }

    /** Recursive descent over the small type grammar. */
    private static final class TypeParser {
        private final String input;
        private int pos;

        TypeParser(String input) {
            this.input = input;
        }

        TypeDescriptor parseType() {
            skipWS();
            String name = parseQualifiedName();
            TypeDescriptor type;
            PrimitiveKind kind = PrimitiveKind.fromKeyword(name);
            if (kind != null) {
                type = new TypeDescriptor.Primitive(kind);
            } else {
                skipWS();
                if (peek() == '<') {
                    pos++;
                    List<TypeDescriptor> args = new ArrayList<>();
                    do {
                        args.add(parseType());
                        skipWS();
                    } while (consume(','));
                    if (!consume('>'))
                        throw err("Expected '>'");
                    type = new TypeDescriptor.Generic(named(name), args);
                } else {
                    type = named(name);
                }
            }
            skipWS();
            while (peek() == '[') {
                pos++;
                skipWS();
                if (!consume(']'))
                    throw err("Expected ']'");
                type = arrayOf(type);
                skipWS();
            }
            return type;
        }

        private String parseQualifiedName() {
            int start = pos;
            while (!atEnd()) {
                char c = input.charAt(pos);
                if (Character.isJavaIdentifierPart(c) || c == '.')
                    pos++;
                else
                    break;
            }
            if (start == pos)
                throw err("Expected type name");
            String name = input.substring(start, pos);
            if (!Character.isJavaIdentifierStart(name.charAt(0)) || name.endsWith(".") || name.contains(".."))
                throw err("Malformed type name '" + name + "'");
            return name;
        }

        private boolean consume(char c) {
            skipWS();
            if (peek() == c) {
                pos++;
                return true;
            }
            return false;
        }

        void skipWS() {
            while (!atEnd() && Character.isWhitespace(input.charAt(pos)))
                pos++;
        }

        boolean atEnd() {
            return pos >= input.length();
        }

        private char peek() {
            return atEnd() ? '\0' : input.charAt(pos);
        }

        IllegalArgumentException err(String msg) {
            return new IllegalArgumentException(msg + " at position " + pos + " in type '" + input + "'");
        }
    }
}
