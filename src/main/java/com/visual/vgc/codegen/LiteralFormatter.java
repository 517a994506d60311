package com.visual.vgc.codegen;

import com.visual.vgc.types.PrimitiveKind;
import com.visual.vgc.types.TypeCatalog;
import com.visual.vgc.types.TypeDescriptor;
import com.visual.vgc.types.Types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

import lombok.extern.log4j.Log4j2;

/**
 * Renders stored values as Java source literals, and zero values for types.
 *
 * <p>
 * The declared type decides the form: {@code 5} stored for a {@code long} pin
 * becomes {@code 5L}, for a {@code byte} pin {@code (byte) 5}. Values typed
 * {@code java.lang.Object} are rendered by their runtime class. Strings and
 * numbers are accepted interchangeably for numeric types, since persisted
 * documents may carry either.
 */
@Log4j2
public final class LiteralFormatter {
    private final TypeCatalog catalog;

    public LiteralFormatter(TypeCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @throws CodeGenerationException if the value cannot represent the type, e.g.
     *                                 {@code "abc"} for an {@code int} or an unknown
     *                                 enum constant
     */
    public String format(Object value, TypeDescriptor type) {
        if (value == null)
            return zeroValue(type);

        if (type instanceof TypeDescriptor.Primitive p)
            return formatPrimitive(value, p.kind());

        if (type instanceof TypeDescriptor.Named n) {
            if (n.equals(Types.STRING))
                return quote(value instanceof Enum<?> e ? e.name() : value.toString());
            if (n.equals(Types.OBJECT))
                return formatByRuntimeClass(value);

            PrimitiveKind boxed = PrimitiveKind.fromBoxedName(n.qualifiedName());
            if (boxed != null)
                return formatPrimitive(value, boxed);

            if (n.qualifiedName().equals(BigDecimal.class.getName()))
                return "new java.math.BigDecimal(" + quote(toBigDecimal(value, type).toPlainString()) + ")";
            if (n.qualifiedName().equals(BigInteger.class.getName()))
                return "new java.math.BigInteger(" + quote(toBigDecimal(value, type).toBigInteger().toString()) + ")";
            if (n.qualifiedName().equals(UUID.class.getName()))
                return "java.util.UUID.fromString(" + quote(toUuid(value).toString()) + ")";
            if (catalog.isEnum(n))
                return formatEnum(value, n);
        }

        log.warn("No literal form for a {} value of type {}, using its zero value", value.getClass().getSimpleName(),
                type);
        return zeroValue(type);
    }

    /** The value an unset variable or unresolved input of this type starts with. */
    public String zeroValue(TypeDescriptor type) {
        if (type instanceof TypeDescriptor.Primitive p) {
            return switch (p.kind()) {
                case BOOLEAN -> "false";
                case BYTE -> "(byte) 0";
                case SHORT -> "(short) 0";
                case INT -> "0";
                case LONG -> "0L";
                case FLOAT -> "0.0f";
                case DOUBLE -> "0.0d";
                case CHAR -> "'\\0'";
                case VOID -> throw new CodeGenerationException("void has no value");
            };
        }
        return "null";
    }

    // ── Primitives ──────────────────────────────────────────────

    private String formatPrimitive(Object value, PrimitiveKind kind) {
        return switch (kind) {
            case BOOLEAN -> Boolean.toString(toBoolean(value));
            case CHAR -> quoteChar(toChar(value));
            case BYTE -> "(byte) " + toNumber(value, kind).byteValue();
            case SHORT -> "(short) " + toNumber(value, kind).shortValue();
            case INT -> Integer.toString(toNumber(value, kind).intValue());
            case LONG -> toNumber(value, kind).longValue() + "L";
            case FLOAT -> formatFloat(toNumber(value, kind).floatValue());
            case DOUBLE -> formatDouble(toNumber(value, kind).doubleValue());
            case VOID -> throw new CodeGenerationException("void has no value");
        };
    }

    private static String formatFloat(float f) {
        if (Float.isNaN(f))
            return "Float.NaN";
        if (Float.isInfinite(f))
            return f > 0 ? "Float.POSITIVE_INFINITY" : "Float.NEGATIVE_INFINITY";
        return Float.toString(f) + "f";
    }

    private static String formatDouble(double d) {
        if (Double.isNaN(d))
            return "Double.NaN";
        if (Double.isInfinite(d))
            return d > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
        return Double.toString(d) + "d";
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b)
            return b;
        String s = value.toString().trim();
        if (s.equalsIgnoreCase("true"))
            return true;
        if (s.equalsIgnoreCase("false"))
            return false;
        throw new CodeGenerationException("Not a boolean literal: " + value);
    }

    private static char toChar(Object value) {
        if (value instanceof Character c)
            return c;
        if (value instanceof Number n)
            return (char) n.intValue();
        String s = value.toString();
        if (s.length() != 1)
            throw new CodeGenerationException("Not a char literal: \"" + s + "\"");
        return s.charAt(0);
    }

    private static Number toNumber(Object value, PrimitiveKind kind) {
        if (value instanceof Number n)
            return n;
        if (value instanceof Character c)
            return (int) c;
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new CodeGenerationException("Not a " + kind.keyword() + " literal: " + value, e);
        }
    }

    // ── Reference types ─────────────────────────────────────────

    private String formatByRuntimeClass(Object value) {
        if (value instanceof String s)
            return quote(s);
        if (value instanceof Enum<?> e)
            return e.getDeclaringClass().getName().replace('$', '.') + "." + e.name();
        if (value instanceof BigDecimal || value instanceof BigInteger || value instanceof UUID)
            return format(value, Types.of(value.getClass()));
        PrimitiveKind boxed = PrimitiveKind.fromBoxedName(value.getClass().getName());
        if (boxed != null)
            return formatPrimitive(value, boxed);
        log.warn("No literal form for {}, using null", value.getClass().getName());
        return "null";
    }

    private String formatEnum(Object value, TypeDescriptor.Named type) {
        String member = value instanceof Enum<?> e ? e.name() : value.toString().trim();
        if (!catalog.enumConstants(type).contains(member))
            throw new CodeGenerationException("'" + member + "' is not a constant of " + type.sourceName());
        return type.sourceName() + "." + member;
    }

    private static BigDecimal toBigDecimal(Object value, TypeDescriptor type) {
        try {
            if (value instanceof BigDecimal bd)
                return bd;
            if (value instanceof BigInteger bi)
                return new BigDecimal(bi);
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new CodeGenerationException("Not a " + type.sourceName() + " literal: " + value, e);
        }
    }

    private static UUID toUuid(Object value) {
        if (value instanceof UUID u)
            return u;
        try {
            return UUID.fromString(value.toString().trim());
        } catch (IllegalArgumentException e) {
            throw new CodeGenerationException("Not a UUID literal: " + value, e);
        }
    }

    // ── Escaping ────────────────────────────────────────────────

    /** Double-quoted Java string literal. */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"')
                sb.append("\\\"");
            else
                appendEscaped(sb, c);
        }
        return sb.append('"').toString();
    }

    /** Single-quoted Java char literal. */
    public static String quoteChar(char c) {
        StringBuilder sb = new StringBuilder(8).append('\'');
        if (c == '\'')
            sb.append("\\'");
        else
            appendEscaped(sb, c);
        return sb.append('\'').toString();
    }

    // Octal escapes, not \\u: unicode escapes are translated before lexing.
    private static void appendEscaped(StringBuilder sb, char c) {
        switch (c) {
            case '\\' -> sb.append("\\\\");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            case '\b' -> sb.append("\\b");
            case '\f' -> sb.append("\\f");
            default -> {
                if (c < 0x20 || c == 0x7f)
                    sb.append(String.format("\\%03o", (int) c));
                else
                    sb.append(c);
            }
        }
    }
}
