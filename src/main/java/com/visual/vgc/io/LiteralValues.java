package com.visual.vgc.io;

import com.visual.vgc.types.PrimitiveKind;
import com.visual.vgc.types.TypeDescriptor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Converts literal values between their in-memory and JSON forms.
 *
 * <p>
 * JSON has one number type, so a {@code long} 5 comes back as an
 * {@code Integer}. {@link #coerce} restores the Java type the literal's
 * declared type calls for.
 */
final class LiteralValues {

    private LiteralValues() {
    }

    /** Form written to JSON: strings, numbers and booleans only. */
    static Object toJson(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean)
            return value;
        if (value instanceof BigDecimal bd)
            return bd.toPlainString();
        if (value instanceof Integer || value instanceof Long || value instanceof Double
                || value instanceof Float || value instanceof Short || value instanceof Byte)
            return value;
        if (value instanceof Enum<?> e)
            return e.name();
        return value.toString();
    }

    /**
     * @throws IllegalArgumentException if the value cannot represent the type
     */
    static Object coerce(Object raw, TypeDescriptor type) {
        if (raw == null)
            return null;
        PrimitiveKind kind = null;
        if (type instanceof TypeDescriptor.Primitive p)
            kind = p.kind();
        else if (type instanceof TypeDescriptor.Named n)
            kind = PrimitiveKind.fromBoxedName(n.qualifiedName());

        if (kind != null) {
            return switch (kind) {
                case BOOLEAN -> raw instanceof Boolean b ? b : Boolean.valueOf(raw.toString().trim());
                case CHAR -> toChar(raw);
                case BYTE -> number(raw).byteValue();
                case SHORT -> number(raw).shortValue();
                case INT -> number(raw).intValue();
                case LONG -> number(raw).longValue();
                case FLOAT -> number(raw).floatValue();
                case DOUBLE -> number(raw).doubleValue();
                case VOID -> throw new IllegalArgumentException("void literal");
            };
        }
        if (type instanceof TypeDescriptor.Named n) {
            String name = n.qualifiedName();
            if (name.equals(BigDecimal.class.getName()))
                return new BigDecimal(raw.toString().trim());
            if (name.equals(BigInteger.class.getName()))
                return new BigInteger(raw.toString().trim());
            if (name.equals(UUID.class.getName()))
                return UUID.fromString(raw.toString().trim());
        }
        return raw;
    }

    private static Character toChar(Object raw) {
        if (raw instanceof Number n)
            return (char) n.intValue();
        String s = raw.toString();
        if (s.length() != 1)
            throw new IllegalArgumentException("Not a char: \"" + s + "\"");
        return s.charAt(0);
    }

    private static Number number(Object raw) {
        if (raw instanceof Number n)
            return n;
        return new BigDecimal(raw.toString().trim());
    }
}
