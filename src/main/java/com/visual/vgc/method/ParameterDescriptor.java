package com.visual.vgc.method;

import com.visual.vgc.types.TypeDescriptor;

import java.util.Objects;

/**
 * One formal parameter of a method.
 *
 * @param defaultValue the declared default, only meaningful when {@code hasDefault}
 */
public record ParameterDescriptor(String name, TypeDescriptor type, boolean hasDefault, Object defaultValue) {
    public ParameterDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static ParameterDescriptor of(String name, TypeDescriptor type) {
        return new ParameterDescriptor(name, type, false, null);
    }

    public static ParameterDescriptor withDefault(String name, TypeDescriptor type, Object defaultValue) {
        return new ParameterDescriptor(name, type, true, defaultValue);
    }
}
