package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.types.TypeDescriptor;

import java.util.Objects;
import java.util.UUID;

/**
 * A constant. The value is kept as given (a {@code String}, boxed number,
 * {@code Character}, {@code Boolean}, or the constant's text for enums and big
 * numbers) and formatted according to the declared type when source is emitted.
 */
public final class LiteralNode extends Node {
    public static final String LITERAL_TYPE = "LiteralType";
    public static final String VALUE = "Value";

    public LiteralNode(TypeDescriptor type, Object value) {
        this(UUID.randomUUID(), type, value);
    }

    public LiteralNode(UUID id, TypeDescriptor type, Object value) {
        super(id, "Literal " + Objects.requireNonNull(type, "type").sourceName(), "Literals",
                "Constant value of type " + type.sourceName());
        setProperty(LITERAL_TYPE, type);
        setProperty(VALUE, value);
        addOutput(PinNames.VALUE, type);
    }

    public TypeDescriptor literalType() {
        return (TypeDescriptor) property(LITERAL_TYPE);
    }

    public Object value() {
        return property(VALUE);
    }
}
