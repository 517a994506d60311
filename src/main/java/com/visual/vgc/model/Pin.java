package com.visual.vgc.model;

import com.visual.vgc.api.PinDirection;
import com.visual.vgc.api.PinKind;
import com.visual.vgc.types.TypeCompatibilityChecker;
import com.visual.vgc.types.TypeDescriptor;

import java.util.Objects;
import java.util.UUID;

/**
 * A typed connection point on a node.
 *
 * <p>
 * Pins are created by their node's constructor and never added or removed
 * afterwards. The {@code connected} flag is owned by {@link Graph}; nothing else
 * writes it.
 */
public final class Pin {
    private final UUID id;
    private final String name;
    private final PinKind kind;
    private final PinDirection direction;
    private final TypeDescriptor type;
    private final Object defaultValue;
    private final UUID nodeId;
    private boolean connected;

    Pin(UUID id, String name, PinKind kind, PinDirection direction, TypeDescriptor type, Object defaultValue,
            UUID nodeId) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.type = type;
        this.defaultValue = defaultValue;
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    }

    public UUID id() {
        return id;
    }

    public String name() {
        return name;
    }

    public PinKind kind() {
        return kind;
    }

    public PinDirection direction() {
        return direction;
    }

    /** Declared type, or null for an untyped (wildcard) pin. Always null for execution pins. */
    public TypeDescriptor type() {
        return type;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public UUID nodeId() {
        return nodeId;
    }

    public boolean isConnected() {
        return connected;
    }

    void setConnected(boolean connected) {
        this.connected = connected;
    }

    public boolean isExecution() {
        return kind == PinKind.EXECUTION;
    }

    public boolean isData() {
        return kind == PinKind.DATA;
    }

    public boolean isInput() {
        return direction == PinDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == PinDirection.OUTPUT;
    }

    /**
     * Checks whether this pin may be wired to {@code other}, in either drag
     * direction.
     *
     * <p>
     * Requires opposite directions, the same kind and different owning nodes.
     * Execution pins are then always compatible. Data pins are compatible when
     * either side is untyped, otherwise the output side's type must be compatible
     * with the input side's type.
     */
    public boolean canConnectTo(Pin other, TypeCompatibilityChecker checker) {
        if (direction == other.direction)
            return false;
        if (nodeId.equals(other.nodeId))
            return false;
        if (kind != other.kind)
            return false;
        if (kind == PinKind.EXECUTION)
            return true;
        if (type == null || other.type == null)
            return true;

        Pin source = isOutput() ? this : other;
        Pin target = isOutput() ? other : this;
        return checker.areCompatible(source.type, target.type);
    }

    @Override
    public String toString() {
        return "Pin[" + name + " " + direction + " " + kind + (type != null ? " " + type : "") + "]";
    }
}
