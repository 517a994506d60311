package com.visual.vgc.model;

import com.visual.vgc.api.PinDirection;
import com.visual.vgc.api.PinKind;
import com.visual.vgc.types.TypeDescriptor;

import java.util.*;

/**
 * Base class for every node template.
 *
 * <p>
 * A node owns two ordered pin lists. Subclasses declare their pins in the
 * constructor through {@link #addInput} / {@link #addOutput}; the lists are
 * frozen from then on. Title, category and description are presentation only.
 *
 * <p>
 * The property bag holds the node's construction arguments (literal value,
 * variable name, operator, ...) so that the graph can be persisted and rebuilt.
 */
public abstract class Node {
    private final UUID id;
    private final String title;
    private final String category;
    private final String description;
    private final List<Pin> inputs = new ArrayList<>();
    private final List<Pin> outputs = new ArrayList<>();
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private Position position = Position.ORIGIN;

    protected Node(UUID id, String title, String category, String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title;
        this.category = category;
        this.description = description;
    }

    public UUID id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String category() {
        return category;
    }

    public String description() {
        return description;
    }

    public Position position() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public List<Pin> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Pin> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    /** Inputs followed by outputs. */
    public List<Pin> allPins() {
        List<Pin> all = new ArrayList<>(inputs.size() + outputs.size());
        all.addAll(inputs);
        all.addAll(outputs);
        return all;
    }

    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public Object property(String name) {
        return properties.get(name);
    }

    protected void setProperty(String name, Object value) {
        properties.put(name, value);
    }

    // ── Pin lookup ──────────────────────────────────────────────

    /** Returns the pin with the given id, or null. */
    public Pin findPin(UUID pinId) {
        for (Pin p : inputs)
            if (p.id().equals(pinId))
                return p;
        for (Pin p : outputs)
            if (p.id().equals(pinId))
                return p;
        return null;
    }

    public Pin input(String name) {
        return byName(inputs, name);
    }

    public Pin output(String name) {
        return byName(outputs, name);
    }

    /** Finds a pin by its persisted identity. Returns null if none matches. */
    public Pin findPin(String name, PinDirection direction, PinKind kind) {
        for (Pin p : direction == PinDirection.INPUT ? inputs : outputs)
            if (p.name().equals(name) && p.kind() == kind)
                return p;
        return null;
    }

    private static Pin byName(List<Pin> pins, String name) {
        for (Pin p : pins)
            if (p.name().equals(name))
                return p;
        return null;
    }

    public boolean hasExecutionPins() {
        for (Pin p : inputs)
            if (p.isExecution())
                return true;
        for (Pin p : outputs)
            if (p.isExecution())
                return true;
        return false;
    }

    // ── Construction helpers ────────────────────────────────────

    protected final Pin addExecInput(String name) {
        return add(inputs, name, PinKind.EXECUTION, PinDirection.INPUT, null, null);
    }

    protected final Pin addExecOutput(String name) {
        return add(outputs, name, PinKind.EXECUTION, PinDirection.OUTPUT, null, null);
    }

    protected final Pin addInput(String name, TypeDescriptor type, Object defaultValue) {
        return add(inputs, name, PinKind.DATA, PinDirection.INPUT, type, defaultValue);
    }

    protected final Pin addOutput(String name, TypeDescriptor type) {
        return add(outputs, name, PinKind.DATA, PinDirection.OUTPUT, type, null);
    }

    private Pin add(List<Pin> list, String name, PinKind kind, PinDirection direction, TypeDescriptor type,
            Object defaultValue) {
        for (Pin p : list)
            if (p.name().equals(name) && p.kind() == kind)
                throw new IllegalArgumentException("Duplicate " + kind.name().toLowerCase(Locale.ROOT)
                        + " pin name '" + name + "' on " + title);
        Pin pin = new Pin(UUID.randomUUID(), name, kind, direction, type, defaultValue, id);
        list.add(pin);
        return pin;
    }

    // ── Validation ──────────────────────────────────────────────

    /** Returns the problems with this node's current wiring. Empty when valid. */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        for (Pin p : inputs) {
            if (p.isExecution() && isExecutionInputRequired(p) && !p.isConnected())
                errors.add("Execution input '" + p.name() + "' must be connected");
        }
        return errors;
    }

    protected boolean isExecutionInputRequired(Pin pin) {
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + title + " " + id + "]";
    }
}
