package com.visual.vgc.model;

import java.util.Objects;

/**
 * Tracks a drag-to-connect gesture from the UI.
 *
 * <p>
 * The user may start dragging from either end. {@link #tryComplete} orients the
 * pair so the output pin becomes the source before asking the graph to connect
 * them.
 */
public final class ConnectionGesture {
    private final Graph graph;
    private Pin origin;

    public ConnectionGesture(Graph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /** Starts a gesture on a pin of this graph. Returns false if the pin is unknown. */
    public boolean tryBegin(Pin pin) {
        if (pin == null || graph.findPin(pin.id()) != pin) {
            origin = null;
            return false;
        }
        origin = pin;
        return true;
    }

    public boolean isActive() {
        return origin != null;
    }

    public Pin origin() {
        return origin;
    }

    /** Whether dropping on {@code pin} would be accepted. Does not change state. */
    public boolean canDropOn(Pin pin) {
        return origin != null && pin != null && origin.canConnectTo(pin, graph.checker());
    }

    /**
     * Finishes the gesture on {@code pin}. The gesture ends either way.
     *
     * @return the created connection, or null if the drop was rejected
     */
    public Connection tryComplete(Pin pin) {
        Pin start = origin;
        origin = null;
        if (start == null || pin == null || !start.canConnectTo(pin, graph.checker()))
            return null;
        return start.isOutput()
                ? graph.addConnection(start.id(), pin.id())
                : graph.addConnection(pin.id(), start.id());
    }

    public void cancel() {
        origin = null;
    }
}
