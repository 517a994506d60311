package com.visual.vgc.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A directed edge from an output pin to an input pin.
 */
public record Connection(UUID id, UUID sourcePinId, UUID targetPinId) {
    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourcePinId, "sourcePinId");
        Objects.requireNonNull(targetPinId, "targetPinId");
    }

    public boolean touches(UUID pinId) {
        return sourcePinId.equals(pinId) || targetPinId.equals(pinId);
    }
}
