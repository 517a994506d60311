package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.types.Types;

import java.util.UUID;

/** Logical negation. Pure data node. */
public final class NotNode extends Node {

    public NotNode() {
        this(UUID.randomUUID());
    }

    public NotNode(UUID id) {
        super(id, "Not", "Operators", "Logical NOT operator (!)");
        addInput(PinNames.VALUE, Types.BOOLEAN, false);
        addOutput(PinNames.RESULT, Types.BOOLEAN);
    }
}
