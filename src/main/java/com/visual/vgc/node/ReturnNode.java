package com.visual.vgc.node;

import com.visual.vgc.model.Node;

import java.util.UUID;

/** Leaves the entry method. The entry method is void, so there is no value pin. */
public final class ReturnNode extends Node {

    public ReturnNode() {
        this(UUID.randomUUID());
    }

    public ReturnNode(UUID id) {
        super(id, "Return", "Flow Control", "Exit function");
        addExecInput(PinNames.EXEC);
    }
}
