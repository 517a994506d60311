package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.model.Pin;

import java.util.UUID;

/** Entry point of execution. */
public final class StartNode extends Node {

    public StartNode() {
        this(UUID.randomUUID());
    }

    public StartNode(UUID id) {
        super(id, "Start", "Flow Control", "Entry point for execution");
        addExecOutput(PinNames.START);
    }

    @Override
    protected boolean isExecutionInputRequired(Pin pin) {
        return false;
    }
}
