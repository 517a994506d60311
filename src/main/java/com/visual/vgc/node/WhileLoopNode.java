package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.types.Types;

import java.util.UUID;

/** Loops while the condition holds. */
public final class WhileLoopNode extends Node {

    public WhileLoopNode() {
        this(UUID.randomUUID());
    }

    public WhileLoopNode(UUID id) {
        super(id, "While Loop", "Flow Control", "Loop while condition is true");
        addExecInput(PinNames.EXEC);
        addInput(PinNames.CONDITION, Types.BOOLEAN, false);
        addExecOutput(PinNames.LOOP_BODY);
        addExecOutput(PinNames.COMPLETED);
    }
}
