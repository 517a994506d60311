package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.types.Types;

import java.util.UUID;

/** Counts from Start (inclusive) to End (exclusive). */
public final class ForLoopNode extends Node {

    public ForLoopNode() {
        this(UUID.randomUUID());
    }

    public ForLoopNode(UUID id) {
        super(id, "For Loop", "Flow Control", "Iterate from start to end index");
        addExecInput(PinNames.EXEC);
        addInput(PinNames.START, Types.INT, 0);
        addInput(PinNames.END, Types.INT, 10);
        addExecOutput(PinNames.LOOP_BODY);
        addOutput(PinNames.INDEX, Types.INT);
        addExecOutput(PinNames.COMPLETED);
    }
}
