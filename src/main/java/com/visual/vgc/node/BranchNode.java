package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.types.Types;

import java.util.UUID;

/** If/else on a boolean condition. */
public final class BranchNode extends Node {

    public BranchNode() {
        this(UUID.randomUUID());
    }

    public BranchNode(UUID id) {
        super(id, "Branch", "Flow Control", "Conditional execution based on boolean condition");
        addExecInput(PinNames.EXEC);
        addInput(PinNames.CONDITION, Types.BOOLEAN, false);
        addExecOutput(PinNames.TRUE);
        addExecOutput(PinNames.FALSE);
    }
}
