package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.types.Types;

import java.util.UUID;

/** Writes a value to standard output. */
public final class PrintNode extends Node {

    public PrintNode() {
        this(UUID.randomUUID());
    }

    public PrintNode(UUID id) {
        super(id, "Print", "Debug", "Print value to console");
        addExecInput(PinNames.EXEC);
        addInput(PinNames.VALUE, Types.OBJECT, null);
        addExecOutput(PinNames.EXEC);
    }
}
