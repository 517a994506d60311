package com.visual.vgc.node;

import com.visual.vgc.model.Node;

import java.util.UUID;

/** Runs each "Then i" chain in order. */
public final class SequenceNode extends Node {
    public static final String OUTPUT_COUNT = "OutputCount";
    public static final int DEFAULT_OUTPUT_COUNT = 2;

    public SequenceNode() {
        this(UUID.randomUUID(), DEFAULT_OUTPUT_COUNT);
    }

    public SequenceNode(int outputCount) {
        this(UUID.randomUUID(), outputCount);
    }

    public SequenceNode(UUID id, int outputCount) {
        super(id, "Sequence", "Flow Control", "Executes multiple outputs in sequence");
        if (outputCount < 1)
            throw new IllegalArgumentException("Sequence needs at least one output, got " + outputCount);
        setProperty(OUTPUT_COUNT, outputCount);
        addExecInput(PinNames.EXEC);
        for (int i = 0; i < outputCount; i++)
            addExecOutput(PinNames.then(i));
    }

    public int outputCount() {
        return (Integer) property(OUTPUT_COUNT);
    }
}
