package com.visual.vgc.api;

/** Side of the node a pin sits on. */
public enum PinDirection {
    INPUT,
    OUTPUT;

    public PinDirection opposite() {
        return this == INPUT ? OUTPUT : INPUT;
    }
}
