package com.visual.vgc.model;

/** Canvas position of a node. Opaque to everything except the UI. */
public record Position(double x, double y) {
    public static final Position ORIGIN = new Position(0, 0);
}
