package com.visual.vgc.api;

/**
 * What a compiled unit is for. A console unit gets a {@code main} method and a
 * {@code Main-Class} manifest entry when persisted.
 */
public enum OutputKind {
    LIBRARY,
    CONSOLE
}
