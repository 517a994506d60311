package com.visual.vgc.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A list of statements at one nesting level.
 *
 * <p>
 * Once a block is terminated (it ended in {@code return}) further statements are
 * dropped, since javac rejects unreachable code.
 */
final class CodeBlock {
    private static final String INDENT = "    ";

    private final List<String> lines = new ArrayList<>();
    private boolean terminated;
    private int dropped;

    void add(String line) {
        if (terminated) {
            dropped++;
            return;
        }
        lines.add(line);
    }

    /** Appends the statements of {@code body} one level deeper. */
    void addIndented(CodeBlock body) {
        if (terminated) {
            dropped += body.lines.size();
            return;
        }
        for (String line : body.lines)
            lines.add(INDENT + line);
    }

    void terminate() {
        terminated = true;
    }

    boolean isTerminated() {
        return terminated;
    }

    boolean isEmpty() {
        return lines.isEmpty();
    }

    int droppedCount() {
        return dropped;
    }

    List<String> lines() {
        return Collections.unmodifiableList(lines);
    }
}
