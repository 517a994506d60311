package com.visual.vgc.host;

/**
 * Outcome of {@link ExecutionHost#run}.
 *
 * @param output everything written to {@code System.out} during the run, also
 *               when it faulted part way
 * @param fault  null on success
 */
public record RunResult(String output, ExecutionFault fault) {

    public boolean success() {
        return fault == null;
    }
}
