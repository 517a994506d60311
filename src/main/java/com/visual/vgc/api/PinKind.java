package com.visual.vgc.api;

/**
 * What a pin carries.
 *
 * <p>
 * {@link #EXECUTION} pins carry control flow and define statement order.
 * {@link #DATA} pins carry typed values between nodes.
 */
public enum PinKind {
    EXECUTION,
    DATA
}
