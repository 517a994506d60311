package com.visual.vgc.node;

/** Pin names shared by several node templates. */
public final class PinNames {
    public static final String EXEC = "Exec";
    public static final String START = "Start";
    public static final String CONDITION = "Condition";
    public static final String TRUE = "True";
    public static final String FALSE = "False";
    public static final String LOOP_BODY = "Loop Body";
    public static final String COMPLETED = "Completed";
    public static final String INDEX = "Index";
    public static final String END = "End";
    public static final String VALUE = "Value";
    public static final String RESULT = "Result";
    public static final String A = "A";
    public static final String B = "B";
    public static final String TARGET = "Target";
    public static final String RETURN_VALUE = "Return Value";

    private PinNames() {
    }

    public static String then(int index) {
        return "Then " + index;
    }
}
