package com.visual.vgc.node;

import com.visual.vgc.api.PinDirection;
import com.visual.vgc.api.PinKind;
import com.visual.vgc.model.Node;
import com.visual.vgc.model.Pin;
import com.visual.vgc.types.TypeDescriptor;

import java.util.Objects;
import java.util.UUID;

/** Assigns its input to a named variable of the entry method. */
public final class SetVariableNode extends Node {
    public static final String VARIABLE_NAME = "VariableName";
    public static final String VARIABLE_TYPE = "VariableType";

    public SetVariableNode(String variableName, TypeDescriptor variableType) {
        this(UUID.randomUUID(), variableName, variableType);
    }

    public SetVariableNode(UUID id, String variableName, TypeDescriptor variableType) {
        super(id, "Set " + variableName, "Variables", "Write value to variable '" + variableName + "'");
        Objects.requireNonNull(variableType, "variableType");
        setProperty(VARIABLE_NAME, variableName);
        setProperty(VARIABLE_TYPE, variableType);
        addExecInput(PinNames.EXEC);
        addInput(variableName, variableType, null);
        addExecOutput(PinNames.EXEC);
    }

    public String variableName() {
        return (String) property(VARIABLE_NAME);
    }

    /** The data input carrying the assigned value. Named after the variable. */
    public Pin valuePin() {
        return findPin(variableName(), PinDirection.INPUT, PinKind.DATA);
    }

    public TypeDescriptor variableType() {
        return (TypeDescriptor) property(VARIABLE_TYPE);
    }
}
