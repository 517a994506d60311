package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.types.TypeDescriptor;

import java.util.Objects;
import java.util.UUID;

/** Reads a named variable. Pure data node. */
public final class GetVariableNode extends Node {

    public GetVariableNode(String variableName, TypeDescriptor variableType) {
        this(UUID.randomUUID(), variableName, variableType);
    }

    public GetVariableNode(UUID id, String variableName, TypeDescriptor variableType) {
        super(id, "Get " + variableName, "Variables", "Read value of variable '" + variableName + "'");
        Objects.requireNonNull(variableType, "variableType");
        setProperty(SetVariableNode.VARIABLE_NAME, variableName);
        setProperty(SetVariableNode.VARIABLE_TYPE, variableType);
        addOutput(variableName, variableType);
    }

    public String variableName() {
        return (String) property(SetVariableNode.VARIABLE_NAME);
    }

    public TypeDescriptor variableType() {
        return (TypeDescriptor) property(SetVariableNode.VARIABLE_TYPE);
    }
}
