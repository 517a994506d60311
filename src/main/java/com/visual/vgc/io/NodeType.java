package com.visual.vgc.io;

import com.visual.vgc.method.MethodRegistry;
import com.visual.vgc.model.Node;
import com.visual.vgc.node.*;
import com.visual.vgc.types.TypeDescriptor;
import com.visual.vgc.types.Types;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Saved node type names and how to rebuild each from a {@link GraphDocument.NodeDef}.
 */
public enum NodeType {
    START(StartNode.class, (id, def, methods) -> new StartNode(id)),
    BRANCH(BranchNode.class, (id, def, methods) -> new BranchNode(id)),
    SEQUENCE(SequenceNode.class, (id, def, methods) -> new SequenceNode(id,
            getInt(def.getProperties(), NodeType.OUTPUT_COUNT, SequenceNode.DEFAULT_OUTPUT_COUNT))),
    FOR_LOOP(ForLoopNode.class, (id, def, methods) -> new ForLoopNode(id)),
    WHILE_LOOP(WhileLoopNode.class, (id, def, methods) -> new WhileLoopNode(id)),
    RETURN(ReturnNode.class, (id, def, methods) -> new ReturnNode(id)),
    PRINT(PrintNode.class, (id, def, methods) -> new PrintNode(id)),
    SET_VARIABLE(SetVariableNode.class, (id, def, methods) -> new SetVariableNode(id,
            requireString(def.getProperties(), NodeType.VARIABLE_NAME),
            Types.parse(requireString(def.getProperties(), NodeType.VARIABLE_TYPE_NAME)))),
    GET_VARIABLE(GetVariableNode.class, (id, def, methods) -> new GetVariableNode(id,
            requireString(def.getProperties(), NodeType.VARIABLE_NAME),
            Types.parse(requireString(def.getProperties(), NodeType.VARIABLE_TYPE_NAME)))),
    LITERAL(LiteralNode.class, (id, def, methods) -> {
        if (def.getLiteralTypeName() == null)
            throw new IllegalArgumentException("Literal node without literalTypeName");
        TypeDescriptor type = Types.parse(def.getLiteralTypeName());
        return new LiteralNode(id, type, LiteralValues.coerce(def.getLiteralValue(), type));
    }),
    BINARY_OPERATOR(BinaryOperatorNode.class, (id, def, methods) -> {
        var op = BinaryOperatorNode.Operator.fromSymbol(requireString(def.getProperties(), NodeType.OPERATOR));
        Object operand = def.getProperties().get(NodeType.OPERAND_TYPE_NAME);
        return new BinaryOperatorNode(id, op, operand == null ? null : Types.parse(operand.toString()));
    }),
    NOT(NotNode.class, (id, def, methods) -> new NotNode(id)),
    METHOD_CALL(MethodCallNode.class, (id, def, methods) -> {
        var m = def.getMethod();
        if (m == null)
            throw new IllegalArgumentException("Method call node without method descriptor");
        return new MethodCallNode(id, methods.resolve(m.getDeclaringTypeName(), m.getMethodName(),
                m.getParameterTypeNames() == null ? List.of() : m.getParameterTypeNames()));
    });

    static final String OUTPUT_COUNT = "outputCount";
    static final String VARIABLE_NAME = "variableName";
    static final String VARIABLE_TYPE_NAME = "variableTypeName";
    static final String OPERATOR = "operator";
    static final String OPERAND_TYPE_NAME = "operandTypeName";

    /** Builds a node with a given id from its saved definition. */
    @FunctionalInterface
    public interface NodeFactory {
        Node create(UUID id, GraphDocument.NodeDef def, MethodRegistry methods);
    }

    private final Class<? extends Node> nodeClass;
    private final NodeFactory factory;

    NodeType(Class<? extends Node> nodeClass, NodeFactory factory) {
        this.nodeClass = nodeClass;
        this.factory = factory;
    }

    public Class<? extends Node> getNodeClass() {
        return nodeClass;
    }

    public NodeFactory getFactory() {
        return factory;
    }

    public static NodeType of(Node node) {
        for (NodeType t : values()) {
            if (t.nodeClass == node.getClass())
                return t;
        }
        throw new IllegalArgumentException("No saved form for node class " + node.getClass().getName());
    }

    public static NodeType fromString(String text) {
        for (NodeType t : NodeType.values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }

    static String requireString(Map<String, Object> props, String key) {
        Object v = props == null ? null : props.get(key);
        if (v == null)
            throw new IllegalArgumentException("Missing property '" + key + "'");
        return v.toString();
    }

    static int getInt(Map<String, Object> props, String key, int def) {
        Object v = props == null ? null : props.get(key);
        if (v instanceof Number n)
            return n.intValue();
        if (v != null)
            return Integer.parseInt(v.toString().trim());
        return def;
    }
}
