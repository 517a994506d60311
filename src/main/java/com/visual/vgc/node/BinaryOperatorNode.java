package com.visual.vgc.node;

import com.visual.vgc.model.Node;
import com.visual.vgc.types.TypeDescriptor;
import com.visual.vgc.types.Types;

import java.util.Objects;
import java.util.UUID;

/** Two inputs A and B combined by an infix operator into Result. Pure data node. */
public final class BinaryOperatorNode extends Node {
    public static final String OPERATOR = "Operator";
    public static final String OPERAND_TYPE = "OperandType";

    public enum Operator {
        ADD("+", "Add", Types.DOUBLE, false),
        SUBTRACT("-", "Subtract", Types.DOUBLE, false),
        MULTIPLY("*", "Multiply", Types.DOUBLE, false),
        DIVIDE("/", "Divide", Types.DOUBLE, false),
        MODULO("%", "Modulo", Types.INT, false),
        EQUALS("==", "Equals", Types.OBJECT, true),
        NOT_EQUALS("!=", "Not Equals", Types.OBJECT, true),
        GREATER_THAN(">", "Greater Than", Types.DOUBLE, true),
        LESS_THAN("<", "Less Than", Types.DOUBLE, true),
        GREATER_OR_EQUAL(">=", "Greater Or Equal", Types.DOUBLE, true),
        LESS_OR_EQUAL("<=", "Less Or Equal", Types.DOUBLE, true),
        AND("&&", "And", Types.BOOLEAN, true),
        OR("||", "Or", Types.BOOLEAN, true);

        private final String symbol;
        private final String title;
        private final TypeDescriptor defaultOperandType;
        private final boolean booleanResult;

        Operator(String symbol, String title, TypeDescriptor defaultOperandType, boolean booleanResult) {
            this.symbol = symbol;
            this.title = title;
            this.defaultOperandType = defaultOperandType;
            this.booleanResult = booleanResult;
        }

        public String symbol() {
            return symbol;
        }

        public String title() {
            return title;
        }

        public TypeDescriptor defaultOperandType() {
            return defaultOperandType;
        }

        public TypeDescriptor resultType(TypeDescriptor operandType) {
            return booleanResult ? Types.BOOLEAN : operandType;
        }

        /** Logical operators only take booleans. */
        public boolean fixedOperandType() {
            return this == AND || this == OR;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values())
                if (op.symbol.equals(symbol))
                    return op;
            throw new IllegalArgumentException("Unknown operator: " + symbol);
        }
    }

    public BinaryOperatorNode(Operator operator) {
        this(UUID.randomUUID(), operator, null);
    }

    public BinaryOperatorNode(Operator operator, TypeDescriptor operandType) {
        this(UUID.randomUUID(), operator, operandType);
    }

    /** @param operandType null for the operator's default */
    public BinaryOperatorNode(UUID id, Operator operator, TypeDescriptor operandType) {
        super(id, Objects.requireNonNull(operator, "operator").title(), "Operators",
                operator.title() + " operator (" + operator.symbol() + ")");
        TypeDescriptor operand = operandType == null || operator.fixedOperandType()
                ? operator.defaultOperandType()
                : operandType;
        setProperty(OPERATOR, operator);
        setProperty(OPERAND_TYPE, operand);
        addInput(PinNames.A, operand, null);
        addInput(PinNames.B, operand, null);
        addOutput(PinNames.RESULT, operator.resultType(operand));
    }

    public Operator operator() {
        return (Operator) property(OPERATOR);
    }

    public TypeDescriptor operandType() {
        return (TypeDescriptor) property(OPERAND_TYPE);
    }
}
