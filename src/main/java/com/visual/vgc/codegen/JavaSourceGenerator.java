package com.visual.vgc.codegen;

import com.visual.vgc.api.OutputKind;
import com.visual.vgc.engine.ExecutionOrderResolver;
import com.visual.vgc.method.MethodDescriptor;
import com.visual.vgc.method.MethodRegistry;
import com.visual.vgc.method.ParameterDescriptor;
import com.visual.vgc.model.Connection;
import com.visual.vgc.model.Graph;
import com.visual.vgc.model.Node;
import com.visual.vgc.model.Pin;
import com.visual.vgc.node.*;
import com.visual.vgc.types.PrimitiveKind;
import com.visual.vgc.types.TypeCatalog;
import com.visual.vgc.types.TypeDescriptor;
import com.visual.vgc.types.Types;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Turns a graph into one Java compilation unit.
 *
 * <p>
 * The unit is a single public class with a no-argument instance entry method.
 * The body is built in three steps:
 * <ol>
 * <li>every variable used by a Set/Get variable node is declared with its zero
 * value, together with the locals that will hold method results;</li>
 * <li>each literal node is bound to a {@code final} local
 * {@code literal_<id8>};</li>
 * <li>execution nodes are emitted in resolver order. Control-flow nodes pull
 * their nested chains in by following their execution outputs. A chain holds
 * every node reachable from its output, so a node where two paths rejoin is
 * emitted on each path. The top-level pass skips nodes already placed by a
 * chain.</li>
 * </ol>
 *
 * <p>
 * Inputs are resolved through a symbol table of output pin to expression. Pure
 * data nodes (operators, Not, Get variable, pure method calls) are never
 * scheduled; their expressions are built on demand where they are used.
 *
 * <p>
 * The generator is immutable and may be shared; all per-graph state lives in a
 * private {@code Emission}.
 */
@Log4j2
public final class JavaSourceGenerator {
    private static final String INDENT = "    ";

    private final TypeCatalog catalog;
    private final MethodRegistry registry;
    private final GenerationOptions options;
    private final LiteralFormatter literals;
    private final ExecutionOrderResolver resolver = new ExecutionOrderResolver();

    public JavaSourceGenerator(MethodRegistry registry, GenerationOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = registry.catalog();
        this.options = Objects.requireNonNull(options, "options");
        this.literals = new LiteralFormatter(catalog);
    }

    public GenerationOptions options() {
        return options;
    }

    /**
     * @throws CodeGenerationException if the graph cannot be expressed as source
     * @throws com.visual.vgc.model.GraphStructureException if execution edges form
     *         a cycle
     */
    public GeneratedSource generate(Graph graph) {
        long t0 = System.nanoTime();
        List<Node> order = resolver.resolve(graph);
        Emission emission = new Emission(graph);
        CodeBlock body = emission.emitBody(order);
        String text = render(graph, body);
        log.info("Generated {} from graph '{}' ({} nodes, {} connections) in {} us",
                options.qualifiedClassName(), graph.name(), graph.nodeCount(), graph.connectionCount(),
                (System.nanoTime() - t0) / 1000);
        return new GeneratedSource(options.qualifiedClassName(), options.entryMethod(), text);
    }

    private String render(Graph graph, CodeBlock body) {
        StringBuilder sb = new StringBuilder();
        if (!options.packageName().isEmpty())
            sb.append("package ").append(options.packageName()).append(";\n\n");
        sb.append("// Generated from graph '").append(sanitizeComment(graph.name())).append("'\n");
        sb.append("public class ").append(options.className()).append(" {\n\n");
        sb.append(INDENT).append("public void ").append(options.entryMethod()).append("() {\n");
        for (String line : body.lines())
            sb.append(INDENT).append(INDENT).append(line).append('\n');
        sb.append(INDENT).append("}\n");
        if (options.outputKind() == OutputKind.CONSOLE) {
            sb.append('\n');
            sb.append(INDENT).append("public static void main(String[] args) {\n");
            sb.append(INDENT).append(INDENT).append("new ").append(options.className()).append("().")
                    .append(options.entryMethod()).append("();\n");
            sb.append(INDENT).append("}\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String sanitizeComment(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n\\\\]", " ");
    }

    static String shortId(UUID id) {
        return id.toString().replace("-", "").substring(0, 8);
    }

    // ── Per-graph state ─────────────────────────────────────────

    private final class Emission {
        private final Graph graph;
        private final SymbolTable symbols = new SymbolTable();
        private final Set<UUID> emitted = new HashSet<>();
        private final Set<UUID> inlining = new LinkedHashSet<>();
        private final Map<String, TypeDescriptor> variables = new LinkedHashMap<>();
        private final Map<UUID, String> resultNames = new HashMap<>();
        private int loopCounter;

        Emission(Graph graph) {
            this.graph = graph;
        }

        CodeBlock emitBody(List<Node> order) {
            checkMethods();
            CodeBlock body = new CodeBlock();
            declareVariables(body);
            declareResults(body);
            emitLiterals(body);

            for (Node node : order) {
                if (!emitted.contains(node.id()))
                    emitNode(node, body);
            }
            if (body.droppedCount() > 0)
                log.warn("Dropped {} unreachable statements after a return", body.droppedCount());
            return body;
        }

        // ── Pre-passes ──────────────────────────────────────────

        private void checkMethods() {
            for (Node node : graph.nodes()) {
                if (node instanceof MethodCallNode m) {
                    MethodDescriptor d = m.method();
                    if (!registry.isKnownType(d.declaringType().typeName()))
                        throw new CodeGenerationException("Unknown declaring type " + d.declaringType()
                                + " on node '" + node.title() + "'");
                    if (!registry.contains(d))
                        throw new CodeGenerationException("Unknown method " + d.signature()
                                + " on node '" + node.title() + "'");
                }
            }
        }

        private void declareVariables(CodeBlock body) {
            for (Node node : graph.nodes()) {
                String name;
                TypeDescriptor type;
                if (node instanceof SetVariableNode s) {
                    name = s.variableName();
                    type = s.variableType();
                } else if (node instanceof GetVariableNode g) {
                    name = g.variableName();
                    type = g.variableType();
                } else {
                    continue;
                }
                if (!GenerationOptions.isIdentifier(name))
                    throw new CodeGenerationException("Variable name '" + name + "' is not a Java identifier");
                if (type.isVoid())
                    throw new CodeGenerationException("Variable '" + name + "' cannot be void");
                TypeDescriptor previous = variables.putIfAbsent(name, type);
                if (previous != null && !previous.equals(type))
                    throw new CodeGenerationException("Variable '" + name + "' is used as both " + previous
                            + " and " + type);
            }
            variables.keySet().forEach(symbols::reserve);
            for (var e : variables.entrySet())
                body.add(e.getValue().sourceName() + " " + e.getKey() + " = " + literals.zeroValue(e.getValue()) + ";");
        }

        // Declared up front so a result assigned inside a branch stays in scope below it.
        private void declareResults(CodeBlock body) {
            for (Node node : graph.nodes()) {
                if (node instanceof MethodCallNode m && !m.method().pure() && m.method().returnsValue()) {
                    String name = symbols.uniqueName("result_" + shortId(node.id()));
                    TypeDescriptor type = m.method().returnType();
                    body.add(type.sourceName() + " " + name + " = " + literals.zeroValue(type) + ";");
                    resultNames.put(node.id(), name);
                }
            }
        }

        private void emitLiterals(CodeBlock body) {
            for (Node node : graph.nodes()) {
                if (!(node instanceof LiteralNode literal))
                    continue;
                String name = symbols.uniqueName("literal_" + shortId(node.id()));
                TypeDescriptor type = literal.literalType();
                body.add("final " + type.sourceName() + " " + name + " = " + literals.format(literal.value(), type)
                        + ";");
                symbols.register(literal.output(PinNames.VALUE).id(), name);
            }
        }

        // ── Execution nodes ─────────────────────────────────────

        private void emitNode(Node node, CodeBlock block) {
            emitted.add(node.id());

            if (node instanceof StartNode) {
                follow(node.output(PinNames.START), block);
            } else if (node instanceof BranchNode) {
                emitBranch(node, block);
            } else if (node instanceof ForLoopNode) {
                emitFor(node, block);
            } else if (node instanceof WhileLoopNode) {
                emitWhile(node, block);
            } else if (node instanceof SequenceNode s) {
                for (int i = 0; i < s.outputCount(); i++)
                    follow(node.output(PinNames.then(i)), block);
            } else if (node instanceof SetVariableNode s) {
                Pin value = s.valuePin();
                block.add(s.variableName() + " = " + resolve(value, literals.zeroValue(s.variableType()), false)
                        + ";");
                follow(node.output(PinNames.EXEC), block);
            } else if (node instanceof PrintNode) {
                block.add("System.out.println(" + resolve(node.input(PinNames.VALUE), "\"\"", true) + ");");
                follow(node.output(PinNames.EXEC), block);
            } else if (node instanceof ReturnNode) {
                block.add("return;");
                block.terminate();
            } else if (node instanceof MethodCallNode m) {
                emitCall(m, block);
            } else {
                throw new CodeGenerationException("Unsupported execution node " + node.getClass().getSimpleName()
                        + " '" + node.title() + "'");
            }
        }

        private void emitBranch(Node node, CodeBlock block) {
            String condition = resolve(node.input(PinNames.CONDITION), "false", false);
            CodeBlock whenTrue = chain(node.output(PinNames.TRUE));
            CodeBlock whenFalse = chain(node.output(PinNames.FALSE));

            block.add("if (" + condition + ") {");
            block.addIndented(whenTrue);
            if (whenFalse.isEmpty()) {
                block.add("}");
            } else {
                block.add("} else {");
                block.addIndented(whenFalse);
                block.add("}");
            }
            if (whenTrue.isTerminated() && whenFalse.isTerminated())
                block.terminate();
        }

        private void emitFor(Node node, CodeBlock block) {
            String start = resolve(node.input(PinNames.START), "0", false);
            String end = resolve(node.input(PinNames.END), "10", false);
            String index = symbols.uniqueName("index" + loopCounter++);

            // The index is only in scope inside the loop.
            Pin indexPin = node.output(PinNames.INDEX);
            symbols.register(indexPin.id(), index);
            CodeBlock loopBody = chain(node.output(PinNames.LOOP_BODY));
            symbols.unregister(indexPin.id());

            block.add("for (int " + index + " = " + start + "; " + index + " < " + end + "; " + index + "++) {");
            block.addIndented(loopBody);
            block.add("}");
            follow(node.output(PinNames.COMPLETED), block);
        }

        private void emitWhile(Node node, CodeBlock block) {
            String condition = resolve(node.input(PinNames.CONDITION), "false", false);
            CodeBlock loopBody = chain(node.output(PinNames.LOOP_BODY));
            // The exit test is a statement so a constant condition cannot make the
            // body or the code after the loop unreachable.
            block.add("while (true) {");
            block.add(INDENT + "if (!(" + condition + ")) {");
            block.add(INDENT + INDENT + "break;");
            block.add(INDENT + "}");
            block.addIndented(loopBody);
            block.add("}");
            follow(node.output(PinNames.COMPLETED), block);
        }

        private void emitCall(MethodCallNode node, CodeBlock block) {
            String call = callExpression(node);
            String result = resultNames.get(node.id());
            if (result != null) {
                block.add(result + " = " + call + ";");
                symbols.register(node.returnPin().id(), result);
            } else {
                block.add(call + ";");
            }
            follow(node.output(PinNames.EXEC), block);
        }

        private CodeBlock chain(Pin execOutput) {
            CodeBlock nested = new CodeBlock();
            follow(execOutput, nested);
            return nested;
        }

        private void follow(Pin execOutput, CodeBlock block) {
            if (execOutput == null)
                return;
            for (Connection c : graph.outgoingConnections(execOutput.id())) {
                Node target = graph.ownerOf(c.targetPinId());
                if (target != null)
                    emitNode(target, block);
            }
        }

        // ── Expressions ─────────────────────────────────────────

        /**
         * Expression for an input pin. Falls back to the pin's default value, then
         * to {@code fallback}. Under the strict policy only inputs whose fallback is
         * part of the node's contract ({@code optional}) may go unresolved.
         */
        private String resolve(Pin input, String fallback, boolean optional) {
            String expr = connectedExpression(input);
            if (expr != null)
                return expr;

            if (input.defaultValue() != null)
                return literals.format(input.defaultValue(), typeOf(input));

            if (options.unresolvedPinPolicy() == UnresolvedPinPolicy.STRICT && !optional)
                throw new CodeGenerationException("Unresolved input '" + input.name() + "' on node '"
                        + nodeTitle(input) + "'");
            return fallback;
        }

        /** Expression from the connected source, or null if unconnected or unresolvable. */
        private String connectedExpression(Pin input) {
            Pin source = graph.sourceOf(input);
            if (source == null)
                return null;

            String expr = symbols.lookup(source.id());
            if (expr == null) {
                Node owner = graph.ownerOf(source.id());
                if (isInlinable(owner))
                    expr = inline(owner, source);
            }
            if (expr == null) {
                if (options.unresolvedPinPolicy() == UnresolvedPinPolicy.STRICT)
                    throw new CodeGenerationException("Input '" + input.name() + "' on node '" + nodeTitle(input)
                            + "' is connected to '" + source.name() + "', which has no value at this point");
                log.warn("Input '{}' on node '{}' is connected to '{}', which has no value at this point",
                        input.name(), nodeTitle(input), source.name());
                return null;
            }
            return adapt(expr, source.type(), input.type());
        }

        private boolean isInlinable(Node node) {
            return node instanceof BinaryOperatorNode
                    || node instanceof NotNode
                    || node instanceof GetVariableNode
                    || (node instanceof MethodCallNode m && m.method().pure());
        }

        private String inline(Node node, Pin output) {
            if (!inlining.add(node.id()))
                throw new CodeGenerationException("Data cycle through node '" + node.title() + "'");
            try {
                if (node instanceof BinaryOperatorNode op)
                    return binary(op);
                if (node instanceof NotNode)
                    return "(!" + resolve(node.input(PinNames.VALUE), "false", false) + ")";
                if (node instanceof GetVariableNode g)
                    return g.variableName();
                return callExpression((MethodCallNode) node);
            } finally {
                inlining.remove(node.id());
            }
        }

        private String binary(BinaryOperatorNode node) {
            TypeDescriptor operand = node.operandType();
            String zero = literals.zeroValue(operand);
            String a = resolve(node.input(PinNames.A), zero, false);
            String b = resolve(node.input(PinNames.B), zero, false);
            BinaryOperatorNode.Operator op = node.operator();

            if (!operand.isPrimitive()) {
                if (op == BinaryOperatorNode.Operator.EQUALS)
                    return "java.util.Objects.equals(" + a + ", " + b + ")";
                if (op == BinaryOperatorNode.Operator.NOT_EQUALS)
                    return "!java.util.Objects.equals(" + a + ", " + b + ")";
            }
            return "(" + a + " " + op.symbol() + " " + b + ")";
        }

        private String callExpression(MethodCallNode node) {
            MethodDescriptor method = node.method();
            List<String> args = new ArrayList<>();
            List<Pin> pins = node.parameterPins();
            for (int i = 0; i < method.parameters().size(); i++) {
                ParameterDescriptor p = method.parameters().get(i);
                String fallback = p.hasDefault()
                        ? literals.format(p.defaultValue(), p.type())
                        : typedZero(p.type());
                args.add(resolve(pins.get(i), fallback, p.hasDefault()));
            }

            String receiver = method.isStatic()
                    ? method.declaringType().sourceName()
                    : instanceExpression(node.targetPin(), method.declaringType());
            return receiver + "." + method.name() + "(" + String.join(", ", args) + ")";
        }

        private String instanceExpression(Pin target, TypeDescriptor declaringType) {
            String expr = connectedExpression(target);
            if (expr != null)
                return expr;
            if (catalog.hasParameterlessConstructor(declaringType))
                return "new " + declaringType.sourceName() + "()";
            return "((" + declaringType.sourceName() + ") null)";
        }

        // A bare null argument can pick the wrong overload.
        private String typedZero(TypeDescriptor type) {
            String zero = literals.zeroValue(type);
            return type.isPrimitive() ? zero : "((" + type.sourceName() + ") null)";
        }

        private TypeDescriptor typeOf(Pin pin) {
            return pin.type() != null ? pin.type() : Types.OBJECT;
        }

        private String nodeTitle(Pin pin) {
            Node owner = graph.ownerOf(pin.id());
            return owner == null ? "?" : owner.title();
        }
    }

    // ── Conversions ─────────────────────────────────────────────

    /**
     * Inserts the conversion javac needs where the compatibility rules accept a
     * pair that plain assignment does not: primitive narrowing, and anything into a
     * {@code String} slot.
     */
    static String adapt(String expr, TypeDescriptor source, TypeDescriptor target) {
        if (source == null || target == null || source.equals(target))
            return expr;
        if (target.equals(Types.STRING))
            return "String.valueOf(" + expr + ")";
        if (source instanceof TypeDescriptor.Primitive s && target instanceof TypeDescriptor.Primitive t
                && narrows(s.kind(), t.kind()))
            return "((" + t.kind().keyword() + ") (" + expr + "))";
        return expr;
    }

    private static final List<PrimitiveKind> WIDENING = List.of(
            PrimitiveKind.BYTE, PrimitiveKind.SHORT, PrimitiveKind.INT, PrimitiveKind.LONG,
            PrimitiveKind.FLOAT, PrimitiveKind.DOUBLE);

    private static boolean narrows(PrimitiveKind from, PrimitiveKind to) {
        int f = WIDENING.indexOf(from);
        int t = WIDENING.indexOf(to);
        return f >= 0 && t >= 0 && t < f;
    }
}
