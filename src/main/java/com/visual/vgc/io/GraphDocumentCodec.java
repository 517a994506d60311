package com.visual.vgc.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.visual.vgc.codegen.CodeGenerationException;
import com.visual.vgc.method.MethodDescriptor;
import com.visual.vgc.method.MethodRegistry;
import com.visual.vgc.model.*;
import com.visual.vgc.node.*;
import com.visual.vgc.types.TypeCompatibilityChecker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Saves graphs as JSON documents and rebuilds them.
 *
 * <p>
 * Loading is forgiving. Nodes of unknown type or with a method that does not
 * resolve are skipped, and connections to pins that no longer exist on the
 * rebuilt node are dropped. Each such case is reported as a warning in the
 * {@link LoadResult} and the rest of the graph loads normally.
 */
@Log4j2
public final class GraphDocumentCodec {
    private final MethodRegistry methods;
    private final ObjectMapper mapper;

    public GraphDocumentCodec(MethodRegistry methods) {
        this(methods, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public GraphDocumentCodec(MethodRegistry methods, ObjectMapper mapper) {
        this.methods = Objects.requireNonNull(methods, "methods");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    // ── Save ────────────────────────────────────────────────────

    public GraphDocument toDocument(Graph graph) {
        return toDocument(graph, List.of());
    }

    public GraphDocument toDocument(Graph graph, List<GraphDocument.LibraryDef> externalLibraries) {
        GraphDocument doc = new GraphDocument();
        doc.setId(graph.id().toString());
        doc.setName(graph.name());
        doc.setMetadata(new LinkedHashMap<>(graph.metadata()));
        doc.setExternalLibraries(new ArrayList<>(externalLibraries));

        for (Node node : graph.nodes())
            doc.getNodes().add(toDef(node));
        for (Connection c : graph.connections()) {
            GraphDocument.ConnectionDef cd = new GraphDocument.ConnectionDef();
            cd.setSourcePinId(c.sourcePinId().toString());
            cd.setTargetPinId(c.targetPinId().toString());
            doc.getConnections().add(cd);
        }
        return doc;
    }

    private GraphDocument.NodeDef toDef(Node node) {
        GraphDocument.NodeDef def = new GraphDocument.NodeDef();
        def.setId(node.id().toString());
        def.setType(NodeType.of(node).name());

        GraphDocument.PositionDef pos = new GraphDocument.PositionDef();
        pos.setX(node.position().x());
        pos.setY(node.position().y());
        def.setPosition(pos);

        for (Pin p : node.allPins()) {
            GraphDocument.PinDef pd = new GraphDocument.PinDef();
            pd.setId(p.id().toString());
            pd.setName(p.name());
            pd.setDirection(p.direction());
            pd.setKind(p.kind());
            def.getPins().add(pd);
        }

        Map<String, Object> props = def.getProperties();
        if (node instanceof LiteralNode l) {
            def.setLiteralTypeName(l.literalType().typeName());
            def.setLiteralValue(LiteralValues.toJson(l.value()));
        } else if (node instanceof MethodCallNode m) {
            MethodDescriptor d = m.method();
            GraphDocument.MethodDef md = new GraphDocument.MethodDef();
            md.setDeclaringTypeName(d.declaringType().typeName());
            md.setMethodName(d.name());
            md.setParameterTypeNames(new ArrayList<>(d.parameterTypeNames()));
            def.setMethod(md);
        } else if (node instanceof SetVariableNode s) {
            props.put(NodeType.VARIABLE_NAME, s.variableName());
            props.put(NodeType.VARIABLE_TYPE_NAME, s.variableType().typeName());
        } else if (node instanceof GetVariableNode g) {
            props.put(NodeType.VARIABLE_NAME, g.variableName());
            props.put(NodeType.VARIABLE_TYPE_NAME, g.variableType().typeName());
        } else if (node instanceof BinaryOperatorNode b) {
            props.put(NodeType.OPERATOR, b.operator().symbol());
            props.put(NodeType.OPERAND_TYPE_NAME, b.operandType().typeName());
        } else if (node instanceof SequenceNode s) {
            props.put(NodeType.OUTPUT_COUNT, s.outputCount());
        }
        return def;
    }

    public String write(Graph graph) {
        return write(graph, List.of());
    }

    public String write(Graph graph, List<GraphDocument.LibraryDef> externalLibraries) {
        try {
            return mapper.writeValueAsString(toDocument(graph, externalLibraries));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize graph '" + graph.name() + "'", e);
        }
    }

    public void save(Graph graph, Path file) throws IOException {
        save(graph, List.of(), file);
    }

    public void save(Graph graph, List<GraphDocument.LibraryDef> externalLibraries, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        mapper.writeValue(file.toFile(), toDocument(graph, externalLibraries));
        log.info("Saved graph '{}' to {}", graph.name(), file);
    }

    // ── Load ────────────────────────────────────────────────────

    /**
     * @throws IllegalArgumentException if the text is not a graph document
     */
    public LoadResult read(String json) {
        try {
            return fromDocument(mapper.readValue(json, GraphDocument.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed graph document: " + e.getOriginalMessage(), e);
        }
    }

    public LoadResult load(Path file) throws IOException {
        LoadResult result = fromDocument(mapper.readValue(file.toFile(), GraphDocument.class));
        log.info("Loaded graph '{}' from {} with {} warnings", result.graph().name(), file, result.warnings().size());
        return result;
    }

    public LoadResult fromDocument(GraphDocument doc) {
        List<String> warnings = new ArrayList<>();
        Graph graph = new Graph(parseId(doc.getId(), UUID.randomUUID()), doc.getName(),
                new TypeCompatibilityChecker(methods.catalog()));
        if (doc.getMetadata() != null)
            graph.metadata().putAll(doc.getMetadata());

        // Saved pin id -> pin id on the rebuilt node.
        Map<String, UUID> pinIds = new HashMap<>();
        for (GraphDocument.NodeDef def : orEmpty(doc.getNodes())) {
            Node node = rebuild(def, warnings);
            if (node == null)
                continue;
            try {
                graph.addNode(node);
            } catch (GraphStructureException e) {
                warn(warnings, "Skipped node " + def.getId() + ": " + e.getMessage());
                continue;
            }
            for (GraphDocument.PinDef pd : orEmpty(def.getPins())) {
                if (pd == null)
                    continue;
                Pin pin = pd.getDirection() == null || pd.getKind() == null || pd.getName() == null
                        ? null
                        : node.findPin(pd.getName(), pd.getDirection(), pd.getKind());
                if (pin == null)
                    warn(warnings, "Pin '" + pd.getName() + "' (" + pd.getDirection() + ", " + pd.getKind()
                            + ") no longer exists on node '" + node.title() + "'");
                else
                    pinIds.put(pd.getId(), pin.id());
            }
        }

        for (GraphDocument.ConnectionDef cd : orEmpty(doc.getConnections())) {
            if (cd == null)
                continue;
            UUID source = pinIds.get(cd.getSourcePinId());
            UUID target = pinIds.get(cd.getTargetPinId());
            if (source == null || target == null) {
                warn(warnings, "Dropped connection " + cd.getSourcePinId() + " -> " + cd.getTargetPinId()
                        + ": pin not found");
                continue;
            }
            if (graph.addConnection(source, target) == null)
                warn(warnings, "Dropped connection " + cd.getSourcePinId() + " -> " + cd.getTargetPinId()
                        + ": rejected as incompatible");
        }

        return new LoadResult(graph, warnings, orEmpty(doc.getExternalLibraries()));
    }

    private Node rebuild(GraphDocument.NodeDef def, List<String> warnings) {
        if (def == null) {
            warn(warnings, "Skipped empty node entry");
            return null;
        }
        UUID id = parseId(def.getId(), null);
        if (id == null) {
            warn(warnings, "Skipped node with invalid id '" + def.getId() + "'");
            return null;
        }
        try {
            Node node = NodeType.fromString(def.getType()).getFactory().create(id, def, methods);
            if (def.getPosition() != null)
                node.setPosition(new Position(def.getPosition().getX(), def.getPosition().getY()));
            return node;
        } catch (IllegalArgumentException | CodeGenerationException e) {
            warn(warnings, "Skipped node " + def.getId() + " of type '" + def.getType() + "': " + e.getMessage());
            return null;
        }
    }

    private static UUID parseId(String text, UUID fallback) {
        if (text == null)
            return fallback;
        try {
            return UUID.fromString(text);
        } catch (IllegalArgumentException e) {
            log.debug("Not a UUID: {}", text);
            return fallback;
        }
    }

    // Absent and explicit-null lists both read as empty.
    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
