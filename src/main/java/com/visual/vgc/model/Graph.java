package com.visual.vgc.model;

import com.visual.vgc.types.TypeCompatibilityChecker;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * The graph model: nodes in insertion order, the connections between their
 * pins, and free-form metadata.
 *
 * <p>
 * All structural mutation goes through this class, which keeps three things in
 * step after every call: each connection's endpoints belong to nodes in the
 * graph, each DATA input has at most one incoming connection, and every pin's
 * {@code connected} flag reflects the connection set.
 *
 * <p>
 * Not thread-safe. A graph is edited and compiled from a single thread.
 */
@Log4j2
public final class Graph {
    private final UUID id;
    private String name;
    private final TypeCompatibilityChecker checker;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private final Map<UUID, Node> nodes = new LinkedHashMap<>();
    private final Map<UUID, Connection> connections = new LinkedHashMap<>();

    // Pin id -> pin / owner, maintained alongside nodes.
    private final Map<UUID, Pin> pins = new HashMap<>();
    private final Map<UUID, Node> pinOwners = new HashMap<>();

    public Graph(String name, TypeCompatibilityChecker checker) {
        this(UUID.randomUUID(), name, checker);
    }

    public Graph(UUID id, String name, TypeCompatibilityChecker checker) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.checker = Objects.requireNonNull(checker, "checker");
    }

    public UUID id() {
        return id;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public TypeCompatibilityChecker checker() {
        return checker;
    }

    /** Mutable metadata carried through save and load untouched. */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /** Nodes in storage (insertion) order. */
    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<Connection> connections() {
        return List.copyOf(connections.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int connectionCount() {
        return connections.size();
    }

    // ── Nodes ───────────────────────────────────────────────────

    public void addNode(Node node) {
        if (nodes.containsKey(node.id()))
            throw GraphStructureException.duplicateId(node.id());
        nodes.put(node.id(), node);
        for (Pin p : node.allPins()) {
            pins.put(p.id(), p);
            pinOwners.put(p.id(), node);
        }
    }

    /** Removes a node and every connection touching its pins. No-op if absent. */
    public void removeNode(UUID nodeId) {
        Node node = nodes.remove(nodeId);
        if (node == null)
            return;

        Set<UUID> ownPins = new HashSet<>();
        for (Pin p : node.allPins())
            ownPins.add(p.id());

        Set<UUID> affected = new HashSet<>();
        Iterator<Connection> it = connections.values().iterator();
        while (it.hasNext()) {
            Connection c = it.next();
            if (ownPins.contains(c.sourcePinId()) || ownPins.contains(c.targetPinId())) {
                it.remove();
                affected.add(c.sourcePinId());
                affected.add(c.targetPinId());
            }
        }

        for (UUID pinId : ownPins) {
            Pin p = pins.remove(pinId);
            pinOwners.remove(pinId);
            p.setConnected(false);
        }
        affected.removeAll(ownPins);
        affected.forEach(this::refreshConnected);
    }

    /** Returns the node with the given id, or null. */
    public Node findNode(UUID nodeId) {
        return nodes.get(nodeId);
    }

    // ── Connections ─────────────────────────────────────────────

    /**
     * Connects an output pin to an input pin.
     *
     * @return the new connection, or null when the request is rejected: a pin is
     *         missing, the pins are incompatible, or the roles are reversed.
     *         Rejection leaves the graph unchanged.
     */
    public Connection addConnection(UUID sourcePinId, UUID targetPinId) {
        Pin source = pins.get(sourcePinId);
        Pin target = pins.get(targetPinId);
        if (source == null || target == null) {
            log.debug("Connection rejected: unknown pin {} or {}", sourcePinId, targetPinId);
            return null;
        }
        if (!source.isOutput() || !target.isInput()) {
            log.debug("Connection rejected: {} -> {} has reversed roles", source, target);
            return null;
        }
        if (!source.canConnectTo(target, checker)) {
            log.debug("Connection rejected: {} is not compatible with {}", source, target);
            return null;
        }

        if (target.isData()) {
            Connection existing = incomingConnection(targetPinId);
            if (existing != null) {
                connections.remove(existing.id());
                refreshConnected(existing.sourcePinId());
            }
        }

        Connection connection = new Connection(UUID.randomUUID(), sourcePinId, targetPinId);
        connections.put(connection.id(), connection);
        source.setConnected(true);
        target.setConnected(true);
        return connection;
    }

    /** Removes a connection and recomputes both endpoint flags. No-op if absent. */
    public void removeConnection(UUID connectionId) {
        Connection c = connections.remove(connectionId);
        if (c == null)
            return;
        refreshConnected(c.sourcePinId());
        refreshConnected(c.targetPinId());
    }

    private void refreshConnected(UUID pinId) {
        Pin p = pins.get(pinId);
        if (p != null)
            p.setConnected(!getConnectionsFromPin(pinId).isEmpty());
    }

    // ── Lookups ─────────────────────────────────────────────────

    /** Returns the pin with the given id on any node of this graph, or null. */
    public Pin findPin(UUID pinId) {
        return pins.get(pinId);
    }

    /** Returns the node owning a pin, or null. */
    public Node ownerOf(UUID pinId) {
        return pinOwners.get(pinId);
    }

    /** Connections with the pin at either end. */
    public List<Connection> getConnectionsFromPin(UUID pinId) {
        List<Connection> result = new ArrayList<>();
        for (Connection c : connections.values())
            if (c.touches(pinId))
                result.add(c);
        return result;
    }

    /** The connection feeding an input pin, or null. */
    public Connection incomingConnection(UUID targetPinId) {
        for (Connection c : connections.values())
            if (c.targetPinId().equals(targetPinId))
                return c;
        return null;
    }

    /** Connections leaving an output pin, in creation order. */
    public List<Connection> outgoingConnections(UUID sourcePinId) {
        List<Connection> result = new ArrayList<>();
        for (Connection c : connections.values())
            if (c.sourcePinId().equals(sourcePinId))
                result.add(c);
        return result;
    }

    /** The output pin wired into an input pin, or null. */
    public Pin sourceOf(Pin input) {
        Connection c = incomingConnection(input.id());
        return c == null ? null : pins.get(c.sourcePinId());
    }

    /** Nodes reached directly through the execution outputs of {@code node}, in pin then connection order. */
    public List<Node> executionSuccessors(Node node) {
        List<Node> result = new ArrayList<>();
        for (Pin out : node.outputs()) {
            if (!out.isExecution())
                continue;
            for (Connection c : outgoingConnections(out.id())) {
                Node target = pinOwners.get(c.targetPinId());
                if (target != null)
                    result.add(target);
            }
        }
        return result;
    }

    // ── Validation ──────────────────────────────────────────────

    /**
     * Checks every node's wiring and looks for cycles in the execution flow.
     * Graph-wide problems are reported under this graph's id.
     */
    public GraphValidationResult validate() {
        Map<UUID, List<String>> errors = new LinkedHashMap<>();
        for (Node node : nodes.values()) {
            List<String> nodeErrors = node.validate();
            if (!nodeErrors.isEmpty())
                errors.put(node.id(), List.copyOf(nodeErrors));
        }
        if (hasExecutionCycle())
            errors.put(id, List.of("Execution flow contains cycles"));
        return new GraphValidationResult(errors.isEmpty(), errors);
    }

    private boolean hasExecutionCycle() {
        Set<UUID> done = new HashSet<>();
        Set<UUID> inProgress = new HashSet<>();
        for (Node node : nodes.values())
            if (reachesInProgress(node, done, inProgress))
                return true;
        return false;
    }

    private boolean reachesInProgress(Node node, Set<UUID> done, Set<UUID> inProgress) {
        if (inProgress.contains(node.id()))
            return true;
        if (done.contains(node.id()))
            return false;
        inProgress.add(node.id());
        for (Node next : executionSuccessors(node))
            if (reachesInProgress(next, done, inProgress))
                return true;
        inProgress.remove(node.id());
        done.add(node.id());
        return false;
    }

    @Override
    public String toString() {
        return "Graph[" + name + ", nodes=" + nodes.size() + ", connections=" + connections.size() + "]";
    }
}
