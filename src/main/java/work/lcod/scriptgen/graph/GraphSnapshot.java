package work.lcod.scriptgen.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.scriptgen.diagnostics.Diagnostic;
import work.lcod.scriptgen.diagnostics.DiagnosticCode;

/**
 * Immutable, validated view of the authoring graph consumed by the generator.
 *
 * <p>Construction resolves zone membership into a parent relation and drops every connection or
 * membership entry that does not fit the graph invariants. Each dropped element is recorded as a
 * {@link Diagnostic} so callers can surface it without failing the whole pass.
 */
public final class GraphSnapshot {
    private final Map<String, Block> blocks;
    private final List<Block> topLevel;
    private final Map<String, String> parentOf;
    private final Map<String, Map<String, List<Block>>> zoneChildren;
    private final List<Connection> connections;
    private final Map<String, List<Connection>> outgoing;
    private final Map<String, List<Connection>> incoming;
    private final List<Diagnostic> anomalies;

    private GraphSnapshot(List<Block> rawBlocks, List<Connection> rawConnections) {
        var problems = new ArrayList<Diagnostic>();
        this.blocks = indexBlocks(rawBlocks, problems);
        var parents = new LinkedHashMap<String, String>();
        this.zoneChildren = resolveZones(parents, problems);
        this.parentOf = Collections.unmodifiableMap(parents);

        var roots = new ArrayList<Block>();
        for (var block : blocks.values()) {
            if (!parentOf.containsKey(block.id())) {
                roots.add(block);
            }
        }
        this.topLevel = List.copyOf(roots);

        this.connections = validateConnections(rawConnections, problems);
        var out = new LinkedHashMap<String, List<Connection>>();
        var in = new LinkedHashMap<String, List<Connection>>();
        for (var connection : connections) {
            out.computeIfAbsent(connection.sourceBlock(), key -> new ArrayList<>()).add(connection);
            in.computeIfAbsent(connection.targetBlock(), key -> new ArrayList<>()).add(connection);
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
        this.anomalies = List.copyOf(problems);
    }

    public static GraphSnapshot of(List<Block> blocks, List<Connection> connections) {
        return new GraphSnapshot(
            blocks == null ? List.of() : blocks,
            connections == null ? List.of() : connections
        );
    }

    public static GraphSnapshot empty() {
        return of(List.of(), List.of());
    }

    public Optional<Block> block(String id) {
        return Optional.ofNullable(blocks.get(id));
    }

    public List<Block> blocks() {
        return List.copyOf(blocks.values());
    }

    /** Blocks not owned by any zone, in authoring order. */
    public List<Block> topLevel() {
        return topLevel;
    }

    public Optional<Block> parent(String blockId) {
        return Optional.ofNullable(parentOf.get(blockId)).map(blocks::get);
    }

    /** Valid children of the named zone, in zone order. Empty when the block or zone does not exist. */
    public List<Block> zoneChildren(Block container, String zoneName) {
        var zones = zoneChildren.get(container.id());
        if (zones == null) {
            return List.of();
        }
        return zones.getOrDefault(zoneName, List.of());
    }

    public List<Connection> connections() {
        return connections;
    }

    public List<Connection> outgoing(String blockId) {
        return outgoing.getOrDefault(blockId, List.of());
    }

    public List<Connection> incoming(String blockId) {
        return incoming.getOrDefault(blockId, List.of());
    }

    /** Elements dropped during construction. */
    public List<Diagnostic> anomalies() {
        return anomalies;
    }

    private static Map<String, Block> indexBlocks(List<Block> rawBlocks, List<Diagnostic> problems) {
        var index = new LinkedHashMap<String, Block>();
        for (var block : rawBlocks) {
            if (block == null) {
                continue;
            }
            if (index.containsKey(block.id())) {
                problems.add(Diagnostic.of(
                    DiagnosticCode.MALFORMED_REFERENCE,
                    block.id(),
                    "Duplicate block id '" + block.id() + "' ignored"
                ));
                continue;
            }
            index.put(block.id(), block);
        }
        return Collections.unmodifiableMap(index);
    }

    private Map<String, Map<String, List<Block>>> resolveZones(Map<String, String> parents, List<Diagnostic> problems) {
        var resolved = new LinkedHashMap<String, Map<String, List<Block>>>();
        for (var container : blocks.values()) {
            if (!container.isContainer()) {
                continue;
            }
            var zones = new LinkedHashMap<String, List<Block>>();
            for (var zone : container.zones()) {
                var children = new ArrayList<Block>();
                for (var childId : zone.children()) {
                    var child = blocks.get(childId);
                    if (child == null) {
                        problems.add(Diagnostic.of(
                            DiagnosticCode.MALFORMED_REFERENCE,
                            container.id(),
                            "Zone '" + zone.name() + "' references unknown block '" + childId + "'"
                        ));
                        continue;
                    }
                    if (parents.containsKey(childId) || isAncestorOrSelf(childId, container.id(), parents)) {
                        problems.add(Diagnostic.of(
                            DiagnosticCode.DUPLICATE_ZONE_MEMBERSHIP,
                            childId,
                            "Block '" + childId + "' cannot also be placed in zone '" + zone.name() + "' of '" + container.id() + "'"
                        ));
                        continue;
                    }
                    parents.put(childId, container.id());
                    children.add(child);
                }
                zones.put(zone.name(), List.copyOf(children));
            }
            resolved.put(container.id(), Collections.unmodifiableMap(zones));
        }
        return Collections.unmodifiableMap(resolved);
    }

    private static boolean isAncestorOrSelf(String candidate, String start, Map<String, String> parents) {
        var seen = new HashSet<String>();
        var current = start;
        while (current != null && seen.add(current)) {
            if (current.equals(candidate)) {
                return true;
            }
            current = parents.get(current);
        }
        return false;
    }

    private List<Connection> validateConnections(List<Connection> rawConnections, List<Diagnostic> problems) {
        var accepted = new ArrayList<Connection>();
        var pairs = new HashSet<Connection>();
        Set<String> occupiedInputs = new HashSet<>();
        for (var connection : rawConnections) {
            if (connection == null) {
                continue;
            }
            var source = blocks.get(connection.sourceBlock());
            var target = blocks.get(connection.targetBlock());
            if (source == null || target == null) {
                problems.add(malformed(connection, "references a block absent from the graph"));
                continue;
            }
            if (Objects.equals(source.id(), target.id())) {
                problems.add(malformed(connection, "connects a block to itself"));
                continue;
            }
            if (!source.hasPort(connection.sourcePort(), PortDirection.OUTPUT)
                || !target.hasPort(connection.targetPort(), PortDirection.INPUT)) {
                problems.add(malformed(connection, "references a missing or misdirected port"));
                continue;
            }
            if (!pairs.add(connection)) {
                problems.add(Diagnostic.of(
                    DiagnosticCode.DUPLICATE_CONNECTION,
                    target.id(),
                    "Connection " + connection.describe() + " declared more than once"
                ));
                continue;
            }
            if (!occupiedInputs.add(target.id() + "\u0000" + connection.targetPort())) {
                problems.add(Diagnostic.of(
                    DiagnosticCode.PORT_ALREADY_CONNECTED,
                    target.id(),
                    "Input port " + target.id() + "." + connection.targetPort() + " already has an upstream; "
                        + connection.describe() + " ignored"
                ));
                continue;
            }
            accepted.add(connection);
        }
        return List.copyOf(accepted);
    }

    private static Diagnostic malformed(Connection connection, String reason) {
        return Diagnostic.of(
            DiagnosticCode.MALFORMED_REFERENCE,
            connection.targetBlock(),
            "Connection " + connection.describe() + " " + reason
        );
    }

    private static Map<String, List<Connection>> freeze(Map<String, List<Connection>> source) {
        var copy = new LinkedHashMap<String, List<Connection>>();
        for (var entry : source.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
