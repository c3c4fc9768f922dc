package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import work.lcod.scriptgen.diagnostics.DiagnosticCode;
import work.lcod.scriptgen.diagnostics.DiagnosticCollector;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.ContainerKind;
import work.lcod.scriptgen.graph.GraphSnapshot;

/**
 * Emits one scope in dependency order: chains as pipeline statements, control-flow containers through
 * {@link ContainerEmitter}, which calls back into this class for every zone.
 *
 * <p>Each call returns the bindings it created, including those of nested zones, so callers merge them upward.
 * Only connections inside a scope are followed; an upstream value from an enclosing scope reaches a zone as its
 * implicit input.
 */
final class ScopeEmitter {
    static final String EMPTY_ZONE_MARKER = "# (empty)";

    private final GraphSnapshot snapshot;
    private final ScriptWriter out;
    private final VariableBinder binder;
    private final DiagnosticCollector diagnostics;

    ScopeEmitter(GraphSnapshot snapshot, ScriptWriter out, VariableBinder binder, DiagnosticCollector diagnostics) {
        this.snapshot = snapshot;
        this.out = out;
        this.binder = binder;
        this.diagnostics = diagnostics;
    }

    ScriptWriter writer() {
        return out;
    }

    boolean hasChildren(Block container, String zoneName) {
        return !snapshot.zoneChildren(container, zoneName).isEmpty();
    }

    List<Binding> emitZone(Block container, String zoneName, int indent, String implicitInput) {
        var children = snapshot.zoneChildren(container, zoneName);
        if (children.isEmpty()) {
            out.line(indent, EMPTY_ZONE_MARKER);
            return List.of();
        }
        var outcome = TopologicalSorter.sort(snapshot, children);
        if (outcome.isCycle()) {
            diagnostics.report(
                DiagnosticCode.CYCLE,
                outcome.cycleAt().id(),
                "Cycle detected in zone '" + zoneName + "' of '" + container.id() + "'"
            );
            out.line(indent, "# ERROR: Cycle detected in zone '" + zoneName + "'!");
            return List.of();
        }
        return emitScope(outcome.order(), indent, implicitInput);
    }

    List<Binding> emitScope(List<Block> sorted, int indent, String implicitInput) {
        var scope = new ScopeGraph(snapshot, sorted);
        var chains = ChainBuilder.build(sorted, scope);
        var local = binder.bindScope(sorted, chains, scope);
        var created = new ArrayList<>(local.values());

        Map<String, Chain> chainByBlock = new HashMap<>();
        for (var chain : chains) {
            for (var member : chain.members()) {
                chainByBlock.put(member.id(), chain);
            }
        }

        var emitted = new HashSet<String>();
        for (var block : sorted) {
            if (emitted.contains(block.id())) {
                continue;
            }
            if (block.container() instanceof ContainerKind.ControlFlow flow) {
                emitted.add(block.id());
                var input = resolveInput(block, scope, local, implicitInput);
                var emitter = new ContainerEmitter(this, block, input, local.get(block.id()), indent);
                created.addAll(flow.accept(emitter));
                out.blank();
                continue;
            }
            var chain = chainByBlock.get(block.id());
            if (chain == null || chain.members().stream().anyMatch(member -> emitted.contains(member.id()))) {
                continue;
            }
            for (var member : chain.members()) {
                emitted.add(member.id());
            }
            var upstream = resolveInput(chain.head(), scope, local, implicitInput);
            var pipeline = BlockExpressions.pipeline(upstream, chain.members());
            var binding = local.get(chain.terminal().id());
            out.line(indent, binding == null ? pipeline : binding.reference() + " = " + pipeline);
            out.blank();
        }
        return created;
    }

    /**
     * The value flowing into a block: the binding of its single in-scope upstream, the implicit input when it
     * has no in-scope upstream, and nothing when several upstreams compete.
     */
    private String resolveInput(
        Block block,
        ScopeGraph scope,
        Map<String, Binding> local,
        String implicitInput
    ) {
        var upstream = scope.predecessors(block);
        if (upstream.isEmpty()) {
            return implicitInput;
        }
        if (upstream.size() > 1) {
            diagnostics.report(
                DiagnosticCode.AMBIGUOUS_UPSTREAM,
                block.id(),
                "Block '" + block.title() + "' has " + upstream.size() + " upstream blocks; its input is left unresolved"
            );
            return null;
        }
        var binding = local.get(upstream.get(0).id());
        return binding == null ? null : binding.reference();
    }
}
