package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.GraphSnapshot;

/**
 * Depth-first ordering of one scope. Only connections between blocks of the scope constrain the order;
 * independent blocks keep their input order.
 */
final class TopologicalSorter {
    private TopologicalSorter() {}

    static Outcome sort(GraphSnapshot snapshot, List<Block> blocks) {
        var scope = new ScopeGraph(snapshot, blocks);
        var visit = new Visit(scope);
        for (var block : blocks) {
            if (!visit.visit(block)) {
                return Outcome.cycle(visit.cycleAt);
            }
        }
        return Outcome.ordered(visit.order);
    }

    /**
     * Either a total order or the block at which a back edge was found.
     */
    record Outcome(List<Block> order, Block cycleAt) {
        static Outcome ordered(List<Block> order) {
            return new Outcome(List.copyOf(order), null);
        }

        static Outcome cycle(Block cycleAt) {
            return new Outcome(List.of(), cycleAt);
        }

        boolean isCycle() {
            return cycleAt != null;
        }
    }

    private static final class Visit {
        private final ScopeGraph scope;
        private final Set<String> visited = new HashSet<>();
        private final Set<String> visiting = new HashSet<>();
        private final List<Block> order = new ArrayList<>();
        private Block cycleAt;

        private Visit(ScopeGraph scope) {
            this.scope = scope;
        }

        private boolean visit(Block block) {
            if (visiting.contains(block.id())) {
                cycleAt = block;
                return false;
            }
            if (visited.contains(block.id())) {
                return true;
            }
            visiting.add(block.id());
            for (var dependency : scope.predecessors(block)) {
                if (!visit(dependency)) {
                    return false;
                }
            }
            visiting.remove(block.id());
            visited.add(block.id());
            order.add(block);
            return true;
        }
    }
}
