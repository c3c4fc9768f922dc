package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import work.lcod.scriptgen.graph.Block;

/**
 * Fuses a sorted scope into chains. Control-flow containers never join a chain; callables do.
 */
final class ChainBuilder {
    private ChainBuilder() {}

    static List<Chain> build(List<Block> sorted, ScopeGraph scope) {
        var chains = new ArrayList<Chain>();
        var assigned = new HashSet<String>();

        for (var block : sorted) {
            if (assigned.contains(block.id()) || block.isControlFlow()) {
                continue;
            }
            if (isAbsorbedByUpstream(block, scope)) {
                continue;
            }

            var members = new ArrayList<Block>();
            members.add(block);
            assigned.add(block.id());

            var current = block;
            while (true) {
                var next = scope.singleSuccessor(current).orElse(null);
                if (next == null
                    || assigned.contains(next.id())
                    || next.isControlFlow()
                    || scope.incomingCount(next) != 1) {
                    break;
                }
                members.add(next);
                assigned.add(next.id());
                current = next;
            }
            chains.add(new Chain(members));
        }
        return chains;
    }

    private static boolean isAbsorbedByUpstream(Block block, ScopeGraph scope) {
        if (scope.incomingCount(block) == 0) {
            return false;
        }
        var upstream = scope.singlePredecessor(block).orElse(null);
        return upstream != null
            && scope.outgoingCount(upstream) == 1
            && !upstream.isControlFlow();
    }
}
