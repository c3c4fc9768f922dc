package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.GraphSnapshot;

/**
 * Connection queries restricted to one scope. Edges whose other end lies outside the scope are invisible.
 */
final class ScopeGraph {
    private final GraphSnapshot snapshot;
    private final Set<String> members = new LinkedHashSet<>();

    ScopeGraph(GraphSnapshot snapshot, Collection<Block> blocks) {
        this.snapshot = snapshot;
        for (var block : blocks) {
            members.add(block.id());
        }
    }

    /** Number of in-scope connections arriving at the block. */
    int incomingCount(Block block) {
        int count = 0;
        for (var connection : snapshot.incoming(block.id())) {
            if (members.contains(connection.sourceBlock())) {
                count++;
            }
        }
        return count;
    }

    /** Number of in-scope connections leaving the block. */
    int outgoingCount(Block block) {
        int count = 0;
        for (var connection : snapshot.outgoing(block.id())) {
            if (members.contains(connection.targetBlock())) {
                count++;
            }
        }
        return count;
    }

    List<Block> predecessors(Block block) {
        var ids = new LinkedHashSet<String>();
        for (var connection : snapshot.incoming(block.id())) {
            if (members.contains(connection.sourceBlock())) {
                ids.add(connection.sourceBlock());
            }
        }
        return resolve(ids);
    }

    List<Block> successors(Block block) {
        var ids = new LinkedHashSet<String>();
        for (var connection : snapshot.outgoing(block.id())) {
            if (members.contains(connection.targetBlock())) {
                ids.add(connection.targetBlock());
            }
        }
        return resolve(ids);
    }

    Optional<Block> singlePredecessor(Block block) {
        var upstream = predecessors(block);
        return upstream.size() == 1 ? Optional.of(upstream.get(0)) : Optional.empty();
    }

    Optional<Block> singleSuccessor(Block block) {
        var downstream = successors(block);
        return downstream.size() == 1 ? Optional.of(downstream.get(0)) : Optional.empty();
    }

    boolean feedsControlFlow(Block block) {
        for (var successor : successors(block)) {
            if (successor.isControlFlow()) {
                return true;
            }
        }
        return false;
    }

    private List<Block> resolve(Set<String> ids) {
        var result = new ArrayList<Block>(ids.size());
        for (var id : ids) {
            snapshot.block(id).ifPresent(result::add);
        }
        return result;
    }
}
