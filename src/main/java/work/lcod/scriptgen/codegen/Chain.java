package work.lcod.scriptgen.codegen;

import java.util.List;
import work.lcod.scriptgen.graph.Block;

/**
 * Maximal run of 1:1 connected blocks emitted as one pipeline expression.
 */
record Chain(List<Block> members) {
    Chain {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A chain needs at least one block");
        }
        members = List.copyOf(members);
    }

    Block head() {
        return members.get(0);
    }

    Block terminal() {
        return members.get(members.size() - 1);
    }
}
