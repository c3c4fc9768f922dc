package work.lcod.scriptgen.support;

import java.util.ArrayList;
import java.util.List;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.Connection;
import work.lcod.scriptgen.graph.ContainerKind;
import work.lcod.scriptgen.graph.GraphSnapshot;

/**
 * Small fluent builder for graph fixtures used across the generator suites.
 */
public final class GraphTestSupport {
    private final List<Block> blocks = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();

    private GraphTestSupport() {}

    public static GraphTestSupport graph() {
        return new GraphTestSupport();
    }

    /** Command block whose title equals its command. */
    public GraphTestSupport command(String id, String command) {
        blocks.add(Block.builder(id).title(command).command(command).build());
        return this;
    }

    public GraphTestSupport script(String id, String title, String script) {
        blocks.add(Block.builder(id).title(title).script(script).build());
        return this;
    }

    public GraphTestSupport block(Block block) {
        blocks.add(block);
        return this;
    }

    public GraphTestSupport container(String id, String title, ContainerKind kind, String zone, String... children) {
        blocks.add(Block.builder(id).title(title).container(kind).zone(zone, List.of(children)).build());
        return this;
    }

    public GraphTestSupport connect(String source, String target) {
        connections.add(Connection.between(source, target));
        return this;
    }

    public GraphTestSupport connect(Connection connection) {
        connections.add(connection);
        return this;
    }

    public GraphSnapshot build() {
        return GraphSnapshot.of(blocks, connections);
    }
}
