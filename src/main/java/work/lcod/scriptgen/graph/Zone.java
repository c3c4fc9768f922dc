package work.lcod.scriptgen.graph;

import java.util.List;
import java.util.Objects;

/**
 * Named region of a container. Children are block identities in authoring order.
 */
public record Zone(String name, List<String> children) {
    public Zone {
        Objects.requireNonNull(name, "name");
        children = children == null ? List.of() : List.copyOf(children);
    }
}
