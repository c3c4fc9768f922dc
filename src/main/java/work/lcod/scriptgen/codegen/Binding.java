package work.lcod.scriptgen.codegen;

import java.util.Objects;

/**
 * Generated variable capturing one block's output for the rest of the pass.
 */
public record Binding(String blockId, String name) {
    public Binding {
        Objects.requireNonNull(blockId, "blockId");
        Objects.requireNonNull(name, "name");
    }

    /** The expression that reads the binding. */
    public String reference() {
        return "$" + name;
    }
}
