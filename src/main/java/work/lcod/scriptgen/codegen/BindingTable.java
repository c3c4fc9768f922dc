package work.lcod.scriptgen.codegen;

import java.util.HashSet;
import java.util.Set;

/**
 * Variable names handed out during one pass. Names are never released, so every binding of a pass is unique
 * unless an explicit output variable reuses one.
 */
final class BindingTable {
    private final Set<String> names = new HashSet<>();

    Binding append(String blockId, String name) {
        names.add(name);
        return new Binding(blockId, name);
    }

    boolean isNameTaken(String name) {
        return names.contains(name);
    }

    void clear() {
        names.clear();
    }
}
