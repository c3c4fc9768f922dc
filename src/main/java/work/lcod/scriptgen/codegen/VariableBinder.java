package work.lcod.scriptgen.codegen;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.scriptgen.diagnostics.DiagnosticCode;
import work.lcod.scriptgen.diagnostics.DiagnosticCollector;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.ContainerKind;

/**
 * Decides which results of a scope are captured into variables and names them.
 */
final class VariableBinder {
    private final BindingTable table;
    private final int suffixLength;
    private final DiagnosticCollector diagnostics;

    VariableBinder(BindingTable table, int suffixLength, DiagnosticCollector diagnostics) {
        this.table = table;
        this.suffixLength = Math.max(1, suffixLength);
        this.diagnostics = diagnostics;
    }

    /**
     * Creates the bindings a scope needs, keyed by block id in sorted order:
     * chain terminals that fan out or feed a control-flow container, and control-flow containers
     * whose output is consumed inside the scope.
     */
    Map<String, Binding> bindScope(List<Block> sorted, List<Chain> chains, ScopeGraph scope) {
        var terminals = new LinkedHashMap<String, Chain>();
        for (var chain : chains) {
            terminals.put(chain.terminal().id(), chain);
        }

        var local = new LinkedHashMap<String, Binding>();
        for (var block : sorted) {
            boolean needsBinding;
            if (block.isControlFlow()) {
                needsBinding = scope.outgoingCount(block) > 0;
            } else if (terminals.containsKey(block.id())) {
                needsBinding = scope.outgoingCount(block) > 1 || scope.feedsControlFlow(block);
            } else {
                needsBinding = false;
            }
            if (needsBinding) {
                local.put(block.id(), table.append(block.id(), nameFor(block)));
            }
        }
        return local;
    }

    String nameFor(Block block) {
        if (!block.outputVariable().isEmpty()) {
            var explicit = IdentifierSanitizer.sanitize(stripSigil(block.outputVariable()));
            if (table.isNameTaken(explicit)) {
                diagnostics.report(
                    DiagnosticCode.DUPLICATE_BINDING_NAME,
                    block.id(),
                    "Output variable $" + explicit + " of '" + block.title() + "' is already bound earlier in the script"
                );
            }
            return explicit;
        }
        var base = IdentifierSanitizer.sanitize(baseName(block));
        var id = block.id();
        var maxLength = Math.max(suffixLength, IdentifierSanitizer.identitySuffix(id, Integer.MAX_VALUE).length());
        for (int length = suffixLength; length <= maxLength; length++) {
            var candidate = base + "_" + IdentifierSanitizer.identitySuffix(id, length);
            if (!table.isNameTaken(candidate)) {
                return candidate;
            }
        }
        var stem = base + "_" + IdentifierSanitizer.identitySuffix(id, maxLength);
        int counter = 2;
        while (table.isNameTaken(stem + "_" + counter)) {
            counter++;
        }
        return stem + "_" + counter;
    }

    private static String baseName(Block block) {
        if (block.container() instanceof ContainerKind.Callable callable) {
            return callable.name();
        }
        return block.title();
    }

    static String stripSigil(String name) {
        var trimmed = name.trim();
        return trimmed.startsWith("$") ? trimmed.substring(1) : trimmed;
    }
}
