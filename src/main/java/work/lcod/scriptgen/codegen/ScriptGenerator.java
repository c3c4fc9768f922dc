package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scriptgen.config.GeneratorSettings;
import work.lcod.scriptgen.diagnostics.Diagnostic;
import work.lcod.scriptgen.diagnostics.DiagnosticCode;
import work.lcod.scriptgen.diagnostics.DiagnosticCollector;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.ContainerKind;
import work.lcod.scriptgen.graph.GraphSnapshot;

/**
 * Generates a PowerShell script from a graph snapshot.
 *
 * <p>Named callables found at the top level are hoisted into function definitions ahead of the execution
 * section. The execution section is the sorted top-level scope: linear runs collapse into pipelines,
 * results that fan out or feed a control-flow container are captured in variables, and each container
 * passes its input on to the head blocks of its zones.
 *
 * <p>Failures are reported in the returned text. A cycle in the top-level scope produces a script made of
 * the diagnostic line alone; a cycle inside a zone replaces only that zone.
 *
 * <p>Instances keep per-pass state and are not thread-safe; use one generator per concurrent request.
 */
public final class ScriptGenerator {
    public static final String CYCLE_MARKER = "# ERROR: Cycle detected in graph!";

    private static final Logger LOG = LoggerFactory.getLogger(ScriptGenerator.class);
    private static final String BANNER_RULE = "# ===========================================";
    private static final String FUNCTIONS_BANNER = "# ── Function Definitions ────────────────────";
    private static final String EXECUTION_BANNER = "# ── Execution ───────────────────────────────";

    private final GeneratorSettings settings;
    private final BindingTable table = new BindingTable();
    private final List<Binding> created = new ArrayList<>();
    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private boolean aborted;

    public ScriptGenerator() {
        this(GeneratorSettings.defaults());
    }

    public ScriptGenerator(GeneratorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public String generate(GraphSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        table.clear();
        created.clear();
        diagnostics.clear();
        aborted = false;
        diagnostics.reportAll(snapshot.anomalies());

        var topLevel = snapshot.topLevel();
        var callables = new ArrayList<Block>();
        for (var block : topLevel) {
            if (block.isCallable()) {
                callables.add(block);
            }
        }
        reportNestedCallables(snapshot);
        LOG.debug("Generating script: {} top-level blocks, {} callables", topLevel.size(), callables.size());

        var sortedCallables = TopologicalSorter.sort(snapshot, callables);
        var sortedMain = TopologicalSorter.sort(snapshot, topLevel);
        if (sortedCallables.isCycle() || sortedMain.isCycle()) {
            var at = sortedMain.isCycle() ? sortedMain.cycleAt() : sortedCallables.cycleAt();
            diagnostics.report(DiagnosticCode.CYCLE, at.id(), "Cycle detected in the top-level graph");
            aborted = true;
            return CYCLE_MARKER + "\n";
        }

        var out = new ScriptWriter(settings.indentWidth());
        var scopes = new ScopeEmitter(snapshot, out, new VariableBinder(table, settings.suffixLength(), diagnostics), diagnostics);
        writeHeader(out);

        if (!sortedCallables.order().isEmpty()) {
            out.line(FUNCTIONS_BANNER).blank();
            var definitions = new CallableEmitter(scopes);
            for (var block : sortedCallables.order()) {
                created.addAll(definitions.emitDefinition(block, (ContainerKind.Callable) block.container()));
            }
        }

        if (!sortedMain.order().isEmpty()) {
            out.line(EXECUTION_BANNER).blank();
            created.addAll(scopes.emitScope(sortedMain.order(), 0, null));
        }

        LOG.debug("Generated script with {} bindings and {} diagnostics", created.size(), diagnostics.entries().size());
        return out.toString();
    }

    /** Diagnostics of the most recent pass. */
    public List<Diagnostic> diagnostics() {
        return diagnostics.entries();
    }

    /** Variable names assigned during the most recent pass, keyed by block id. */
    public Map<String, String> bindings() {
        var names = new LinkedHashMap<String, String>();
        for (var binding : created) {
            names.putIfAbsent(binding.blockId(), binding.name());
        }
        return names;
    }

    /** Whether the most recent pass stopped at a top-level cycle. */
    public boolean aborted() {
        return aborted;
    }

    private void writeHeader(ScriptWriter out) {
        if (!settings.includeHeader()) {
            return;
        }
        out.line(BANNER_RULE)
            .line("# " + settings.headerTitle())
            .line(BANNER_RULE)
            .blank();
    }

    private void reportNestedCallables(GraphSnapshot snapshot) {
        for (var block : snapshot.blocks()) {
            if (block.isCallable() && snapshot.parent(block.id()).isPresent()) {
                diagnostics.report(
                    DiagnosticCode.UNHOISTED_CALLABLE,
                    block.id(),
                    "Callable '" + ((ContainerKind.Callable) block.container()).name()
                        + "' is nested in a zone; its definition is not emitted"
                );
            }
        }
    }
}
