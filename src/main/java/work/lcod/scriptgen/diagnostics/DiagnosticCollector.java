package work.lcod.scriptgen.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates diagnostics for one generation pass and mirrors each entry to the log.
 */
public final class DiagnosticCollector {
    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticCollector.class);

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(DiagnosticCode code, String blockId, String message) {
        report(Diagnostic.of(code, blockId, message));
    }

    public void report(Diagnostic diagnostic) {
        entries.add(diagnostic);
        if (diagnostic.severity() == Severity.ERROR) {
            LOG.error("{}", diagnostic);
        } else {
            LOG.warn("{}", diagnostic);
        }
    }

    public void reportAll(Collection<Diagnostic> diagnostics) {
        for (var diagnostic : diagnostics) {
            report(diagnostic);
        }
    }

    public List<Diagnostic> entries() {
        return List.copyOf(entries);
    }

    public void clear() {
        entries.clear();
    }
}
