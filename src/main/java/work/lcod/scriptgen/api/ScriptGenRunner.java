package work.lcod.scriptgen.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scriptgen.codegen.ScriptGenerator;
import work.lcod.scriptgen.loader.GraphDocumentLoader;
import work.lcod.scriptgen.loader.GraphFormatException;

/**
 * Public entry point: load a graph document, generate the script and optionally write it out.
 */
public final class ScriptGenRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptGenRunner.class);

    public RunResult run(GenerateConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("graph", configuration.graphFile().toString());
        metadata.put("logLevel", configuration.logLevel().name().toLowerCase());
        LOG.debug("Generating from {}", configuration.graphFile());
        try {
            var snapshot = GraphDocumentLoader.loadFromFile(configuration.graphFile());
            var generator = new ScriptGenerator(configuration.settings());
            var script = generator.generate(snapshot);

            var diagnostics = new ArrayList<Object>();
            for (var diagnostic : generator.diagnostics()) {
                diagnostics.add(diagnostic.toMap());
            }
            metadata.put("blocks", snapshot.blocks().size());
            metadata.put("connections", snapshot.connections().size());
            metadata.put("bindings", generator.bindings());
            metadata.put("diagnostics", diagnostics);
            configuration.outputFile().ifPresent(path -> metadata.put("output", path.toString()));
            metadata.put("script", script);

            if (configuration.outputFile().isPresent()) {
                writeScript(configuration.outputFile().get(), script);
            }
            if (generator.aborted()) {
                return RunResult.aborted(metadata, started);
            }
            return RunResult.success(metadata, started);
        } catch (GraphFormatException ex) {
            LOG.debug("Graph document rejected ({})", ex.code(), ex);
            metadata.put("code", ex.code());
            return RunResult.failure(ex.getMessage(), metadata, started);
        } catch (RuntimeException | IOException ex) {
            LOG.debug("Generation run failed", ex);
            var message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return RunResult.failure(message, metadata, started);
        }
    }

    private void writeScript(Path target, String script) throws IOException {
        var parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, script, StandardCharsets.UTF_8);
        LOG.info("Wrote script to {}", target);
    }
}
