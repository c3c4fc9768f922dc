package work.lcod.scriptgen.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import picocli.CommandLine;
import work.lcod.scriptgen.api.GenerateConfiguration;
import work.lcod.scriptgen.api.LogLevel;
import work.lcod.scriptgen.api.RunResult;
import work.lcod.scriptgen.api.ScriptGenRunner;
import work.lcod.scriptgen.config.GeneratorSettings;
import work.lcod.scriptgen.config.GeneratorSettingsLoader;

@CommandLine.Command(
    name = "scriptgen",
    description = "Generate a PowerShell script from a block graph document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class GenerateCommand implements java.util.concurrent.Callable<Integer> {
    static final String LOG_LEVEL_ENV = "SCRIPTGEN_LOG_LEVEL";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-g", "--graph"},
        required = true,
        description = "Graph document (YAML or JSON)."
    )
    private String graph;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Script output path (default: stdout).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String output;

    @CommandLine.Option(
        names = "--config",
        description = "Settings file (default: scriptgen.toml next to the graph).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(
        names = "--indent",
        description = "Spaces per nesting level (overrides the settings file).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer indent;

    @CommandLine.Option(
        names = "--no-header",
        description = "Omit the comment header."
    )
    private boolean noHeader;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--report",
        description = "Print the run result as JSON on stderr."
    )
    private boolean report;

    @Override
    public Integer call() {
        LogLevel logLevel = resolveLogLevel();
        LoggingConfigurator.apply(logLevel);

        Path graphFile = Paths.get(graph).toAbsolutePath().normalize();

        GenerateConfiguration configuration = GenerateConfiguration.builder()
            .graphFile(graphFile)
            .outputFile(Optional.ofNullable(output).map(value -> Paths.get(value).toAbsolutePath().normalize()))
            .settings(resolveSettings(graphFile))
            .logLevel(logLevel)
            .build();

        RunResult result = new ScriptGenRunner().run(configuration);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (result.status() != RunResult.Status.FAILURE && configuration.outputFile().isEmpty()) {
            out.print(result.script());
            out.flush();
        }
        if (result.status() == RunResult.Status.FAILURE && !report) {
            err.println(spec.commandLine().getColorScheme().errorText(String.valueOf(result.metadata().get("error"))));
        }
        if (report) {
            err.println(result.toPrettyJson());
        }
        err.flush();
        return result.status().exitCode();
    }

    private GeneratorSettings resolveSettings(Path graphFile) {
        Optional<Path> settingsFile = config != null
            ? Optional.of(Paths.get(config).toAbsolutePath().normalize())
            : GeneratorSettingsLoader.locateBeside(graphFile);
        GeneratorSettings base = settingsFile.map(GeneratorSettingsLoader::load).orElseGet(GeneratorSettings::defaults);
        GeneratorSettings.Builder builder = base.toBuilder();
        if (indent != null) {
            builder.indentWidth(indent);
        }
        if (noHeader) {
            builder.includeHeader(false);
        }
        return builder.build();
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(LOG_LEVEL_ENV);
        }
        return LogLevel.from(candidate);
    }
}
