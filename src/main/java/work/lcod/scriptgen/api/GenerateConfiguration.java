package work.lcod.scriptgen.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.lcod.scriptgen.config.GeneratorSettings;

/**
 * Immutable inputs of one generation run.
 */
public record GenerateConfiguration(
    Path graphFile,
    Optional<Path> outputFile,
    GeneratorSettings settings,
    LogLevel logLevel
) {
    public GenerateConfiguration {
        Objects.requireNonNull(graphFile, "graphFile");
        Objects.requireNonNull(outputFile, "outputFile");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path graphFile;
        private Optional<Path> outputFile = Optional.empty();
        private GeneratorSettings settings = GeneratorSettings.defaults();
        private LogLevel logLevel = LogLevel.DEFAULT;

        public Builder graphFile(Path graphFile) {
            this.graphFile = graphFile;
            return this;
        }

        public Builder outputFile(Optional<Path> outputFile) {
            this.outputFile = outputFile;
            return this;
        }

        public Builder settings(GeneratorSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public GenerateConfiguration build() {
            return new GenerateConfiguration(graphFile, outputFile, settings, logLevel);
        }
    }
}
