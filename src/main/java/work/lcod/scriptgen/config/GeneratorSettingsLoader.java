package work.lcod.scriptgen.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;

/**
 * Reads {@link GeneratorSettings} from a {@code scriptgen.toml} file:
 *
 * <pre>
 * indent = 4
 * header = true
 * headerTitle = "Auto-generated PowerShell 5.1 Script"
 *
 * [naming]
 * suffixLength = 4
 * </pre>
 *
 * Missing keys keep their defaults.
 */
public final class GeneratorSettingsLoader {
    public static final String FILE_NAME = "scriptgen.toml";

    private static final Logger LOG = LoggerFactory.getLogger(GeneratorSettingsLoader.class);

    private GeneratorSettingsLoader() {}

    /** Settings file next to the graph document, if there is one. */
    public static Optional<Path> locateBeside(Path graphFile) {
        if (graphFile == null) {
            return Optional.empty();
        }
        var parent = graphFile.toAbsolutePath().getParent();
        if (parent == null) {
            return Optional.empty();
        }
        var candidate = parent.resolve(FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    public static GeneratorSettings load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    public static GeneratorSettings parse(String toml) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid settings file: " + result.errors().get(0).toString());
        }
        try {
            return fromToml(result);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid settings value: " + ex.getMessage(), ex);
        }
    }

    static GeneratorSettings fromToml(TomlParseResult result) {
        var builder = GeneratorSettings.builder();
        Long indent = result.getLong("indent");
        if (indent != null) {
            builder.indentWidth(Math.toIntExact(indent));
        }
        Boolean header = result.getBoolean("header");
        if (header != null) {
            builder.includeHeader(header);
        }
        String headerTitle = result.getString("headerTitle");
        if (headerTitle != null && !headerTitle.isBlank()) {
            builder.headerTitle(headerTitle);
        }
        Long suffixLength = result.getLong("naming.suffixLength");
        if (suffixLength != null) {
            builder.suffixLength(Math.toIntExact(suffixLength));
        }
        var settings = builder.build();
        LOG.debug("Loaded generator settings {}", settings);
        return settings;
    }
}
