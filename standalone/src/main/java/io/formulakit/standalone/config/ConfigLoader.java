package io.formulakit.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * catalog: ./formulas.json
 * random:
 *   seed: 42
 * runner:
 *   input-pooling: true
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as set only if it is
 * defined and its trimmed value is non-empty.
 *
 * <table>
 * <caption>Environment overlay</caption>
 * <tr><td>{@code FORMULAKIT_CATALOG}</td><td>{@code catalog}</td></tr>
 * <tr><td>{@code FORMULAKIT_RANDOM_SEED}</td><td>{@code random.seed}</td></tr>
 * <tr><td>{@code FORMULAKIT_INPUT_POOLING}</td><td>{@code runner.input-pooling}</td></tr>
 * <tr><td>{@code LOG_FORMAT}</td><td>{@code logging.format}</td></tr>
 * <tr><td>{@code LOG_LEVEL}</td><td>{@code logging.level}</td></tr>
 * </table>
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "formulakit.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}.
     * {@code envLookup} returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Resolves the configuration for a run. An explicit path must exist; without one, {@value
     * #DEFAULT_CONFIG_FILE} in the working directory is used when present and defaults otherwise.
     * The environment overlay applies in every case.
     *
     * @param explicitPath value of {@code --config}, or {@code null}
     * @throws ConfigLoadException if the explicit file is missing or any file is invalid
     */
    public static CliConfig resolve(String explicitPath, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(Path.of(explicitPath), envLookup);
        }
        Path defaultPath = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultPath)) {
            return load(defaultPath, envLookup);
        }
        return mapToConfig(null, envLookup);
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        // --- YAML mapping ---

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a YAML mapping");
            }
            if (root.has("catalog")) builder.catalog(root.get("catalog").asText());

            JsonNode random = root.path("random");
            if (random.has("seed")) {
                JsonNode seed = random.get("seed");
                if (!seed.canConvertToLong()) {
                    throw new ConfigLoadException("Invalid random.seed '" + seed.asText() + "': expected an integer");
                }
                builder.randomSeed(seed.asLong());
            }

            JsonNode runner = root.path("runner");
            if (runner.has("input-pooling"))
                builder.inputPooling(runner.get("input-pooling").asBoolean());

            JsonNode logging = root.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        }

        // --- Environment variable overlay ---

        envString(envLookup, "FORMULAKIT_CATALOG", builder::catalog);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envBool(envLookup, "FORMULAKIT_INPUT_POOLING", builder::inputPooling);
        if (isSet(envLookup, "FORMULAKIT_RANDOM_SEED")) {
            String value = envLookup.apply("FORMULAKIT_RANDOM_SEED").trim();
            try {
                builder.randomSeed(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(
                        "Invalid FORMULAKIT_RANDOM_SEED '" + value + "': expected an integer", e);
            }
        }

        return builder.build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
