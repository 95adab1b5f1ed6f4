package io.shakemyleg.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.shakemyleg.core.engine.GlobalsRollback;
import io.shakemyleg.core.engine.TransitionCheck;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link RunnerConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code shakemyleg.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Every key can be overridden by an environment variable, and env vars take
 * precedence over YAML values. An env var counts as set only if it is defined
 * and its trimmed value is non-empty.
 *
 * <table>
 * <caption>Keys</caption>
 * <tr><th>YAML</th><th>Env var</th></tr>
 * <tr><td>{@code script}</td><td>{@code SML_SCRIPT}</td></tr>
 * <tr><td>{@code globals}</td><td>{@code SML_GLOBALS}</td></tr>
 * <tr><td>{@code cycle.mode}</td><td>{@code SML_MODE}</td></tr>
 * <tr><td>{@code cycle.fail-fast}</td><td>{@code SML_FAIL_FAST}</td></tr>
 * <tr><td>{@code compiler.transition-check}</td><td>{@code SML_TRANSITION_CHECK}</td></tr>
 * <tr><td>{@code compiler.globals-rollback}</td><td>{@code SML_GLOBALS_ROLLBACK}</td></tr>
 * <tr><td>{@code logging.format}</td><td>{@code SML_LOG_FORMAT}</td></tr>
 * <tr><td>{@code logging.level}</td><td>{@code SML_LOG_LEVEL}</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "shakemyleg.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaying
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or
     *                             holds an invalid value
     */
    public static RunnerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying the supplied
     * environment lookup. The lookup returns {@code null} for undefined
     * variables.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or
     *                             holds an invalid value
     */
    public static RunnerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode()) {
            root = YAML_MAPPER.createObjectNode();
        }

        try {
            return mapToConfig(root, envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static RunnerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        RunnerConfig.Builder builder = RunnerConfig.builder();

        // --- YAML mapping ---

        if (root.hasNonNull("script")) builder.script(root.get("script").asText());
        if (root.hasNonNull("globals")) builder.globals(root.get("globals").asText());

        JsonNode cycle = root.path("cycle");
        if (cycle.has("mode")) builder.mode(CycleMode.fromString(cycle.get("mode").asText()));
        if (cycle.has("fail-fast")) builder.failFast(cycle.get("fail-fast").asBoolean());

        JsonNode compiler = root.path("compiler");
        if (compiler.has("transition-check"))
            builder.transitionCheck(TransitionCheck.fromString(compiler.get("transition-check").asText()));
        if (compiler.has("globals-rollback"))
            builder.globalsRollback(GlobalsRollback.fromString(compiler.get("globals-rollback").asText()));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "SML_SCRIPT", builder::script);
        envString(envLookup, "SML_GLOBALS", builder::globals);
        envString(envLookup, "SML_MODE", v -> builder.mode(CycleMode.fromString(v)));
        envBool(envLookup, "SML_FAIL_FAST", builder::failFast);
        envString(envLookup, "SML_TRANSITION_CHECK", v -> builder.transitionCheck(TransitionCheck.fromString(v)));
        envString(envLookup, "SML_GLOBALS_ROLLBACK", v -> builder.globalsRollback(GlobalsRollback.fromString(v)));
        envString(envLookup, "SML_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "SML_LOG_LEVEL", builder::loggingLevel);

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
