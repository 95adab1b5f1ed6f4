package io.shakemyleg.standalone.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.shakemyleg.core.engine.StateMachine;
import io.shakemyleg.core.spec.BlockCompiler;
import io.shakemyleg.standalone.config.ConfigLoadException;
import io.shakemyleg.standalone.config.ConfigLoader;
import io.shakemyleg.standalone.config.RunnerConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates a runner invocation.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback from {@code logging.format} and
 * {@code logging.level}</li>
 * <li>Compile the script</li>
 * <li>Seed globals from the {@code globals} file, if configured</li>
 * <li>Run the machine over standard input</li>
 * </ol>
 *
 * <p>
 * Relative {@code script} and {@code globals} paths are resolved against the
 * directory of the configuration file.
 *
 * <p>
 * Kept apart from {@link io.shakemyleg.standalone.StandaloneMain} so the whole
 * sequence can be tested without {@code main()}.
 */
public final class RunnerApp {

    private static final Logger LOG = LoggerFactory.getLogger(RunnerApp.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private RunnerApp() {
        // utility class
    }

    /**
     * Runs with the process environment over standard input and output.
     *
     * @param args command-line arguments (e.g. {@code --config shakemyleg.yaml})
     */
    public static ScriptRunner.Summary start(String[] args) throws IOException {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        RunnerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return run(config, baseDir(configPath), System.in, System.out);
    }

    /** Loads configuration with the given env lookup and runs over the given streams. */
    public static ScriptRunner.Summary start(
            Path configPath, Function<String, String> envLookup, InputStream in, OutputStream out)
            throws IOException {
        RunnerConfig config = ConfigLoader.load(configPath, envLookup);
        return run(config, baseDir(configPath), in, out);
    }

    static ScriptRunner.Summary run(RunnerConfig config, Path baseDir, InputStream in, OutputStream out)
            throws IOException {
        Path script = baseDir.resolve(config.script());
        StateMachine machine = new BlockCompiler(config.compileOptions()).compile(script);
        LOG.info(
                "Script compiled: path={}, states={}, initial_state={}",
                script,
                machine.stateNames().size(),
                machine.initialState());

        if (config.globals() != null && !config.globals().isBlank()) {
            Path globalsPath = baseDir.resolve(config.globals());
            machine.reinit(readGlobals(globalsPath));
            LOG.info("Globals seeded from {}", globalsPath);
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        ScriptRunner runner = new ScriptRunner(machine, config.mode(), config.failFast());
        return runner.run(reader, writer);
    }

    private static JsonNode readGlobals(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigLoadException("Globals file not found: " + path);
        }
        try {
            return YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse globals file: " + path, e);
        }
    }

    private static Path baseDir(Path configPath) {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of("").toAbsolutePath();
    }
}
