package io.shakemyleg.standalone;

import io.shakemyleg.standalone.runner.RunnerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone runner.
 *
 * <p>
 * Delegates to {@link RunnerApp#start(String[])}. On failure, logs the error
 * and exits with a non-zero status code.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/shakemyleg.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            RunnerApp.start(args);
        } catch (Exception e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
