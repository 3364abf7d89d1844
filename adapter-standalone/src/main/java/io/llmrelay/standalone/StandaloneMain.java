package io.llmrelay.standalone;

import io.llmrelay.standalone.proxy.RelayApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone relay.
 *
 * <p>
 * Delegates to {@link RelayApp#start(String[])} for the full startup
 * sequence. On failure, logs the error and exits with a non-zero status code.
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
     *             {@code --config path/to/llm-relay.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            RelayApp app = RelayApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "llm-relay-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
