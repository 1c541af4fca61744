package io.docmirror.standalone;

import io.docmirror.standalone.config.ConfigLoader;
import io.docmirror.standalone.config.MirrorConfig;
import io.docmirror.standalone.runner.LogbackConfigurator;
import io.docmirror.standalone.runner.MirrorRunner;
import io.docmirror.standalone.runner.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for a standalone mirror run.
 *
 * <p>
 * Loads configuration, applies the logging settings and runs {@link MirrorRunner}. On failure,
 * logs the error and exits with a non-zero status code.
 */
public final class MirrorMain {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorMain.class);

    private MirrorMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/doc-mirror.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            run(args);
        } catch (Exception e) {
            LOG.error("Mirror run failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static RunSummary run(String[] args) throws Exception {
        MirrorConfig config = ConfigLoader.load(ConfigLoader.resolveConfigPath(args));
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        return new MirrorRunner(config).run();
    }
}
