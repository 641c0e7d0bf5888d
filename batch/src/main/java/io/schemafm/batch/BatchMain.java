package io.schemafm.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the schema-fm batch tool.
 *
 * <p>
 * Usage: {@code java -jar schema-fm-batch.jar [generate|validate|run|diff] [--config <path>]}.
 * Any failure is logged and ends the process with status 1.
 */
public final class BatchMain {

    private static final Logger LOG = LoggerFactory.getLogger(BatchMain.class);

    private BatchMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        BatchApp app = new BatchApp(System::getenv, System.out);
        Runtime.getRuntime().addShutdownHook(new Thread(app::cancel, "schemafm-shutdown"));
        try {
            app.execute(args);
        } catch (Exception e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
