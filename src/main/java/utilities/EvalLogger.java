package utilities;

import java.io.IOException;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Log of skipped cells, cache decisions and fallbacks. Console shows INFO and above, the log file
 * in the working directory also receives FINE.
 */
public final class EvalLogger {
    static final String LOG_FILE = "trajectory-evaluation.log";
    private static final Logger LOGGER = createLogger();

    private EvalLogger() {}

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("trajectory-evaluation");
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.FINE);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(Level.INFO);
        logger.addHandler(console);

        try {
            FileHandler file = new FileHandler(LOG_FILE, true);
            file.setLevel(Level.FINE);
            file.setFormatter(new SimpleFormatter());
            logger.addHandler(file);
        } catch (IOException e) {
            logger.warning("Could not open " + LOG_FILE + ", logging to console only: " + e.getMessage());
        }
        return logger;
    }

    public static void info(String msg) {
        LOGGER.info(msg);
    }

    // Per-cell degradations and ignored snapshots.
    public static void warning(String msg) {
        LOGGER.warning(msg);
    }

    public static void debug(String msg) {
        LOGGER.fine(msg);
    }
}
