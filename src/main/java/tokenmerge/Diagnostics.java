package tokenmerge;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging switch for the {@code tokenmerge} library.
 * <p>
 * All library loggers are children of the {@code tokenmerge} logger, which is
 * off by default so that embedding applications see no console output.
 * </p>
 */
public final class Diagnostics {
    /**
     * Parent of every library logger. Held strongly so its level is not lost.
     */
    private static final Logger ROOT = Logger.getLogger("tokenmerge");

    static {
        // Disable logging by default
        ROOT.setLevel(Level.OFF);
    }

    private Diagnostics() {
    }

    /**
     * Enables or disables verbose logging for the library.
     *
     * @param enabled {@code true} to log at {@code INFO} and above, {@code false} to silence
     */
    public static void setVerboseLogging(boolean enabled) {
        ROOT.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    /**
     * Returns {@code true} if verbose logging is currently enabled.
     *
     * @return whether library messages are logged
     */
    public static boolean isVerboseLogging() {
        return ROOT.getLevel() != Level.OFF;
    }

    static Logger logger(Class<?> owner) {
        return Logger.getLogger(owner.getName());
    }
}
