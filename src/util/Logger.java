package util;

/**
 * Verbosity-gated diagnostic output written to standard error. Lines are prefixed with the id of the thread that
 * wrote them since several sources may be analyzed at once.
 */
public class Logger {
    /**
     * Messages with a level above this are dropped
     */
    private static volatile int outputLevel = 0;

    /**
     * Set the level of output, higher means more console output
     *
     * @param level new output level
     */
    public static void setOutputLevel(int level) {
        outputLevel = level;
    }

    /**
     * Get the current level of output
     *
     * @return output level
     */
    public static int getOutputLevel() {
        return outputLevel;
    }

    /**
     * Print the message if the output level is at least <code>level</code>
     *
     * @param level minimum output level at which the message is printed
     * @param s message
     */
    public static void println(int level, String s) {
        if (level <= outputLevel) {
            System.err.println("[" + Thread.currentThread().getId() + "]" + s);
        }
    }

    /**
     * Print a warning about the given source line if the output level is at least 1
     *
     * @param line line in the analyzed source
     * @param s message
     */
    public static void warn(int line, String s) {
        println(1, "WARNING (line " + line + "): " + s);
    }
}
