package resqpack.cli.utils;

/**
 * ANSI coloring for command output. Turned off by {@code --no-color}.
 */
public class ColorOutput {
    public static final String RESET = "\033[0m";

    public static final String RED = "\033[31m";
    public static final String GREEN = "\033[32m";
    public static final String YELLOW = "\033[33m";
    public static final String CYAN = "\033[36m";

    private static volatile boolean colorEnabled = true;

    private ColorOutput() {
    }

    public static void setColorEnabled(boolean enabled) {
        colorEnabled = enabled;
    }

    public static String colorize(String text, String color) {
        return colorEnabled ? color + text + RESET : text;
    }

    /** Errors and invalid parts. */
    public static String red(String text) {
        return colorize(text, RED);
    }

    public static String green(String text) {
        return colorize(text, GREEN);
    }

    /** OIDs. */
    public static String yellow(String text) {
        return colorize(text, YELLOW);
    }

    /** Type tags. */
    public static String cyan(String text) {
        return colorize(text, CYAN);
    }
}
