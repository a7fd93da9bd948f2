package categorizer.tree;

/**
* <b>PrintTools</b> provides verbosity-gated status messages. The verbosity is
* taken from the command-line option and defaults to zero, which prints
* nothing.
*/
public final class PrintTools {

    // Short names for system properties
    public static final String line_sep = System.getProperty("line.separator");

    /** Global verbosity taken from the command-line option */
    private static int verbosity = 0;

    private PrintTools() {
    }

    /**
    * Sets the global verbosity level.
    *
    * @param level the new level, 0 (quiet) to 4.
    */
    public static void setVerbosity(int level) {
        verbosity = level;
    }

    /**
    * Prints a string to System.err if the verbosity level is at least
    * <var>min_verbosity</var>.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void printlnStatus(String message, int min_verbosity) {
        if (verbosity >= min_verbosity) {
            System.err.println(message);
        }
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is at least {@code min_verbosity}.
    * The string is composed only if the verbosity level is met.
    * @param min_verbosity the minimum verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= verbosity && items.length > 0) {
            StringBuilder sb = new StringBuilder(80);
            sb.append(items[0]);
            for (int i = 1; i < items.length; i++) {
                sb.append(" ").append(items[i]);
            }
            System.err.println(sb.toString());
        }
    }

}
