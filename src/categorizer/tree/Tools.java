package categorizer.tree;

/**
* Process-level helpers shared by the driver and the tree builders.
*/
public final class Tools {

    /** Flag for selecting how exit() is handled. */
    private static boolean exit_throws_exception = false;

    private Tools() {
    }

    /**
    * Selects how Tools.exit() behaves.
    * Setting <b>flag = true</b> causes <b>Tools.exit()</b> to throw a runtime
    * exception instead of invoking <b>System.exit()</b>.
    * @param flag the boolean flag
    */
    public static void exitThrowsException(boolean flag) {
        exit_throws_exception = flag;
    }

    /**
    * Invokes exit operation.
    * Depending on the flag set by {@link #exitThrowsException(boolean)}, this
    * method either calls {@link System#exit(int)} or throws a
    * {@link RuntimeException}.
    * @param status the exit status
    * @exception RuntimeException if the last call to
    *       {@link #exitThrowsException(boolean)} is with <b>true</b>.
    */
    public static void exit(int status) {
        if (exit_throws_exception) {
            throw new ExitException(status);
        } else {
            System.exit(status);
        }
    }

    /**
    * Thrown by {@link Tools#exit(int)} in place of terminating the VM.
    */
    public static class ExitException extends RuntimeException {

        private static final long serialVersionUID = 5103L;

        private final int status;

        public ExitException(int status) {
            super("Exiting with status " + status);
            this.status = status;
        }

        /** Returns the requested exit status */
        public int getStatus() {
            return status;
        }
    }

}
