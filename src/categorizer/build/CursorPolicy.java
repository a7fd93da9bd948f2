package categorizer.build;

/**
* Selects how {@link ProductCategorizer} moves its cursor, the position under
* which the next label of a line is looked up or added.
*/
public enum CursorPolicy {

    /**
    * The cursor carries over from one line to the next, and stays where it
    * is after a child is created. Any label equal to the root element moves
    * the cursor back to the root.
    */
    REFERENCE("reference", false, false),

    /**
    * Every line starts at the root and the cursor follows each label, so a
    * line always becomes a root-to-node path. Only a leading label equal to
    * the root element is skipped.
    */
    RESET("reset", true, true);

    private final String name;

    private final boolean reset_per_line;

    private final boolean advance_on_create;

    private CursorPolicy(String name, boolean reset_per_line,
                         boolean advance_on_create) {
        this.name = name;
        this.reset_per_line = reset_per_line;
        this.advance_on_create = advance_on_create;
    }

    /** Returns true if the cursor goes back to the root on every line */
    public boolean resetsPerLine() {
        return reset_per_line;
    }

    /** Returns true if the cursor moves onto a child it has just created */
    public boolean advancesOnCreate() {
        return advance_on_create;
    }

    /**
    * Looks up a policy by option value.
    *
    * @param name "reference" or "reset"; null selects {@link #REFERENCE}.
    * @return the matching policy.
    * @throws IllegalArgumentException if the name is unknown.
    */
    public static CursorPolicy fromName(String name) {
        if (name == null) {
            return REFERENCE;
        }
        for (CursorPolicy policy : values()) {
            if (policy.name.equals(name)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("unknown cursor policy " + name);
    }

    @Override
    public String toString() {
        return name;
    }

}
