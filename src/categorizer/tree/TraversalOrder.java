package categorizer.tree;

/**
* The depth-first orders in which a tree can be printed.
*/
public enum TraversalOrder {

    /** A node before its children */
    PRE("pre"),

    /** The children of a node before the node */
    POST("post");

    private final String name;

    private TraversalOrder(String name) {
        this.name = name;
    }

    /**
    * Maps a short name to an order. Only "pre" selects pre-order; any other
    * name selects post-order.
    *
    * @param name the short name, may be null.
    * @return the matching order.
    */
    public static TraversalOrder fromName(String name) {
        if (PRE.name.equals(name)) {
            return PRE;
        }
        return POST;
    }

    @Override
    public String toString() {
        return name;
    }

}
