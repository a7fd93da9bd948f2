package categorizer.tree;

/**
* Thrown when a root is added to a tree that already has one.
*/
public class AlreadyHasRootException extends RuntimeException {

    private static final long serialVersionUID = 5102L;

    public AlreadyHasRootException() {
        super();
    }

    public AlreadyHasRootException(String message) {
        super(message);
    }

}
