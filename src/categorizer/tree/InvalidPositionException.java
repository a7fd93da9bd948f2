package categorizer.tree;

/**
* Thrown when a position handed to a tree is not one of its own live
* positions: the position has the wrong type, belongs to another tree, or
* refers to a node that was removed.
*/
public class InvalidPositionException extends RuntimeException {

    private static final long serialVersionUID = 5101L;

    public InvalidPositionException() {
        super();
    }

    public InvalidPositionException(String message) {
        super(message);
    }

}
