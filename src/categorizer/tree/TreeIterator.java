package categorizer.tree;

import java.util.Iterator;
import java.util.List;
import java.util.ArrayList;
import java.util.NoSuchElementException;

/**
* Base class of the iterators that walk the positions of a {@link Tree}.
* Every iterator can be moved back to the beginning of its sequence with
* {@link #reset}.
*/
public abstract class TreeIterator<E> implements Iterator<Position<E>> {

    /** The tree being walked */
    protected final Tree<E> tree;

    /** The position the walk starts from, or null for an empty walk */
    protected final Position<E> root;

    /** Constructs a base TreeIterator */
    protected TreeIterator(Tree<E> tree, Position<E> root) {
        this.tree = tree;
        this.root = root;
    }

    /**
    * Returns true if the iteration has more positions.
    *
    * @return true if the iterator has more positions.
    */
    public abstract boolean hasNext();

    /**
    * Returns the next position in the iteration.
    *
    * @return the next position in the iteration.
    * @throws NoSuchElementException if there is no position left.
    */
    public abstract Position<E> next();

    /**
    * Collects the remaining positions into a list.
    *
    * @return the collected list.
    */
    public List<Position<E>> getList() {
        List<Position<E>> ret = new ArrayList<Position<E>>();
        while (hasNext()) {
            ret.add(next());
        }
        return ret;
    }

    /**
    * This operation is not supported.
    */
    public void remove() {
        throw new UnsupportedOperationException();
    }

    /**
    * Moves the iterator back to the beginning of the sequence.
    */
    public abstract void reset();

}
