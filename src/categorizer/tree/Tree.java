package categorizer.tree;

/**
* Any class implementing this interface acts as a rooted tree whose children
* are ordered by insertion. Implementations supply the primitive accessors
* ({@link #root}, {@link #parent}, {@link #numChildren}, {@link #children} and
* {@link #size}); the remaining queries are derived from them once, in
* {@link AbstractTree}.
*/
public interface Tree<E> {

    /**
    * Returns the position of the root.
    *
    * @return the root position, or null if the tree is empty.
    */
    Position<E> root();

    /**
    * Returns the position of the parent of <var>p</var>.
    *
    * @param p a valid position of this tree.
    * @return the parent position, or null if <var>p</var> is the root.
    * @throws InvalidPositionException if <var>p</var> is not valid.
    */
    Position<E> parent(Position<E> p);

    /**
    * Returns the number of children of <var>p</var>.
    *
    * @throws InvalidPositionException if <var>p</var> is not valid.
    */
    int numChildren(Position<E> p);

    /**
    * Provides the children of <var>p</var> in insertion order. The returned
    * iterable is empty for a leaf.
    *
    * @throws InvalidPositionException if <var>p</var> is not valid.
    */
    Iterable<Position<E>> children(Position<E> p);

    /** Returns the total number of nodes in the tree. */
    int size();

    boolean isRoot(Position<E> p);

    boolean isLeaf(Position<E> p);

    boolean isEmpty();

    /**
    * Returns the number of levels separating <var>p</var> from the root.
    */
    int depth(Position<E> p);

    /**
    * Returns the height of the whole tree.
    */
    int height();

    /**
    * Returns the height of the subtree rooted at <var>p</var>.
    */
    int height(Position<E> p);

}
