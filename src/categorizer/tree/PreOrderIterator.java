package categorizer.tree;

import java.util.LinkedList;
import java.util.NoSuchElementException;

/**
* Iterates over the positions of a tree in depth-first pre-order: a node is
* visited before its children, and children in insertion order. Children are
* expanded only when their parent is returned, so the walk is lazy.
*/
public class PreOrderIterator<E> extends TreeIterator<E> {

    private LinkedList<Position<E>> stack;

    /**
    * Creates a new iterator starting at <var>init</var>.
    *
    * @param tree the tree to walk.
    * @param init the first position to visit; null yields an empty walk.
    */
    public PreOrderIterator(Tree<E> tree, Position<E> init) {
        super(tree, init);
        stack = new LinkedList<Position<E>>();
        if (init != null) {
            stack.add(init);
        }
    }

    public boolean hasNext() {
        return !stack.isEmpty();
    }

    public Position<E> next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException();
        }
        Position<E> p = stack.removeFirst();
        // keep the children ahead of the pending siblings, in order
        int i = 0;
        for (Position<E> child : tree.children(p)) {
            stack.add(i++, child);
        }
        return p;
    }

    /**
    * Resets the iterator by setting the current position to the root.
    */
    public void reset() {
        stack.clear();
        if (root != null) {
            stack.add(root);
        }
    }

}
