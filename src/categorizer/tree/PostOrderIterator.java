package categorizer.tree;

import java.util.LinkedList;
import java.util.NoSuchElementException;

/**
* Performs a post-order traversal over a tree: the children of a node, in
* insertion order, are visited before the node itself. The whole sequence is
* collected when the iterator is created or reset, since the first position
* to visit is usually a leaf deep below the starting position.
*/
public class PostOrderIterator<E> extends TreeIterator<E> {

    private LinkedList<Position<E>> queue;

    /**
    * Creates a new iterator with the specified starting position.
    *
    * @param tree the tree to walk.
    * @param root the root of the traversal; null yields an empty walk.
    */
    public PostOrderIterator(Tree<E> tree, Position<E> root) {
        super(tree, root);
        queue = new LinkedList<Position<E>>();
        if (root != null) {
            populate(root);
        }
    }

    public boolean hasNext() {
        return !queue.isEmpty();
    }

    public Position<E> next() {
        if (queue.isEmpty()) {
            throw new NoSuchElementException();
        }
        return queue.removeFirst();
    }

    private void populate(Position<E> p) {
        for (Position<E> child : tree.children(p)) {
            populate(child);
        }
        queue.add(p);
    }

    /**
    * Resets the iterator by setting the current position to the root.
    */
    public void reset() {
        queue.clear();
        if (root != null) {
            populate(root);
        }
    }

}
