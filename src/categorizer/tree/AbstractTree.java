package categorizer.tree;

/**
* Implements the queries of {@link Tree} that can be answered with the
* primitive accessors alone. Concrete trees only provide storage and
* position validation.
*/
public abstract class AbstractTree<E> implements Tree<E> {

    protected AbstractTree() {
    }

    public boolean isRoot(Position<E> p) {
        Position<E> root = root();
        return root != null && root.equals(p);
    }

    public boolean isLeaf(Position<E> p) {
        return numChildren(p) == 0;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
    * Returns the depth of <var>p</var>: zero for the root, otherwise one more
    * than the depth of the parent. The cost is linear in the depth.
    *
    * @param p a valid position of this tree.
    * @return the depth of <var>p</var>.
    */
    public int depth(Position<E> p) {
        if (isRoot(p)) {
            return 0;
        } else {
            return 1 + depth(parent(p));
        }
    }

    /**
    * Returns the height of the whole tree.
    *
    * @throws IllegalStateException if the tree is empty.
    */
    public int height() {
        Position<E> root = root();
        if (root == null) {
            throw new IllegalStateException("height of an empty tree");
        }
        return height(root);
    }

    /**
    * Returns the height of the subtree rooted at <var>p</var>. Every node of
    * the subtree is visited, so the cost is linear in the subtree size.
    *
    * @param p a valid position of this tree.
    * @return zero for a leaf, otherwise one more than the tallest child.
    */
    public int height(Position<E> p) {
        int h = 0;
        for (Position<E> c : children(p)) {
            h = Math.max(h, 1 + height(c));
        }
        return h;
    }

}
