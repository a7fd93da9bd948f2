package categorizer.tree;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
* A general tree whose nodes are linked to their parent and keep their
* children in insertion order. Positions handed out by a tree are only valid
* for that tree, and stop being valid once their node is removed.
*
* <p>Children are unique by element: adding a child whose element is already
* held by a sibling returns the existing sibling instead of a new node.
*
* <p>{@link #depth}, {@link #height}, post-order traversal and the indented
* lines of {@link #allNodes} recurse once per level, so a chain tens of
* thousands of levels deep can overflow the thread stack.
*/
public class LinkedTree<E> extends AbstractTree<E> {

    private static final class Node<E> {

        private final E element;

        private Node<E> parent;

        /** Allocated on the first child */
        private List<Node<E>> children;

        private boolean removed;

        private Node(E element, Node<E> parent) {
            this.element = element;
            this.parent = parent;
            this.children = null;
            this.removed = false;
        }
    }

    private static final class NodePosition<E> implements Position<E> {

        private final LinkedTree<E> container;

        private final Node<E> node;

        private NodePosition(LinkedTree<E> container, Node<E> node) {
            this.container = container;
            this.node = node;
        }

        public E getElement() {
            return node.element;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof NodePosition)) {
                return false;
            }
            NodePosition<?> other = (NodePosition<?>)o;
            return other.container == container && other.node == node;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(node);
        }

        @Override
        public String toString() {
            return String.valueOf(node.element);
        }
    }

    private Node<E> root;

    private int size;

    /**
    * Creates an empty tree.
    */
    public LinkedTree() {
        root = null;
        size = 0;
    }

    /**
    * Returns the node behind <var>p</var> if <var>p</var> is a live position
    * of this tree.
    *
    * @throws InvalidPositionException if <var>p</var> is null, of a foreign
    *   type, from another tree, or refers to a removed node.
    */
    private Node<E> validate(Position<E> p) {
        if (!(p instanceof NodePosition)) {
            throw new InvalidPositionException("p must be proper Position type");
        }
        NodePosition<E> np = (NodePosition<E>)p;
        if (np.container != this) {
            throw new InvalidPositionException("p does not belong to this tree");
        }
        if (np.node.removed) {
            throw new InvalidPositionException("p is no longer valid");
        }
        return np.node;
    }

    private Position<E> makePosition(Node<E> node) {
        return (node == null) ? null : new NodePosition<E>(this, node);
    }

    public int size() {
        return size;
    }

    public Position<E> root() {
        return makePosition(root);
    }

    public Position<E> parent(Position<E> p) {
        return makePosition(validate(p).parent);
    }

    public int numChildren(Position<E> p) {
        Node<E> node = validate(p);
        return (node.children == null) ? 0 : node.children.size();
    }

    public Iterable<Position<E>> children(Position<E> p) {
        final Node<E> node = validate(p);
        return new Iterable<Position<E>>() {
            public Iterator<Position<E>> iterator() {
                return new ChildIterator(node);
            }
        };
    }

    /**
    * Iterates over the immediate children of one node.
    */
    private class ChildIterator implements Iterator<Position<E>> {

        private final List<Node<E>> children;

        private int next;

        private ChildIterator(Node<E> parent) {
            this.children = parent.children;
            this.next = 0;
        }

        public boolean hasNext() {
            return children != null && next < children.size();
        }

        public Position<E> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return makePosition(children.get(next++));
        }

        public void remove() {
            throw new UnsupportedOperationException();
        }
    }

    /**
    * Places <var>e</var> at the root of an empty tree.
    *
    * @param e the root element.
    * @return the position of the new root.
    * @throws AlreadyHasRootException if the tree is not empty.
    */
    public Position<E> addRoot(E e) {
        if (root != null) {
            throw new AlreadyHasRootException("Root exists");
        }
        root = new Node<E>(e, null);
        size = 1;
        return makePosition(root);
    }

    /**
    * Adds a child holding <var>e</var> under <var>p</var>. If <var>p</var>
    * already has a child equal to <var>e</var>, that child is returned and
    * the tree is left unchanged.
    *
    * @param p the parent position.
    * @param e the child element.
    * @return the position of the new or existing child.
    * @throws InvalidPositionException if <var>p</var> is not valid.
    */
    public Position<E> addChild(Position<E> p, E e) {
        Node<E> node = validate(p);
        Position<E> existing = findChildByValue(p, e);
        if (existing != null) {
            return existing;
        }
        if (node.children == null) {
            node.children = new ArrayList<Node<E>>();
        }
        Node<E> child = new Node<E>(e, node);
        node.children.add(child);
        size++;
        return makePosition(child);
    }

    /**
    * Adds a node to the tree. A null <var>p</var> adds the root.
    *
    * @param e the element to add.
    * @param p the parent position, or null for the root.
    * @return the position holding <var>e</var>.
    */
    public Position<E> addNode(E e, Position<E> p) {
        if (p == null) {
            return addRoot(e);
        } else {
            return addChild(p, e);
        }
    }

    /**
    * Detaches the leaf at <var>p</var> and marks it removed, so that every
    * position still referring to it fails validation.
    *
    * @throws IllegalArgumentException if <var>p</var> is not a leaf.
    */
    void invalidate(Position<E> p) {
        Node<E> node = validate(p);
        if (node.children != null && !node.children.isEmpty()) {
            throw new IllegalArgumentException("p is not a leaf");
        }
        if (node.parent == null) {
            root = null;
        } else {
            node.parent.children.remove(node);
        }
        node.parent = null;
        node.removed = true;
        size--;
    }

    /**
    * Returns the child of <var>p</var> holding <var>value</var>.
    *
    * @param p the parent position.
    * @param value the element to look for.
    * @return the first matching child, or null if no child matches.
    * @throws InvalidPositionException if <var>p</var> is not valid.
    */
    public Position<E> findChildByValue(Position<E> p, E value) {
        for (Position<E> child : children(p)) {
            E element = child.getElement();
            if (element == null ? value == null : element.equals(value)) {
                return child;
            }
        }
        return null;
    }

    /**
    * Returns the positions from <var>p</var> up to the root, both included.
    *
    * @param p a valid position.
    * @return a list of length {@code depth(p) + 1}.
    */
    public List<Position<E>> pathToRoot(Position<E> p) {
        List<Position<E>> path = new ArrayList<Position<E>>();
        path.add(p);
        while (!isRoot(p)) {
            p = parent(p);
            path.add(p);
        }
        return path;
    }

    /**
    * Returns a fresh iterator over all positions in the given order.
    */
    public TreeIterator<E> positions(TraversalOrder order) {
        if (order == TraversalOrder.PRE) {
            return new PreOrderIterator<E>(this, root());
        } else {
            return new PostOrderIterator<E>(this, root());
        }
    }

    /**
    * Returns the printed form of the tree in the given order, one line per
    * node. Each line is the element indented with one tab per level of depth
    * and terminated by a newline. Every call to {@code iterator()} starts a
    * new walk.
    *
    * @param order the traversal order.
    * @return the lines, empty for an empty tree.
    */
    public Iterable<String> allNodes(final TraversalOrder order) {
        return new Iterable<String>() {
            public Iterator<String> iterator() {
                final TreeIterator<E> iter = positions(order);
                return new Iterator<String>() {
                    public boolean hasNext() {
                        return iter.hasNext();
                    }

                    public String next() {
                        return formatLine(iter.next());
                    }

                    public void remove() {
                        throw new UnsupportedOperationException();
                    }
                };
            }
        };
    }

    /**
    * Returns <var>p</var>'s element indented by its depth.
    */
    public String formatLine(Position<E> p) {
        int depth = depth(p);
        StringBuilder sb = new StringBuilder(depth + 16);
        for (int i = 0; i < depth; i++) {
            sb.append('\t');
        }
        sb.append(validate(p).element).append('\n');
        return sb.toString();
    }

}
