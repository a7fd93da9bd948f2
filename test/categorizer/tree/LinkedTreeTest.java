package categorizer.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LinkedTreeTest {

    private LinkedTree<String> tree;

    private Position<String> a;
    private Position<String> b;
    private Position<String> c;
    private Position<String> d;

    // A with children B, C; D under B
    @BeforeEach
    void buildTree() {
        tree = new LinkedTree<String>();
        a = tree.addRoot("A");
        b = tree.addChild(a, "B");
        c = tree.addChild(a, "C");
        d = tree.addChild(b, "D");
    }

    private static List<String> lines(Iterable<String> it) {
        List<String> ret = new ArrayList<String>();
        for (String s : it) {
            ret.add(s);
        }
        return ret;
    }

    @Test
    void testEmptyTree() {
        LinkedTree<String> empty = new LinkedTree<String>();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertNull(empty.root());
        assertTrue(lines(empty.allNodes(TraversalOrder.PRE)).isEmpty());
        assertTrue(lines(empty.allNodes(TraversalOrder.POST)).isEmpty());
        assertThrows(IllegalStateException.class, empty::height);
    }

    @Test
    void testAddRootTwiceFails() {
        assertThrows(AlreadyHasRootException.class, () -> tree.addRoot("Z"));
        assertEquals(4, tree.size());
        assertEquals("A", tree.root().getElement());
    }

    @Test
    void testAddNodeDispatches() {
        LinkedTree<String> t = new LinkedTree<String>();
        Position<String> root = t.addNode("R", null);
        assertTrue(t.isRoot(root));
        Position<String> child = t.addNode("X", root);
        assertEquals(root, t.parent(child));
        assertEquals(2, t.size());
    }

    @Test
    void testAddChildIsIdempotent() {
        Position<String> again = tree.addChild(a, "B");
        assertEquals(b, again);
        assertEquals(4, tree.size());
        assertEquals(2, tree.numChildren(a));
        assertEquals(Arrays.asList("A\n", "\tB\n", "\t\tD\n", "\tC\n"),
                lines(tree.allNodes(TraversalOrder.PRE)));
    }

    @Test
    void testSameLabelUnderDifferentParents() {
        Position<String> cd = tree.addChild(c, "D");
        assertNotEquals(d, cd);
        assertEquals(5, tree.size());
        assertEquals(c, tree.parent(cd));
    }

    @Test
    void testRootAndParent() {
        assertEquals(a, tree.root());
        assertNull(tree.parent(a));
        assertEquals(a, tree.parent(b));
        assertEquals(b, tree.parent(d));
        assertTrue(tree.isRoot(a));
        assertFalse(tree.isRoot(b));
    }

    @Test
    void testLeavesAndChildren() {
        assertFalse(tree.isLeaf(a));
        assertTrue(tree.isLeaf(c));
        assertTrue(tree.isLeaf(d));
        assertEquals(0, tree.numChildren(c));
        assertFalse(tree.children(c).iterator().hasNext());
        List<Position<String>> kids = new ArrayList<Position<String>>();
        for (Position<String> p : tree.children(a)) {
            kids.add(p);
        }
        assertEquals(Arrays.asList(b, c), kids);
    }

    @Test
    void testDepth() {
        assertEquals(0, tree.depth(a));
        for (Position<String> p : tree.positions(TraversalOrder.PRE).getList()) {
            for (Position<String> child : tree.children(p)) {
                assertEquals(tree.depth(p) + 1, tree.depth(child));
            }
        }
        assertEquals(2, tree.depth(d));
    }

    @Test
    void testHeight() {
        assertEquals(2, tree.height());
        assertEquals(2, tree.height(a));
        assertEquals(1, tree.height(b));
        assertEquals(0, tree.height(c));
        assertEquals(0, tree.height(d));
    }

    @Test
    void testDeepChain() {
        LinkedTree<String> t = new LinkedTree<String>();
        Position<String> p = t.addRoot("L0");
        for (int i = 1; i <= 1000; i++) {
            p = t.addChild(p, "L" + i);
        }
        assertEquals(1000, t.depth(p));
        assertEquals(1000, t.height());
        assertEquals(1001, t.pathToRoot(p).size());
        List<String> post = lines(t.allNodes(TraversalOrder.POST));
        assertEquals(1001, post.size());
        assertEquals("L0\n", post.get(1000));
    }

    @Test
    void testSizeIsRootPlusSubtrees() {
        int total = 1;
        for (Position<String> child : tree.children(tree.root())) {
            total += new PreOrderIterator<String>(tree, child).getList().size();
        }
        assertEquals(tree.size(), total);
    }

    @Test
    void testPathToRoot() {
        List<Position<String>> path = tree.pathToRoot(d);
        assertEquals(tree.depth(d) + 1, path.size());
        assertEquals(d, path.get(0));
        assertEquals(tree.root(), path.get(path.size() - 1));
        for (int i = 0; i + 1 < path.size(); i++) {
            assertEquals(path.get(i + 1), tree.parent(path.get(i)));
        }
        assertEquals(Arrays.asList(a), tree.pathToRoot(a));
    }

    @Test
    void testFindChildByValue() {
        assertEquals(b, tree.findChildByValue(a, "B"));
        assertEquals(c, tree.findChildByValue(a, "C"));
        // only immediate children are searched
        assertNull(tree.findChildByValue(a, "D"));
        assertNull(tree.findChildByValue(c, "B"));
    }

    @Test
    void testPositionEquality() {
        assertEquals(tree.root(), tree.root());
        assertEquals(tree.root().hashCode(), tree.root().hashCode());
        LinkedTree<String> other = new LinkedTree<String>();
        Position<String> otherRoot = other.addRoot("A");
        assertNotEquals(a, otherRoot);
        assertEquals("A", otherRoot.getElement());
    }

    @Test
    void testTwoChildTraversal() {
        LinkedTree<String> t = new LinkedTree<String>();
        Position<String> root = t.addRoot("A");
        t.addChild(root, "B");
        t.addChild(root, "C");
        assertEquals(Arrays.asList("A\n", "\tB\n", "\tC\n"),
                lines(t.allNodes(TraversalOrder.PRE)));
        assertEquals(Arrays.asList("\tB\n", "\tC\n", "A\n"),
                lines(t.allNodes(TraversalOrder.POST)));
    }

    @Test
    void testNestedTraversal() {
        assertEquals(Arrays.asList("A\n", "\tB\n", "\t\tD\n", "\tC\n"),
                lines(tree.allNodes(TraversalOrder.PRE)));
        assertEquals(Arrays.asList("\t\tD\n", "\tB\n", "\tC\n", "A\n"),
                lines(tree.allNodes(TraversalOrder.POST)));
    }

    @Test
    void testTraversalIsRestartable() {
        Iterable<String> pre = tree.allNodes(TraversalOrder.PRE);
        List<String> first = lines(pre);
        List<String> second = lines(pre);
        assertEquals(first, second);
        assertEquals(tree.size(), first.size());
    }

    @Test
    void testEmptyLabelIsOrdinary() {
        Position<String> blank = tree.addChild(c, "");
        assertEquals(blank, tree.findChildByValue(c, ""));
        assertEquals("\t\t\n", tree.formatLine(blank));
    }

    @Test
    void testForeignPositionRejected() {
        LinkedTree<String> other = new LinkedTree<String>();
        Position<String> foreign = other.addRoot("A");
        assertThrows(InvalidPositionException.class, () -> tree.parent(foreign));
        assertThrows(InvalidPositionException.class, () -> tree.numChildren(foreign));
        assertThrows(InvalidPositionException.class, () -> tree.children(foreign));
        assertThrows(InvalidPositionException.class, () -> tree.addChild(foreign, "X"));
        assertThrows(InvalidPositionException.class, () -> tree.depth(foreign));
        assertThrows(InvalidPositionException.class, () -> tree.pathToRoot(foreign));
        assertEquals(4, tree.size());
    }

    @Test
    void testWrongPositionTypeRejected() {
        Position<String> fake = new Position<String>() {
            public String getElement() {
                return "A";
            }
        };
        assertThrows(InvalidPositionException.class, () -> tree.parent(fake));
        assertThrows(InvalidPositionException.class, () -> tree.parent(null));
        assertThrows(InvalidPositionException.class, () -> tree.addChild(null, "X"));
    }

    @Test
    void testRemovedPositionRejected() {
        Position<String> stale = tree.findChildByValue(b, "D");
        tree.invalidate(d);
        assertEquals(3, tree.size());
        assertTrue(tree.isLeaf(b));
        assertThrows(InvalidPositionException.class, () -> tree.parent(stale));
        assertThrows(InvalidPositionException.class, () -> tree.numChildren(d));
        assertThrows(InvalidPositionException.class, () -> tree.addChild(d, "E"));
    }

    @Test
    void testInvalidateRequiresLeaf() {
        assertThrows(IllegalArgumentException.class, () -> tree.invalidate(b));
        assertEquals(4, tree.size());
    }

}
