package categorizer.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class TreeIteratorTest {

    private static List<String> elements(List<Position<String>> positions) {
        List<String> ret = new ArrayList<String>();
        for (Position<String> p : positions) {
            ret.add(p.getElement());
        }
        return ret;
    }

    // R(X(X1, X2), Y, Z(Z1))
    private static LinkedTree<String> sample() {
        LinkedTree<String> tree = new LinkedTree<String>();
        Position<String> r = tree.addRoot("R");
        Position<String> x = tree.addChild(r, "X");
        tree.addChild(r, "Y");
        Position<String> z = tree.addChild(r, "Z");
        tree.addChild(x, "X1");
        tree.addChild(x, "X2");
        tree.addChild(z, "Z1");
        return tree;
    }

    @Test
    void testPreOrder() {
        LinkedTree<String> tree = sample();
        PreOrderIterator<String> iter = new PreOrderIterator<String>(tree, tree.root());
        assertEquals(Arrays.asList("R", "X", "X1", "X2", "Y", "Z", "Z1"),
                elements(iter.getList()));
        assertFalse(iter.hasNext());
        assertThrows(NoSuchElementException.class, iter::next);
    }

    @Test
    void testPostOrder() {
        LinkedTree<String> tree = sample();
        PostOrderIterator<String> iter = new PostOrderIterator<String>(tree, tree.root());
        assertEquals(Arrays.asList("X1", "X2", "X", "Y", "Z1", "Z", "R"),
                elements(iter.getList()));
        assertThrows(NoSuchElementException.class, iter::next);
    }

    @Test
    void testSubtreeWalk() {
        LinkedTree<String> tree = sample();
        Position<String> z = tree.findChildByValue(tree.root(), "Z");
        assertEquals(Arrays.asList("Z", "Z1"),
                elements(new PreOrderIterator<String>(tree, z).getList()));
        assertEquals(Arrays.asList("Z1", "Z"),
                elements(new PostOrderIterator<String>(tree, z).getList()));
    }

    @Test
    void testPreOrderExpandsLazily() {
        LinkedTree<String> tree = sample();
        PreOrderIterator<String> iter = new PreOrderIterator<String>(tree, tree.root());
        assertEquals("R", iter.next().getElement());
        assertEquals("X", iter.next().getElement());
        // Y has not been expanded yet
        tree.addChild(tree.findChildByValue(tree.root(), "Y"), "Y1");
        assertEquals(Arrays.asList("X1", "X2", "Y", "Y1", "Z", "Z1"),
                elements(iter.getList()));
    }

    @Test
    void testReset() {
        LinkedTree<String> tree = sample();
        TreeIterator<String> pre = tree.positions(TraversalOrder.PRE);
        TreeIterator<String> post = tree.positions(TraversalOrder.POST);
        List<Position<String>> firstPre = pre.getList();
        List<Position<String>> firstPost = post.getList();
        pre.reset();
        post.reset();
        assertEquals(firstPre, pre.getList());
        assertEquals(firstPost, post.getList());
    }

    @Test
    void testEmptyWalk() {
        LinkedTree<String> tree = new LinkedTree<String>();
        assertFalse(tree.positions(TraversalOrder.PRE).hasNext());
        assertFalse(tree.positions(TraversalOrder.POST).hasNext());
        TreeIterator<String> iter = tree.positions(TraversalOrder.PRE);
        iter.reset();
        assertFalse(iter.hasNext());
    }

    @Test
    void testRemoveUnsupported() {
        LinkedTree<String> tree = sample();
        TreeIterator<String> iter = tree.positions(TraversalOrder.PRE);
        iter.next();
        assertThrows(UnsupportedOperationException.class, iter::remove);
    }

    @Test
    void testOrderNames() {
        assertEquals(TraversalOrder.PRE, TraversalOrder.fromName("pre"));
        assertEquals(TraversalOrder.POST, TraversalOrder.fromName("post"));
        assertEquals(TraversalOrder.POST, TraversalOrder.fromName("anything"));
        assertEquals(TraversalOrder.POST, TraversalOrder.fromName(null));
        assertEquals("pre", TraversalOrder.PRE.toString());
    }

}
