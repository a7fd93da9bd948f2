package categorizer.build;

import categorizer.tree.LinkedTree;
import categorizer.tree.Position;
import categorizer.tree.PrintTools;
import categorizer.tree.TraversalOrder;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
* Builds a category tree from lines of comma-separated labels and prints it
* in pre-order and post-order.
*
* <p>The first line read into an empty tree becomes the root as a whole; it
* is trimmed but not split. Every later line is split into labels, and each
* label is looked up under the cursor and added there when missing. How the
* cursor moves is decided by the {@link CursorPolicy}.
*/
public class ProductCategorizer {

    /** Default name of the pre-order output file */
    public static final String PRE_FILE = "pre.txt";

    /** Default name of the post-order output file */
    public static final String POST_FILE = "post.txt";

    private final CursorPolicy policy;

    private LinkedTree<String> tree;

    /** Parent of the next label to place */
    private Position<String> cursor;

    private int line_count;

    /**
    * Creates a categorizer with the {@link CursorPolicy#REFERENCE} policy.
    */
    public ProductCategorizer() {
        this(CursorPolicy.REFERENCE);
    }

    public ProductCategorizer(CursorPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy");
        }
        this.policy = policy;
        this.tree = new LinkedTree<String>();
        this.cursor = null;
        this.line_count = 0;
    }

    /** Returns the tree built by the last fill, empty before any fill */
    public LinkedTree<String> getTree() {
        return tree;
    }

    /**
    * Builds a new tree from the given lines, replacing the current one.
    *
    * @param lines the input lines, without terminators.
    * @return the new tree.
    */
    public LinkedTree<String> fillTree(Iterable<String> lines) {
        clear();
        for (String line : lines) {
            addLine(line);
        }
        PrintTools.printlnStatus(1, "[ProductCategorizer]", line_count,
                "lines,", tree.size(), "nodes");
        return tree;
    }

    /**
    * Builds a new tree from the lines of <var>input</var>, replacing the
    * current one. The file is decoded as UTF-8 and closed whether or not
    * reading succeeds.
    *
    * @param input the category file.
    * @return the new tree.
    * @throws IOException if the file is missing or cannot be read.
    */
    public LinkedTree<String> fillTree(File input) throws IOException {
        PrintTools.printlnStatus("Reading " + input + "...", 1);
        clear();
        BufferedReader br = new BufferedReader(new InputStreamReader(
                new FileInputStream(input), StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = br.readLine()) != null) {
                addLine(line);
            }
        } finally {
            br.close();
        }
        PrintTools.printlnStatus(1, "[ProductCategorizer]", line_count,
                "lines,", tree.size(), "nodes");
        return tree;
    }

    private void clear() {
        tree = new LinkedTree<String>();
        cursor = null;
        line_count = 0;
    }

    /**
    * Places one line into the tree.
    *
    * @param line the input line, without its terminator.
    */
    public void addLine(String line) {
        line_count++;
        PrintTools.printlnStatus(2, "[ProductCategorizer] line", line_count,
                ":", line);
        if (tree.isEmpty()) {
            cursor = tree.addRoot(line.trim());
            PrintTools.printlnStatus(3, "[ProductCategorizer] root",
                    cursor.getElement());
            return;
        }
        Position<String> root = tree.root();
        if (policy.resetsPerLine()) {
            cursor = root;
        }
        boolean first = true;
        for (String label : CategoryPath.split(line)) {
            boolean at_root_label = root.getElement().equals(label) &&
                    (first || !policy.resetsPerLine());
            first = false;
            if (at_root_label) {
                cursor = root;
                continue;
            }
            Position<String> child = tree.findChildByValue(cursor, label);
            if (child != null) {
                cursor = child;
            } else {
                Position<String> created = tree.addChild(cursor, label);
                PrintTools.printlnStatus(3, "[ProductCategorizer] added",
                        label, "under", cursor.getElement());
                if (policy.advancesOnCreate()) {
                    cursor = created;
                }
            }
        }
    }

    /**
    * Writes the pre-order lines of the tree to <var>pre</var> and the
    * post-order lines to <var>post</var>. Nothing is written for an empty
    * tree.
    *
    * @throws IOException if a sink fails.
    */
    public void printTree(LineSink pre, LineSink post) throws IOException {
        print(TraversalOrder.PRE, pre);
        print(TraversalOrder.POST, post);
    }

    /**
    * Writes the lines of the tree in the given order to <var>sink</var>.
    *
    * @throws IOException if the sink fails.
    */
    public void print(TraversalOrder order, LineSink sink) throws IOException {
        for (String line : tree.allNodes(order)) {
            sink.write(line);
        }
    }

    /**
    * Writes {@value #PRE_FILE} and {@value #POST_FILE} into <var>outdir</var>.
    */
    public void printTree(File outdir) throws IOException {
        printTree(new File(outdir, PRE_FILE), new File(outdir, POST_FILE));
    }

    /**
    * Writes the pre-order and post-order lines to the given files, replacing
    * their content.
    *
    * @throws IOException if a file cannot be written.
    */
    public void printTree(File pre_file, File post_file) throws IOException {
        PrintTools.printlnStatus("Printing " + pre_file + "...", 1);
        writeFile(TraversalOrder.PRE, pre_file);
        PrintTools.printlnStatus("Printing " + post_file + "...", 1);
        writeFile(TraversalOrder.POST, post_file);
    }

    private void writeFile(TraversalOrder order, File file) throws IOException {
        FileLineSink sink = new FileLineSink(file);
        try {
            print(order, sink);
        } finally {
            sink.close();
        }
    }

}
