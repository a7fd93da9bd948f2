package categorizer.build;

import java.util.ArrayList;
import java.util.List;

/**
* Splits an input line into the labels of a category path.
*/
public final class CategoryPath {

    /** Separator between the labels of a path */
    public static final char SEPARATOR = ',';

    private CategoryPath() {
    }

    /**
    * Splits <var>line</var> on commas and trims every label. Empty labels,
    * including trailing ones, are kept.
    *
    * @param line the input line, without its terminator.
    * @return the labels in order; never empty.
    */
    public static List<String> split(String line) {
        List<String> labels = new ArrayList<String>();
        int start = 0;
        int comma;
        while ((comma = line.indexOf(SEPARATOR, start)) != -1) {
            labels.add(line.substring(start, comma).trim());
            start = comma + 1;
        }
        labels.add(line.substring(start).trim());
        return labels;
    }

}
