package categorizer.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Keeps written lines in memory.
*/
public class StringLineSink implements LineSink {

    private final List<String> lines;

    public StringLineSink() {
        lines = new ArrayList<String>();
    }

    public void write(String line) {
        lines.add(line);
    }

    /** Returns the lines written so far, in order */
    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    /** Returns the concatenation of all lines written so far */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80 * lines.size());
        for (String line : lines) {
            sb.append(line);
        }
        return sb.toString();
    }

}
