package categorizer.build;

import java.io.IOException;

/**
* Receives the printed lines of a tree traversal. Lines carry their own
* terminator.
*/
public interface LineSink {

    /**
    * Appends one line.
    *
    * @param line the line, including its newline.
    * @throws IOException if the line could not be written.
    */
    void write(String line) throws IOException;

}
