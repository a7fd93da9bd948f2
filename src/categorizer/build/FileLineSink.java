package categorizer.build;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
* Writes lines to a file in UTF-8. The file is truncated when the sink is
* opened.
*/
public class FileLineSink implements LineSink, Closeable {

    private final Writer out;

    /**
    * Opens <var>file</var> for writing, replacing any previous content.
    *
    * @param file the target file.
    * @throws IOException if the file could not be opened.
    */
    public FileLineSink(File file) throws IOException {
        // default buffer size 8192 (characters).
        this.out = new BufferedWriter(new OutputStreamWriter(
                new FileOutputStream(file), StandardCharsets.UTF_8));
    }

    public void write(String line) throws IOException {
        out.write(line);
    }

    public void close() throws IOException {
        out.close();
    }

}
