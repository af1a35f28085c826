package com.vidnyan.sixer.adapter.out.console;

import com.vidnyan.sixer.application.port.out.SourceOutput;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Writes patched content to standard output. Logs go to standard error, so the output
 * can be redirected to a file as is.
 */
@Component
public class StdoutSourceOutput implements SourceOutput {

    private final PrintStream out;

    public StdoutSourceOutput() {
        this(System.out);
    }

    StdoutSourceOutput(PrintStream out) {
        this.out = out;
    }

    @Override
    public void emit(Path file, String content) {
        out.print(content);
        if (!content.isEmpty() && !content.endsWith("\n")) {
            out.println();
        }
        out.flush();
    }
}
