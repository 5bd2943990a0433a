package com.cah.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

import com.cah.debug.Debug;

/**
 * Line-at-a-time read-eval-print loop. Every line runs against the same
 * engine, so declarations from earlier lines stay visible. Errors are
 * reported and the loop keeps prompting; EOF ends it.
 */
public final class CahRepl {
    static final String PROMPT = "> ";

    private final CahScript engine;
    private final BufferedReader in;
    private final PrintStream out;

    public CahRepl(CahScript engine, BufferedReader in, PrintStream out, PrintStream err) {
        this.engine = engine;
        this.in = in;
        this.out = out;
        engine.setOutputWriter(out::println);
        engine.setDiagnosticReporter((line, message) -> err.println("[line " + line + "] " + message));
    }

    /** Returns the number of lines evaluated. */
    public int run() throws IOException {
        int count = 0;
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) break;
            if (line.trim().isEmpty()) continue;
            engine.run(line);
            count++;
        }
        out.println();
        Debug.get().d(Debug.REPL, "session ended after " + count + " line(s)");
        return count;
    }
}
