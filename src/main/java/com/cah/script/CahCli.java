package com.cah.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cah.debug.Debug;
import com.cah.debug.DebugLevel;
import com.cah.debug.StreamDebugSink;
import com.cah.script.parser.AstJsonWriter;
import com.cah.script.parser.AstPrinter;

/**
 * Command line entry point.
 *
 * Usage:
 *   cahscript [--tokens] [--ast] [--ast-json] [--verbose] [script-file]
 *
 * With a script file the whole file is run once (file mode); without one an
 * interactive prompt is started.
 */
public final class CahCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_DIAGNOSTICS = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_READ_FAILED = 3;

    private static final String USAGE =
            "Usage: cahscript [--tokens] [--ast] [--ast-json] [--verbose] [script-file]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        Map<String, String> flags = new LinkedHashMap<>();
        List<String> positional = new ArrayList<>();
        if (!parseArgs(args, flags, positional) || positional.size() > 1) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (flags.containsKey("verbose")) {
            Debug.get().setLevel(DebugLevel.DEBUG);
            Debug.get().setSink(new StreamDebugSink(err, DebugLevel.DEBUG));
        }

        CahScript engine = new CahScript();

        if (positional.isEmpty()) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            try {
                new CahRepl(engine, reader, out, err).run();
                return EXIT_OK;
            } catch (IOException e) {
                err.println("Failed to read input: " + e.getMessage());
                return EXIT_READ_FAILED;
            }
        }

        final Path scriptPath = Path.of(positional.get(0));
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            Debug.get().e(Debug.CLI, "read failed: " + scriptPath, e);
            return EXIT_READ_FAILED;
        }

        return runFile(engine, script, flags, out, err);
    }

    static int runFile(CahScript engine, String script, Map<String, String> flags, PrintStream out, PrintStream err) {
        // dumps stay quiet; the run below reports each problem once
        engine.setDiagnosticReporter(null);
        if (flags.containsKey("tokens")) {
            out.println(AstJsonWriter.pretty(AstJsonWriter.tokensToJson(engine.scan(script))));
        }
        if (flags.containsKey("ast")) {
            out.println(AstPrinter.print(engine.parse(script)));
        }
        if (flags.containsKey("ast-json")) {
            out.println(AstJsonWriter.pretty(AstJsonWriter.toJson(engine.parse(script))));
        }

        engine.setOutputWriter(out::println);
        engine.setDiagnosticReporter((line, message) -> err.println("[line " + line + "] " + message));
        RunResult result = engine.run(script);
        return result.hasErrors() ? EXIT_DIAGNOSTICS : EXIT_OK;
    }

    /** Accepts {@code --name} switches and bare positionals; false on an unknown switch. */
    static boolean parseArgs(String[] args, Map<String, String> flags, List<String> positional) {
        for (String a : args) {
            if (a.startsWith("--")) {
                String name = a.substring(2);
                switch (name) {
                    case "tokens":
                    case "ast":
                    case "ast-json":
                    case "verbose":
                        flags.put(name, "true");
                        break;
                    default:
                        return false;
                }
            } else {
                positional.add(a);
            }
        }
        return true;
    }

    private CahCli() {}
}
