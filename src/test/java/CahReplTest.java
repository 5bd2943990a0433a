import org.junit.jupiter.api.Test;

import com.cah.script.CahRepl;
import com.cah.script.CahScript;
import com.cah.script.parser.Value;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class CahReplTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int session(CahScript engine, String input) throws Exception {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return new CahRepl(engine, new BufferedReader(new StringReader(input)), out, err).run();
    }

    @Test
    void declarationsPersistAcrossLines() throws Exception {
        CahScript engine = new CahScript();
        int lines = session(engine, "offering x = 2\n$< x * 21\n");

        assertEquals(2, lines);
        assertTrue(outBytes.toString(StandardCharsets.UTF_8).contains("42"));
        assertEquals(Value.number(2), engine.globals().snapshot().get("x"));
    }

    @Test
    void errorsAreReported_andLoopContinues() throws Exception {
        int lines = session(new CahScript(), "$< missing\n\n   \n$< \"still here\"\n");

        assertEquals(2, lines);
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("[line 1] Undefined variable 'missing'."));
        assertTrue(outBytes.toString(StandardCharsets.UTF_8).contains("still here"));
    }

    @Test
    void emptyInput_endsImmediately() throws Exception {
        assertEquals(0, session(new CahScript(), ""));
        assertTrue(outBytes.toString(StandardCharsets.UTF_8).startsWith("> "));
    }
}
