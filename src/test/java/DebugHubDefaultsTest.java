import org.junit.jupiter.api.Test;

import com.cah.debug.Debug;
import com.cah.debug.DebugLevel;
import com.cah.script.CahScript;
import com.cah.script.RunResult;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against the hub exactly as class loading leaves it; nothing here
 * installs a sink or calls reset(). Surefire gives each test class its own JVM.
 */
public class DebugHubDefaultsTest {

    @Test
    void freshHub_discardsEverything() {
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().enabled(DebugLevel.TRACE));
        assertFalse(Debug.get().enabled(DebugLevel.ERROR));
        assertEquals(DebugLevel.TRACE, Debug.get().getLevel());
        assertDoesNotThrow(() -> Debug.get().w(Debug.ENGINE, "nobody listens"));
    }

    @Test
    void freshHub_engineRunsWithoutSink() {
        RunResult r = assertDoesNotThrow(() -> new CahScript().run("$< 1\n$< nope"));
        assertEquals(List.of("1"), r.output());
        assertEquals(1, r.diagnostics().size());
    }
}
