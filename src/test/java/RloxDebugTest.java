import com.rlox.debug.Debug;
import com.rlox.debug.DebugLevel;

import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RloxDebugTest {

    // A private loader re-runs Debug's static initialization, whatever other tests did to the shared hub.
    private static URLClassLoader isolatedLoader() {
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        return new URLClassLoader(new URL[]{classes}, null);
    }

    @Test
    void freshHub_hasNoopSink_beforeAnyoneInstallsOne() throws Exception {
        try (URLClassLoader loader = isolatedLoader()) {
            Class<?> hub = Class.forName("com.rlox.debug.Debug", true, loader);
            assertNotSame(Debug.class, hub);

            Object debug = hub.getMethod("get").invoke(null);
            assertNotNull(hub.getMethod("getSink").invoke(debug));
            assertDoesNotThrow(() -> hub.getMethod("w", String.class, String.class).invoke(debug, "test", "no sink"));
        }
    }

    @Test
    void freshEngine_runsWithoutInstallingASink() throws Exception {
        try (URLClassLoader loader = isolatedLoader()) {
            Class<?> engine = Class.forName("com.rlox.script.RloxScript", true, loader);
            Object rs = engine.getConstructor().newInstance();

            Object result = assertDoesNotThrow(() -> engine.getMethod("run", String.class).invoke(rs, "var x = 10000000;"));
            assertEquals(Boolean.TRUE, result.getClass().getMethod("ok").invoke(result));
        }
    }

    @Test
    void setSink_nullRestoresNoop() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(message));
        Debug.get().i("t", "one");

        Debug.get().setSink(null);
        Debug.get().i("t", "two");

        assertEquals(List.of("one"), seen);
        assertNotNull(Debug.get().getSink());
    }

    @Test
    void levels_areOrderedLowestFirst() {
        assertTrue(DebugLevel.ERROR.atLeast(DebugLevel.WARN));
        assertTrue(DebugLevel.WARN.atLeast(DebugLevel.WARN));
        assertFalse(DebugLevel.DEBUG.atLeast(DebugLevel.INFO));
    }
}
