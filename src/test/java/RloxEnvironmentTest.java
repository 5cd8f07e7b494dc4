import org.junit.jupiter.api.Test;

import com.rlox.script.parser.Environment;
import com.rlox.script.parser.RuntimeError;
import com.rlox.script.parser.Token;
import com.rlox.script.parser.TokenType;
import com.rlox.script.parser.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RloxEnvironmentTest {

    private static Token name(String lexeme, int line) {
        return new Token(TokenType.IDENTIFIER, lexeme, null, line);
    }

    @Test
    void define_thenGet() {
        Environment env = new Environment();
        env.define("x", Value.number(10));

        assertTrue(env.exists("x"));
        assertEquals(Value.number(10), env.get(name("x", 1)));
        assertEquals(1, env.size());
    }

    @Test
    void define_overwritesSilently() {
        Environment env = new Environment();
        env.define("x", Value.number(1));
        env.define("x", Value.string("two"));

        assertEquals(1, env.size());
        assertEquals("two", env.get(name("x", 1)).asString());
    }

    @Test
    void define_nullValueBindsNil() {
        Environment env = new Environment();
        env.define("x", null);
        assertTrue(env.get(name("x", 1)).isNil());
        assertThrows(IllegalArgumentException.class, () -> env.define(null, Value.nil()));
    }

    @Test
    void get_unboundName_failsWithItsLine() {
        Environment env = new Environment();
        RuntimeError e = assertThrows(RuntimeError.class, () -> env.get(name("nope", 7)));

        assertEquals(RuntimeError.Kind.UNDEFINED_VARIABLE, e.kind());
        assertEquals("Undefined variable 'nope'.", e.getMessage());
        assertEquals(7, e.line());
    }

    @Test
    void get_returnsIndependentCopy() {
        Environment env = new Environment();
        Value stored = Value.number(3);
        env.define("n", stored);

        Value read = env.get(name("n", 1));
        assertEquals(stored, read);
        assertNotSame(stored, read);
        assertSame(Value.nil(), Value.nil().copy());
    }

    @Test
    void initialBindings_areCopiedIn() {
        Map<String, Value> seed = new LinkedHashMap<>();
        seed.put("a", Value.number(1));
        seed.put("b", Value.bool(true));

        Environment env = new Environment(seed);
        seed.put("c", Value.nil());

        assertEquals(2, env.size());
        assertFalse(env.exists("c"));
        assertTrue(env.get(name("b", 1)).asBool());
        assertEquals(0, new Environment(null).size());
    }

    @Test
    void snapshot_isReadOnly_andInDefinitionOrder() {
        Environment env = new Environment();
        env.define("z", Value.number(1));
        env.define("a", Value.number(2));
        env.define("m", Value.number(3));

        Map<String, Value> snap = env.snapshot();
        assertEquals(List.of("z", "a", "m"), List.copyOf(snap.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> snap.put("q", Value.nil()));

        env.define("later", Value.nil());
        assertFalse(snap.containsKey("later"));
    }

    @Test
    void value_accessorsRejectWrongVariant() {
        assertThrows(IllegalStateException.class, () -> Value.nil().asNumber());
        assertThrows(IllegalStateException.class, () -> Value.number(1).asString());
        assertThrows(IllegalStateException.class, () -> Value.string("x").asBool());
        assertThrows(IllegalArgumentException.class, () -> Value.string(null));
    }

    @Test
    void value_displayAndToString() {
        assertEquals("3", Value.number(3).display());
        assertEquals("3.25", Value.number(3.25).display());
        assertEquals("NaN", Value.number(Double.NaN).display());
        assertEquals("-Infinity", Value.number(Double.NEGATIVE_INFINITY).display());
        assertEquals("12345678901", Value.number(12345678901.0).display());
        assertEquals("0.00001", Value.number(0.00001).display());
        assertEquals("-2.5", Value.number(-2.5).display());
        assertEquals("", Value.nil().display());
        assertEquals("nil", Value.nil().toString());
        assertEquals("\"s\"", Value.string("s").toString());
        assertEquals("s", Value.string("s").display());
    }
}
