import org.junit.jupiter.api.Test;

import com.cah.script.parser.Value;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    @Test
    void canonicalRendering() {
        assertEquals("6", Value.number(6).toString());
        assertEquals("1.5", Value.number(1.5).toString());
        assertEquals("0", Value.number(-0.0).toString());
        assertEquals("0.0000001", Value.number(1e-7).toString());
        assertEquals("100000000000000000000", Value.number(1e20).toString());
        assertEquals("NaN", Value.number(Double.NaN).toString());
        assertEquals("-inf", Value.number(Double.NEGATIVE_INFINITY).toString());
        assertEquals("true", Value.bool(true).toString());
        assertEquals("none", Value.none().toString());
        assertEquals("plain", Value.string("plain").toString());
        assertEquals("\"quoted\"", Value.string("quoted").debugString());
    }

    @Test
    void equality_isStructural() {
        assertEquals(Value.number(2), Value.number(2.0));
        assertEquals(Value.string("x"), Value.string(new String("x")));
        assertEquals(Value.none(), Value.none());
        assertNotEquals(Value.number(1), Value.string("1"));
        assertNotEquals(Value.bool(false), Value.none());
        assertEquals(Value.number(0.0).hashCode(), Value.number(-0.0).hashCode());
    }

    @Test
    void nan_isUnequalToTheSameInstance() {
        Value nan = Value.number(Double.NaN);
        assertFalse(nan.equals(nan));
        assertFalse(nan.equals(Value.number(0.0 / 0.0)));
        Value one = Value.number(1);
        assertTrue(one.equals(one));
    }

    @Test
    void truthiness() {
        assertFalse(Value.none().isTruthy());
        assertFalse(Value.bool(false).isTruthy());
        assertTrue(Value.bool(true).isTruthy());
        assertTrue(Value.number(0).isTruthy());
        assertTrue(Value.string("").isTruthy());
    }

    @Test
    void typedAccessors_rejectOtherTypes() {
        assertThrows(IllegalStateException.class, () -> Value.string("1").asNumber());
        assertThrows(IllegalStateException.class, () -> Value.none().asBool());
        assertThrows(NullPointerException.class, () -> Value.string(null));
    }
}
