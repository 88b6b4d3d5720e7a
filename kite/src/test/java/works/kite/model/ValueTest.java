package works.kite.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueTest {

	@Test
	void accessors() {
		assertEquals("s", Value.of("s").asString());
		assertEquals(5L, Value.of(5).asNumber());
		assertEquals(BigInteger.TEN, Value.of(BigInteger.TEN).asNumber());
		assertEquals(new BigDecimal("1.5"), Value.of(new BigDecimal("1.5")).asNumber());
		assertTrue(Value.of(true).asBoolean());
		assertTrue(Value.NULL.isNull());
		assertTrue(Value.of("s").isString());
		assertTrue(Value.of(5).isNumber());
		assertFalse(Value.of("5").isNumber());
	}

	@Test
	void wrongType() {
		assertThrows(IllegalStateException.class, () -> Value.of(1).asString());
		assertThrows(IllegalStateException.class, () -> Value.of("1").asNumber());
		assertThrows(IllegalStateException.class, () -> Value.NULL.asBoolean());
	}

	@Test
	void typeHint() {
		Value hinted = Value.of(8).withTypeHint("u8");
		assertEquals("u8", hinted.typeHint());
		assertEquals(Value.of(8).literal(), hinted.literal());
		assertNotEquals(Value.of(8), hinted);
	}

	@Test
	void string() {
		assertEquals("\"text\"", Value.of("text").toString());
		assertEquals("(u8)8", Value.of(8).withTypeHint("u8").toString());
		assertEquals("null", Value.NULL.toString());
	}
}
