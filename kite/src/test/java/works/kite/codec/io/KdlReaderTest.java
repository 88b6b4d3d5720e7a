package works.kite.codec.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.kite.codec.KdlReader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.kite.codec.KdlReader.END_OF_INPUT;

@ParameterizedClass
@MethodSource("readerSuppliers")
class KdlReaderTest extends AbstractKdlReaderTest {

	@ParameterizedTest
	@ValueSource(strings = {
		"node",
		"héllo wörld",
		"日本語のテキスト",
		"😎 outside the BMP 🚀",
	})
	void readsCodePoints(String text) {
		int[] expected = text.codePoints().toArray();
		try (KdlReader reader = readerFor(text)) {
			for (int i = 0; i < expected.length; i++) {
				assertEquals(i, reader.currentOffset());
				assertEquals(expected[i], reader.peek(), "Code point #" + i);
				reader.discard(1);
			}
			assertEquals(END_OF_INPUT, reader.peek());
		}
	}

	@Test
	void emptyInput() {
		try (KdlReader reader = readerFor("")) {
			assertEquals(END_OF_INPUT, reader.peek());
			assertEquals(END_OF_INPUT, reader.peek(5));
			assertEquals("", reader.previewString(10));
			assertEquals(0, reader.currentOffset());
		}
	}

	@Test
	void peekIsIdempotent() {
		try (KdlReader reader = readerFor("ab")) {
			assertEquals('a', reader.peek());
			assertEquals('a', reader.peek());
			assertEquals('b', reader.peek(1));
			assertEquals('a', reader.peek());
			assertEquals(0, reader.currentOffset());
		}
	}

	@Test
	void farLookahead() {
		String text = "x".repeat(200) + "=";
		try (KdlReader reader = readerFor(text)) {
			assertEquals('=', reader.peek(200));
			assertEquals(END_OF_INPUT, reader.peek(201));
			reader.discard(199);
			assertEquals('x', reader.peek());
			assertEquals('=', reader.peek(1));
			assertEquals(199, reader.currentOffset());
		}
	}

	@Test
	void lookaheadWrapsAroundWindow() {
		// Alternate short discards and long peeks so the lookahead window wraps
		String text = "abcdefghijklmnopqrstuvwxyz".repeat(10);
		try (KdlReader reader = readerFor(text)) {
			for (int i = 0; i < text.length() - 40; i += 7) {
				assertEquals(text.charAt(i + 40), reader.peek(40));
				assertEquals(text.charAt(i), reader.peek());
				reader.discard(7);
			}
		}
	}

	@Test
	void discardPastEnd() {
		try (KdlReader reader = readerFor("abc")) {
			reader.discard(10);
			assertEquals(END_OF_INPUT, reader.peek());
			assertEquals(3, reader.currentOffset());
		}
	}

	@Test
	void negativeArguments() {
		try (KdlReader reader = readerFor("abc")) {
			assertThrows(IllegalArgumentException.class, () -> reader.discard(-1));
			assertThrows(IllegalArgumentException.class, () -> reader.peek(-1));
		}
	}

	@Test
	void isNextDoesNotConsume() {
		try (KdlReader reader = readerFor("/* comment */")) {
			assertTrue(reader.isNext("/*"));
			assertFalse(reader.isNext("//"));
			assertFalse(reader.isNext("/* comment */ and more"));
			assertTrue(reader.isNext("/* comment */"));
			assertEquals(0, reader.currentOffset());
		}
	}

	@Test
	void isNextWithSupplementaryCharacters() {
		try (KdlReader reader = readerFor("😎x")) {
			assertTrue(reader.isNext("😎"));
			assertTrue(reader.isNext("😎x"));
			assertEquals('x', reader.peek(1));
		}
	}

	@Test
	void previewString() {
		try (KdlReader reader = readerFor("node 1 2 3")) {
			reader.discard(5);
			assertEquals("1 2", reader.previewString(3));
			assertEquals("1 2 3", reader.previewString(100));
		}
	}
}
