package works.kite.codec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.kite.codec.io.AbstractKdlReaderTest;
import works.kite.exceptions.KdlEndOfInputException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.kite.codec.KdlReader.END_OF_INPUT;

@ParameterizedClass
@MethodSource("works.kite.codec.io.AbstractKdlReaderTest#readerSuppliers")
class SkipperTest extends AbstractKdlReaderTest {

	/**
	 * @return the character the skipper stops at
	 */
	int skip(String kdl) {
		try (KdlReader reader = readerFor(kdl)) {
			return new Skipper(reader).skipToSignificant();
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"x",
		"   x",
		"\t \u3000\uFEFF\u00A0x",
		"/* comment */x",
		"/* comment */ /* another */ x",
		"/**/x",
		"/* a /* b */ c */x",
		"/* a /* b /* c */ d */ e */x",
		"/* spans\nlines */x",
		"/* * / */x",
		"\\\nx",
		"\\   \n  x",
		"\\ // comment\nx",
		"\\\r\nx",
	})
	void stopsAtSignificant(String kdl) {
		assertEquals('x', skip(kdl));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"\nx",
		"  \nx",
		"// comment\nx",
		"/* comment */ // comment\nx",
		"  // comment /* not a block */\nx",
	})
	void stopsAtNewLine(String kdl) {
		assertEquals('\n', skip(kdl));
	}

	@Test
	void commentBeforeCrlfLeavesLf() {
		try (KdlReader reader = readerFor("// comment\r\nx")) {
			assertEquals('\n', new Skipper(reader).skipToSignificant());
			assertEquals(11, reader.currentOffset());
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		"   ",
		"// comment",
		"/* comment */",
		"\\",
		"\\ trailing",
	})
	void stopsAtEndOfInput(String kdl) {
		assertEquals(END_OF_INPUT, skip(kdl));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"/* unterminated",
		"/* a /* b */ c",
		"/* a /* b */",
		"/*/",
	})
	void unterminatedBlockComment(String kdl) {
		assertThrows(KdlEndOfInputException.class, () -> skip(kdl));
	}

	@Test
	void singleCloserDoesNotEndNestedComment() {
		try (KdlReader reader = readerFor("/* a /* b */ c */ d")) {
			assertEquals('d', new Skipper(reader).skipToSignificant());
		}
		try (KdlReader reader = readerFor("/* a /* b */ c */ d */ e")) {
			// The first two closers balance the two openers; the third is ordinary text
			assertEquals('d', new Skipper(reader).skipToSignificant());
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"/-node",
		"/ x",
		"-x",
		"*/",
	})
	void slashesThatArentComments(String kdl) {
		assertEquals(kdl.codePointAt(0), skip(kdl));
	}

	@Test
	void skipLineConsumingBreak() {
		try (KdlReader reader = readerFor("rest of line\r\nnext")) {
			new Skipper(reader).skipLine(true);
			assertEquals('n', reader.peek());
		}
	}

	@Test
	void skipLineNotConsumingBreak() {
		try (KdlReader reader = readerFor("rest of line\nnext")) {
			new Skipper(reader).skipLine(false);
			assertEquals('\n', reader.peek());
		}
	}

	@Test
	void consumeNewLine() {
		try (KdlReader reader = readerFor("\r\n\nx")) {
			Skipper skipper = new Skipper(reader);
			skipper.consumeNewLine();
			assertEquals('\n', reader.peek());
			skipper.consumeNewLine();
			assertEquals('x', reader.peek());
		}
	}
}
