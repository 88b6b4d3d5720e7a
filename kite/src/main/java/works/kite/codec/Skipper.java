package works.kite.codec;

import works.kite.exceptions.KdlEndOfInputException;

import static java.util.Objects.requireNonNull;
import static works.kite.codec.KdlReader.END_OF_INPUT;
import static works.kite.codec.io.CharClasses.isNewLine;
import static works.kite.codec.io.CharClasses.isWhitespace;

/**
 * Skips the parts of KDL text that carry no meaning:
 * whitespace, line continuations, and comments.
 * <p>
 * Newlines are significant in KDL because they terminate nodes,
 * so {@link #skipToSignificant()} never consumes one.
 * (Line continuations are the exception: they swallow their own line break.)
 */
final class Skipper {
	private static final String CRLF = "\r\n";
	private static final String LINE_COMMENT = "//";
	private static final String BLOCK_COMMENT_START = "/*";
	private static final String BLOCK_COMMENT_END = "*/";

	private final KdlReader input;

	Skipper(KdlReader input) {
		this.input = requireNonNull(input);
	}

	/**
	 * Advances past insignificant content.
	 *
	 * @return the next character, which is not consumed;
	 * either a newline, {@link KdlReader#END_OF_INPUT END_OF_INPUT}, or something significant
	 * @throws KdlEndOfInputException if the input ends inside a block comment
	 */
	int skipToSignificant() {
		while (true) {
			int c = input.peek();
			if (isWhitespace(c)) {
				input.discard(1);
			} else if (c == '\\') {
				// Line continuation: the next line carries on this one
				input.discard(1);
				skipLine(true);
			} else if (input.isNext(LINE_COMMENT)) {
				input.discard(2);
				skipLine(false);
				return input.peek();
			} else if (input.isNext(BLOCK_COMMENT_START)) {
				input.discard(2);
				skipBlockComment();
			} else {
				return c;
			}
		}
	}

	/**
	 * Discards characters up to the next line break.
	 * A CRLF counts as a single break.
	 * Stops quietly at the end of the input.
	 *
	 * @param consumeBreak if true, the break itself is consumed too.
	 *                     If false, the reader is left just before a single newline character
	 *                     (the LF, in the case of CRLF).
	 */
	void skipLine(boolean consumeBreak) {
		while (true) {
			if (input.isNext(CRLF)) {
				input.discard(consumeBreak ? 2 : 1);
				return;
			}
			int c = input.peek();
			if (c == END_OF_INPUT) {
				return;
			} else if (isNewLine(c)) {
				if (consumeBreak) {
					input.discard(1);
				}
				return;
			}
			input.discard(1);
		}
	}

	/**
	 * Consumes one line break, treating CRLF as one.
	 */
	void consumeNewLine() {
		assert isNewLine(input.peek());
		input.discard(input.isNext(CRLF) ? 2 : 1);
	}

	/**
	 * Block comments nest, so we count opening and closing markers
	 * rather than just searching for the first closing one.
	 * The opening marker has already been consumed.
	 */
	private void skipBlockComment() {
		int depth = 1;
		while (depth > 0) {
			if (input.isNext(BLOCK_COMMENT_START)) {
				input.discard(2);
				depth++;
			} else if (input.isNext(BLOCK_COMMENT_END)) {
				input.discard(2);
				depth--;
			} else if (input.peek() == END_OF_INPUT) {
				throw new KdlEndOfInputException("Unterminated block comment", input.currentOffset());
			} else {
				input.discard(1);
			}
		}
	}
}
