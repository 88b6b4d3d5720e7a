package works.kite.codec;

import java.io.InputStream;
import works.kite.codec.io.ByteArrayChunkFiller;
import works.kite.codec.io.ByteChunkKdlReader;
import works.kite.codec.io.CharArrayKdlReader;
import works.kite.codec.io.SynchronousChunkFiller;

/**
 * A cursor over decoded KDL text.
 * <p>
 * Everything here works in terms of Unicode code points, not {@code char}s:
 * offsets passed to {@link #peek(int)} and counts passed to {@link #discard(int)}
 * count code points, and so does {@link #currentOffset()}.
 * <p>
 * Lookahead is unlimited: {@link #peek(int)} may look arbitrarily far ahead
 * without consuming anything, which is what lets the parser try to read
 * an identifier and quietly fall back to reading a value instead.
 * The readers are not thread-safe; a reader belongs to one parse at a time.
 */
public sealed interface KdlReader extends AutoCloseable permits ByteChunkKdlReader, CharArrayKdlReader {
	/**
	 * Returned by {@link #peek} when there are no more characters.
	 */
	int END_OF_INPUT = -1;

	@Override void close(); // No throws Exception

	/**
	 * @return a new KdlReader that reads UTF-8 text from the given stream.
	 * The stream will be closed when the reader is closed.
	 */
	static KdlReader create(InputStream stream) {
		return new ByteChunkKdlReader(new SynchronousChunkFiller(stream));
	}

	/**
	 * @return a new KdlReader that reads from the given UTF-8 byte array that contains a complete document.
	 */
	static KdlReader create(byte[] utf8Bytes) {
		return new ByteChunkKdlReader(new ByteArrayChunkFiller(utf8Bytes));
	}

	/**
	 * @return a new KdlReader that reads from the given UTF-16 char array that contains a complete document.
	 */
	static KdlReader create(char[] utf16Chars) {
		return new CharArrayKdlReader(utf16Chars);
	}

	static KdlReader create(String string) {
		return CharArrayKdlReader.forString(string);
	}

	/**
	 * @return the next code point, or {@link #END_OF_INPUT}
	 */
	default int peek() {
		return peek(0);
	}

	/**
	 * @param offset how many code points past the current position to look; zero means the next one
	 * @return the code point at the given offset, or {@link #END_OF_INPUT} if the input ends first
	 */
	int peek(int offset);

	/**
	 * Consumes {@code n} code points, or fewer if the input ends first.
	 *
	 * @throws IllegalArgumentException if {@code n} is negative
	 */
	void discard(int n);

	/**
	 * Checks whether the upcoming input starts with the given literal,
	 * consuming nothing either way.
	 */
	default boolean isNext(CharSequence literal) {
		int offset = 0;
		for (int i = 0; i < literal.length(); ) {
			int expected = Character.codePointAt(literal, i);
			if (peek(offset) != expected) {
				return false;
			}
			offset++;
			i += Character.charCount(expected);
		}
		return true;
	}

	/**
	 * On a best-effort basis, return the upcoming characters in the input.
	 */
	default String previewString(int requestedLength) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < requestedLength; i++) {
			int c = peek(i);
			if (c == END_OF_INPUT) {
				break;
			}
			sb.appendCodePoint(c);
		}
		return sb.toString();
	}

	/**
	 * @return the number of code points consumed so far. Useful for diagnostics.
	 */
	long currentOffset();
}
