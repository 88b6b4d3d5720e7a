package works.kite.codec.io;

import works.kite.codec.KdlReader;

/**
 * A {@link KdlReader} that reads from a char array.
 * Useful for KDL text small enough to have been
 * fully loaded into memory already, like when reading from a String.
 * <p>
 * The text is decoded into code points up front,
 * so lookahead of any distance is just an array index.
 */
public final class CharArrayKdlReader implements KdlReader {
	final int[] codePoints;
	int pos = 0;

	public CharArrayKdlReader(char[] chars) {
		this.codePoints = new String(chars).codePoints().toArray();
	}

	public static CharArrayKdlReader forString(String s) {
		return new CharArrayKdlReader(s.toCharArray());
	}

	@Override
	public int peek(int offset) {
		if (offset < 0) {
			throw new IllegalArgumentException("Can't peek at a negative offset: " + offset);
		}
		int index = pos + offset;
		if (index >= codePoints.length) {
			return END_OF_INPUT;
		} else {
			return codePoints[index];
		}
	}

	@Override
	public void discard(int n) {
		if (n < 0) {
			throw new IllegalArgumentException("Can't discard a negative number of characters: " + n);
		}
		pos = (int) Math.min((long) pos + n, codePoints.length);
	}

	@Override
	public String previewString(int requestedLength) {
		int actualLength = Math.max(0, Math.min(requestedLength, codePoints.length - pos));
		return new String(codePoints, pos, actualLength);
	}

	@Override
	public long currentOffset() {
		return pos;
	}

	@Override
	public void close() {

	}
}
