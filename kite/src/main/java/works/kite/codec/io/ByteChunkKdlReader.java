package works.kite.codec.io;

import works.kite.codec.KdlReader;
import works.kite.exceptions.KdlEndOfInputException;
import works.kite.exceptions.KdlSyntaxException;

/**
 * {@link KdlReader} that decodes UTF-8 bytes supplied by a {@link ChunkFiller}.
 * Can process KDL text of arbitrary size.
 * <p>
 * Decoded code points are held in a lookahead window until they are discarded,
 * so {@link #peek(int)} works across chunk boundaries.
 * The window grows to accommodate the furthest lookahead requested,
 * which in practice is the length of the longest identifier in the input.
 * <p>
 * Calling {@link #close()} will close the underlying filler.
 */
public final class ByteChunkKdlReader implements KdlReader {
	private static final int INITIAL_WINDOW_SIZE = 32;

	private final ChunkFiller filler;
	private ByteChunk currentChunk;

	/**
	 * The current index within the current chunk.
	 * If equal to currentChunk.stop(), then the next byte
	 * to be read is in the next chunk (which may not exist).
	 */
	private int currentChunkPos;

	private boolean fillerExhausted = false;

	/**
	 * Ring buffer of decoded code points that have been peeked but not discarded.
	 * The capacity is always a power of two.
	 */
	private int[] window = new int[INITIAL_WINDOW_SIZE];
	private int windowHead = 0;
	private int windowSize = 0;

	private long discarded = 0;

	/**
	 * Number of bytes decoded so far, for error messages about malformed UTF-8.
	 */
	private long bytesDecoded = 0;

	public ByteChunkKdlReader(ChunkFiller chunkFiller) {
		this.filler = chunkFiller;
	}

	@Override
	public int peek(int offset) {
		if (offset < 0) {
			throw new IllegalArgumentException("Can't peek at a negative offset: " + offset);
		}
		while (windowSize <= offset) {
			int codePoint = decodeNext();
			if (codePoint == END_OF_INPUT) {
				return END_OF_INPUT;
			}
			append(codePoint);
		}
		return window[(windowHead + offset) & (window.length - 1)];
	}

	@Override
	public void discard(int n) {
		if (n < 0) {
			throw new IllegalArgumentException("Can't discard a negative number of characters: " + n);
		}
		if (n > windowSize) {
			// Make sure the window holds everything we're about to drop
			if (peek(n - 1) == END_OF_INPUT) {
				n = windowSize;
			}
		}
		windowHead = (windowHead + n) & (window.length - 1);
		windowSize -= n;
		discarded += n;
	}

	@Override
	public long currentOffset() {
		return discarded;
	}

	@Override
	public void close() {
		filler.close();
	}

	private void append(int codePoint) {
		if (windowSize == window.length) {
			int[] bigger = new int[window.length * 2];
			for (int i = 0; i < windowSize; i++) {
				bigger[i] = window[(windowHead + i) & (window.length - 1)];
			}
			window = bigger;
			windowHead = 0;
		}
		window[(windowHead + windowSize) & (window.length - 1)] = codePoint;
		windowSize++;
	}

	/**
	 * @return the next raw byte as an unsigned value, or -1 at the end of the input
	 */
	private int nextByte() {
		while (currentChunk == null || currentChunkPos >= currentChunk.stop()) {
			if (!nextChunk()) {
				return -1;
			}
		}
		bytesDecoded++;
		return currentChunk.bytes()[currentChunkPos++] & 0xFF;
	}

	private boolean nextChunk() {
		if (fillerExhausted) {
			return false;
		}
		if (currentChunk != null) {
			filler.recycleChunk(currentChunk);
		}
		currentChunk = filler.nextChunk();
		if (currentChunk == null) {
			fillerExhausted = true;
			return false;
		} else {
			currentChunkPos = currentChunk.start();
			return true;
		}
	}

	private int decodeNext() {
		int firstByte = nextByte();
		if (firstByte == -1) {
			return END_OF_INPUT;
		} else if ((firstByte & 0x80) == 0) {
			// ASCII fast path
			return firstByte;
		} else {
			return decodeUtf8Char(firstByte);
		}
	}

	private int decodeUtf8Char(int firstByte) {
		// The first byte tells us how long a sequence we're dealing with
		int codePoint;
		int sequenceLength;
		int minimum;
		if ((firstByte & 0xE0) == 0xC0) {
			sequenceLength = 2;
			codePoint = firstByte & 0x1F;
			minimum = 0x80;
		} else if ((firstByte & 0xF0) == 0xE0) {
			sequenceLength = 3;
			codePoint = firstByte & 0x0F;
			minimum = 0x800;
		} else if ((firstByte & 0xF8) == 0xF0) {
			sequenceLength = 4;
			codePoint = firstByte & 0x07;
			minimum = 0x10000;
		} else {
			throw new KdlSyntaxException("Invalid UTF-8 start byte 0x" + Integer.toHexString(firstByte), bytesDecoded);
		}

		for (int i = 1; i < sequenceLength; i++) {
			int bx = nextByte();
			if (bx == -1) {
				throw new KdlEndOfInputException("Unexpected end of input in the middle of a UTF-8 sequence", bytesDecoded);
			} else if ((bx & 0xC0) != 0x80) {
				throw new KdlSyntaxException("Invalid UTF-8 continuation byte 0x" + Integer.toHexString(bx), bytesDecoded);
			}
			codePoint = (codePoint << 6) | (bx & 0x3F);
		}
		if (codePoint < minimum || codePoint > Character.MAX_CODE_POINT
			|| (Character.MIN_SURROGATE <= codePoint && codePoint <= Character.MAX_SURROGATE)) {
			throw new KdlSyntaxException("Invalid UTF-8 encoding of U+" + Integer.toHexString(codePoint), bytesDecoded);
		}
		return codePoint;
	}
}
