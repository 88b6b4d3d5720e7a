package works.kite.codec.io;

import java.io.IOException;
import java.io.InputStream;
import works.kite.exceptions.KdlProcessingException;

/**
 * A {@link ChunkFiller} that reads chunks on demand from an {@link InputStream},
 * reusing a single buffer.
 */
public class SynchronousChunkFiller implements ChunkFiller {
	static final int DEFAULT_BUFFER_SIZE = 16_384;

	final InputStream stream;
	final byte[] buffer;

	public SynchronousChunkFiller(InputStream stream) {
		this(stream, DEFAULT_BUFFER_SIZE);
	}

	SynchronousChunkFiller(InputStream stream, int bufferSize) {
		assert bufferSize >= 1: "Buffer size must be positive";
		this.stream = stream;
		buffer = new byte[bufferSize];
	}

	@Override
	public ByteChunk nextChunk() {
		int length;
		do {
			try {
				length = stream.read(buffer, 0, buffer.length);
			} catch (IOException e) {
				throw new KdlProcessingException("Unable to read KDL input", e);
			}
		} while (length == 0);
		if (length == -1) {
			return null;
		}

		return new ByteChunk(buffer, 0, length);
	}

	@Override
	public void recycleChunk(ByteChunk chunk) {
		assert chunk.bytes() == this.buffer;
	}

	@Override
	public void close() {
		try {
			stream.close();
		} catch (IOException e) {
			throw new KdlProcessingException("Unable to close KDL input", e);
		}
	}
}
