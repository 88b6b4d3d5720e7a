package works.kite.codec.io;

/**
 * Supplies a series of byte chunks for processing
 * and allows them to be reused when the caller is finished.
 * This is a way for an IO source to produce data for consumption by {@link ByteChunkKdlReader}.
 * <p>
 * In general, the results of calling {@link #nextChunk()} multiple times
 * without recycling the previous chunk are undefined.
 * The implementation may overwrite the chunk previously returned.
 */
public interface ChunkFiller extends AutoCloseable {
	/**
	 * @return the next chunk, or null if the input is exhausted
	 */
	ByteChunk nextChunk();

	void recycleChunk(ByteChunk chunk);

	@Override void close(); // No throws Exception
}
