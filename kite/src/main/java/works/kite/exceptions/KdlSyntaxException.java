package works.kite.exceptions;

/**
 * The input text is not valid KDL.
 * <p>
 * Every syntax problem the parser reports is one of these, whether it was
 * detected by the node grammar or by the lexer underneath it.
 */
public sealed class KdlSyntaxException extends KdlException permits KdlEndOfInputException {
	private final long offset;

	public KdlSyntaxException(String message, long offset) {
		super(message + " (at offset " + offset + ")");
		this.offset = offset;
	}

	/**
	 * @return some notion of where in the input the problem was detected,
	 * usually as reported by {@link works.kite.codec.KdlReader#currentOffset()}.
	 * Malformed UTF-8 is reported by byte offset instead.
	 */
	public long offset() {
		return offset;
	}
}
