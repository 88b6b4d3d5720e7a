package works.kite.exceptions;

/**
 * Children blocks are nested more deeply than the parser is configured to allow.
 *
 * @see works.kite.codec.KdlParser.Settings#maxDepth()
 */
public final class KdlDepthLimitException extends KdlException {
	public KdlDepthLimitException(String message) {
		super(message);
	}
}
