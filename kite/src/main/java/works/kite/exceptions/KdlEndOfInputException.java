package works.kite.exceptions;

/**
 * The input ended somewhere it isn't allowed to,
 * like inside a children block, a comment, or a string.
 */
public final class KdlEndOfInputException extends KdlSyntaxException {
	public KdlEndOfInputException(String message, long offset) {
		super(message, offset);
	}
}
