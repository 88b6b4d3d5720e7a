package works.kite.exceptions;

/**
 * An unexpected error has occurred while reading KDL text,
 * usually a failure of the underlying input stream.
 * <p>
 * This does not indicate a problem with the input text itself.
 */
public final class KdlProcessingException extends KdlException {
	public KdlProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
