package works.kite.exceptions;

public sealed abstract class KdlException extends RuntimeException permits
	KdlSyntaxException,
	KdlDepthLimitException,
	KdlProcessingException
{
	protected KdlException(String message) {
		super(message);
	}

	protected KdlException(String message, Throwable cause) {
		super(message, cause);
	}
}
