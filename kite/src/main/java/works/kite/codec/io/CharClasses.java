package works.kite.codec.io;

import static works.kite.codec.KdlReader.END_OF_INPUT;

/**
 * Character classification for KDL text.
 * All methods accept {@link works.kite.codec.KdlReader#END_OF_INPUT END_OF_INPUT},
 * which belongs to no class except {@link #isValueTerminator value terminators}.
 */
public final class CharClasses {
	private CharClasses() {}

	/**
	 * Unicode space characters that separate tokens within a line.
	 * Newlines are not whitespace; see {@link #isNewLine}.
	 */
	public static boolean isWhitespace(int codePoint) {
		return switch (codePoint) {
			case 0x0009, 0x0020, 0x00A0, 0x1680,
				 0x202F, 0x205F, 0x3000,
				 0xFEFF -> true;
			default -> 0x2000 <= codePoint && codePoint <= 0x200A;
		};
	}

	/**
	 * Note that CRLF is two newline characters here;
	 * callers that care must check for it first.
	 */
	public static boolean isNewLine(int codePoint) {
		return switch (codePoint) {
			case '\r', '\n', 0x0085, 0x000C, 0x2028, 0x2029 -> true;
			default -> false;
		};
	}

	/**
	 * Characters that may appear anywhere in a bare identifier.
	 */
	public static boolean isIdentifierChar(int codePoint) {
		if (codePoint <= 0x20 || codePoint > Character.MAX_CODE_POINT) {
			return false;
		}
		return switch (codePoint) {
			case '\\', '/', '(', ')', '{', '}', '<', '>', ';', '[', ']', '=', ',', '"' -> false;
			default -> !isWhitespace(codePoint) && !isNewLine(codePoint);
		};
	}

	/**
	 * Characters that may legally follow a complete value or string argument.
	 */
	public static boolean isValueTerminator(int codePoint) {
		return switch (codePoint) {
			case END_OF_INPUT, ';', '{', '}', '/', '\\' -> true;
			default -> isWhitespace(codePoint) || isNewLine(codePoint);
		};
	}

	public static boolean isDigit(int codePoint) {
		return '0' <= codePoint && codePoint <= '9';
	}

	public static boolean isSign(int codePoint) {
		return codePoint == '+' || codePoint == '-';
	}

	/**
	 * Renders a code point for an error message.
	 */
	public static String describe(int codePoint) {
		if (codePoint == END_OF_INPUT) {
			return "end of input";
		} else if (codePoint < 0x20 || isWhitespace(codePoint) || isNewLine(codePoint)) {
			return String.format("U+%04X", codePoint);
		} else {
			return "'" + Character.toString(codePoint) + "'";
		}
	}
}
