package works.kite.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import works.kite.exceptions.KdlEndOfInputException;
import works.kite.exceptions.KdlSyntaxException;
import works.kite.model.Value;

import static java.util.Objects.requireNonNull;
import static works.kite.codec.KdlReader.END_OF_INPUT;
import static works.kite.codec.io.CharClasses.describe;
import static works.kite.codec.io.CharClasses.isDigit;
import static works.kite.codec.io.CharClasses.isIdentifierChar;
import static works.kite.codec.io.CharClasses.isSign;

/**
 * Reads the individual tokens of KDL text: identifiers, type hints, and literal values.
 * The node grammar itself lives in {@link KdlParser}.
 * <p>
 * Every method either consumes exactly the token it returns,
 * or throws {@link KdlSyntaxException}.
 * The one exception is {@link #readIdentifier} in {@link IdentifierMode#EQUALS EQUALS} mode,
 * which consumes nothing if the upcoming text can't be an identifier.
 */
final class Lexer {
	private final KdlReader input;

	Lexer(KdlReader input) {
		this.input = requireNonNull(input);
	}

	enum IdentifierMode {
		/**
		 * For node names and type hints: the identifier is mandatory.
		 */
		FREESTANDING,

		/**
		 * For the token that might be a property name.
		 * Stops before an {@code =}, and gives up quietly when the text is not an identifier,
		 * so that the caller can read a value instead.
		 */
		EQUALS,
	}

	/**
	 * @param quoted true if the identifier was written as a string
	 */
	record Identifier(String name, boolean quoted) { }

	/**
	 * @return the type hint, or null if the input does not start with {@code (}
	 */
	String readMaybeTypeHint() {
		if (input.peek() != '(') {
			return null;
		}
		input.discard(1);
		Identifier hint = readIdentifier(IdentifierMode.FREESTANDING);
		int c = input.peek();
		if (c == END_OF_INPUT) {
			throw new KdlEndOfInputException("Unterminated type hint", input.currentOffset());
		} else if (c != ')') {
			throw syntaxError("Expected ')' to close type hint but found " + describe(c));
		}
		input.discard(1);
		return hint.name();
	}

	/**
	 * @return the identifier, or null if {@code mode} is {@link IdentifierMode#EQUALS EQUALS}
	 * and the upcoming text is not an identifier, in which case nothing is consumed.
	 * @throws KdlSyntaxException if {@code mode} is {@link IdentifierMode#FREESTANDING FREESTANDING}
	 * and the upcoming text is not an identifier, or if a quoted identifier is malformed.
	 */
	Identifier readIdentifier(IdentifierMode mode) {
		int c = input.peek();
		if (c == '"') {
			return new Identifier(readEscapedString(), true);
		} else if (rawStringHashes() >= 0) {
			return new Identifier(readRawString(), true);
		}

		int length = bareWordLength();
		String problem = bareIdentifierProblem(length);
		if (problem == null) {
			String name = input.previewString(length);
			input.discard(length);
			return new Identifier(name, false);
		} else if (mode == IdentifierMode.EQUALS) {
			return null;
		} else if (c == END_OF_INPUT) {
			throw new KdlEndOfInputException("Expected identifier but input ended", input.currentOffset());
		} else {
			throw syntaxError(problem);
		}
	}

	/**
	 * Reads a string, number, or keyword.
	 * Any type hint must already have been read by {@link #readMaybeTypeHint}.
	 */
	Value readValue() {
		int c = input.peek();
		if (c == '"') {
			return Value.of(readEscapedString());
		} else if (rawStringHashes() >= 0) {
			return Value.of(readRawString());
		} else if (isDigit(c) || (isSign(c) && isDigit(input.peek(1)))) {
			return readNumber();
		} else if (c == END_OF_INPUT) {
			throw new KdlEndOfInputException("Expected a value but input ended", input.currentOffset());
		}

		int length = bareWordLength();
		String word = input.previewString(length);
		Value result = switch (word) {
			case "true" -> Value.of(true);
			case "false" -> Value.of(false);
			case "null" -> Value.NULL;
			default -> null;
		};
		if (result == null) {
			if (length == 0) {
				throw syntaxError("Expected a value but found " + describe(c));
			} else {
				throw syntaxError("Expected a value but found \"" + word + "\"");
			}
		}
		input.discard(length);
		return result;
	}

	/**
	 * @return the number of upcoming characters that could belong to a bare identifier
	 */
	private int bareWordLength() {
		int length = 0;
		while (isIdentifierChar(input.peek(length))) {
			length++;
		}
		return length;
	}

	/**
	 * @return why the upcoming {@code length} characters are not a bare identifier, or null if they are
	 */
	private String bareIdentifierProblem(int length) {
		int first = input.peek();
		if (length == 0) {
			return "Expected identifier but found " + describe(first);
		} else if (isDigit(first)) {
			return "Identifier cannot start with a digit";
		} else if (isSign(first) && isDigit(input.peek(1))) {
			return "Identifier cannot start with a sign followed by a digit";
		} else if (length <= 5) {
			String word = input.previewString(length);
			if (word.equals("true") || word.equals("false") || word.equals("null")) {
				return "Keyword \"" + word + "\" cannot be used as an identifier";
			}
		}
		return null;
	}

	/**
	 * @return the number of {@code #} characters if the input starts a raw string, or -1 if not
	 */
	private int rawStringHashes() {
		if (input.peek() != 'r') {
			return -1;
		}
		int hashes = 0;
		while (input.peek(1 + hashes) == '#') {
			hashes++;
		}
		return (input.peek(1 + hashes) == '"') ? hashes : -1;
	}

	private String readRawString() {
		int hashes = rawStringHashes();
		assert hashes >= 0;
		input.discard(2 + hashes); // The r, the hashes, and the opening quote
		StringBuilder sb = new StringBuilder();
		while (true) {
			int c = input.peek();
			if (c == END_OF_INPUT) {
				throw new KdlEndOfInputException("Unterminated raw string", input.currentOffset());
			} else if (c == '"' && closesRawString(hashes)) {
				input.discard(1 + hashes);
				return sb.toString();
			}
			sb.appendCodePoint(c);
			input.discard(1);
		}
	}

	private boolean closesRawString(int hashes) {
		for (int i = 1; i <= hashes; i++) {
			if (input.peek(i) != '#') {
				return false;
			}
		}
		return true;
	}

	private String readEscapedString() {
		assert input.peek() == '"';
		input.discard(1);
		StringBuilder sb = new StringBuilder();
		while (true) {
			int c = input.peek();
			input.discard(1);
			switch (c) {
				case END_OF_INPUT -> throw new KdlEndOfInputException("Unterminated string", input.currentOffset());
				case '"' -> {
					return sb.toString();
				}
				case '\\' -> sb.appendCodePoint(readEscape());
				default -> sb.appendCodePoint(c);
			}
		}
	}

	private int readEscape() {
		int esc = input.peek();
		input.discard(1);
		return switch (esc) {
			case 'n' -> '\n';
			case 'r' -> '\r';
			case 't' -> '\t';
			case '\\' -> '\\';
			case '/' -> '/';
			case '"' -> '"';
			case 'b' -> '\b';
			case 'f' -> '\f';
			case 'u' -> readUnicodeEscape();
			case END_OF_INPUT -> throw new KdlEndOfInputException("Unterminated escape sequence", input.currentOffset());
			default -> throw syntaxError("Invalid escape: \\" + Character.toString(esc));
		};
	}

	private int readUnicodeEscape() {
		if (input.peek() != '{') {
			throw syntaxError("Expected '{' after \\u");
		}
		input.discard(1);
		int value = 0;
		int digits = 0;
		int c;
		while ((c = input.peek()) != '}') {
			int digitValue = Character.digit(c, 16);
			if (c == END_OF_INPUT) {
				throw new KdlEndOfInputException("Unterminated Unicode escape", input.currentOffset());
			} else if (digitValue == -1 || c > 0x7F) {
				throw syntaxError("Invalid hex digit in Unicode escape: " + describe(c));
			} else if (++digits > 6) {
				throw syntaxError("Unicode escape has more than 6 hex digits");
			}
			value = (value << 4) | digitValue;
			input.discard(1);
		}
		input.discard(1);
		if (digits == 0) {
			throw syntaxError("Empty Unicode escape");
		} else if (value > Character.MAX_CODE_POINT
			|| (Character.MIN_SURROGATE <= value && value <= Character.MAX_SURROGATE)) {
			throw syntaxError("Unicode escape is not a valid code point: " + Integer.toHexString(value));
		}
		return value;
	}

	private Value readNumber() {
		StringBuilder sb = new StringBuilder();
		int c = input.peek();
		if (isSign(c)) {
			if (c == '-') {
				sb.append('-');
			}
			input.discard(1);
		}

		if (input.peek() == '0') {
			int radix = switch (input.peek(1)) {
				case 'x' -> 16;
				case 'o' -> 8;
				case 'b' -> 2;
				default -> 10;
			};
			if (radix != 10) {
				input.discard(2);
				readDigits(sb, radix);
				return integerValue(new BigInteger(sb.toString(), radix));
			}
		}

		readDigits(sb, 10);
		boolean isInteger = true;
		if (input.peek() == '.' && isDigit(input.peek(1))) {
			isInteger = false;
			input.discard(1);
			sb.append('.');
			readDigits(sb, 10);
		}
		c = input.peek();
		if (c == 'e' || c == 'E') {
			isInteger = false;
			input.discard(1);
			sb.append('E');
			c = input.peek();
			if (isSign(c)) {
				sb.append((char) c);
				input.discard(1);
			}
			readDigits(sb, 10);
		}

		if (isInteger) {
			return integerValue(new BigInteger(sb.toString()));
		} else {
			return Value.of(new BigDecimal(sb.toString()));
		}
	}

	/**
	 * Reads a digit followed by any mix of digits and underscores,
	 * appending the digits to {@code sb}.
	 */
	private void readDigits(StringBuilder sb, int radix) {
		int c = input.peek();
		if (Character.digit(c, radix) == -1 || c > 0x7F) {
			if (c == END_OF_INPUT) {
				throw new KdlEndOfInputException("Expected a digit but input ended", input.currentOffset());
			}
			throw syntaxError("Expected a base-" + radix + " digit but found " + describe(c));
		}
		while (true) {
			c = input.peek();
			if (c == '_') {
				input.discard(1);
			} else if (c <= 0x7F && Character.digit(c, radix) != -1) {
				sb.append((char) c);
				input.discard(1);
			} else {
				return;
			}
		}
	}

	private static Value integerValue(BigInteger n) {
		if (n.bitLength() < 64) {
			return Value.of(n.longValue());
		} else {
			return Value.of(n);
		}
	}

	private KdlSyntaxException syntaxError(String message) {
		return new KdlSyntaxException(message, input.currentOffset());
	}
}
