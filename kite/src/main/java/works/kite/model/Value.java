package works.kite.model;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A literal appearing as a {@link Node} argument or property value.
 * <p>
 * The {@code literal} is one of:
 * <ul>
 *     <li>{@link String};</li>
 *     <li>{@link Long} for integers that fit, or {@link BigInteger} for those that don't;</li>
 *     <li>{@link BigDecimal} for numbers written with a fraction or exponent;</li>
 *     <li>{@link Boolean}; or</li>
 *     <li>{@code null}, for the {@code null} keyword.</li>
 * </ul>
 *
 * @param typeHint the annotation written in parentheses before the value, or null if there was none
 */
public record Value(Object literal, String typeHint) {
	public static final Value NULL = new Value(null, null);

	public Value {
		assert literal == null
			|| literal instanceof String
			|| literal instanceof Long
			|| literal instanceof BigInteger
			|| literal instanceof BigDecimal
			|| literal instanceof Boolean
			: "Unexpected literal type: " + literal.getClass();
	}

	public static Value of(String s) {
		return new Value(s, null);
	}

	public static Value of(long n) {
		return new Value(n, null);
	}

	public static Value of(BigInteger n) {
		return new Value(n, null);
	}

	public static Value of(BigDecimal n) {
		return new Value(n, null);
	}

	public static Value of(boolean b) {
		return new Value(b, null);
	}

	public Value withTypeHint(String typeHint) {
		return new Value(literal, typeHint);
	}

	public boolean isNull() {
		return literal == null;
	}

	public boolean isString() {
		return literal instanceof String;
	}

	public boolean isNumber() {
		return literal instanceof Number;
	}

	/**
	 * @throws IllegalStateException if this is not a string
	 */
	public String asString() {
		if (literal instanceof String s) {
			return s;
		}
		throw new IllegalStateException("Not a string: " + this);
	}

	/**
	 * @throws IllegalStateException if this is not a number
	 */
	public Number asNumber() {
		if (literal instanceof Number n) {
			return n;
		}
		throw new IllegalStateException("Not a number: " + this);
	}

	/**
	 * @throws IllegalStateException if this is not a boolean
	 */
	public boolean asBoolean() {
		if (literal instanceof Boolean b) {
			return b;
		}
		throw new IllegalStateException("Not a boolean: " + this);
	}

	@Override
	public String toString() {
		String text = (literal instanceof String) ? '"' + (String) literal + '"' : String.valueOf(literal);
		return (typeHint == null) ? text : "(" + typeHint + ")" + text;
	}
}
