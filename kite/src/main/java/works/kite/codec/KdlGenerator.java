package works.kite.codec;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import works.kite.codec.io.CharClasses;
import works.kite.exceptions.KdlProcessingException;
import works.kite.model.Document;
import works.kite.model.Node;
import works.kite.model.Value;

import static works.kite.codec.io.CharClasses.isDigit;
import static works.kite.codec.io.CharClasses.isSign;

/**
 * Writes a {@link Document} as canonical KDL text:
 * one node per line, children indented by four spaces,
 * identifiers bare wherever possible, and strings always quoted.
 * <p>
 * {@link KdlParser} reads the output back into an equal {@link Document}.
 */
public final class KdlGenerator implements Generator {
	private static final String INDENT = "    ";

	public static KdlGenerator create() {
		return new KdlGenerator();
	}

	@Override
	public void generate(Writer out, Document document) {
		try {
			writeNodes(out, document.nodes(), 0);
		} catch (IOException e) {
			throw new KdlProcessingException("Unable to write KDL output", e);
		}
	}

	public String generate(Document document) {
		StringWriter sw = new StringWriter();
		generate(sw, document);
		return sw.toString();
	}

	private void writeNodes(Writer out, List<Node> nodes, int indent) throws IOException {
		for (Node node : nodes) {
			writeNode(out, node, indent);
		}
	}

	private void writeNode(Writer out, Node node, int indent) throws IOException {
		out.write(INDENT.repeat(indent));
		writeTypeHint(out, node.typeHint());
		writeIdentifier(out, node.name());
		for (Value arg : node.args()) {
			out.write(' ');
			writeValue(out, arg);
		}
		for (Map.Entry<String, Value> prop : node.props().entrySet()) {
			out.write(' ');
			writeIdentifier(out, prop.getKey());
			out.write('=');
			writeValue(out, prop.getValue());
		}
		if (node.hasChildren()) {
			out.write(" {\n");
			writeNodes(out, node.children(), indent + 1);
			out.write(INDENT.repeat(indent));
			out.write('}');
		}
		out.write('\n');
	}

	private void writeTypeHint(Writer out, String typeHint) throws IOException {
		if (typeHint != null) {
			out.write('(');
			writeIdentifier(out, typeHint);
			out.write(')');
		}
	}

	private void writeValue(Writer out, Value value) throws IOException {
		writeTypeHint(out, value.typeHint());
		Object literal = value.literal();
		if (literal instanceof String s) {
			writeQuoted(out, s);
		} else {
			// Numbers, booleans, and null all print as themselves
			out.write(String.valueOf(literal));
		}
	}

	private void writeIdentifier(Writer out, String identifier) throws IOException {
		if (isBareIdentifier(identifier)) {
			out.write(identifier);
		} else {
			writeQuoted(out, identifier);
		}
	}

	static boolean isBareIdentifier(String s) {
		if (s.isEmpty() || !s.codePoints().allMatch(CharClasses::isIdentifierChar)) {
			return false;
		}
		int first = s.codePointAt(0);
		if (isDigit(first)) {
			return false;
		} else if (isSign(first) && s.length() > 1 && isDigit(s.charAt(1))) {
			return false;
		} else {
			return switch (s) {
				case "true", "false", "null" -> false;
				default -> true;
			};
		}
	}

	private void writeQuoted(Writer out, String s) throws IOException {
		out.write('"');
		for (int i = 0; i < s.length(); ) {
			int c = s.codePointAt(i);
			switch (c) {
				case '"' -> out.write("\\\"");
				case '\\' -> out.write("\\\\");
				case '\n' -> out.write("\\n");
				case '\r' -> out.write("\\r");
				case '\t' -> out.write("\\t");
				case '\b' -> out.write("\\b");
				case '\f' -> out.write("\\f");
				default -> {
					if (c < 0x20 || c == 0x7F) {
						out.write("\\u{" + Integer.toHexString(c) + "}");
					} else {
						out.write(Character.toChars(c));
					}
				}
			}
			i += Character.charCount(c);
		}
		out.write('"');
	}
}
