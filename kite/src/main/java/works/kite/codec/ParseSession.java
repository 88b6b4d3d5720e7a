package works.kite.codec;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.kite.codec.Lexer.Identifier;
import works.kite.codec.Lexer.IdentifierMode;
import works.kite.exceptions.KdlDepthLimitException;
import works.kite.exceptions.KdlEndOfInputException;
import works.kite.exceptions.KdlSyntaxException;
import works.kite.model.Document;
import works.kite.model.Node;
import works.kite.model.Value;

import static java.util.Objects.requireNonNull;
import static works.kite.codec.KdlReader.END_OF_INPUT;
import static works.kite.codec.io.CharClasses.describe;
import static works.kite.codec.io.CharClasses.isNewLine;
import static works.kite.codec.io.CharClasses.isValueTerminator;

/**
 * The state of one run of {@link KdlParser} over one input.
 * <p>
 * The grammar is driven by three mutually recursive methods:
 * {@link #readNodes} reads a sequence of sibling nodes,
 * {@link #readNode} reads one node, and
 * {@link #readArgOrProp} reads one argument or property of a node.
 * Children blocks recurse back into {@link #readNodes}.
 * <p>
 * {@link #depth} counts the children blocks currently open.
 * It's what tells {@link #readNodes} whether the end of the input
 * (or a closing brace) is legitimate.
 */
final class ParseSession {
	private static final String SLASHDASH = "/-";

	private final KdlReader input;
	private final Lexer lexer;
	private final Skipper skipper;
	private final int maxDepth;
	private int depth = 0;

	ParseSession(KdlReader input, KdlParser.Settings settings) {
		this.input = requireNonNull(input);
		this.lexer = new Lexer(input);
		this.skipper = new Skipper(input);
		this.maxDepth = settings.maxDepth();
	}

	int depth() {
		return depth;
	}

	Document parseDocument() {
		LOGGER.debug("Parsing document @ {}", input.currentOffset());
		List<Node> nodes = readNodes();
		assert depth == 0: "Depth should be back to zero, not " + depth;
		LOGGER.debug("Parsed {} top-level nodes @ {}", nodes.size(), input.currentOffset());
		return new Document(nodes);
	}

	/**
	 * Reads sibling nodes until the end of the input (at the top level)
	 * or a closing brace (at any other level), which is left unconsumed
	 * for {@link #readChildren} to deal with.
	 */
	private List<Node> readNodes() {
		List<Node> nodes = new ArrayList<>();
		while (true) {
			int c = skipper.skipToSignificant();
			if (c == END_OF_INPUT) {
				if (depth == 0) {
					return nodes;
				}
				throw new KdlEndOfInputException("Unterminated children block", input.currentOffset());
			} else if (isNewLine(c)) {
				skipper.consumeNewLine();
			} else if (c == ';') {
				throw syntaxError("Unexpected ';' not terminating a node");
			} else if (c == '}') {
				if (depth == 0) {
					throw syntaxError("Unexpected top-level '}'");
				}
				return nodes;
			} else {
				boolean slashdash = consumeSlashdash();
				Node node = readNode();
				if (slashdash) {
					LOGGER.trace("Discarding slashdashed node {}", node.name());
				} else {
					nodes.add(node);
				}
			}
		}
	}

	/**
	 * Reads a node through to its terminator, which is consumed
	 * unless it's the closing brace of the enclosing block.
	 */
	private Node readNode() {
		logEntry("readNode");
		String typeHint = lexer.readMaybeTypeHint();
		Identifier name = lexer.readIdentifier(IdentifierMode.FREESTANDING);
		if (name.name().isEmpty()) {
			throw syntaxError("Node name must not be empty");
		}
		Node.Builder node = Node.builder(name.name()).typeHint(typeHint);

		while (true) {
			int c = skipper.skipToSignificant();
			if (c == END_OF_INPUT) {
				return node.build();
			} else if (isNewLine(c)) {
				skipper.consumeNewLine();
				return node.build();
			} else if (c == ';') {
				input.discard(1);
				return node.build();
			} else if (c == '}') {
				return node.build();
			} else if (c == '{') {
				// TODO: reject arguments and properties after a children block once the grammar is pinned down
				node.children(readChildren());
			} else {
				readArgOrProp(node);
			}
		}
	}

	/**
	 * Reads a brace-delimited children block, consuming both braces.
	 * On success, {@link #depth} is the same as it was on entry.
	 */
	private List<Node> readChildren() {
		assert input.peek() == '{';
		if (depth >= maxDepth) {
			throw new KdlDepthLimitException("Children blocks nested more than " + maxDepth + " deep at offset " + input.currentOffset());
		}
		input.discard(1);
		++depth;
		List<Node> children = readNodes();
		assert input.peek() == '}';
		input.discard(1);
		--depth;
		return children;
	}

	/**
	 * Reads one argument or property, and adds it to {@code node} unless it's slashdashed.
	 * <p>
	 * An unquoted word followed by {@code =} is a property name,
	 * but most other tokens that look like identifiers are actually values,
	 * so we first try to read an identifier (which consumes nothing if it fails)
	 * and look at what follows it.
	 */
	private void readArgOrProp(Node.Builder node) {
		boolean slashdash = consumeSlashdash();
		if (slashdash && input.peek() == '{') {
			List<Node> discarded = readChildren();
			LOGGER.trace("Discarding {} slashdashed children of {}", discarded.size(), node.name());
			return;
		}

		String typeHint = lexer.readMaybeTypeHint();

		// A type hint means this is a value; property names can't have them
		if (typeHint == null) {
			Identifier identifier = lexer.readIdentifier(IdentifierMode.EQUALS);
			if (identifier != null) {
				int c = input.peek();
				if (c == '=') {
					input.discard(1);
					Value value = readTerminatedValue(lexer.readMaybeTypeHint());
					if (!slashdash) {
						node.prop(identifier.name(), value);
					}
				} else if (isValueTerminator(c)) {
					if (!identifier.quoted()) {
						throw syntaxError("Unexpected bare identifier \"" + identifier.name() + "\"");
					}
					if (!slashdash) {
						node.arg(Value.of(identifier.name()));
					}
				} else {
					throw syntaxError("Unexpected " + describe(c) + " after identifier \"" + identifier.name() + "\"");
				}
				return;
			}
			// Otherwise this must be a value
		}

		Value value = readTerminatedValue(typeHint);
		if (!slashdash) {
			node.arg(value);
		}
	}

	/**
	 * Reads a value and checks that it's followed by something that can legally follow a value.
	 */
	private Value readTerminatedValue(String typeHint) {
		Value value = lexer.readValue().withTypeHint(typeHint);
		int c = input.peek();
		if (!isValueTerminator(c)) {
			throw syntaxError("Unexpected " + describe(c) + " after value " + value);
		}
		return value;
	}

	/**
	 * Consumes a slashdash marker and any insignificant content after it.
	 *
	 * @return true if there was a slashdash marker
	 */
	private boolean consumeSlashdash() {
		if (input.isNext(SLASHDASH)) {
			input.discard(2);
			skipper.skipToSignificant();
			return true;
		} else {
			return false;
		}
	}

	private KdlSyntaxException syntaxError(String message) {
		return new KdlSyntaxException(message, input.currentOffset());
	}

	private void logEntry(String methodName) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} depth {} @ {}: |{}|", methodName, depth, input.currentOffset(), input.previewString(20));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ParseSession.class);
}
