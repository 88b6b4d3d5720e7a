package works.kite.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * One node of a KDL document.
 *
 * @param typeHint the annotation written in parentheses before the name, or null if there was none
 * @param name never empty
 * @param args positional arguments, in order of appearance
 * @param props properties in order of first appearance; when a name appears more than once, the last value wins
 * @param children nested nodes, in order of appearance
 */
public record Node(
	String typeHint,
	String name,
	List<Value> args,
	Map<String, Value> props,
	List<Node> children
) {
	public Node {
		requireNonNull(name);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Node name must not be empty");
		}
		args = List.copyOf(args);
		props = Collections.unmodifiableMap(new LinkedHashMap<>(props));
		children = List.copyOf(children);
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public Value arg(int index) {
		return args.get(index);
	}

	/**
	 * @return the value of the named property, or null if there is none
	 */
	public Value prop(String name) {
		return props.get(name);
	}

	public boolean hasChildren() {
		return !children.isEmpty();
	}

	/**
	 * Assembles a {@link Node} while it's being parsed.
	 * The name comes first and never changes;
	 * everything else can be attached in any order.
	 */
	public static final class Builder {
		private final String name;
		private String typeHint;
		private final List<Value> args = new ArrayList<>();
		private final Map<String, Value> props = new LinkedHashMap<>();
		private final List<Node> children = new ArrayList<>();

		Builder(String name) {
			this.name = requireNonNull(name);
		}

		public String name() {
			return name;
		}

		public Builder typeHint(String typeHint) {
			this.typeHint = typeHint;
			return this;
		}

		public Builder arg(Value value) {
			args.add(requireNonNull(value));
			return this;
		}

		public Builder prop(String name, Value value) {
			props.put(requireNonNull(name), requireNonNull(value));
			return this;
		}

		public Builder child(Node child) {
			children.add(requireNonNull(child));
			return this;
		}

		public Builder children(List<Node> children) {
			children.forEach(this::child);
			return this;
		}

		public Node build() {
			return new Node(typeHint, name, args, props, children);
		}
	}
}
