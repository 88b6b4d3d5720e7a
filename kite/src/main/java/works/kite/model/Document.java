package works.kite.model;

import java.util.List;

/**
 * The result of parsing KDL text: its top-level nodes, in order.
 */
public record Document(List<Node> nodes) {
	public static final Document EMPTY = new Document(List.of());

	public Document {
		nodes = List.copyOf(nodes);
	}

	public static Document of(Node... nodes) {
		return new Document(List.of(nodes));
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	/**
	 * @return the top-level nodes with the given name, in order
	 */
	public List<Node> nodesNamed(String name) {
		return nodes.stream()
			.filter(n -> n.name().equals(name))
			.toList();
	}
}
