/**
 * Kite reads KDL documents.
 * <p>
 * KDL text is a sequence of nodes, each with a name, positional arguments,
 * named properties, and optionally a brace-delimited block of child nodes.
 * Kite parses such text into an immutable {@link works.kite.model.Document Document} tree.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.kite.model}, the node tree itself;
 *     </li>
 *     <li>
 *         {@link works.kite.codec}, which holds the {@link works.kite.codec.KdlParser parser}
 *         and the {@link works.kite.codec.KdlGenerator generator}; and
 *     </li>
 *     <li>
 *         {@link works.kite.codec.io}, which supplies decoded characters to the parser.
 *     </li>
 * </ul>
 */
module works.kite {
	requires org.slf4j;

	exports works.kite.codec;
	exports works.kite.codec.io;
	exports works.kite.exceptions;
	exports works.kite.model;
}
