package works.kite.codec;

import java.io.InputStream;
import works.kite.model.Document;

/**
 * Reads KDL text into a {@link Document}.
 * <p>
 * Parsing is all-or-nothing: the result is either a complete document
 * or a {@link works.kite.exceptions.KdlException KdlException} describing the first problem found.
 * Instances hold only their {@link Settings}, so one parser can be shared freely;
 * each call to {@link #parse} runs its own independent session.
 */
public final class KdlParser implements Parser {
	private final Settings settings;

	private KdlParser(Settings settings) {
		this.settings = settings;
	}

	public static KdlParser create() {
		return create(Settings.DEFAULT);
	}

	public static KdlParser create(Settings settings) {
		return new KdlParser(settings);
	}

	@Override
	public Document parse(KdlReader input) {
		return new ParseSession(input, settings).parseDocument();
	}

	public Document parse(String text) {
		try (KdlReader input = KdlReader.create(text)) {
			return parse(input);
		}
	}

	/**
	 * Reads UTF-8 text from the given stream, and closes it.
	 */
	public Document parse(InputStream stream) {
		try (KdlReader input = KdlReader.create(stream)) {
			return parse(input);
		}
	}

	/**
	 * @param maxDepth the most deeply nested children block allowed.
	 *                 Each level of nesting costs a few stack frames, so this
	 *                 keeps hostile input from overflowing the stack.
	 *                 Zero means no children blocks at all.
	 */
	public record Settings(
		int maxDepth
	) {
		public static final Settings DEFAULT = new Settings(256);

		public Settings {
			if (maxDepth < 0) {
				throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
			}
		}

		public Settings withMaxDepth(int maxDepth) {
			return new Settings(maxDepth);
		}
	}
}
