package works.kite.codec;

import works.kite.model.Document;

/**
 * Creates a {@link Document} corresponding to KDL text.
 */
public interface Parser {
	Document parse(KdlReader input);
}
