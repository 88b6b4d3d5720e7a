package works.kite.codec;

import java.io.Writer;
import works.kite.model.Document;

/**
 * Emits KDL text corresponding to a {@link Document}.
 */
public interface Generator {
	void generate(Writer out, Document document);
}
