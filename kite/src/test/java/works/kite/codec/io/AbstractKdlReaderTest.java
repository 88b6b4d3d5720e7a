package works.kite.codec.io;

import java.io.ByteArrayInputStream;
import java.util.function.Function;
import java.util.stream.Stream;
import org.junit.jupiter.params.Parameter;
import works.kite.codec.KdlReader;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Base for tests that should pass regardless of which {@link KdlReader} supplies the text.
 * Subclasses are annotated with
 * {@code @ParameterizedClass @MethodSource("works.kite.codec.io.AbstractKdlReaderTest#readerSuppliers")}.
 */
public class AbstractKdlReaderTest {
	@Parameter
	protected Function<String, ? extends KdlReader> readerSupplier;

	protected KdlReader readerFor(String kdl) {
		return readerSupplier.apply(kdl);
	}

	@SuppressWarnings("unused") // Subclasses use this to parameterize tests
	public static Stream<Function<String, ? extends KdlReader>> readerSuppliers() {
		return Stream.of(
			new ByteArray(),
			new FromStream(),
			new TinyChunks(),
			new CharArray()
		);
	}

	static class ByteArray implements Function<String, KdlReader> {
		@Override
		public KdlReader apply(String s) {
			return KdlReader.create(s.getBytes(UTF_8));
		}

		@Override
		public String toString() {
			return "Byte array";
		}
	}

	static class FromStream implements Function<String, KdlReader> {
		@Override
		public KdlReader apply(String s) {
			return KdlReader.create(new ByteArrayInputStream(s.getBytes(UTF_8)));
		}

		@Override
		public String toString() {
			return "Input stream";
		}
	}

	/**
	 * Three-byte chunks make sure every multi-byte character, comment marker,
	 * and CRLF gets split across a chunk boundary somewhere in the tests.
	 */
	static class TinyChunks implements Function<String, KdlReader> {
		@Override
		public KdlReader apply(String s) {
			return new ByteChunkKdlReader(new SynchronousChunkFiller(new ByteArrayInputStream(s.getBytes(UTF_8)), 3));
		}

		@Override
		public String toString() {
			return "Tiny chunks";
		}
	}

	static class CharArray implements Function<String, KdlReader> {
		@Override
		public KdlReader apply(String s) {
			return KdlReader.create(s.toCharArray());
		}

		@Override
		public String toString() {
			return "Char array";
		}
	}
}
