/**
 * Low-level access to KDL text.
 * The main abstraction is {@link works.kite.codec.KdlReader},
 * which decodes characters from a byte or char source and offers
 * the unlimited lookahead the parser needs.
 * It knows nothing about KDL syntax beyond {@link works.kite.codec.io.CharClasses character classes};
 * use {@link works.kite.codec.KdlParser} to actually read a document.
 */
package works.kite.codec.io;
