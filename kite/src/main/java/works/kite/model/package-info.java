/**
 * The in-memory form of a KDL document.
 * These are plain immutable data holders;
 * {@link works.kite.codec.KdlParser} creates them from text,
 * and {@link works.kite.codec.KdlGenerator} turns them back into text.
 */
package works.kite.model;
