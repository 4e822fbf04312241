//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.model;

import java.util.Set;

/**
 * Represents a named declaration owned by a class. Symbols are owned by a {@link TypeSystem}; the
 * collector only reads them.
 *
 * <p>Symbols are compared by identity: two symbols are the same iff they are the same object.
 * Implementations must not override {@code equals} or {@code hashCode}, and a type system must
 * hand out the same object every time it reports a given declaration.</p>
 */
public interface Symbol {

  /** The name declared by this symbol. */
  String name ();

  /** The kind of this symbol, or null if it cannot be determined. */
  Kind kind ();

  /** The flags of this symbol, or null if they cannot be determined without further analysis.
    * The returned set must not be mutated. */
  Set<Flag> flags ();

  /** The class that declares this symbol, or null for a top-level class. */
  Symbol owner ();

  /** Returns false if this symbol has been invalidated (by a recompilation, for example). */
  boolean exists ();

  /** Returns true if this symbol's flags are known and include {@code flag}. */
  default boolean is (Flag flag) {
    Set<Flag> flags = flags();
    return flags != null && flags.contains(flag);
  }

  /** Returns true if this symbol's flags are known and do not include {@code flag}. Note that
    * this is not {@code !is(flag)}: a symbol with unknown flags neither is nor lacks anything. */
  default boolean lacks (Flag flag) {
    Set<Flag> flags = flags();
    return flags != null && !flags.contains(flag);
  }
}
