//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.model;

/**
 * An opaque handle on a type, owned by a {@link TypeSystem}. The only type known to the collector
 * itself is {@link #NONE}.
 */
public interface Type {

  /** The "no type" sentinel. Always compare against it by reference. */
  Type NONE = new Type() {
    @Override public String toString () { return "<notype>"; }
  };
}
