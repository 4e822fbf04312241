//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.model;

/**
 * Denotes the different kinds of declarations that can be members of a class. This is a closed set:
 * whether a symbol is a singleton module is modeled by {@link Flag#MODULE}, not by a kind.
 */
public enum Kind {

  /** A term-level value. Examples: a field, a method, a constructor, the value of a singleton
    * object. */
  TERM,

  /** A type-level declaration which is not a class. Examples: a type alias, an abstract type
    * member, a type parameter. */
  TYPE,

  /** A class, trait or interface declaration. A class is also a type-level declaration. */
  CLASS;

  /** Returns true if declarations of this kind live in the type namespace. */
  public boolean isType () {
    switch (this) {
    case TERM: return false;
    case TYPE: return true;
    case CLASS: return true;
    default: throw new AssertionError("Unknown kind " + this);
    }
  }

  /** Returns true if declarations of this kind live in the term namespace. */
  public boolean isTerm () {
    switch (this) {
    case TERM: return true;
    case TYPE: return false;
    case CLASS: return false;
    default: throw new AssertionError("Unknown kind " + this);
    }
  }

  /** Returns true if this is {@link #CLASS}. */
  public boolean isClass () {
    return this == CLASS;
  }
}
