//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.model;

/**
 * Enumerates the origin and visibility flags that matter when collecting members. This is the
 * union of the flags used by all supported type systems; a given type system will likely only set a
 * subset of them.
 */
public enum Flag {

  /** The symbol was generated by the compiler rather than written by the user. */
  SYNTHETIC,

  /** The symbol is private to its owner. */
  PRIVATE,

  /** The symbol is a constructor (or an initializer). */
  CONSTRUCTOR,

  /** The symbol is a singleton module, or the class of one (Scala objects, companions). */
  MODULE;
}
