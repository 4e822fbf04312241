//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.model;

import java.util.List;

/**
 * The view of a compiler's semantic model needed to collect members. A type system is passed
 * explicitly to every collector operation; implementations decide how (and whether) to guard
 * against concurrent mutation.
 */
public interface TypeSystem {

  /**
   * Returns the nominal upper bound of {@code tpe}: a singleton or refined type widens to its class
   * type. {@link Type#NONE} widens to itself.
   */
  Type widen (Type tpe);

  /**
   * Returns the linearized base classes of {@code tpe}, most derived first. The list contains no
   * duplicates. It is empty for {@link Type#NONE} and for types that have no class.
   */
  List<Symbol> baseClasses (Type tpe);

  /**
   * Returns the symbols declared directly in {@code cls}, in declaration order.
   */
  Iterable<Symbol> decls (Symbol cls);

  /**
   * Returns the signature alternatives of {@code sym}. A symbol that is not overloaded has exactly
   * one.
   */
  List<Occurrence> alternatives (Symbol sym);

  /**
   * Returns true if {@code sym} may be accessed from code whose enclosing type is {@code site}.
   * Implementations may throw if {@code site} does not belong to this type system.
   */
  boolean isAccessibleFrom (Symbol sym, Type site);
}
