//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.model;

import com.google.common.base.Preconditions;

/**
 * One concrete signature of a symbol, as seen through the class that declares it. An overloaded
 * symbol has one occurrence per alternative. Occurrences are compared by identity.
 */
public final class Occurrence {

  /** The symbol of which this is an occurrence. */
  public final Symbol symbol;

  /** The class through which {@link #symbol} was reached. */
  public final Symbol through;

  /** The signature of this alternative. */
  public final Sig sig;

  public Occurrence (Symbol symbol, Symbol through, Sig sig) {
    this.symbol = Preconditions.checkNotNull(symbol);
    this.through = through;
    this.sig = Preconditions.checkNotNull(sig);
  }

  /** The name of the underlying symbol. */
  public String name () {
    return symbol.name();
  }

  @Override public String toString () {
    return String.format("Occurrence(%s, %s, %s)",
                         symbol.name(), (through == null) ? "<none>" : through.name(), sig);
  }
}
