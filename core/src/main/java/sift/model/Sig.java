//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Contains information on one signature of a symbol.
 */
public class Sig {

  /** The text of the signature, as rendered by the type system. */
  public final String text;

  /** The rendered types of the signature's parameters, or null if the signature does not take
    * parameters (a field, for example, as opposed to a nullary method). */
  public final List<String> params;

  /** Creates a parameterless signature. */
  public Sig (String text) {
    this(text, null);
  }

  public Sig (String text, List<String> params) {
    this.text = Preconditions.checkNotNull(text);
    this.params = (params == null) ? null : ImmutableList.copyOf(params);
  }

  /** Returns true if this signature takes a (possibly empty) parameter list. */
  public boolean isApplicable () {
    return params != null;
  }

  @Override public String toString () {
    return text;
  }
}
