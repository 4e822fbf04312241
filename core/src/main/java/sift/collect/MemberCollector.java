//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.collect;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import sift.model.*;

/**
 * Collects the members of a type. This is shared between code completion, which needs every
 * signature of every candidate, and "did you mean" suggestions, which only need the candidates'
 * names to compare them with the name that failed to resolve.
 *
 * <p>None of these methods catch exceptions thrown by the supplied {@link TypeSystem}.</p>
 */
public class MemberCollector {

  /**
   * Returns true if {@code sym} has the requested kind.
   *
   * @param isType whether we're looking for types.
   * @param isApplied whether the member access is followed by an argument list. In that case a
   * class also counts as a term, as it has a constructor proxy, which does not show up separately
   * as a member. Module classes have no such proxy.
   */
  public static boolean kindOK (Symbol sym, boolean isType, boolean isApplied) {
    Kind kind = sym.kind();
    if (kind == null) return false;
    if (isType) return kind.isType();
    else return kind.isTerm() || (isApplied && kind.isClass() && !sym.is(Flag.MODULE));
  }

  /**
   * Returns true if {@code sym} should be collected under {@code config}. A flag check that is not
   * waived by {@code config} fails for a symbol whose flags are unknown.
   */
  public static boolean includes (TypeSystem ts, Symbol sym, Config config) {
    return (kindOK(sym, config.isType, config.isApplied) &&
            (config.includeConstructors || sym.lacks(Flag.CONSTRUCTOR)) &&
            (config.includeSynthetic || sym.lacks(Flag.SYNTHETIC)) &&
            (config.includePrivate || sym.lacks(Flag.PRIVATE)) &&
            (!config.filtersAccess() || ts.isAccessibleFrom(sym, config.site)));
  }

  /**
   * Collects the members of {@code tpe} as symbols. Each symbol is reported once, even if it is
   * reachable through more than one base class. The set iterates in the order in which symbols
   * were first seen.
   *
   * <p>This is the method to use for suggestions, where only the symbols' names matter.</p>
   */
  public static Set<Symbol> collectSymbols (TypeSystem ts, Type tpe, Config config) {
    ImmutableSet.Builder<Symbol> syms = ImmutableSet.builder();
    for (Symbol bc : ts.baseClasses(ts.widen(tpe))) {
      for (Symbol sym : ts.decls(bc)) {
        if (includes(ts, sym, config)) syms.add(sym);
      }
    }
    return syms.build();
  }

  /**
   * Collects the members of {@code tpe} as occurrences: every alternative of every included
   * symbol, in base class order (most derived first), then declaration order, then the order in
   * which {@code ts} reports alternatives. Occurrences reached through different base classes are
   * all reported.
   *
   * <p>This is the method to use for completions, which need each member's signatures.</p>
   */
  public static List<Occurrence> collectDenotations (TypeSystem ts, Type tpe, Config config) {
    List<Occurrence> result = new ArrayList<>();
    for (Symbol bc : ts.baseClasses(ts.widen(tpe))) {
      for (Symbol sym : ts.decls(bc)) {
        if (includes(ts, sym, config)) result.addAll(ts.alternatives(sym));
      }
    }
    return result;
  }

  /**
   * Returns the names of the symbols collected by {@link #collectSymbols}, in the same order.
   */
  public static Set<String> collectNames (TypeSystem ts, Type tpe, Config config) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (Symbol sym : collectSymbols(ts, tpe, config)) names.add(sym.name());
    return names.build();
  }

  /**
   * Returns true if {@code occ} is still a valid completion candidate. This is a narrower check
   * than {@link #includes}: it is used to re-filter known occurrences without walking the type
   * hierarchy again. Constructors, synthetic and private members are always rejected, and classes
   * never count as terms.
   *
   * @param site the type from which accessibility is checked. {@link Type#NONE} disables the
   * check, as it does for {@link Config#site}.
   */
  public static boolean isValidMember (TypeSystem ts, Occurrence occ, boolean isType, Type site,
                                       boolean checkAccessibility) {
    Symbol sym = occ.symbol;
    return (sym.exists() &&
            sym.lacks(Flag.CONSTRUCTOR) &&
            sym.lacks(Flag.SYNTHETIC) &&
            sym.lacks(Flag.PRIVATE) &&
            kindOK(sym, isType, false) &&
            (!checkAccessibility || site == null || site == Type.NONE ||
             ts.isAccessibleFrom(sym, site)));
  }

  /**
   * Returns the occurrences in {@code occs} which pass {@link #isValidMember}, in order.
   */
  public static List<Occurrence> revalidate (TypeSystem ts, Iterable<Occurrence> occs,
                                             boolean isType, Type site,
                                             boolean checkAccessibility) {
    List<Occurrence> valid = new ArrayList<>();
    for (Occurrence occ : occs) {
      if (isValidMember(ts, occ, isType, site, checkAccessibility)) valid.add(occ);
    }
    return valid;
  }

  private MemberCollector () {} // no instances
}
