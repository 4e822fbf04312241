//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.collect;

import sift.model.Type;

/**
 * Describes which members qualify for collection. Configs are immutable: each modifier returns an
 * updated copy.
 *
 * <pre>{@code
 * Config.terms().applied(true).checkAccessibility(true).site(enclosingType)
 * }</pre>
 */
public final class Config {

  /** If true, collect type members; otherwise term members. */
  public final boolean isType;
  /** If true, the member access is followed by an argument list, which makes (non-module) classes
    * eligible as term members: they stand for their constructor proxies. */
  public final boolean isApplied;
  /** If true, include private members. */
  public final boolean includePrivate;
  /** If true, include compiler generated members. */
  public final boolean includeSynthetic;
  /** If true, include constructors. */
  public final boolean includeConstructors;
  /** If true, include only members accessible from {@link #site}. */
  public final boolean checkAccessibility;
  /** The type from which accessibility is checked. {@link Type#NONE} disables the check. */
  public final Type site;

  /** Returns a config that collects term members. */
  public static Config terms () { return DEFAULT_TERMS; }
  /** Returns a config that collects type members. */
  public static Config types () { return DEFAULT_TYPES; }
  /** Returns a config that collects type members if {@code isType}, term members otherwise. */
  public static Config of (boolean isType) { return isType ? DEFAULT_TYPES : DEFAULT_TERMS; }

  /** Copies this config and sets {@link #isApplied}. */
  public Config applied (boolean isApplied) {
    return new Config(isType, isApplied, includePrivate, includeSynthetic, includeConstructors,
                      checkAccessibility, site);
  }
  /** Copies this config and sets {@link #includePrivate}. */
  public Config includePrivate (boolean includePrivate) {
    return new Config(isType, isApplied, includePrivate, includeSynthetic, includeConstructors,
                      checkAccessibility, site);
  }
  /** Copies this config and sets {@link #includeSynthetic}. */
  public Config includeSynthetic (boolean includeSynthetic) {
    return new Config(isType, isApplied, includePrivate, includeSynthetic, includeConstructors,
                      checkAccessibility, site);
  }
  /** Copies this config and sets {@link #includeConstructors}. */
  public Config includeConstructors (boolean includeConstructors) {
    return new Config(isType, isApplied, includePrivate, includeSynthetic, includeConstructors,
                      checkAccessibility, site);
  }
  /** Copies this config and sets {@link #checkAccessibility}. */
  public Config checkAccessibility (boolean checkAccessibility) {
    return new Config(isType, isApplied, includePrivate, includeSynthetic, includeConstructors,
                      checkAccessibility, site);
  }
  /** Copies this config and sets {@link #site}. A null site means {@link Type#NONE}. */
  public Config site (Type site) {
    return new Config(isType, isApplied, includePrivate, includeSynthetic, includeConstructors,
                      checkAccessibility, site);
  }

  /** Returns true if members must be checked against the accessibility oracle. */
  public boolean filtersAccess () {
    return checkAccessibility && site != Type.NONE;
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof Config)) return false;
    Config oc = (Config)other;
    return (isType == oc.isType && isApplied == oc.isApplied &&
            includePrivate == oc.includePrivate && includeSynthetic == oc.includeSynthetic &&
            includeConstructors == oc.includeConstructors &&
            checkAccessibility == oc.checkAccessibility && site == oc.site);
  }

  @Override public int hashCode () {
    int bits = (isType ? 1 : 0) | (isApplied ? 2 : 0) | (includePrivate ? 4 : 0) |
      (includeSynthetic ? 8 : 0) | (includeConstructors ? 16 : 0) | (checkAccessibility ? 32 : 0);
    return bits ^ System.identityHashCode(site);
  }

  @Override public String toString () {
    return "Config(" + (isType ? "types" : "terms") + ", applied=" + isApplied +
      ", private=" + includePrivate + ", synthetic=" + includeSynthetic +
      ", ctors=" + includeConstructors + ", access=" + checkAccessibility + ", site=" + site + ")";
  }

  private Config (boolean isType, boolean isApplied, boolean includePrivate,
                  boolean includeSynthetic, boolean includeConstructors,
                  boolean checkAccessibility, Type site) {
    this.isType = isType;
    this.isApplied = isApplied;
    this.includePrivate = includePrivate;
    this.includeSynthetic = includeSynthetic;
    this.includeConstructors = includeConstructors;
    this.checkAccessibility = checkAccessibility;
    this.site = (site == null) ? Type.NONE : site;
  }

  private static final Config DEFAULT_TERMS =
    new Config(false, false, false, false, false, false, Type.NONE);
  private static final Config DEFAULT_TYPES =
    new Config(true, false, false, false, false, false, Type.NONE);
}
