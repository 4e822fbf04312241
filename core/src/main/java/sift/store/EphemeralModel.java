//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.store;

import com.carrotsearch.hppc.IntHashSet;
import com.carrotsearch.hppc.IntObjectHashMap;
import com.carrotsearch.hppc.IntObjectMap;
import com.carrotsearch.hppc.IntSet;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import sift.model.*;

/**
 * A completely in-memory type system. Classes, members, signatures and base class sequences are
 * declared by hand, which makes this useful for tests and for hosts that mirror the symbol table of
 * some other compiler.
 *
 * <p>Base class sequences are taken verbatim: this model does not linearize anything. Mutation is
 * not synchronized; populate the model, then query it.</p>
 */
public class EphemeralModel implements TypeSystem {

  /** A symbol declared in an ephemeral model. */
  public final class Sym implements Symbol {

    /** The unique (within the model) id of this symbol. */
    public final int id;

    private Sym (int id, String name, Kind kind, Set<Flag> flags, Sym owner) {
      this.id = id;
      _name = name;
      _kind = kind;
      _flags = flags;
      _owner = owner;
    }

    @Override public String name () { return _name; }
    @Override public Kind kind () { return _kind; }
    @Override public Set<Flag> flags () { return _flags; }
    @Override public Symbol owner () { return _owner; }
    @Override public boolean exists () { return !_invalid.contains(id); }

    @Override public String toString () {
      return String.format("Sym(%d, %s, %s, %s)", id, _name, _kind, _flags);
    }

    EphemeralModel model () { return EphemeralModel.this; }

    private final String _name;
    private final Kind _kind;
    private final Set<Flag> _flags;
    private final Sym _owner;
  }

  /** The nominal type of a class. */
  public final class ClassType implements Type {

    /** The class of this type. */
    public final Sym cls;

    private ClassType (Sym cls) {
      this.cls = cls;
    }

    @Override public String toString () { return cls.name(); }
  }

  /** The singleton type of a named value, which widens to the type of its class. */
  public final class SingletonType implements Type {

    /** The name of the value whose type this is. */
    public final String name;

    /** The type to which this type widens. */
    public final ClassType underlying;

    private SingletonType (String name, ClassType underlying) {
      this.name = name;
      this.underlying = underlying;
    }

    @Override public String toString () { return name + ".type"; }
  }

  /**
   * Declares a top-level class. Its base class sequence is initially just itself.
   */
  public Sym defClass (String name, Flag... flags) {
    return define(null, Kind.CLASS, name, toFlags(flags));
  }

  /**
   * Declares a member of {@code owner}, after all members declared so far. A member of kind
   * {@link Kind#CLASS} is itself a class, with a base class sequence of just itself.
   */
  public Sym defMember (Symbol owner, Kind kind, String name, Flag... flags) {
    return define(reqclass(owner), Preconditions.checkNotNull(kind), name, toFlags(flags));
  }

  /**
   * Declares a member of {@code owner} whose flags cannot be determined.
   */
  public Sym defUnresolved (Symbol owner, Kind kind, String name) {
    return define(reqclass(owner), kind, name, null);
  }

  /**
   * Sets the base class sequence of {@code cls} to {@code cls} followed by {@code parents}. The
   * parents must already be linearized, most derived first.
   */
  public void setBases (Symbol cls, Symbol... parents) {
    Sym ccls = reqclass(cls);
    List<Symbol> bases = new ArrayList<>();
    bases.add(ccls);
    for (Symbol parent : parents) bases.add(reqclass(parent));
    _bases.put(ccls.id, Collections.unmodifiableList(bases));
  }

  /**
   * Adds a signature alternative to {@code sym}.
   * @return the occurrence that {@link #alternatives} will report for it.
   */
  public Occurrence addSig (Symbol sym, String text) {
    return addSig(sym, new Sig(text));
  }

  /**
   * Adds a method signature alternative to {@code sym}.
   * @return the occurrence that {@link #alternatives} will report for it.
   */
  public Occurrence addSig (Symbol sym, String text, String... params) {
    return addSig(sym, new Sig(text, Arrays.asList(params)));
  }

  /**
   * Adds a signature alternative to {@code sym}.
   * @return the occurrence that {@link #alternatives} will report for it.
   */
  public Occurrence addSig (Symbol sym, Sig sig) {
    Sym ssym = req(sym);
    List<Occurrence> sigs = _sigs.get(ssym.id);
    if (sigs == null) _sigs.put(ssym.id, sigs = new ArrayList<>());
    Occurrence occ = new Occurrence(ssym, ssym._owner, sig);
    sigs.add(occ);
    return occ;
  }

  /** Returns the nominal type of {@code cls}. */
  public ClassType typeOf (Symbol cls) {
    Sym ccls = reqclass(cls);
    ClassType tpe = _types.get(ccls.id);
    if (tpe == null) _types.put(ccls.id, tpe = new ClassType(ccls));
    return tpe;
  }

  /** Returns the singleton type of a value named {@code name} whose class is {@code cls}. */
  public SingletonType singletonOf (Symbol cls, String name) {
    return new SingletonType(name, typeOf(cls));
  }

  /** Marks {@code sym} as no longer existing, as a recompilation would. */
  public void invalidate (Symbol sym) {
    _invalid.add(req(sym).id);
  }

  /** Returns the number of symbols declared in this model. */
  public int symbolCount () {
    return _syms.size();
  }

  /** Returns the symbol with id {@code id}.
    * @throws NoSuchElementException if no symbol exists with that id. */
  public Sym symbol (int id) {
    Sym sym = _syms.get(id);
    if (sym == null) throw new NoSuchElementException("No symbol with id " + id);
    return sym;
  }

  @Override public Type widen (Type tpe) {
    if (tpe == Type.NONE) return tpe;
    if (tpe instanceof SingletonType && ((SingletonType)tpe).underlying.cls.model() == this) {
      return ((SingletonType)tpe).underlying;
    }
    return reqtype(tpe);
  }

  @Override public List<Symbol> baseClasses (Type tpe) {
    Type wtpe = widen(tpe);
    if (wtpe == Type.NONE) return Collections.emptyList();
    return _bases.get(((ClassType)wtpe).cls.id);
  }

  @Override public Iterable<Symbol> decls (Symbol cls) {
    List<Symbol> decls = _decls.get(reqclass(cls).id);
    return (decls == null) ? Collections.<Symbol>emptyList() : Collections.unmodifiableList(decls);
  }

  @Override public List<Occurrence> alternatives (Symbol sym) {
    Sym ssym = req(sym);
    List<Occurrence> sigs = _sigs.get(ssym.id);
    if (sigs != null) return Collections.unmodifiableList(sigs);
    List<Occurrence> dflt = _defaultAlts.get(ssym.id);
    if (dflt == null) _defaultAlts.put(ssym.id, dflt = Collections.singletonList(
      new Occurrence(ssym, ssym._owner, new Sig(ssym._name))));
    return dflt;
  }

  @Override public boolean isAccessibleFrom (Symbol sym, Type site) {
    Sym ssym = req(sym);
    Type wsite = widen(site);
    return (wsite == Type.NONE) || isAccessible(ssym, ((ClassType)wsite).cls);
  }

  /**
   * Decides whether {@code sym} is accessible from code in {@code siteClass}. By default, a
   * private symbol is accessible only from its owner, and everything else from everywhere.
   */
  protected boolean isAccessible (Sym sym, Sym siteClass) {
    return !sym.is(Flag.PRIVATE) || sym._owner == siteClass;
  }

  private Sym define (Sym owner, Kind kind, String name, Set<Flag> flags) {
    Preconditions.checkNotNull(name, "Symbol name must not be null");
    Sym sym = new Sym(++_lastId, name, kind, flags, owner);
    _syms.put(sym.id, sym);
    if (owner != null) {
      List<Symbol> decls = _decls.get(owner.id);
      if (decls == null) _decls.put(owner.id, decls = new ArrayList<>());
      decls.add(sym);
    }
    if (kind == Kind.CLASS) _bases.put(sym.id, Collections.<Symbol>singletonList(sym));
    return sym;
  }

  private Set<Flag> toFlags (Flag[] flags) {
    EnumSet<Flag> set = EnumSet.noneOf(Flag.class);
    Collections.addAll(set, flags);
    return Collections.unmodifiableSet(set);
  }

  private Sym req (Symbol sym) {
    if (!(sym instanceof Sym) || ((Sym)sym).model() != this) throw new IllegalArgumentException(
      "Symbol not from this model: " + sym);
    return (Sym)sym;
  }

  private Sym reqclass (Symbol cls) {
    Sym ccls = req(cls);
    Preconditions.checkArgument(ccls._kind == Kind.CLASS, "Not a class: %s", ccls);
    return ccls;
  }

  private ClassType reqtype (Type tpe) {
    if (!(tpe instanceof ClassType) || ((ClassType)tpe).cls.model() != this) {
      throw new IllegalArgumentException("Type not from this model: " + tpe);
    }
    return (ClassType)tpe;
  }

  private int _lastId;
  private final IntObjectMap<Sym> _syms = new IntObjectHashMap<>();
  private final IntObjectMap<List<Symbol>> _decls = new IntObjectHashMap<>();
  private final IntObjectMap<List<Symbol>> _bases = new IntObjectHashMap<>();
  private final IntObjectMap<List<Occurrence>> _sigs = new IntObjectHashMap<>();
  private final IntObjectMap<List<Occurrence>> _defaultAlts = new IntObjectHashMap<>();
  private final IntObjectMap<ClassType> _types = new IntObjectHashMap<>();
  private final IntSet _invalid = new IntHashSet();
}
