//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.javac;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.sun.source.util.JavacTask;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.IntersectionType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.TypeVariable;
import javax.lang.model.type.WildcardType;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import sift.model.*;

/**
 * A type system backed by the Java compiler's model of an analyzed program. Symbols wrap {@link
 * Element}s and types wrap {@link TypeMirror}s.
 *
 * <p>Accessibility follows the Java rules for the member and for each class enclosing its
 * owner. The accessibility of a top-level owner is not checked: its public members may be
 * reached through a public subclass, and a symbol does not record the type through which it was
 * reached.</p>
 *
 * <p>Like the compiler itself, this is not thread safe: use one model per analysis, from one
 * thread.</p>
 */
public class JavacModel implements TypeSystem {

  /** A symbol backed by a compiler element. */
  public final class Sym implements Symbol {

    /** The element wrapped by this symbol. */
    public final Element element;

    private Sym (Element element) {
      this.element = element;
      _kind = kindOf(element);
      _flags = flagsOf(element);
    }

    @Override public String name () { return element.getSimpleName().toString(); }
    @Override public Kind kind () { return _kind; }
    @Override public Set<Flag> flags () { return _flags; }

    @Override public Symbol owner () {
      TypeElement owner = enclosingClass(element);
      return (owner == null) ? null : symbol(owner);
    }

    @Override public boolean exists () {
      return element.asType().getKind() != TypeKind.ERROR;
    }

    @Override public String toString () {
      return "Sym(" + element.getKind() + " " + element + ")";
    }

    JavacModel model () { return JavacModel.this; }

    private final Kind _kind;
    private final Set<Flag> _flags;
    private List<Occurrence> _alts;
  }

  /** A type backed by a compiler type mirror. */
  public static final class MirrorType implements Type {

    /** The type mirror wrapped by this type. */
    public final TypeMirror mirror;

    public MirrorType (TypeMirror mirror) {
      this.mirror = Preconditions.checkNotNull(mirror);
    }

    @Override public String toString () { return mirror.toString(); }
  }

  /** Creates a model over the results of {@code task}, which must have been analyzed. */
  public JavacModel (JavacTask task) {
    this(task.getElements(), task.getTypes());
  }

  public JavacModel (Elements elements, Types types) {
    _elements = elements;
    _types = types;
  }

  /** Returns the symbol for the class named {@code fqName}.
    * @throws NoSuchElementException if no such class is known to the compiler. */
  public Sym classNamed (String fqName) {
    TypeElement elem = _elements.getTypeElement(fqName);
    if (elem == null) throw new NoSuchElementException("No class named " + fqName);
    return symbol(elem);
  }

  /** Returns the type of the class named {@code fqName}.
    * @throws NoSuchElementException if no such class is known to the compiler. */
  public Type typeOf (String fqName) {
    return type(classNamed(fqName).element.asType());
  }

  /** Returns the (unique) symbol for {@code elem}. */
  public Sym symbol (Element elem) {
    Sym sym = _syms.get(elem);
    if (sym == null) _syms.put(elem, sym = new Sym(elem));
    return sym;
  }

  /** Returns a type wrapping {@code mirror}. */
  public Type type (TypeMirror mirror) {
    return new MirrorType(mirror);
  }

  @Override public Type widen (Type tpe) {
    if (tpe == Type.NONE) return tpe;
    TypeMirror mirror = reqtype(tpe).mirror, wide = widen(mirror);
    return (wide == mirror) ? tpe : new MirrorType(wide);
  }

  @Override public List<Symbol> baseClasses (Type tpe) {
    TypeElement cls = classOf(widen(tpe));
    if (cls == null) return Collections.emptyList();

    // the class and its superclasses, then all of their interfaces, then Object
    TypeElement object = _elements.getTypeElement("java.lang.Object");
    List<TypeElement> chain = new ArrayList<>();
    for (TypeElement cc = cls; cc != null; cc = superclass(cc)) {
      if (!cc.equals(object)) chain.add(cc);
    }
    Set<TypeElement> bases = new LinkedHashSet<>(chain);
    for (TypeElement cc : chain) addInterfaces(cc, bases);
    if (object != null) bases.add(object);

    List<Symbol> syms = new ArrayList<>();
    for (TypeElement base : bases) syms.add(symbol(base));
    return syms;
  }

  @Override public Iterable<Symbol> decls (Symbol cls) {
    Element elem = req(cls).element;
    if (!(elem instanceof TypeElement)) throw new IllegalArgumentException("Not a class: " + cls);
    List<Symbol> decls = new ArrayList<>();
    for (Element mem : elem.getEnclosedElements()) decls.add(symbol(mem));
    return decls;
  }

  @Override public List<Occurrence> alternatives (Symbol sym) {
    // Java overloads are distinct elements, so each symbol has exactly one signature
    Sym jsym = req(sym);
    if (jsym._alts == null) jsym._alts = Collections.singletonList(
      new Occurrence(jsym, jsym.owner(), sigOf(jsym.element)));
    return jsym._alts;
  }

  @Override public boolean isAccessibleFrom (Symbol sym, Type site) {
    Element elem = req(sym).element;
    if (site == Type.NONE) return true;
    TypeElement siteCls = classOf(widen(site));
    if (siteCls == null) throw new IllegalArgumentException("Not a class type: " + site);

    // a member of a nested class is only reachable if each enclosing class is
    for (Element mem = elem; mem != null; mem = enclosingClass(mem)) {
      TypeElement owner = enclosingClass(mem);
      if (owner != null && !permits(mem, owner, siteCls)) return false;
    }
    return true;
  }

  protected Kind kindOf (Element elem) {
    ElementKind ekind = elem.getKind();
    if (ekind.isClass() || ekind.isInterface()) return Kind.CLASS;
    switch (ekind) {
    case TYPE_PARAMETER:
      return Kind.TYPE;
    case FIELD:
    case ENUM_CONSTANT:
    case METHOD:
    case CONSTRUCTOR:
    case STATIC_INIT:
    case INSTANCE_INIT:
      return Kind.TERM;
    default:
      return null;
    }
  }

  protected Set<Flag> flagsOf (Element elem) {
    EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
    if (elem.getModifiers().contains(Modifier.PRIVATE)) flags.add(Flag.PRIVATE);
    switch (elem.getKind()) {
    case CONSTRUCTOR:
    case STATIC_INIT:
    case INSTANCE_INIT:
      flags.add(Flag.CONSTRUCTOR);
      break;
    default:
      break;
    }
    if (_elements.getOrigin(elem) == Elements.Origin.SYNTHETIC) flags.add(Flag.SYNTHETIC);
    return Collections.unmodifiableSet(flags);
  }

  protected Sig sigOf (Element elem) {
    if (elem instanceof ExecutableElement) {
      ExecutableElement exec = (ExecutableElement)elem;
      List<String> params = new ArrayList<>();
      for (VariableElement param : exec.getParameters()) params.add(param.asType().toString());
      boolean ctor = (exec.getKind() == ElementKind.CONSTRUCTOR);
      String name = ctor ? exec.getEnclosingElement().getSimpleName().toString() :
        exec.getSimpleName().toString();
      String prefix = ctor ? "" : exec.getReturnType() + " ";
      return new Sig(prefix + name + "(" + Joiner.on(", ").join(params) + ")", params);
    } else if (elem instanceof TypeElement) {
      String keyword = elem.getKind().toString().toLowerCase().replace('_', ' ');
      return new Sig(keyword + " " + ((TypeElement)elem).getQualifiedName());
    } else {
      return new Sig(elem.asType() + " " + elem.getSimpleName());
    }
  }

  private boolean permits (Element mem, TypeElement owner, TypeElement siteCls) {
    Set<Modifier> mods = mem.getModifiers();
    if (mods.contains(Modifier.PRIVATE)) return outermost(siteCls).equals(outermost(owner));
    if (mods.contains(Modifier.PUBLIC) || owner.getKind().isInterface()) return true;
    boolean samePackage = _elements.getPackageOf(siteCls).equals(_elements.getPackageOf(owner));
    if (mods.contains(Modifier.PROTECTED)) return samePackage || inSubclass(siteCls, owner);
    return samePackage;
  }

  private TypeMirror widen (TypeMirror mirror) {
    switch (mirror.getKind()) {
    case TYPEVAR:
      return widen(((TypeVariable)mirror).getUpperBound());
    case WILDCARD:
      TypeMirror ext = ((WildcardType)mirror).getExtendsBound();
      return (ext == null) ? _elements.getTypeElement("java.lang.Object").asType() : widen(ext);
    case INTERSECTION:
      return widen(((IntersectionType)mirror).getBounds().get(0));
    default:
      return mirror;
    }
  }

  private TypeElement classOf (Type tpe) {
    if (tpe == Type.NONE) return null;
    TypeMirror mirror = reqtype(tpe).mirror;
    if (mirror.getKind() != TypeKind.DECLARED) return null;
    return (TypeElement)((DeclaredType)mirror).asElement();
  }

  private TypeElement superclass (TypeElement cls) {
    TypeMirror sup = cls.getSuperclass();
    if (sup.getKind() != TypeKind.DECLARED) return null;
    return (TypeElement)((DeclaredType)sup).asElement();
  }

  private void addInterfaces (TypeElement cls, Set<TypeElement> into) {
    for (TypeMirror iface : cls.getInterfaces()) {
      if (iface.getKind() != TypeKind.DECLARED) continue;
      TypeElement ielem = (TypeElement)((DeclaredType)iface).asElement();
      if (into.add(ielem)) addInterfaces(ielem, into);
    }
  }

  private boolean inSubclass (TypeElement siteCls, TypeElement owner) {
    TypeMirror otype = _types.erasure(owner.asType());
    for (TypeElement cc = siteCls; cc != null; cc = enclosingClass(cc)) {
      if (_types.isSubtype(_types.erasure(cc.asType()), otype)) return true;
    }
    return false;
  }

  private static TypeElement enclosingClass (Element elem) {
    Element encl = elem.getEnclosingElement();
    return (encl instanceof TypeElement) ? (TypeElement)encl : null;
  }

  private static TypeElement outermost (TypeElement cls) {
    TypeElement outer = cls;
    for (TypeElement encl = enclosingClass(cls); encl != null; encl = enclosingClass(encl)) {
      outer = encl;
    }
    return outer;
  }

  private Sym req (Symbol sym) {
    if (!(sym instanceof Sym) || ((Sym)sym).model() != this) throw new IllegalArgumentException(
      "Symbol not from this model: " + sym);
    return (Sym)sym;
  }

  private MirrorType reqtype (Type tpe) {
    if (!(tpe instanceof MirrorType)) throw new IllegalArgumentException(
      "Type not from a javac model: " + tpe);
    return (MirrorType)tpe;
  }

  private final Elements _elements;
  private final Types _types;
  private final Map<Element,Sym> _syms = new HashMap<>();
}
