//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.javac;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import javax.lang.model.element.ExecutableElement;
import org.junit.*;
import sift.collect.Config;
import sift.collect.MemberCollector;
import sift.model.*;
import static org.junit.Assert.*;

public class JavacModelTest {

  public static final String BASE = Joiner.on("\n").join(
    "package test;",
    "public class Base {",
    "    public int count;",
    "    private int secret;",
    "    protected void hook () {}",
    "    void pkg () {}",
    "    public Base () {}",
    "    public static class Nested {}",
    "    public <T extends Base> T pick (T a, T b) { return a; }",
    "}");

  public static final String DERIVED = Joiner.on("\n").join(
    "package test;",
    "public class Derived extends Base implements Runnable {",
    "    public String name;",
    "    public void run () {}",
    "    public void run (int times) {}",
    "}");

  public static final String SUB = Joiner.on("\n").join(
    "package other;",
    "public class Sub extends test.Base {",
    "    class Inner {}",
    "}");

  public static final String OUTSIDER = Joiner.on("\n").join(
    "package other;",
    "public class Outsider {",
    "    private static class Hidden { public int open; }",
    "    static class Shared { public int open; }",
    "}");

  public static JavacModel model;

  @BeforeClass public static void analyze () {
    model = new JavacAnalyzer().analyze(
      Arrays.asList("test/Base.java", "test/Derived.java", "other/Sub.java", "other/Outsider.java"),
      Arrays.asList(BASE, DERIVED, SUB, OUTSIDER));
  }

  @AfterClass public static void clearModel () {
    model = null;
  }

  @Test public void testBaseClasses () {
    List<String> names = new ArrayList<>();
    for (Symbol bc : model.baseClasses(model.typeOf("test.Derived"))) names.add(bc.name());
    assertEquals(Arrays.asList("Derived", "Base", "Runnable", "Object"), names);
    assertTrue(model.baseClasses(Type.NONE).isEmpty());
  }

  @Test public void testKindsAndFlags () {
    Symbol base = model.classNamed("test.Base");
    assertEquals(Kind.CLASS, base.kind());
    assertNull(base.owner());
    for (Symbol sym : model.decls(base)) {
      switch (sym.name()) {
      case "secret":
        assertEquals(Kind.TERM, sym.kind());
        assertTrue(sym.is(Flag.PRIVATE));
        break;
      case "<init>":
        assertTrue(sym.is(Flag.CONSTRUCTOR));
        break;
      case "Nested":
        assertEquals(Kind.CLASS, sym.kind());
        assertSame(base, sym.owner());
        break;
      default:
        assertEquals(Kind.TERM, sym.kind());
        assertTrue(sym.lacks(Flag.PRIVATE));
        assertTrue(sym.lacks(Flag.SYNTHETIC));
        break;
      }
      assertTrue(sym.exists());
    }
  }

  @Test public void testCollectTerms () {
    Set<String> names = MemberCollector.collectNames(
      model, model.typeOf("test.Derived"), Config.terms());
    assertTrue(names.containsAll(Arrays.asList("name", "run", "count", "hook", "pkg", "toString")));
    assertFalse(names.contains("secret"));
    assertFalse(names.contains("<init>"));
    assertFalse(names.contains("Nested"));
  }

  @Test public void testOverloadsAreDistinctSymbols () {
    Type derived = model.typeOf("test.Derived");
    int runs = 0;
    for (Symbol sym : MemberCollector.collectSymbols(model, derived, Config.terms())) {
      if (sym.name().equals("run")) runs++;
    }
    // two in Derived, one in Runnable
    assertEquals(3, runs);

    List<Occurrence> occs = MemberCollector.collectDenotations(model, derived, Config.terms());
    assertEquals("void run()", occs.get(1).sig.text);
    assertEquals(Arrays.asList("int"), occs.get(2).sig.params);
    Set<Symbol> syms = MemberCollector.collectSymbols(model, derived, Config.terms());
    assertTrue(occs.size() >= syms.size());
  }

  @Test public void testAppliedClasses () {
    Type base = model.typeOf("test.Base");
    assertTrue(MemberCollector.collectNames(model, base, Config.terms().applied(true)).
               contains("Nested"));
    assertEquals(Arrays.asList("Nested"), new ArrayList<>(
      MemberCollector.collectNames(model, base, Config.types())));
  }

  @Test public void testConstructors () {
    Type base = model.typeOf("test.Base");
    Set<String> names = MemberCollector.collectNames(
      model, base, Config.terms().includeConstructors(true));
    assertTrue(names.contains("<init>"));
  }

  @Test public void testAccessibility () {
    Type derived = model.typeOf("test.Derived");
    Config config = Config.terms().includePrivate(true).checkAccessibility(true);

    Set<String> fromBase = MemberCollector.collectNames(
      model, derived, config.site(model.typeOf("test.Base")));
    assertTrue(fromBase.contains("secret"));
    assertTrue(fromBase.contains("pkg"));

    Set<String> fromDerived = MemberCollector.collectNames(
      model, derived, config.site(derived));
    assertFalse(fromDerived.contains("secret"));
    assertTrue(fromDerived.contains("pkg"));

    Set<String> fromSub = MemberCollector.collectNames(
      model, derived, config.site(model.typeOf("other.Sub")));
    assertTrue(fromSub.contains("hook"));
    assertFalse(fromSub.contains("pkg"));
    assertTrue(fromSub.contains("count"));

    Set<String> fromOutsider = MemberCollector.collectNames(
      model, derived, config.site(model.typeOf("other.Outsider")));
    assertFalse(fromOutsider.contains("hook"));
    assertFalse(fromOutsider.contains("pkg"));
    assertTrue(fromOutsider.contains("count"));
  }

  @Test public void testProtectedFromNestedClassOfSubclass () {
    Symbol hook = findMember("hook");
    assertTrue(model.isAccessibleFrom(hook, model.typeOf("other.Sub.Inner")));
  }

  @Test public void testMembersOfNestedClasses () {
    // public fields, but Hidden is private and Shared is package private
    Symbol hidden = memberNamed("other.Outsider.Hidden", "open");
    Symbol shared = memberNamed("other.Outsider.Shared", "open");
    assertTrue(model.isAccessibleFrom(hidden, model.typeOf("other.Outsider")));
    assertFalse(model.isAccessibleFrom(hidden, model.typeOf("other.Sub")));
    assertTrue(model.isAccessibleFrom(shared, model.typeOf("other.Sub")));
    assertFalse(model.isAccessibleFrom(shared, model.typeOf("test.Base")));
  }

  @Test public void testIsValidMember () {
    Type derived = model.typeOf("test.Derived");
    List<Occurrence> occs = MemberCollector.collectDenotations(
      model, derived, Config.terms().includePrivate(true).includeConstructors(true));
    for (Occurrence occ : occs) {
      boolean valid = MemberCollector.isValidMember(model, occ, false, Type.NONE, false);
      String name = occ.name();
      if (name.equals("secret") || name.equals("<init>")) assertFalse(name, valid);
      else if (occ.symbol.lacks(Flag.PRIVATE)) assertTrue(name, valid);
    }
  }

  @Test public void testWidenTypeVariable () {
    ExecutableElement pick = (ExecutableElement)((JavacModel.Sym)findMember("pick")).element;
    Type tvar = model.type(pick.getReturnType());
    List<String> names = new ArrayList<>();
    for (Symbol bc : model.baseClasses(tvar)) names.add(bc.name());
    assertEquals(Arrays.asList("Base", "Object"), names);
    assertTrue(MemberCollector.collectNames(model, tvar, Config.terms()).contains("count"));
  }

  @Test public void testSymbolsAreCanonical () {
    assertSame(model.classNamed("test.Base"), model.classNamed("test.Base"));
    Symbol first = model.decls(model.classNamed("test.Base")).iterator().next();
    assertSame(first, model.decls(model.classNamed("test.Base")).iterator().next());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testNonClassSiteRejected () {
    Symbol hook = findMember("hook");
    Type voidType = model.type(((ExecutableElement)((JavacModel.Sym)hook).element).getReturnType());
    model.isAccessibleFrom(hook, voidType);
  }

  private static Symbol findMember (String name) {
    return memberNamed("test.Base", name);
  }

  private static Symbol memberNamed (String cls, String name) {
    for (Symbol sym : model.decls(model.classNamed(cls))) {
      if (sym.name().equals(name)) return sym;
    }
    throw new AssertionError("No member named " + name + " in " + cls);
  }
}
