//
// Sift - collecting type members for completion and suggestions
// http://github.com/scaled/codex/blob/master/LICENSE

package sift.model;

import org.junit.*;
import static org.junit.Assert.*;

public class KindTest {

  @Test public void testNamespaces () {
    assertTrue(Kind.TERM.isTerm());
    assertFalse(Kind.TERM.isType());
    assertTrue(Kind.TYPE.isType());
    assertFalse(Kind.TYPE.isTerm());
    // classes are types, but not terms
    assertTrue(Kind.CLASS.isType());
    assertFalse(Kind.CLASS.isTerm());
    assertTrue(Kind.CLASS.isClass());
    assertFalse(Kind.TYPE.isClass());
  }
}
