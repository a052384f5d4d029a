package com.cliffc.wire.util;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class TestDoc {
  @Test public void testText() {
    Doc d = Doc.text("abc");
    assertEquals(1, d.len());
    assertEquals("abc", d.toString());
    // Embedded newlines split lines; a trailing one makes a blank line
    d = Doc.text("The ","input"," named 'p'\n");
    assertEquals(Arrays.asList("The input named 'p'",""), d.lines());
    assertEquals("", Doc.EMPTY.toString());
  }

  @Test public void testNest() {
    Doc d = Doc.vcat(Doc.text("Error:"),
                     Doc.vcat(Doc.text("first\n"),
                              Doc.text("type").nest(4),
                              Doc.text("  two spaces")).nest(4));
    assertEquals("Error:\n" +
                 "    first\n" +
                 "\n" +               // Blank lines are never indented
                 "        type\n" +
                 "      two spaces", d.toString());
    // Nesting makes a new document
    Doc t = Doc.text("x");
    assertNotSame(t, t.nest(2));
    assertEquals("x", t.toString());
    assertEquals("  x", t.nest(2).toString());
  }

  @Test public void testEquals() {
    assertEquals(Doc.text("a\nb"), Doc.vcat(Doc.text("a"),Doc.text("b")));
    assertEquals(Doc.text("  a"), Doc.text("a").nest(2));
    assertNotEquals(Doc.text("a"), Doc.text("a").nest(1));
  }

  @Test public void testSB() {
    SB sb = new SB().p("a, ").p("b, ").unchar(2);
    assertEquals("a, b", sb.toString());
    assertEquals("    x", new SB().ii(4).ip("x").toString());
    assertEquals("(1)", new SB().p('(').p(1).p(')').toString());
  }
}
