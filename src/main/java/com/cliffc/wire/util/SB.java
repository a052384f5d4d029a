package com.cliffc.wire.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB(String s) { _sb = new StringBuilder(s); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally call the Object
  // version with a String.
  public SB pobj( Object s ) { _sb.append(s.toString()); return this; }
  // Indent by the current indent level, in single spaces
  public SB i( int d ) { for( int i=0; i<d+_indent; i++ ) p(' '); return this; }
  public SB i( ) { return i(0); }
  public SB ip(String s) { return i().p(s); }
  public SB s() { _sb.append(' '); return this; }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }

  public SB nl( ) { return p('\n'); }

  // Delete last char.  Useful when doing string-joins and JSON printing and an
  // extra separator char needs to be removed.
  public SB unchar() { return unchar(1); }
  public SB unchar(int x) { _sb.setLength(_sb.length()-x); return this; }

  @Override public String toString() { return _sb.toString(); }
}
