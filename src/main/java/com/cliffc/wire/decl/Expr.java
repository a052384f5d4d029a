package com.cliffc.wire.decl;

// Opaque handle on a canonicalized implementation expression; never inspected
// here, only carried through to code generation.
public final class Expr {
  public final String _src;     // Source text, for printing
  public Expr( String src ) { _src=src; }
  @Override public String toString() { return _src; }
}
