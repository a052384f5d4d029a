package com.cliffc.wire.decl;

import com.cliffc.wire.WireCheck.Dir;
import com.cliffc.wire.type.CType;

/** Declarations crossing the host boundary, as collected from one module. */
public abstract class Decl {
  public final String _name;
  public final CType _type;     // Canonical, post-inference
  Decl( String name, CType type ) { _name=name; _type=type; }

  // Named input or output port
  public static final class Port extends Decl {
    public final Dir _dir;
    public Port( Dir dir, String name, CType type ) { super(name,type); _dir=dir; }
    @Override public String toString() { return _dir._wire+" "+_name+" : "+_type; }
  }

  // Loopback, with an optional implementation
  public static final class Loop extends Decl {
    public final Expr _expr;    // Null for a mailbox loopback
    public Loop( String name, Expr expr, CType type ) { super(name,type); _expr=expr; }
    @Override public String toString() { return "loopback "+_name+" : "+_type+(_expr==null ? "" : " = "+_expr); }
  }
}
