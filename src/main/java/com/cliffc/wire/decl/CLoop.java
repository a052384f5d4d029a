package com.cliffc.wire.decl;

import com.cliffc.wire.type.CType;

/** Canonical loopback declaration, consumed by code generation. */
public abstract class CLoop {
  public final String _name;
  CLoop( String name ) { _name=name; }

  // Feedback loop: a write-only mailbox paired with the stream it feeds
  public static final class MailboxLoop extends CLoop {
    public final CType _type;   // Declared type, unexpanded
    public MailboxLoop( String name, CType type ) { super(name); _type=type; }
    @Override public String toString() { return "mailbox "+_name+" : "+_type; }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      return o instanceof MailboxLoop m && _name.equals(m._name) && _type.equals(m._type);
    }
    @Override public int hashCode() { return _name.hashCode()*31+_type.hashCode(); }
  }

  // Stream of promises run by the host, results fed back as a stream
  public static final class PromiseLoop extends CLoop {
    public final CType _promise; // Stream (Promise x a)
    public final Expr _expr;     // Implementation
    public final CType _type;    // Declared type, Stream (Result x a) possibly aliased
    public PromiseLoop( String name, CType promise, Expr expr, CType type ) {
      super(name); _promise=promise; _expr=expr; _type=type;
    }
    @Override public String toString() { return "promise "+_name+" : "+_promise+" = "+_expr; }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      return o instanceof PromiseLoop p && _name.equals(p._name) && _promise.equals(p._promise) &&
        _expr==p._expr && _type.equals(p._type);
    }
    @Override public int hashCode() { return _name.hashCode()*31+_promise.hashCode(); }
  }
}
