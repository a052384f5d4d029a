package com.cliffc.wire.type;

import org.jetbrains.annotations.NotNull;

/** Canonical identity of a type constructor: a home module plus a local name.
 *  Builtins have an empty home.  Identity is both parts, so a user type named
 *  "Stream" in module "Foo" is never the well-known Stream.
 */
public final class Var {
  public static final String BUILTIN = "";
  public static final String TUPLE = "_Tuple";

  public final String _home;    // Dotted module path, or BUILTIN
  public final String _name;    // Local name

  private Var( String home, String name ) { _home=home; _name=name; }

  public static @NotNull Var builtin( String name ) { return new Var(BUILTIN,name); }
  public static @NotNull Var fromModule( String home, String name ) {
    assert !home.isEmpty() : "use builtin() for "+name;
    return new Var(home,name);
  }
  // The N-tuple constructor; the 0-tuple is unit
  public static @NotNull Var tuple( int n ) { return builtin(TUPLE+n); }

  public boolean is_builtin() { return _home.isEmpty(); }
  public boolean is( Builtin b ) { return b._var.equals(this); }

  public boolean isPrimitive() { return is(Builtin.INT) || is(Builtin.FLOAT) || is(Builtin.BOOL) || is(Builtin.STRING); }
  public boolean isJson     () { return is(Builtin.JSON_ENCODE) || is(Builtin.JSON_DECODE); }
  public boolean isMaybe    () { return is(Builtin.MAYBE  ); }
  public boolean isArray    () { return is(Builtin.ARRAY  ); }
  public boolean isList     () { return is(Builtin.LIST   ); }
  public boolean isStream   () { return is(Builtin.STREAM ); }
  public boolean isVarying  () { return is(Builtin.VARYING); }
  public boolean isMailbox  () { return is(Builtin.MAILBOX); }
  public boolean isResult   () { return is(Builtin.RESULT ); }
  public boolean isTuple    () { return tuple_arity() >= 0; }

  // Arity of a builtin tuple constructor, or -1 if not a tuple
  public int tuple_arity() {
    if( !is_builtin() || !_name.startsWith(TUPLE) || _name.length()==TUPLE.length() ) return -1;
    int n=0;
    for( int i=TUPLE.length(); i<_name.length(); i++ ) {
      char c = _name.charAt(i);
      if( c<'0' || c>'9' ) return -1;
      n = n*10+(c-'0');
    }
    return n;
  }

  // Builtins and well-known constructors print by local name, all others are
  // qualified by their home module.
  @Override public String toString() {
    if( tuple_arity()==0 ) return "()";
    return is_builtin() || Builtin.find(this)!=null ? _name : _home+"."+_name;
  }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Var v && _home.equals(v._home) && _name.equals(v._name);
  }
  @Override public int hashCode() { return _home.hashCode()*31+_name.hashCode(); }
}
