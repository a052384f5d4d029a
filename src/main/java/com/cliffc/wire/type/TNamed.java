package com.cliffc.wire.type;

import com.cliffc.wire.util.SB;

import java.util.HashMap;

// Zero-arity use of a builtin or user type constructor
public class TNamed extends CType {
  public final Var _var;
  public TNamed( Var var ) { super(Kind.NAMED); _var=var; }

  @Override CType subst( HashMap<String,CType> map ) { return this; }
  @Override public CType deepDealias() { return this; }
  @Override SB _str( SB sb, int prec ) { return sb.pobj(_var); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof TNamed t && _var.equals(t._var);
  }
  @Override public int hashCode() { return _var.hashCode(); }
}
