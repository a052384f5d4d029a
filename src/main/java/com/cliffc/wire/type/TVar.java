package com.cliffc.wire.type;

import com.cliffc.wire.util.SB;

import java.util.HashMap;

// Free (unbound) type variable
public class TVar extends CType {
  public final String _name;
  public TVar( String name ) { super(Kind.VAR); _name=name; }

  @Override CType subst( HashMap<String,CType> map ) { return map.getOrDefault(_name,this); }
  @Override public CType deepDealias() { return this; }
  @Override SB _str( SB sb, int prec ) { return sb.p(_name); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof TVar t && _name.equals(t._name);
  }
  @Override public int hashCode() { return _name.hashCode(); }
}
