package com.cliffc.wire.type;

import com.cliffc.wire.util.SB;

import java.util.ArrayList;
import java.util.HashMap;

// Curried function type, one argument at a time
public class TLambda extends CType {
  public final CType _arg, _ret;
  public TLambda( CType arg, CType ret ) { super(Kind.LAMBDA); _arg=arg; _ret=ret; }

  // Right-nested arrow from a list: fun(a,b,c) is a -> b -> c
  public static TLambda fun( CType... ts ) {
    assert ts.length >= 2;
    CType t = ts[ts.length-1];
    for( int i=ts.length-2; i>=0; i-- ) t = new TLambda(ts[i],t);
    return (TLambda)t;
  }

  /** Flatten the curried arrow.  Only direct arrows in the result position are
   *  flattened; an alias of a function in result position is left whole.
   *  @return argument types in order, then the final result type */
  public ArrayList<CType> collect() {
    ArrayList<CType> ts = new ArrayList<>();
    CType t = this;
    while( t instanceof TLambda lam ) { ts.add(lam._arg); t = lam._ret; }
    ts.add(t);
    return ts;
  }

  @Override CType subst( HashMap<String,CType> map ) { return new TLambda(_arg.subst(map),_ret.subst(map)); }
  @Override public CType deepDealias() { return new TLambda(_arg.deepDealias(),_ret.deepDealias()); }

  @Override SB _str( SB sb, int prec ) {
    if( prec >= P_FUN ) sb.p('(');
    _ret._str(_arg._str(sb,P_FUN).p(" -> "),P_TOP);
    return prec >= P_FUN ? sb.p(')') : sb;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof TLambda t && _arg.equals(t._arg) && _ret.equals(t._ret);
  }
  @Override public int hashCode() { return _arg.hashCode()*37+_ret.hashCode(); }
}
