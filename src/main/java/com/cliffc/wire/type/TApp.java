package com.cliffc.wire.type;

import com.cliffc.wire.util.SB;

import java.util.HashMap;

/** A type constructor applied to argument types, e.g. {@code List Int}.  Tuples
 *  are the builtin {@code _TupleN} constructor applied to N args. */
public class TApp extends CType {
  public final CType _fun;      // Constructor, normally a TNamed
  public final CType[] _args;
  public TApp( CType fun, CType... args ) { super(Kind.APP); _fun=fun; _args=args; }
  public TApp( Var fun, CType... args ) { this(new TNamed(fun),args); }
  public TApp( Builtin fun, CType... args ) { this(fun._var,args); }

  public static TApp tuple( CType... args ) { return new TApp(Var.tuple(args.length),args); }

  // The constructor identity, or null if the head is not a named constructor
  public Var head() { return _fun instanceof TNamed n ? n._var : null; }

  @Override CType subst( HashMap<String,CType> map ) { return new TApp(_fun.subst(map),subst(_args,map)); }
  @Override public CType deepDealias() { return new TApp(_fun.deepDealias(),deep(_args)); }

  @Override SB _str( SB sb, int prec ) {
    if( _args.length==0 ) return _fun._str(sb,prec);
    Var v = head();
    if( v!=null && v.tuple_arity()==_args.length ) {
      sb.p('(');
      for( CType t : _args ) t._str(sb,P_TOP).p(", ");
      return sb.unchar(2).p(')');
    }
    if( prec >= P_ARG ) sb.p('(');
    args(_fun._str(sb,P_ARG),_args);
    return prec >= P_ARG ? sb.p(')') : sb;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof TApp t && _fun.equals(t._fun) && eq(_args,t._args);
  }
  @Override public int hashCode() {
    int h = _fun.hashCode();
    for( CType t : _args ) h = h*31+t.hashCode();
    return h;
  }
}
