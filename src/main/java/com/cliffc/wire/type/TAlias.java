package com.cliffc.wire.type;

import com.cliffc.wire.util.SB;

import java.util.HashMap;

/** Use of a type alias: the alias name, its arguments, and the alias body
 *  written over the alias parameters.  E.g. given
 *  {@code type alias Pair a = (a, a)}, the use {@code Pair Int} is
 *  {@code TAlias(Pair, [a], [Int], (a, a))}.
 *  <p>
 *  Alias bodies are attached as values, so an alias can only refer to aliases
 *  built before it; a finite tree always finishes expanding.
 */
public class TAlias extends CType {
  public final Var _alias;
  public final String[] _params; // Alias parameter names, as used in the body
  public final CType[] _args;    // Arguments, parallel to params
  public final CType _body;

  public TAlias( Var alias, String[] params, CType[] args, CType body ) {
    super(Kind.ALIAS);
    assert params.length==args.length;
    _alias=alias; _params=params; _args=args; _body=body;
  }
  // Zero-parameter alias
  public TAlias( Var alias, CType body ) { this(alias,new String[0],new CType[0],body); }

  /** One level of expansion: the body with the arguments substituted for the
   *  parameters.  The result may itself be an alias. */
  public CType dealias() {
    if( _params.length==0 ) return _body;
    HashMap<String,CType> map = new HashMap<>();
    for( int i=0; i<_params.length; i++ ) map.put(_params[i],_args[i]);
    return _body.subst(map);
  }

  // Arguments are substituted, the body is closed over the params
  @Override CType subst( HashMap<String,CType> map ) { return new TAlias(_alias,_params,subst(_args,map),_body); }
  @Override public CType deepDealias() { return dealias().deepDealias(); }

  @Override SB _str( SB sb, int prec ) {
    if( _args.length==0 ) return sb.pobj(_alias);
    if( prec >= P_ARG ) sb.p('(');
    args(sb.pobj(_alias),_args);
    return prec >= P_ARG ? sb.p(')') : sb;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof TAlias t && _alias.equals(t._alias) && eq(_args,t._args) && _body.equals(t._body);
  }
  @Override public int hashCode() {
    int h = _alias.hashCode();
    for( CType t : _args ) h = h*31+t.hashCode();
    return h;
  }
}
