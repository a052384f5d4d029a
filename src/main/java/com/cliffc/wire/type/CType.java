package com.cliffc.wire.type;

import com.cliffc.wire.util.SB;

import java.util.HashMap;

/** Canonical types: fully resolved, post-inference types of declarations.
 *
 *  A closed recursive sum, tagged by {@link Kind}.  Checkers switch on the
 *  kind with switch expressions and no default, so adding a kind is a compile
 *  error until every checker handles it.  Values are immutable trees; they are
 *  built by the inference pass and only ever read here.
 *
 *  BNF for the pretty-printed types:
 *    T = Name                 | // Named constructor, e.g. Int or Http.Error
 *        Name T*              | // Applied constructor, e.g. List (Maybe Int)
 *        ( T, T* )            | // Tuple; () is unit
 *        var                  | // Free type variable
 *        T -> T               | // Curried function
 *        { (label : T,)* }    | // Closed record
 *        { var | (label : T,)* }// Extended record
 */
public abstract class CType {
  public enum Kind { ALIAS, NAMED, APP, VAR, LAMBDA, RECORD }

  // Printing precedence; parens are needed when a type prints inside a
  // context binding tighter than itself.
  static final int P_TOP=0, P_FUN=1, P_ARG=2;

  public final Kind _kind;
  CType( Kind kind ) { _kind=kind; }

  // Replace free type variables by name.  Used by alias expansion.
  abstract CType subst( HashMap<String,CType> map );

  /** @return this type with every alias at every depth expanded */
  public abstract CType deepDealias();

  abstract SB _str( SB sb, int prec );
  public SB str( SB sb ) { return _str(sb,P_TOP); }
  @Override public final String toString() { return str(new SB()).toString(); }

  // Shared by structural equality of the subclasses
  static boolean eq( CType[] ts0, CType[] ts1 ) {
    if( ts0.length != ts1.length ) return false;
    for( int i=0; i<ts0.length; i++ )
      if( !ts0[i].equals(ts1[i]) )
        return false;
    return true;
  }
  static CType[] subst( CType[] ts, HashMap<String,CType> map ) {
    CType[] rs = new CType[ts.length];
    for( int i=0; i<ts.length; i++ ) rs[i] = ts[i].subst(map);
    return rs;
  }
  static CType[] deep( CType[] ts ) {
    CType[] rs = new CType[ts.length];
    for( int i=0; i<ts.length; i++ ) rs[i] = ts[i].deepDealias();
    return rs;
  }
  // Space-separated args, as for an applied constructor or alias
  static SB args( SB sb, CType[] ts ) {
    for( CType t : ts ) t._str(sb.s(),P_ARG);
    return sb;
  }
}
