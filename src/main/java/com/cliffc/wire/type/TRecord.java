package com.cliffc.wire.type;

import com.cliffc.wire.util.SB;

import java.util.Arrays;
import java.util.HashMap;

import static com.cliffc.wire.Canon.unimpl;

/** Record type with fields in declaration order, and an optional extension
 *  variable for row-polymorphic records: {@code { r | x : Int }}.
 *  Field order is kept for checking and printing; equality ignores it.
 */
public class TRecord extends CType {
  public final String[] _flds;  // Field labels, declaration order
  public final CType[] _types;  // Field types, parallel to labels
  public final TVar _ext;       // Extension variable, or null if closed

  public TRecord( String[] flds, CType[] types, TVar ext ) {
    super(Kind.RECORD);
    assert flds.length==types.length;
    _flds=flds; _types=types; _ext=ext;
  }
  public TRecord( String[] flds, CType[] types ) { this(flds,types,null); }

  public int len() { return _flds.length; }
  public boolean closed() { return _ext==null; }

  // Field index by label, or -1
  public int find( String fld ) {
    for( int i=0; i<_flds.length; i++ ) if( _flds[i].equals(fld) ) return i;
    return -1;
  }
  // Field type by label, or null
  public CType get( String fld ) {
    int idx = find(fld);
    return idx== -1 ? null : _types[idx];
  }

  // Substituting the extension by a record merges its fields in after ours;
  // by a variable just renames the extension.
  @Override CType subst( HashMap<String,CType> map ) {
    CType[] types = subst(_types,map);
    if( _ext==null ) return new TRecord(_flds,types);
    CType ext = _ext.subst(map);
    while( ext instanceof TAlias ali ) ext = ali.dealias();
    if( ext instanceof TVar tv ) return new TRecord(_flds,types,tv);
    if( !(ext instanceof TRecord rec) ) throw unimpl("record extended by "+ext);
    String[] flds = Arrays.copyOf(_flds,_flds.length+rec._flds.length);
    System.arraycopy(rec._flds,0,flds,_flds.length,rec._flds.length);
    CType[] ts = Arrays.copyOf(types,types.length+rec._types.length);
    System.arraycopy(rec._types,0,ts,types.length,rec._types.length);
    return new TRecord(flds,ts,rec._ext);
  }
  @Override public CType deepDealias() { return new TRecord(_flds,deep(_types),_ext); }

  @Override SB _str( SB sb, int prec ) {
    if( _flds.length==0 && _ext==null ) return sb.p("{}");
    sb.p("{ ");
    if( _ext!=null ) _ext._str(sb,P_TOP).p(" | ");
    for( int i=0; i<_flds.length; i++ )
      _types[i]._str(sb.p(_flds[i]).p(" : "),P_TOP).p(", ");
    if( _flds.length>0 ) sb.unchar(2).p(' ');
    return sb.p('}');
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof TRecord rec) ) return false;
    if( _flds.length != rec._flds.length ) return false;
    if( _ext==null ? rec._ext!=null : !_ext.equals(rec._ext) ) return false;
    for( int i=0; i<_flds.length; i++ )
      if( !_types[i].equals(rec.get(_flds[i])) )
        return false;
    return true;
  }
  @Override public int hashCode() {
    int h = _ext==null ? 0 : _ext.hashCode();
    for( int i=0; i<_flds.length; i++ ) h += _flds[i].hashCode() ^ _types[i].hashCode();
    return h;
  }
}
