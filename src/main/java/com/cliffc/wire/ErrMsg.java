package com.cliffc.wire;

import com.cliffc.wire.util.Doc;

// Error messages, one per failing declaration
public abstract class ErrMsg implements Comparable<ErrMsg> {

  // Error levels
  public enum Level {
    Port,                     // Input and output port types
    Loopback,                 // Loopback shapes
  }

  public final String _name;  // Declaration to blame
  public final Level _lvl;    // Priority for printing
  public int _order;          // Message order as they are found.
  ErrMsg( String name, Level lvl ) { _name=name; _lvl=lvl; }

  // Complete printable diagnostic
  public abstract Doc doc();

  @Override public String toString() { return doc().toString(); }
  @Override public int compareTo(ErrMsg msg) {
    int cmp = _lvl.compareTo(msg._lvl);
    if( cmp != 0 ) return cmp;
    return _order - msg._order;
  }
  @Override public boolean equals(Object obj) {
    if( this==obj ) return true;
    if( !(obj instanceof ErrMsg err) ) return false;
    return _lvl==err._lvl && _name.equals(err._name) && doc().equals(err.doc());
  }
  @Override public int hashCode() {
    return _name.hashCode()+_lvl.hashCode();
  }
}
