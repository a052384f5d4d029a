package com.cliffc.wire;

import com.cliffc.wire.type.CType;
import com.cliffc.wire.util.Doc;

// A loopback declaration matching neither loopback shape
public class LoopErr extends ErrMsg {
  public final CType _type;     // Declared type, unexpanded
  public final String[] _msg;   // Explanation lines

  LoopErr( String name, CType type, String... msg ) {
    super(name,Level.Loopback);
    _type=type; _msg=msg;
  }

  @Override public Doc doc() { return Diag.loopback(_name,_type,_msg); }
}
