package com.cliffc.wire;

import com.cliffc.wire.WireCheck.Dir;
import com.cliffc.wire.type.CType;
import com.cliffc.wire.util.Doc;

/** A port whose type cannot cross the boundary.  Carries the whole root type
 *  and the subtype whose own rule failed, so the diagnostic is rendered
 *  without re-walking the type. */
public class WireErr extends ErrMsg {

  // Why the offending subtype was rejected
  public enum Reason {
    UNSUPPORTED ("It contains an unsupported type"),
    FREE_VAR    ("It contains a free type variable"),
    FUNCTIONS   ("It contains functions"),
    HIGHER_ORDER("It contains higher-order functions"),
    STREAM_FUNC ("It is a stream that contains a function"),
    VARYING_FUNC("It is a varying value that contains a function"),
    EXT_RECORD  ("It contains extended records with free type variables");
    public final String _msg;
    Reason( String msg ) { _msg=msg; }
  }

  public final Dir _dir;
  public final CType _root;     // Declared type
  public final CType _local;    // Offending subtype
  public final Reason _reason;

  WireErr( String name, Dir dir, CType root, CType local, Reason reason ) {
    super(name,Level.Port);
    _dir=dir; _root=root; _local=local; _reason=reason;
  }

  @Override public Doc doc() { return Diag.wire(_dir,_name,_root,_local,_reason._msg); }
}
