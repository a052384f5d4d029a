package com.cliffc.wire.type;

// Well-known constructor identities.  Closed set; the wire and loopback rules
// only ever compare against these.
public enum Builtin {
  INT        (Var.builtin("Int"   )),
  FLOAT      (Var.builtin("Float" )),
  BOOL       (Var.builtin("Bool"  )),
  STRING     (Var.builtin("String")),
  LIST       (Var.builtin("List"  )),
  JSON_ENCODE(Var.fromModule("Json.Encode","Value")),
  JSON_DECODE(Var.fromModule("Json.Decode","Value")),
  MAYBE      (Var.fromModule("Maybe"  ,"Maybe"  )),
  ARRAY      (Var.fromModule("Array"  ,"Array"  )),
  STREAM     (Var.fromModule("Stream" ,"Stream" )),
  VARYING    (Var.fromModule("Varying","Varying")),
  MAILBOX    (Var.fromModule("Mailbox","Mailbox")),
  RESULT     (Var.fromModule("Result" ,"Result" )),
  PROMISE    (Var.fromModule("Promise","Promise"));

  public final Var _var;
  Builtin( Var var ) { _var=var; }

  // Named reference to this constructor
  public TNamed type() { return new TNamed(_var); }

  public static Builtin find( Var v ) {
    for( Builtin b : values() )
      if( b._var.equals(v) )
        return b;
    return null;
  }
}
