package com.cliffc.wire;

import com.cliffc.wire.decl.CLoop;
import com.cliffc.wire.decl.CLoop.MailboxLoop;
import com.cliffc.wire.decl.CLoop.PromiseLoop;
import com.cliffc.wire.decl.Expr;
import com.cliffc.wire.type.*;
import org.junit.Test;

import static com.cliffc.wire.Loopback.loopback;
import static org.junit.Assert.*;

public class TestLoopback {
  static final CType INT = Builtin.INT   .type();
  static final CType STR = Builtin.STRING.type();
  static final CType ERR = new TNamed(Var.fromModule("Http","Error"));
  static final Expr EXPR = new Expr("Http.send requests");

  static CType app( Builtin b, CType... ts ) { return new TApp(b,ts); }
  static TRecord writable( CType a, CType b ) {
    return new TRecord(new String[]{"mailbox","stream"},new CType[]{app(Builtin.MAILBOX,a),app(Builtin.STREAM,b)});
  }

  @Test public void testMailbox() {
    TRecord t = writable(INT,INT);
    Result<CLoop> rez = loopback("m",null,t);
    assertTrue(rez.isOk());
    assertEquals(new MailboxLoop("m",t), rez._val);
    // Field order does not matter
    TRecord swap = new TRecord(new String[]{"stream","mailbox"},new CType[]{app(Builtin.STREAM,STR),app(Builtin.MAILBOX,STR)});
    assertTrue(loopback("m",null,swap).isOk());
    // Inner types compare structurally
    CType pair = TApp.tuple(INT,app(Builtin.LIST,STR));
    assertTrue(loopback("m",null,writable(pair,TApp.tuple(INT,app(Builtin.LIST,STR)))).isOk());
  }

  @Test public void testMailboxAlias() {
    // type alias Writable a = { mailbox : Mailbox a, stream : Stream a }
    TVar a = new TVar("a");
    TAlias t = new TAlias(Var.fromModule("Main","Writable"),new String[]{"a"},new CType[]{INT},writable(a,a));
    Result<CLoop> rez = loopback("m",null,t);
    assertTrue(rez.isOk());
    // Keeps the declared type, not the expansion
    assertSame(t, ((MailboxLoop)rez._val)._type);
    // Aliases inside the fields expand too
    TAlias id = new TAlias(Var.fromModule("Main","Id"),INT);
    assertTrue(loopback("m",null,writable(id,INT)).isOk());
  }

  @Test public void testMailboxMismatch() {
    Result<CLoop> rez = loopback("m",null,writable(INT,STR));
    assertFalse(rez.isOk());
    assertTrue(rez._err instanceof LoopErr);
    assertEquals("Loopback Error:\n" +
                 "    The loopback named 'm' has an invalid type.\n" +
                 "\n" +
                 "        { mailbox : Mailbox Int, stream : Stream String }\n" +
                 "\n" +
                 "    A loopback like this must be a WritableStream.",
                 rez._err.toString());
  }

  @Test public void testMailboxShapes() {
    // Extra field
    TRecord extra = new TRecord(new String[]{"mailbox","stream","x"},
                                new CType[]{app(Builtin.MAILBOX,INT),app(Builtin.STREAM,INT),INT});
    assertFalse(loopback("m",null,extra).isOk());
    // Open record
    TRecord open = new TRecord(new String[]{"mailbox","stream"},
                               new CType[]{app(Builtin.MAILBOX,INT),app(Builtin.STREAM,INT)},new TVar("r"));
    assertFalse(loopback("m",null,open).isOk());
    // Wrong field names
    TRecord names = new TRecord(new String[]{"box","stream"},new CType[]{app(Builtin.MAILBOX,INT),app(Builtin.STREAM,INT)});
    assertFalse(loopback("m",null,names).isOk());
    // Look-alike Mailbox
    TRecord fake = new TRecord(new String[]{"mailbox","stream"},
                               new CType[]{new TApp(Var.fromModule("Foo","Mailbox"),INT),app(Builtin.STREAM,INT)});
    assertFalse(loopback("m",null,fake).isOk());
    // Varying instead of Stream
    TRecord vary = new TRecord(new String[]{"mailbox","stream"},new CType[]{app(Builtin.MAILBOX,INT),app(Builtin.VARYING,INT)});
    assertFalse(loopback("m",null,vary).isOk());
    // Not a record at all
    assertFalse(loopback("m",null,INT).isOk());
  }

  @Test public void testPromise() {
    CType t = app(Builtin.STREAM,app(Builtin.RESULT,ERR,STR));
    Result<CLoop> rez = loopback("r",EXPR,t);
    assertTrue(rez.isOk());
    PromiseLoop p = (PromiseLoop)rez._val;
    assertEquals("r", p._name);
    assertEquals(app(Builtin.STREAM,app(Builtin.PROMISE,ERR,STR)), p._promise);
    assertEquals("Stream (Promise Http.Error String)", p._promise.toString());
    assertSame(EXPR, p._expr);
    assertSame(t, p._type);
    assertEquals(new PromiseLoop("r",app(Builtin.STREAM,app(Builtin.PROMISE,ERR,STR)),EXPR,t), p);
    // Unit success type
    assertTrue(loopback("r",EXPR,app(Builtin.STREAM,app(Builtin.RESULT,new TVar("x"),TApp.tuple()))).isOk());
  }

  @Test public void testPromiseAlias() {
    // type alias Response = Result Http.Error String
    TAlias resp = new TAlias(Var.fromModule("Main","Response"),app(Builtin.RESULT,ERR,STR));
    Result<CLoop> rez = loopback("r",EXPR,app(Builtin.STREAM,resp));
    assertTrue(rez.isOk());
    assertEquals(app(Builtin.STREAM,app(Builtin.PROMISE,ERR,STR)), ((PromiseLoop)rez._val)._promise);
    assertEquals(app(Builtin.STREAM,resp), ((PromiseLoop)rez._val)._type);
  }

  @Test public void testPromiseShapes() {
    Result<CLoop> rez = loopback("r",EXPR,INT);
    assertFalse(rez.isOk());
    assertEquals("Loopback Error:\n" +
                 "    The loopback named 'r' has an invalid type.\n" +
                 "\n" +
                 "        Int\n" +
                 "\n" +
                 "    A loopback that runs promises must be a stream of results.\n" +
                 "    Something like the following:\n" +
                 "\n" +
                 "        Stream (Result Error Success)\n" +
                 "        Stream (Result x ())",
                 rez._err.toString());
    assertFalse(loopback("r",EXPR,app(Builtin.STREAM,app(Builtin.RESULT,STR))).isOk());
    assertFalse(loopback("r",EXPR,app(Builtin.VARYING,app(Builtin.RESULT,ERR,STR))).isOk());
    assertFalse(loopback("r",EXPR,app(Builtin.RESULT,ERR,STR)).isOk());
    assertFalse(loopback("r",EXPR,app(Builtin.STREAM,STR)).isOk());
    // A writable stream with an implementation is the wrong shape
    assertFalse(loopback("r",EXPR,writable(INT,INT)).isOk());
  }
}
