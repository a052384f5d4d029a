package com.cliffc.wire;

import com.cliffc.wire.decl.CLoop;
import com.cliffc.wire.decl.CLoop.MailboxLoop;
import com.cliffc.wire.decl.CLoop.PromiseLoop;
import com.cliffc.wire.decl.Expr;
import com.cliffc.wire.type.*;

/** Classifies loopback declarations.
 *
 *  Without an implementation the type must be a writable stream,
 *  {@code { mailbox : Mailbox a, stream : Stream a }}, and becomes a mailbox
 *  loopback.  With an implementation the type must be
 *  {@code Stream (Result x a)}, and becomes a promise loopback of type
 *  {@code Stream (Promise x a)}.  Both shapes are matched after expanding every
 *  alias.
 */
public abstract class Loopback {
  static final String[] WRITABLE = new String[]{
    "A loopback like this must be a WritableStream."
  };
  static final String[] PROMISE = new String[]{
    "A loopback that runs promises must be a stream of results.",
    "Something like the following:\n",
    "    Stream (Result Error Success)",
    "    Stream (Result x ())",
  };

  public static Result<CLoop> loopback( String name, Expr expr, CType tipe ) {
    CType t = tipe.deepDealias();
    if( expr==null ) {
      return mailbox(t)
        ? Result.ok(new MailboxLoop(name,tipe))
        : Result.err(new LoopErr(name,tipe,WRITABLE));
    }
    TApp promise = promise(t);
    return promise!=null
      ? Result.ok(new PromiseLoop(name,promise,expr,tipe))
      : Result.err(new LoopErr(name,tipe,PROMISE));
  }

  // { mailbox : Mailbox a, stream : Stream a }, fields in any order, no others
  private static boolean mailbox( CType t ) {
    if( !(t instanceof TRecord rec) || !rec.closed() || rec.len()!=2 ) return false;
    CType a = arg(rec.get("mailbox"),Builtin.MAILBOX);
    CType b = arg(rec.get("stream" ),Builtin.STREAM );
    return a!=null && a.equals(b);
  }

  // Stream (Result x a) becomes Stream (Promise x a), or null if no match
  private static TApp promise( CType t ) {
    CType res = arg(t,Builtin.STREAM);
    if( !(res instanceof TApp app) || app._args.length!=2 || app.head()==null || !app.head().isResult() )
      return null;
    TApp stream = (TApp)t;
    return new TApp(stream._fun,new TApp(Builtin.PROMISE,app._args));
  }

  // The single argument of constructor b, or null
  private static CType arg( CType t, Builtin b ) {
    if( !(t instanceof TApp app) || app._args.length!=1 || app.head()==null ) return null;
    return app.head().is(b) ? app._args[0] : null;
  }
}
