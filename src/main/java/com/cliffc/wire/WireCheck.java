package com.cliffc.wire;

import com.cliffc.wire.WireErr.Reason;
import com.cliffc.wire.type.*;

/** Checks that a port type can cross the boundary between the host runtime and
 *  managed code.
 *
 *  Wire types are primitives, JSON values, tuples (unit included), Maybes,
 *  Lists, Arrays and closed records of wire types.  Outputs may also carry
 *  first-order functions.  A single Stream or Varying wrapper is allowed at the
 *  outermost position only, and never around a function.
 *
 *  The walk is depth-first and left-to-right, and stops at the first failing
 *  node; that node is the subtype named in the error.
 */
public final class WireCheck {

  // Port direction
  public enum Dir {
    In ("Input" ,"input" ),
    Out("Output","output");
    public final String _title, _wire;
    Dir( String title, String wire ) { _title=title; _wire=wire; }
  }

  // Outermost signal wrapper, if any
  enum Signal {
    Stream (Reason.STREAM_FUNC ),
    Varying(Reason.VARYING_FUNC);
    final Reason _func;         // Reason when wrapping a function
    Signal( Reason func ) { _func=func; }
  }

  private final Dir _dir;
  private final String _name;
  private final CType _root;    // Declared type, for error context
  private WireCheck( Dir dir, String name, CType root ) { _dir=dir; _name=name; _root=root; }

  public static Result<Void> checkInput ( String name, CType tipe ) { return check(Dir.In ,name,tipe); }
  public static Result<Void> checkOutput( String name, CType tipe ) { return check(Dir.Out,name,tipe); }
  public static Result<Void> check( Dir dir, String name, CType tipe ) {
    WireErr err = new WireCheck(dir,name,tipe).top(tipe);
    return err==null ? Result.ok() : Result.err(err);
  }

  // Expand top-level aliases, then peel at most one signal wrapper
  private WireErr top( CType t ) {
    while( t instanceof TAlias ali ) t = ali.dealias();
    if( t instanceof TApp app && app._args.length==1 && app.head()!=null ) {
      Var v = app.head();
      if( v.isStream () ) return valid(false,Signal.Stream ,app._args[0]);
      if( v.isVarying() ) return valid(false,Signal.Varying,app._args[0]);
    }
    return valid(false,null,t);
  }

  // Null if valid, or the first failure
  private WireErr valid( boolean seenFunc, Signal seenSignal, CType t ) {
    return switch( t._kind ) {
    case ALIAS  -> valid(seenFunc,seenSignal,((TAlias)t).dealias());
    case NAMED  -> {
      Var v = ((TNamed)t)._var;
      yield v.isJson() || v.isPrimitive() || v.isTuple() ? null : err(t,Reason.UNSUPPORTED);
    }
    case APP    -> app   (seenFunc,seenSignal,(TApp)t);
    case VAR    -> err(t,Reason.FREE_VAR);
    case LAMBDA -> lambda(seenFunc,seenSignal,(TLambda)t);
    case RECORD -> record(seenFunc,seenSignal,(TRecord)t);
    };
  }

  private WireErr app( boolean seenFunc, Signal seenSignal, TApp app ) {
    if( app._args.length==0 ) return valid(seenFunc,seenSignal,app._fun);
    Var v = app.head();
    if( v==null ) return err(app,Reason.UNSUPPORTED);
    if( app._args.length==1 && (v.isMaybe() || v.isArray() || v.isList()) )
      return valid(seenFunc,seenSignal,app._args[0]);
    if( v.isTuple() ) return all(seenFunc,seenSignal,app._args);
    // Nested signals, Results, user containers
    return err(app,Reason.UNSUPPORTED);
  }

  private WireErr lambda( boolean seenFunc, Signal seenSignal, TLambda lam ) {
    if( _dir==Dir.In ) return err(lam,Reason.FUNCTIONS);
    if( seenFunc ) return err(lam,Reason.HIGHER_ORDER);
    if( seenSignal!=null ) return err(lam,seenSignal._func);
    // First-order: no argument nor the result may itself be a function
    for( CType t : lam.collect() ) {
      WireErr err = valid(true,seenSignal,t);
      if( err!=null ) return err;
    }
    return null;
  }

  private WireErr record( boolean seenFunc, Signal seenSignal, TRecord rec ) {
    if( !rec.closed() ) return err(rec,Reason.EXT_RECORD);
    return all(seenFunc,seenSignal,rec._types);
  }

  // In order; first failure wins
  private WireErr all( boolean seenFunc, Signal seenSignal, CType[] ts ) {
    for( CType t : ts ) {
      WireErr err = valid(seenFunc,seenSignal,t);
      if( err!=null ) return err;
    }
    return null;
  }

  private WireErr err( CType local, Reason reason ) {
    return new WireErr(_name,_dir,_root,local,reason);
  }
}
