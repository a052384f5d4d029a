package com.cliffc.wire;

import com.cliffc.wire.decl.CLoop;
import com.cliffc.wire.decl.Decl;
import com.cliffc.wire.decl.Decl.Loop;
import com.cliffc.wire.decl.Decl.Port;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Checks every boundary declaration of a module.
 *
 *  Declarations are independent: each gets at most one error, and a failing
 *  declaration does not stop the others being checked.  The module is
 *  rejected as a whole if any declaration failed.
 */
public abstract class Canonicalize {

  // Results for one module
  public static class ModEnv {
    public final String _module;
    public final ArrayList<CLoop> _loops;  // Canonical loopbacks, declaration order
    public final ArrayList<ErrMsg> _errs;  // Errors sorted by level then order, or null
    ModEnv( String module, ArrayList<CLoop> loops, ArrayList<ErrMsg> errs ) {
      _module=module; _loops=loops; _errs=errs;
    }
    public boolean ok() { return _errs==null; }
    @Override public String toString() {
      return _module+(ok() ? ": "+_loops : ": "+_errs.size()+" errors");
    }
  }

  public static ModEnv go( String module, Decl... decls ) { return go(module,Arrays.asList(decls)); }
  public static ModEnv go( String module, List<Decl> decls ) {
    ArrayList<CLoop> loops = new ArrayList<>();
    ArrayList<ErrMsg> errs = new ArrayList<>();
    for( Decl d : decls ) {
      ErrMsg err;
      if( d instanceof Port port ) {
        err = WireCheck.check(port._dir,port._name,port._type)._err;
      } else if( d instanceof Loop loop ) {
        Result<CLoop> rez = Loopback.loopback(loop._name,loop._expr,loop._type);
        if( rez.isOk() ) loops.add(rez._val);
        err = rez._err;
      } else throw Canon.unimpl("unknown declaration "+d);
      if( err != null ) {
        err._order = errs.size();
        errs.add(err);
      }
    }
    Collections.sort(errs);
    ModEnv env = new ModEnv(module,loops,errs.isEmpty() ? null : errs);
    return Canon.p(env,"Canonicalize "+module+": "+decls.size()+" decls, "+errs.size()+" errors");
  }
}
