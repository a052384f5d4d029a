package com.cliffc.wire;

/** Wire-type validation and loopback classification, run once per
 *  declaration during canonicalization.
 */
public abstract class Canon {
  public static RuntimeException unimpl( String msg ) { throw new RuntimeException(msg); }

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !Canon.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
