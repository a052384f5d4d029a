package com.cliffc.wire;

import org.jetbrains.annotations.NotNull;

/** Outcome of checking one declaration: a value, or the first error found.
 *  Exactly one of the two is set; for a bare success the value is null. */
public final class Result<T> {
  private static final Result<Void> OK = new Result<>(null,null);

  public final T _val;
  public final ErrMsg _err;
  private Result( T val, ErrMsg err ) { _val=val; _err=err; }

  public static @NotNull Result<Void> ok() { return OK; }
  @NotNull public static <T> Result<T> ok( @NotNull T val ) { return new Result<>(val,null); }
  @NotNull public static <T> Result<T> err( @NotNull ErrMsg err ) { return new Result<>(null,err); }

  public boolean isOk() { return _err==null; }

  @Override public String toString() { return _err==null ? "ok "+_val : _err.toString(); }
}
