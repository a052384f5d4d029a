package com.cliffc.wire;

import com.cliffc.wire.WireCheck.Dir;
import com.cliffc.wire.type.CType;
import com.cliffc.wire.util.Doc;

import java.util.ArrayList;

/** Diagnostic documents for wire and loopback errors.  Formatting only; the
 *  checkers decide what is wrong.
 *
 *  <pre>
 *  Output Error:
 *      The output named 'p' has an invalid type.
 *
 *          Stream (Int -> Int)
 *
 *      It is a stream that contains a function:
 *
 *          Int -> Int
 *
 *      Acceptable values for outputs include:
 *        ...
 *  </pre>
 */
public abstract class Diag {
  static final int NEST = 4;

  public static Doc wire( Dir dir, String name, CType root, CType local, String problem ) {
    String wire = dir._wire;
    return report(dir._title,
                  Doc.text("The ",wire," named '",name,"' has an invalid type.\n"),
                  type(root),
                  Doc.text(problem,":\n"),
                  type(local),
                  Doc.text("Acceptable values for ",wire,"s include:"),
                  Doc.text("  Ints, Floats, Bools, Strings, Maybes, Lists, Arrays, Tuples, unit values,"),
                  Doc.text("  Json.Values, ",dir==Dir.In ? "" : "first-order functions, promises, ","and concrete records."));
  }

  public static Doc loopback( String name, CType tipe, String... msg ) {
    ArrayList<Doc> docs = new ArrayList<>();
    docs.add(Doc.text("The loopback named '",name,"' has an invalid type.\n"));
    docs.add(type(tipe));
    for( String s : msg ) docs.add(Doc.text(s));
    return report("Loopback",docs.toArray(new Doc[0]));
  }

  // "Category Error:" heading over the nested body
  static Doc report( String category, Doc... body ) {
    return Doc.vcat(Doc.text(category+" Error:"), Doc.vcat(body).nest(NEST));
  }

  // A type on its own indented line, then a blank line
  static Doc type( CType t ) {
    return Doc.vcat(Doc.text(t.toString()).nest(NEST), Doc.text(""));
  }
}
