package com.cliffc.wire.util;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Immutable block of indented text lines.
 *  <p>
 *  A tiny pretty-printing document: {@link #text} makes lines (embedded
 *  newlines split), {@link #vcat} stacks documents, {@link #nest} shifts a
 *  document right.  Blank lines never carry indentation when rendered.
 */
public final class Doc {
  public static final Doc EMPTY = new Doc(new String[0],new int[0]);

  private final String[] _lines;
  private final int[] _indents; // Per-line indent, in spaces

  private Doc( String[] lines, int[] indents ) { _lines=lines; _indents=indents; }

  public static @NotNull Doc text( String s ) {
    String[] lines = s.split("\n",-1);
    return new Doc(lines,new int[lines.length]);
  }
  // Glue the strings together into a single text block
  public static @NotNull Doc text( String... ss ) { return text(String.join("",ss)); }

  public static @NotNull Doc vcat( Doc... docs ) { return vcat(Arrays.asList(docs)); }
  public static @NotNull Doc vcat( List<Doc> docs ) {
    int len=0;
    for( Doc d : docs ) len += d._lines.length;
    String[] lines = new String[len];
    int[] indents = new int[len];
    int i=0;
    for( Doc d : docs ) {
      System.arraycopy(d._lines  ,0,lines  ,i,d._lines.length);
      System.arraycopy(d._indents,0,indents,i,d._lines.length);
      i += d._lines.length;
    }
    return new Doc(lines,indents);
  }

  // Shift every line right by n spaces
  public @NotNull Doc nest( int n ) {
    int[] indents = _indents.clone();
    for( int i=0; i<indents.length; i++ ) indents[i] += n;
    return new Doc(_lines,indents);
  }

  public int len() { return _lines.length; }

  // Rendered lines, indentation included
  public List<String> lines() {
    String[] rs = new String[_lines.length];
    for( int i=0; i<_lines.length; i++ )
      rs[i] = _lines[i].isEmpty() ? "" : new SB().ii(_indents[i]).i().p(_lines[i]).toString();
    return Collections.unmodifiableList(Arrays.asList(rs));
  }

  public SB str( SB sb ) {
    for( String s : lines() ) sb.p(s).nl();
    return _lines.length==0 ? sb : sb.unchar();
  }

  @Override public String toString() { return str(new SB()).toString(); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Doc doc && lines().equals(doc.lines());
  }
  @Override public int hashCode() { return lines().hashCode(); }
}
