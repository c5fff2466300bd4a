//============================================================================//
//    FCUDA
//    Copyright (c) <2016> 
//    <University of Illinois at Urbana-Champaign>
//    <University of California at Los Angeles> 
//    All rights reserved.
// 
//    Developed by:
// 
//        <ES CAD Group & IMPACT Research Group>
//            <University of Illinois at Urbana-Champaign>
//            <http://dchen.ece.illinois.edu/>
//            <http://impact.crhc.illinois.edu/>
// 
//        <VAST Laboratory>
//            <University of California at Los Angeles>
//            <http://vast.cs.ucla.edu/>
// 
//        <Hardware Research Group>
//            <Advanced Digital Sciences Center>
//            <http://adsc.illinois.edu/>
//============================================================================//

package hipify.ir;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

/**
 * The path and original text of one file under translation. The text is
 * the buffer every span of a pass refers to and is never modified; edits
 * are only materialized by the source rewriter.
 */
public final class SourceFile
{
  private final String path;
  private final String text;

  public SourceFile(String path, String text)
  {
    if (path == null || text == null)
      throw new IllegalArgumentException("source file needs a path and a text");
    this.path = path;
    this.text = text;
  }

  public static SourceFile read(String path) throws IOException
  {
    byte[] bytes = Files.readAllBytes(Paths.get(path));
    return new SourceFile(path, new String(bytes, StandardCharsets.UTF_8));
  }

  public String getPath()
  {
    return path;
  }

  public String getText()
  {
    return text;
  }

  public int length()
  {
    return text.length();
  }

  /** Returns the original text covered by <var>span</var>. */
  public String getText(SourceSpan span)
  {
    if (span.getEnd() > text.length())
      throw new IllegalArgumentException("span " + span + " outside of " + path
          + " (" + text.length() + " characters)");
    return text.substring(span.getStart(), span.getEnd());
  }

  /** 1-based line number of <var>offset</var>, for diagnostics. */
  public int getLine(int offset)
  {
    int line = 1;
    int limit = Math.min(offset, text.length());
    for (int i = 0; i < limit; i++)
      if (text.charAt(i) == '\n')
        line++;
    return line;
  }

  @Override
  public String toString()
  {
    return path;
  }
}
