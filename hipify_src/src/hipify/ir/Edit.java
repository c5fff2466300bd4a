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

/**
 * A proposed replacement of one span of a file's original text. Edits are
 * immutable and always addressed against the untouched original buffer.
 */
public final class Edit
{
  private final String file;
  private final SourceSpan span;
  private final String newText;
  private final MatchKind origin;

  public Edit(String file, SourceSpan span, String newText, MatchKind origin)
  {
    if (file == null || span == null || newText == null || origin == null)
      throw new IllegalArgumentException("incomplete edit");
    this.file = file;
    this.span = span;
    this.newText = newText;
    this.origin = origin;
  }

  public String getFile()
  {
    return file;
  }

  public SourceSpan getSpan()
  {
    return span;
  }

  public String getNewText()
  {
    return newText;
  }

  public MatchKind getOrigin()
  {
    return origin;
  }

  /** True when <var>other</var> would write the same text over the same span. */
  public boolean isSameChange(Edit other)
  {
    return file.equals(other.file) && span.equals(other.span) && newText.equals(other.newText);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o)
      return true;
    if (!(o instanceof Edit))
      return false;
    Edit other = (Edit)o;
    return isSameChange(other) && origin == other.origin;
  }

  @Override
  public int hashCode()
  {
    int h = file.hashCode();
    h = 31 * h + span.hashCode();
    h = 31 * h + newText.hashCode();
    return 31 * h + origin.hashCode();
  }

  @Override
  public String toString()
  {
    return file + ":" + span + " -> \"" + newText + "\" (" + origin + ")";
  }
}
