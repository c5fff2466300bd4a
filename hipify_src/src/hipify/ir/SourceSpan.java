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
 * Half-open range [start, end) of character offsets into the original,
 * unedited text of one file.
 */
public final class SourceSpan implements Comparable<SourceSpan>
{
  private final int start;
  private final int end;

  public SourceSpan(int start, int end)
  {
    if (start < 0 || end < start)
      throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
    this.start = start;
    this.end = end;
  }

  public static SourceSpan ofLength(int start, int length)
  {
    return new SourceSpan(start, start + length);
  }

  public int getStart()
  {
    return start;
  }

  public int getEnd()
  {
    return end;
  }

  public int length()
  {
    return end - start;
  }

  public boolean isEmpty()
  {
    return start == end;
  }

  /**
   * Two spans overlap when they are identical or share at least one
   * character. An empty span overlaps a non-empty one only strictly
   * inside it.
   */
  public boolean overlaps(SourceSpan other)
  {
    if (equals(other))
      return true;
    return start < other.end && other.start < end;
  }

  public int compareTo(SourceSpan other)
  {
    if (start != other.start)
      return (start < other.start) ? -1 : 1;
    if (end != other.end)
      return (end < other.end) ? -1 : 1;
    return 0;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o)
      return true;
    if (!(o instanceof SourceSpan))
      return false;
    SourceSpan other = (SourceSpan)o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode()
  {
    return 31 * start + end;
  }

  @Override
  public String toString()
  {
    return "[" + start + ", " + end + ")";
  }
}
