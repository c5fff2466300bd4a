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
 * One recognized construct occurrence in a file. A match only carries the
 * spans and the literal text captured from the source, never a reference
 * into the front end's data structures.
 */
public abstract class MatchResult
{
  private final String file;

  protected MatchResult(String file)
  {
    if (file == null)
      throw new IllegalArgumentException("match without a file");
    this.file = file;
  }

  /** Path of the file the match was found in. */
  public String getFile()
  {
    return file;
  }

  public abstract MatchKind getKind();

  /** The span a log line points at. */
  public abstract SourceSpan getSpan();

  public abstract <R> R accept(MatchVisitor<R> visitor);

  /** Short human readable description of the captured text. */
  public abstract String describe();

  @Override
  public String toString()
  {
    return getKind() + " " + describe() + " at " + file + getSpan();
  }
}
