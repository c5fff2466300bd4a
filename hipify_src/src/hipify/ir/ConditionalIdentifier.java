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
 * An identifier tested by a conditional directive, e.g. the
 * <code>__CUDACC__</code> of <code>#ifdef __CUDACC__</code>.
 */
public final class ConditionalIdentifier extends MatchResult
{
  private final String name;
  private final String directive;
  private final SourceSpan span;
  private final boolean writtenInMainFile;

  public ConditionalIdentifier(String file, String name, String directive, SourceSpan span,
      boolean writtenInMainFile)
  {
    super(file);
    this.name = name;
    this.directive = directive;
    this.span = span;
    this.writtenInMainFile = writtenInMainFile;
  }

  public String getName()
  {
    return name;
  }

  /** The directive keyword: if, ifdef, ifndef or elif. */
  public String getDirective()
  {
    return directive;
  }

  public boolean isWrittenInMainFile()
  {
    return writtenInMainFile;
  }

  public MatchKind getKind()
  {
    return MatchKind.CONDITIONAL_IDENTIFIER;
  }

  public SourceSpan getSpan()
  {
    return span;
  }

  public <R> R accept(MatchVisitor<R> visitor)
  {
    return visitor.visit(this);
  }

  public String describe()
  {
    return name + " in #" + directive;
  }
}
