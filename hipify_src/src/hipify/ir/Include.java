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
 * An <code>#include</code> directive. The span covers the file name
 * together with its delimiters, <code>&lt;cuda_runtime.h&gt;</code> or
 * <code>"kernels.cuh"</code>.
 */
public final class Include extends MatchResult
{
  private final String targetName;
  private final boolean angled;
  private final SourceSpan span;
  private final boolean writtenInMainFile;

  public Include(String file, String targetName, boolean angled, SourceSpan span,
      boolean writtenInMainFile)
  {
    super(file);
    this.targetName = targetName;
    this.angled = angled;
    this.span = span;
    this.writtenInMainFile = writtenInMainFile;
  }

  public String getTargetName()
  {
    return targetName;
  }

  public boolean isAngled()
  {
    return angled;
  }

  public boolean isWrittenInMainFile()
  {
    return writtenInMainFile;
  }

  public MatchKind getKind()
  {
    return MatchKind.INCLUDE;
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
    return angled ? "<" + targetName + ">" : "\"" + targetName + "\"";
  }
}
