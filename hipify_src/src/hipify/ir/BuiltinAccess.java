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
 * A member access on one of the builtin coordinate variables, e.g.
 * <code>threadIdx.x</code>. The member name may still carry the internal
 * accessor prefix of the builtin record type.
 */
public final class BuiltinAccess extends MatchResult
{
  private final String baseName;
  private final String memberName;
  private final SourceSpan span;

  public BuiltinAccess(String file, String baseName, String memberName, SourceSpan span)
  {
    super(file);
    this.baseName = baseName;
    this.memberName = memberName;
    this.span = span;
  }

  public String getBaseName()
  {
    return baseName;
  }

  public String getMemberName()
  {
    return memberName;
  }

  public MatchKind getKind()
  {
    return MatchKind.BUILTIN_ACCESS;
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
    return baseName + "." + memberName;
  }
}
