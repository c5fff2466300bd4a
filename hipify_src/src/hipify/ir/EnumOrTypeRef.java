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
 * An occurrence of an enumerator or a declared type name. The name is the
 * constant or the type as written, never the name of the variable being
 * declared.
 */
public final class EnumOrTypeRef extends MatchResult
{
  /** Where the name occurrence was found. */
  public enum RefKind
  {
    ENUM_CONSTANT,
    ENUM_VARIABLE,
    STRUCT_VARIABLE,
    PARAMETER
  }

  private final String name;
  private final SourceSpan span;
  private final RefKind refKind;

  public EnumOrTypeRef(String file, String name, SourceSpan span, RefKind refKind)
  {
    super(file);
    this.name = name;
    this.span = span;
    this.refKind = refKind;
  }

  public String getName()
  {
    return name;
  }

  public RefKind getRefKind()
  {
    return refKind;
  }

  public MatchKind getKind()
  {
    return MatchKind.ENUM_OR_TYPE_REF;
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
    return name + " (" + refKind.name().toLowerCase() + ")";
  }
}
