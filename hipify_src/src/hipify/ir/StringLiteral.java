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
 * A string literal token. The raw text includes the quotes and any
 * encoding prefix exactly as written.
 */
public final class StringLiteral extends MatchResult
{
  private final String rawText;
  private final SourceSpan span;

  public StringLiteral(String file, String rawText, SourceSpan span)
  {
    super(file);
    this.rawText = rawText;
    this.span = span;
  }

  public String getRawText()
  {
    return rawText;
  }

  public MatchKind getKind()
  {
    return MatchKind.STRING_LITERAL;
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
    return rawText;
  }
}
