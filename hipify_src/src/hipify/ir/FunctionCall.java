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
 * A call through a named callee, e.g. <code>cudaMalloc(&amp;p, n)</code>.
 * The call span covers the callee token only. When the call is written as
 * a macro argument the spelling span locates the callee in the argument
 * text rather than in the macro body.
 */
public final class FunctionCall extends MatchResult
{
  private final String calleeName;
  private final SourceSpan callSpan;
  private final SourceSpan spellingSpan;
  private final boolean inMacroArgument;

  public FunctionCall(String file, String calleeName, SourceSpan callSpan)
  {
    this(file, calleeName, callSpan, callSpan, false);
  }

  public FunctionCall(String file, String calleeName, SourceSpan callSpan,
      SourceSpan spellingSpan, boolean inMacroArgument)
  {
    super(file);
    this.calleeName = calleeName;
    this.callSpan = callSpan;
    this.spellingSpan = (spellingSpan == null) ? callSpan : spellingSpan;
    this.inMacroArgument = inMacroArgument;
  }

  public String getCalleeName()
  {
    return calleeName;
  }

  public SourceSpan getCallSpan()
  {
    return callSpan;
  }

  public SourceSpan getSpellingSpan()
  {
    return spellingSpan;
  }

  public boolean isInMacroArgument()
  {
    return inMacroArgument;
  }

  public MatchKind getKind()
  {
    return MatchKind.FUNCTION_CALL;
  }

  public SourceSpan getSpan()
  {
    return callSpan;
  }

  public <R> R accept(MatchVisitor<R> visitor)
  {
    return visitor.visit(this);
  }

  public String describe()
  {
    return calleeName + "(...)";
  }
}
