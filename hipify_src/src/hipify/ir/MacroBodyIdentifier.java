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
 * An identifier token in the replacement list of a macro definition.
 */
public final class MacroBodyIdentifier extends MatchResult
{
  private final String name;
  private final String macroName;
  private final SourceSpan span;
  private final boolean writtenInMainFile;

  public MacroBodyIdentifier(String file, String name, String macroName, SourceSpan span,
      boolean writtenInMainFile)
  {
    super(file);
    this.name = name;
    this.macroName = macroName;
    this.span = span;
    this.writtenInMainFile = writtenInMainFile;
  }

  public String getName()
  {
    return name;
  }

  /** Name of the macro whose body holds the identifier. */
  public String getMacroName()
  {
    return macroName;
  }

  public boolean isWrittenInMainFile()
  {
    return writtenInMainFile;
  }

  public MatchKind getKind()
  {
    return MatchKind.MACRO_BODY_IDENTIFIER;
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
    return name + " in #define " + macroName;
  }
}
