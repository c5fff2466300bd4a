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

package hipify.transforms.rules;

import java.util.*;

import hipify.common.*;
import hipify.ir.*;
import hipify.utils.*;

/**
 *
 * Routes every match of one file to the rule owning its construct shape.
 * Dispatch goes through {@link MatchVisitor}, so a new match variant
 * does not compile until a rule is wired for it here.
 *
 */
public class RuleDispatcher implements MatchVisitor<List<Edit>>
{
  private final RuleContext context;

  private final CallRenameRule callRule = new CallRenameRule();
  private final KernelLaunchRule launchRule = new KernelLaunchRule();
  private final BuiltinAccessRule builtinRule = new BuiltinAccessRule();
  private final DeclarationRenameRule declRule = new DeclarationRenameRule();
  private final StringLiteralRule stringRule = new StringLiteralRule();
  private final IncludeRule includeRule = new IncludeRule();
  private final MacroIdentifierRule macroRule = new MacroIdentifierRule();
  private final ConditionalIdentifierRule conditionalRule = new ConditionalIdentifierRule();

  public RuleDispatcher(RenameTable names, SourceFile source)
  {
    this.context = new RuleContext(names, source);
  }

  public RuleContext getContext()
  {
    return context;
  }

  /** Returns the edits the owning rule derives from <var>match</var>. */
  public List<Edit> apply(MatchResult match)
  {
    if (!match.getFile().equals(context.getSource().getPath()))
      throw new IllegalArgumentException("match from " + match.getFile()
          + " offered to the rules of " + context.getSource().getPath());
    return match.accept(this);
  }

  public List<Edit> visit(FunctionCall call)
  {
    return run(callRule, call);
  }

  public List<Edit> visit(KernelLaunch launch)
  {
    return run(launchRule, launch);
  }

  public List<Edit> visit(BuiltinAccess access)
  {
    return run(builtinRule, access);
  }

  public List<Edit> visit(EnumOrTypeRef ref)
  {
    return run(declRule, ref);
  }

  public List<Edit> visit(StringLiteral literal)
  {
    return run(stringRule, literal);
  }

  public List<Edit> visit(Include include)
  {
    return run(includeRule, include);
  }

  public List<Edit> visit(MacroBodyIdentifier identifier)
  {
    return run(macroRule, identifier);
  }

  public List<Edit> visit(ConditionalIdentifier identifier)
  {
    return run(conditionalRule, identifier);
  }

  private <M extends MatchResult> List<Edit> run(TranslationRule<M> rule, M match)
  {
    List<Edit> edits = rule.apply(match, context);
    if (edits.isEmpty()) {
      PrintTools.printlnStatus(4, rule.getRuleName(), "no entry for", match.describe());
    }
    else if (PrintTools.getVerbosity() >= 1) {
      for (Edit edit : edits)
        PrintTools.printlnStatus(1, rule.getRuleName(), match.getKind(),
            PrintTools.quote(originalText(edit.getSpan())), "->",
            PrintTools.quote(edit.getNewText()), "at", edit.getFile() + edit.getSpan());
    }
    return edits;
  }

  private String originalText(SourceSpan span)
  {
    if (span.getEnd() > context.getSource().length())
      return "<past end of file>";
    return context.getText(span);
  }
}
