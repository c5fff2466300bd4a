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

import hipify.ir.*;

/**
 * Renames the callee of a call, leaving parentheses and arguments alone.
 */
public class CallRenameRule implements TranslationRule<FunctionCall>
{
  public String getRuleName()
  {
    return "[CallRename]";
  }

  public List<Edit> apply(FunctionCall call, RuleContext context)
  {
    String repName = context.lookup(call.getCalleeName());
    if (repName == null)
      return Collections.emptyList();

    // Land in the macro argument text, not in the macro body
    SourceSpan span = call.isInMacroArgument() ? call.getSpellingSpan() : call.getCallSpan();
    return Collections.singletonList(new Edit(call.getFile(), span, repName, call.getKind()));
  }
}
