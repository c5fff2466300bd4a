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
 * Rewrites angle-bracket includes of CUDA headers written in the file
 * under translation.
 */
public class IncludeRule implements TranslationRule<Include>
{
  public String getRuleName()
  {
    return "[IncludeRewrite]";
  }

  public List<Edit> apply(Include include, RuleContext context)
  {
    if (!include.isWrittenInMainFile() || !include.isAngled())
      return Collections.emptyList();
    String repName = context.lookup(include.getTargetName());
    if (repName == null)
      return Collections.emptyList();
    return Collections.singletonList(new Edit(include.getFile(), include.getSpan(),
          "<" + repName + ">", include.getKind()));
  }
}
