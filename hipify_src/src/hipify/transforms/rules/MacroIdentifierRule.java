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
 * Renames identifiers inside the bodies of macros defined in the file
 * under translation.
 */
public class MacroIdentifierRule implements TranslationRule<MacroBodyIdentifier>
{
  public String getRuleName()
  {
    return "[MacroIdentifier]";
  }

  public List<Edit> apply(MacroBodyIdentifier identifier, RuleContext context)
  {
    if (!identifier.isWrittenInMainFile())
      return Collections.emptyList();
    String repName = context.lookup(identifier.getName());
    if (repName == null)
      return Collections.emptyList();
    return Collections.singletonList(new Edit(identifier.getFile(), identifier.getSpan(),
          repName, identifier.getKind()));
  }
}
