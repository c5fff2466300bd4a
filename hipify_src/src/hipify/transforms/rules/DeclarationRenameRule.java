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
 * Renames enumerators and the type names of variable and parameter
 * declarations.
 */
public class DeclarationRenameRule implements TranslationRule<EnumOrTypeRef>
{
  public String getRuleName()
  {
    return "[DeclarationRename]";
  }

  public List<Edit> apply(EnumOrTypeRef ref, RuleContext context)
  {
    String repName = context.lookup(ref.getName());
    if (repName == null)
      return Collections.emptyList();
    return Collections.singletonList(new Edit(ref.getFile(), ref.getSpan(), repName, ref.getKind()));
  }
}
