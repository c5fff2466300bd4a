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
 * Replaces <code>threadIdx.x</code> style coordinate accesses with the
 * matching HIP coordinate macro.
 */
public class BuiltinAccessRule implements TranslationRule<BuiltinAccess>
{
  /** Prefix of the accessor properties of the builtin record types. */
  public static final String FETCH_PREFIX = "__fetch_builtin_";

  public String getRuleName()
  {
    return "[BuiltinAccess]";
  }

  public List<Edit> apply(BuiltinAccess access, RuleContext context)
  {
    String key = access.getBaseName() + "." + stripFetchPrefix(access.getMemberName());
    String repName = context.lookup(key);
    if (repName == null)
      return Collections.emptyList();

    // The edit covers the composed "base.member" text from the access start
    SourceSpan span = SourceSpan.ofLength(access.getSpan().getStart(), key.length());
    return Collections.singletonList(new Edit(access.getFile(), span, repName, access.getKind()));
  }

  public static String stripFetchPrefix(String memberName)
  {
    if (memberName.startsWith(FETCH_PREFIX))
      return memberName.substring(FETCH_PREFIX.length());
    return memberName;
  }
}
