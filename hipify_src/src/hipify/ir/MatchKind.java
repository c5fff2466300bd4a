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
 * Tag of every recognized construct shape, also recorded as the origin of
 * each edit.
 */
public enum MatchKind
{
  FUNCTION_CALL,
  KERNEL_LAUNCH,
  BUILTIN_ACCESS,
  ENUM_OR_TYPE_REF,
  STRING_LITERAL,
  INCLUDE,
  MACRO_BODY_IDENTIFIER,
  CONDITIONAL_IDENTIFIER
}
