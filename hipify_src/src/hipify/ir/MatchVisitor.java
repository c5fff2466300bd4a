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
 * Exhaustive dispatch over the match result variants. Adding a variant
 * adds a method here, so every visitor has to handle it.
 */
public interface MatchVisitor<R>
{
  R visit(FunctionCall call);

  R visit(KernelLaunch launch);

  R visit(BuiltinAccess access);

  R visit(EnumOrTypeRef ref);

  R visit(StringLiteral literal);

  R visit(Include include);

  R visit(MacroBodyIdentifier identifier);

  R visit(ConditionalIdentifier identifier);
}
