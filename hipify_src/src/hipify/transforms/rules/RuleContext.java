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

import hipify.common.*;
import hipify.ir.*;

/**
 * What a rule may consult while turning a match into edits: the shared
 * rename table and the read-only original text of the file the match was
 * found in.
 */
public final class RuleContext
{
  private final RenameTable names;
  private final SourceFile source;

  public RuleContext(RenameTable names, SourceFile source)
  {
    this.names = names;
    this.source = source;
  }

  public RenameTable getNames()
  {
    return names;
  }

  public SourceFile getSource()
  {
    return source;
  }

  public String lookup(String name)
  {
    return names.lookup(name);
  }

  public String getText(SourceSpan span)
  {
    return source.getText(span);
  }
}
