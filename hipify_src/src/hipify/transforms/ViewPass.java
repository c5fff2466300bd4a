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

package hipify.transforms;

import java.util.*;

import hipify.analysis.*;
import hipify.common.*;
import hipify.ir.*;
import hipify.transforms.rules.*;
import hipify.utils.*;

/**
 *
 * Translates every file as one compilation view reads it: the scanner
 * reports the matches of the view, the rules turn them into edits and
 * the edits are proposed in discovery order.
 *
 */
public class ViewPass extends TranslationPass
{
  private final CompilationView view;
  private final CudaScanner scanner;

  public ViewPass(List<SourceFile> files, RenameTable names, ReplacementSet replacements,
      CudaScanner scanner, CompilationView view)
  {
    super(files, names, replacements);
    this.scanner = scanner;
    this.view = view;
  }

  public String getPassName()
  {
    return (view == CompilationView.HOST_ONLY) ? "[HostOnlyPass]" : "[DeviceOnlyPass]";
  }

  public CompilationView getView()
  {
    return view;
  }

  public void start()
  {
    for (SourceFile file : files) {
      final RuleDispatcher rules = new RuleDispatcher(names, file);
      PrintTools.printlnStatus(2, getPassName(), "scanning", file.getPath(), view.getFlag());
      try {
        scanner.scan(file, view, new MatchListener() {
          public void matched(MatchResult match)
          {
            PrintTools.printlnStatus(4, getPassName(), "match", match.describe());
            for (Edit edit : rules.apply(match))
              propose(edit);
          }
        });
      } catch (ScanException e) {
        failures.add(file.getPath());
        PrintTools.printlnStatus(0, getPassName(), "error:", e.getMessage(),
            "(" + view.getFlag() + ")");
      }
    }
  }

  private void propose(Edit edit)
  {
    Proposal proposal = replacements.propose(edit);
    if (proposal.isAccepted())
      return;
    if (proposal.isDuplicate())
      PrintTools.printlnStatus(2, getPassName(), "duplicate", edit);
    else
      PrintTools.printlnStatus(0, getPassName(), "conflict:", edit, "rejected,",
          proposal.getReason(), "by", proposal.getClaimedBy());
  }
}
