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
import hipify.utils.*;

/**
 *
 * Runs the host-only pass and then the device-only pass over the same
 * files and folds both into one {@link ReplacementSet}. Because the host
 * pass proposes first, its edits win every span both passes claim.
 *
 * HOST_ONLY_PASS -> DEVICE_ONLY_PASS -> DONE
 *
 */
public class PassOrchestrator
{
  public enum State
  {
    HOST_ONLY_PASS,
    DEVICE_ONLY_PASS,
    DONE
  }

  private final RenameTable names;
  private final CudaScanner scanner;
  private final ReplacementSet replacements;
  private final Set<String> failedFiles = new LinkedHashSet<String>();
  private State state = State.HOST_ONLY_PASS;

  public PassOrchestrator(RenameTable names, CudaScanner scanner, ConflictPolicy policy)
  {
    this.names = names;
    this.scanner = scanner;
    this.replacements = new ReplacementSet(policy);
  }

  public PassOrchestrator(RenameTable names)
  {
    this(names, new CudaScanner(), ConflictPolicy.IDENTICAL);
  }

  /**
   * Runs both passes over <var>files</var> and returns the accepted edits.
   *
   * @throws IllegalStateException if the passes already ran.
   */
  public ReplacementSet translate(List<SourceFile> files)
  {
    if (state != State.HOST_ONLY_PASS)
      throw new IllegalStateException("passes already ran, state " + state);
    ReplacementSet host = runPass(files, CompilationView.HOST_ONLY);
    state = State.DEVICE_ONLY_PASS;
    ReplacementSet device = runPass(files, CompilationView.DEVICE_ONLY);
    state = State.DONE;

    fold(host);
    fold(device);

    int conflicts = 0;
    for (Proposal rejected : replacements.getRejected())
      if (!rejected.isDuplicate())
        conflicts++;
    PrintTools.printlnStatus(1, "[PassOrchestrator]", replacements.size(), "edits accepted,",
        replacements.getRejected().size(), "rejected,", conflicts, "conflicts");
    return replacements;
  }

  /**
   * Scans every file in <var>view</var> and returns the edits of that
   * pass alone; the orchestrator's state and accumulated edits are left
   * untouched. A file that fails keeps the edits proposed before the
   * failure.
   */
  public ReplacementSet runPass(List<SourceFile> files, CompilationView view)
  {
    ReplacementSet edits = new ReplacementSet(replacements.getPolicy());
    ViewPass pass = new ViewPass(files, names, edits, scanner, view);
    TranslationPass.run(pass);
    failedFiles.addAll(pass.getFailures());
    return edits;
  }

  private void fold(ReplacementSet passEdits)
  {
    for (Proposal proposal : replacements.addAll(passEdits)) {
      if (proposal.isDuplicate())
        PrintTools.printlnStatus(2, "[PassOrchestrator] duplicate", proposal.getEdit());
      else
        PrintTools.printlnStatus(0, "[PassOrchestrator] conflict:", proposal.getEdit(),
            "rejected,", proposal.getReason(), "by", proposal.getClaimedBy());
    }
  }

  public State getState()
  {
    return state;
  }

  public ReplacementSet getReplacements()
  {
    return replacements;
  }

  /** Files whose scan stopped early in at least one view. */
  public Set<String> getFailedFiles()
  {
    return failedFiles;
  }
}
