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

import hipify.common.*;
import hipify.ir.*;
import hipify.utils.*;

/**
 * Base class of the translation passes. A pass reads the original text of
 * every file and proposes its edits to a shared {@link ReplacementSet};
 * it never writes a file.
 */
public abstract class TranslationPass
{
  /** The files under translation */
  protected List<SourceFile> files;

  /** The rename table shared by every rule */
  protected RenameTable names;

  /** Where the edits of this pass are proposed */
  protected ReplacementSet replacements;

  /** Files whose analysis stopped early in this pass */
  protected List<String> failures;

  protected TranslationPass(List<SourceFile> files, RenameTable names, ReplacementSet replacements)
  {
    this.files = files;
    this.names = names;
    this.replacements = replacements;
    this.failures = new ArrayList<String>();
  }

  /** Returns the name of the translation pass */
  public abstract String getPassName();

  /**
   * Invokes the specified translation pass.
   * @param pass the translation pass that is to be run.
   */
  public static void run(TranslationPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.println(pass.getPassName() + " begin", 1);
    int before = pass.replacements.size();
    pass.start();
    PrintTools.printlnStatus(1, pass.getPassName(), "accepted",
        pass.replacements.size() - before, "edits");
    PrintTools.println(pass.getPassName() + " end in " +
        String.format("%.2f seconds", Tools.getTime(timer)), 1);
  }

  /** Starts a translation pass */
  public abstract void start();

  public List<String> getFailures()
  {
    return failures;
  }
}
