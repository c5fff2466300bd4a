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

package hipify;

import java.io.*;
import java.util.*;

import hipify.analysis.*;
import hipify.common.*;
import hipify.exec.*;
import hipify.ir.*;
import hipify.transforms.*;
import hipify.utils.*;

/**
 * Translates CUDA sources to HIP sources in place. Every file is read in
 * the host-only view and then in the device-only view, the edits of both
 * views are collected in one replacement set and applied at the end.
 */
public class DriverHipify extends Driver
{
  public static final String VERSION = "hipify 1.0";

  /**
   * Runs both translation passes and applies their edits.
   */
  public int runPasses()
  {
    RenameTable names;
    ConflictPolicy policy;
    try {
      names = loadNames();
      policy = ConflictPolicy.fromOption(getOptionValue("conflict-policy"));
    } catch (IllegalArgumentException e) {
      System.err.println("hipify: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      System.err.println("hipify: could not read rename table: " + e.getMessage());
      return 1;
    }
    boolean dryRun = getOptionValue("dry-run") != null;

    // Work on scratch copies
    boolean skippedAny = false;
    List<ScratchFile> scratchFiles = new ArrayList<ScratchFile>();
    List<SourceFile> sources = new ArrayList<SourceFile>();
    for (String filename : filenames) {
      ScratchFile scratch = null;
      try {
        scratch = ScratchFile.prepare(filename);
        sources.add(SourceFile.read(scratch.getWorkingPath()));
        scratchFiles.add(scratch);
      } catch (IOException e) {
        System.err.println("hipify: skipping " + filename + ": " + e);
        discard(scratch);
        skippedAny = true;
      }
    }

    PassOrchestrator passes = new PassOrchestrator(names, new CudaScanner(parseMacros(
          getOptionValue("macro"))), policy);
    ReplacementSet replacements = passes.translate(sources);

    if (getOptionValue("print-replacements") != null)
      printReplacements(sources, replacements);

    SourceRewriter rewriter = new SourceRewriter(dryRun);
    for (SourceFile source : sources) {
      try {
        ApplyResult result = rewriter.rewrite(source, replacements);
        skippedAny |= !result.isClean();
      } catch (IOException e) {
        System.err.println("hipify: could not rewrite " + source.getPath() + ": " + e);
        skippedAny = true;
      }
    }
    if (skippedAny)
      System.err.println("Skipped some replacements.");

    for (ScratchFile scratch : scratchFiles) {
      try {
        if (dryRun)
          scratch.discard();
        else
          scratch.commit();
      } catch (IOException e) {
        System.err.println("hipify: could not restore " + scratch.getOriginalPath() + " from "
            + scratch.getWorkingPath() + ": " + e);
        skippedAny = true;
      }
    }
    return skippedAny ? 1 : 0;
  }

  private RenameTable loadNames() throws IOException
  {
    String file = getOptionValue("names");
    if (file == null)
      return HipNames.create();
    return HipNames.load(new File(file));
  }

  /** Parses the value of -macro, "A=1,B" defining A as 1 and B as 1. */
  static Map<String, String> parseMacros(String value)
  {
    Map<String, String> macros = new LinkedHashMap<String, String>();
    if (value == null)
      return macros;
    for (String def : value.split(",")) {
      def = def.trim();
      // A bare -macro sets the value "1"
      if (def.isEmpty() || Character.isDigit(def.charAt(0)))
        continue;
      int eq = def.indexOf('=');
      if (eq == -1)
        macros.put(def, "1");
      else if (eq > 0)
        macros.put(def.substring(0, eq), def.substring(eq + 1));
    }
    return macros;
  }

  private void printReplacements(List<SourceFile> sources, ReplacementSet replacements)
  {
    for (SourceFile source : sources) {
      for (Edit edit : replacements.getEdits(source.getPath())) {
        String original = (edit.getSpan().getEnd() <= source.length())
            ? source.getText(edit.getSpan()) : "<past end of file>";
        PrintTools.println(source.getPath() + ":" + source.getLine(edit.getSpan().getStart())
            + ": " + PrintTools.quote(original) + " -> " + PrintTools.quote(edit.getNewText()), 0);
      }
    }
  }

  private static void discard(ScratchFile scratch)
  {
    if (scratch == null)
      return;
    try {
      scratch.discard();
    } catch (IOException e) {
      System.err.println("hipify: could not delete " + scratch.getWorkingPath() + ": " + e);
    }
  }

  public void printVersion()
  {
    System.err.println(VERSION + " - CUDA to HIP source translator");
  }

  /**
   * Entry point for hipify; creates a new driver object,
   * and calls run on it with args.
   *
   * @param args Command line options.
   */
  public static void main(String[] args)
  {
    Tools.exit((new DriverHipify()).run(args));
  }
}
