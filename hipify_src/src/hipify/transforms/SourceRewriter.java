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

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

import hipify.ir.*;
import hipify.utils.*;

/**
 *
 * Materializes accepted edits. The edits of a file are applied in
 * ascending span order against the text the passes analyzed; an edit that
 * lies outside the file or overlaps an edit already applied is skipped and
 * reported, the others still go through. A file that changed on disk
 * since it was analyzed is left alone.
 *
 */
public class SourceRewriter
{
  public static final String OUT_OF_RANGE = "span outside of file";
  public static final String OVERLAPS_APPLIED = "overlaps an applied edit";
  public static final String FILE_CHANGED = "file changed since analysis";

  private final boolean dryRun;

  public SourceRewriter(boolean dryRun)
  {
    this.dryRun = dryRun;
  }

  public boolean isDryRun()
  {
    return dryRun;
  }

  /**
   * Applies the edits <var>replacements</var> holds for <var>analyzed</var>
   * and writes the result over the file unless this is a dry run.
   */
  public ApplyResult rewrite(SourceFile analyzed, ReplacementSet replacements) throws IOException
  {
    return rewrite(analyzed, replacements.getEdits(analyzed.getPath()));
  }

  public ApplyResult rewrite(SourceFile analyzed, List<Edit> edits) throws IOException
  {
    ApplyResult result = new ApplyResult(analyzed.getPath());
    if (edits.isEmpty())
      return result;

    SourceFile current = SourceFile.read(analyzed.getPath());
    if (!current.getText().equals(analyzed.getText())) {
      for (Edit edit : edits)
        result.skipped(edit, FILE_CHANGED);
      report(result);
      return result;
    }

    String text = apply(analyzed.getText(), sorted(edits), result);
    boolean write = !dryRun && !result.getApplied().isEmpty();
    if (write)
      Files.write(Paths.get(analyzed.getPath()), text.getBytes(StandardCharsets.UTF_8));
    result.setNewText(text, write);
    report(result);
    return result;
  }

  /**
   * Returns <var>original</var> with the applicable <var>edits</var>
   * substituted, recording each outcome in <var>result</var>.
   */
  static String apply(String original, List<Edit> edits, ApplyResult result)
  {
    StringBuilder sb = new StringBuilder(original.length() + 64);
    int copied = 0;
    for (Edit edit : edits) {
      SourceSpan span = edit.getSpan();
      if (span.getEnd() > original.length()) {
        result.skipped(edit, OUT_OF_RANGE);
      }
      else if (span.getStart() < copied) {
        result.skipped(edit, OVERLAPS_APPLIED);
      }
      else {
        sb.append(original, copied, span.getStart());
        sb.append(edit.getNewText());
        copied = span.getEnd();
        result.applied(edit);
      }
    }
    sb.append(original, copied, original.length());
    return sb.toString();
  }

  private static List<Edit> sorted(List<Edit> edits)
  {
    List<Edit> ret = new ArrayList<Edit>(edits);
    Collections.sort(ret, new Comparator<Edit>() {
      public int compare(Edit a, Edit b)
      {
        return a.getSpan().compareTo(b.getSpan());
      }
    });
    return ret;
  }

  private void report(ApplyResult result)
  {
    PrintTools.printlnStatus(1, "[SourceRewriter]", result.getFile() + ":",
        result.getApplied().size(), "applied,", result.getSkipped().size(), "skipped",
        dryRun ? "(dry run)" : "");
    for (ApplyResult.Skipped skipped : result.getSkipped())
      PrintTools.printlnStatus(0, "[SourceRewriter] skipped", skipped);
  }
}
