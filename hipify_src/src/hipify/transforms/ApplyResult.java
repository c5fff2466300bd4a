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

import hipify.ir.*;

/**
 * What happened to the accepted edits of one file when they were applied.
 */
public class ApplyResult
{
  /** An edit that could not be applied and why. */
  public static final class Skipped
  {
    private final Edit edit;
    private final String reason;

    Skipped(Edit edit, String reason)
    {
      this.edit = edit;
      this.reason = reason;
    }

    public Edit getEdit()
    {
      return edit;
    }

    public String getReason()
    {
      return reason;
    }

    @Override
    public String toString()
    {
      return edit + ": " + reason;
    }
  }

  private final String file;
  private final List<Edit> applied = new ArrayList<Edit>();
  private final List<Skipped> skipped = new ArrayList<Skipped>();
  private String newText;
  private boolean written;

  ApplyResult(String file)
  {
    this.file = file;
  }

  void applied(Edit edit)
  {
    applied.add(edit);
  }

  void skipped(Edit edit, String reason)
  {
    skipped.add(new Skipped(edit, reason));
  }

  void setNewText(String text, boolean written)
  {
    this.newText = text;
    this.written = written;
  }

  public String getFile()
  {
    return file;
  }

  public List<Edit> getApplied()
  {
    return Collections.unmodifiableList(applied);
  }

  public List<Skipped> getSkipped()
  {
    return Collections.unmodifiableList(skipped);
  }

  /** The rewritten text, null when nothing could be applied. */
  public String getNewText()
  {
    return newText;
  }

  public boolean isWritten()
  {
    return written;
  }

  /** True when every edit was applied. */
  public boolean isClean()
  {
    return skipped.isEmpty();
  }
}
