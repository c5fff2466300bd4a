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
 * Outcome of offering an edit to a {@link ReplacementSet}.
 */
public final class Proposal
{
  public static final String SPAN_ALREADY_CLAIMED = "span already claimed";

  private static final Proposal ACCEPTED = new Proposal(null, null);

  private final Edit edit;
  private final Edit claimedBy;

  private Proposal(Edit edit, Edit claimedBy)
  {
    this.edit = edit;
    this.claimedBy = claimedBy;
  }

  static Proposal accepted()
  {
    return ACCEPTED;
  }

  static Proposal rejected(Edit edit, Edit claimedBy)
  {
    return new Proposal(edit, claimedBy);
  }

  public boolean isAccepted()
  {
    return claimedBy == null;
  }

  public String getReason()
  {
    return isAccepted() ? null : SPAN_ALREADY_CLAIMED;
  }

  /** The rejected edit, null when accepted. */
  public Edit getEdit()
  {
    return edit;
  }

  /** The accepted edit that owns the span, null when accepted. */
  public Edit getClaimedBy()
  {
    return claimedBy;
  }

  /**
   * A rejected edit that would have written the same text over the same
   * span as the edit that claimed it first.
   */
  public boolean isDuplicate()
  {
    return !isAccepted() && edit.isSameChange(claimedBy);
  }

  @Override
  public String toString()
  {
    if (isAccepted())
      return "accepted";
    return "rejected(" + SPAN_ALREADY_CLAIMED + "): " + edit + " claimed by " + claimedBy;
  }
}
