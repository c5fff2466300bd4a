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
 * Decides when a proposed edit collides with one already accepted.
 */
public enum ConflictPolicy
{
  /** Only edits over exactly the same span collide. */
  IDENTICAL("identical")
  {
    public boolean collides(SourceSpan accepted, SourceSpan proposed)
    {
      return accepted.equals(proposed);
    }
  },

  /** Any two intersecting spans collide. */
  OVERLAP("overlap")
  {
    public boolean collides(SourceSpan accepted, SourceSpan proposed)
    {
      return accepted.overlaps(proposed);
    }
  };

  private final String optionName;

  ConflictPolicy(String optionName)
  {
    this.optionName = optionName;
  }

  public abstract boolean collides(SourceSpan accepted, SourceSpan proposed);

  public String getOptionName()
  {
    return optionName;
  }

  /** Parses an option value; null selects the default policy. */
  public static ConflictPolicy fromOption(String value)
  {
    if (value == null)
      return IDENTICAL;
    for (ConflictPolicy policy : values())
      if (policy.optionName.equalsIgnoreCase(value.trim()))
        return policy;
    throw new IllegalArgumentException("unknown conflict policy: " + value);
  }
}
