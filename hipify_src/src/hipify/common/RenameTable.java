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

package hipify.common;

import java.util.*;

/**
 *
 * Read-only mapping from CUDA spellings to HIP spellings. Every rule
 * consults the same instance; it is built once through a {@link Builder}
 * at start-up and never changes afterwards.
 *
 * Lookups are exact and case sensitive. Rules that need a derived key
 * (e.g. "threadIdx.x" from a member access) compose the key themselves.
 *
 */
public final class RenameTable
{
  private final Map<String, SymbolEntry> mEntries;

  private RenameTable(Map<String, SymbolEntry> entries)
  {
    mEntries = Collections.unmodifiableMap(new LinkedHashMap<String, SymbolEntry>(entries));
  }

  /**
   * Returns the HIP spelling of <var>name</var>, or null if the table
   * has no entry for it.
   */
  public String lookup(String name)
  {
    if (name == null)
      return null;
    SymbolEntry entry = mEntries.get(name);
    return (entry == null) ? null : entry.getTargetName();
  }

  public boolean contains(String name)
  {
    return name != null && mEntries.containsKey(name);
  }

  public int size()
  {
    return mEntries.size();
  }

  /** Entries in first-insertion order of their source names. */
  public Collection<SymbolEntry> getEntries()
  {
    return mEntries.values();
  }

  public static Builder builder()
  {
    return new Builder();
  }

  /**
   * Collects entries before the table is frozen. Inserting a source name
   * twice is allowed, the later target simply replaces the earlier one.
   */
  public static final class Builder
  {
    private final LinkedHashMap<String, SymbolEntry> mPending = new LinkedHashMap<String, SymbolEntry>();
    private int mOverwrites = 0;

    private Builder()
    {
    }

    public Builder put(String sourceName, String targetName)
    {
      if (mPending.put(sourceName, new SymbolEntry(sourceName, targetName)) != null)
        mOverwrites++;
      return this;
    }

    public Builder putAll(RenameTable table)
    {
      for (SymbolEntry entry : table.getEntries())
        put(entry.getSourceName(), entry.getTargetName());
      return this;
    }

    /** Number of puts that replaced an existing source name. */
    public int getOverwriteCount()
    {
      return mOverwrites;
    }

    public RenameTable build()
    {
      return new RenameTable(mPending);
    }
  }
}
