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

/**
 * One CUDA to HIP rename: a source-API spelling and its target-API spelling.
 */
public final class SymbolEntry
{
  private final String sourceName;
  private final String targetName;

  public SymbolEntry(String sourceName, String targetName)
  {
    if (sourceName == null || sourceName.isEmpty())
      throw new IllegalArgumentException("empty source name");
    if (targetName == null || targetName.isEmpty())
      throw new IllegalArgumentException("empty target name for " + sourceName);
    this.sourceName = sourceName;
    this.targetName = targetName;
  }

  public String getSourceName()
  {
    return sourceName;
  }

  public String getTargetName()
  {
    return targetName;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o)
      return true;
    if (!(o instanceof SymbolEntry))
      return false;
    SymbolEntry other = (SymbolEntry)o;
    return sourceName.equals(other.sourceName) && targetName.equals(other.targetName);
  }

  @Override
  public int hashCode()
  {
    return 31 * sourceName.hashCode() + targetName.hashCode();
  }

  @Override
  public String toString()
  {
    return sourceName + " -> " + targetName;
  }
}
