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

package hipify.analysis;

/**
 * Thrown when a file cannot be analyzed any further in a view. Matches
 * reported before the failure remain valid.
 */
public class ScanException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final String file;
  private final int line;

  public ScanException(String file, int line, String message)
  {
    super(file + ":" + line + ": " + message);
    this.file = file;
    this.line = line;
  }

  public String getFile()
  {
    return file;
  }

  public int getLine()
  {
    return line;
  }
}
