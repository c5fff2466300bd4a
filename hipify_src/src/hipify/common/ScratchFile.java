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

import java.io.*;
import java.nio.file.*;

import hipify.utils.*;

/**
 *
 * The file a translation actually works on. A ".cu" source is copied to a
 * ".hip.cu" scratch copy which is analyzed and rewritten, then renamed
 * back over the original; any other source is worked on in place.
 *
 */
public class ScratchFile
{
  public static final String CUDA_SUFFIX = ".cu";
  public static final String SCRATCH_SUFFIX = ".hip.cu";

  private final String originalPath;
  private final String workingPath;

  private ScratchFile(String originalPath, String workingPath)
  {
    this.originalPath = originalPath;
    this.workingPath = workingPath;
  }

  /**
   * Returns the scratch name of <var>path</var>, or null when the file is
   * translated in place.
   */
  public static String scratchName(String path)
  {
    if (!path.endsWith(CUDA_SUFFIX))
      return null;
    return path.substring(0, path.length() - CUDA_SUFFIX.length()) + SCRATCH_SUFFIX;
  }

  /**
   * Creates the working copy of <var>path</var>, replacing a stale scratch
   * copy left by an earlier run.
   */
  public static ScratchFile prepare(String path) throws IOException
  {
    Path original = Paths.get(path);
    if (!Files.isRegularFile(original))
      throw new FileNotFoundException(path);
    String scratch = scratchName(path);
    if (scratch == null)
      return new ScratchFile(path, path);
    Files.copy(original, Paths.get(scratch), StandardCopyOption.REPLACE_EXISTING);
    PrintTools.printlnStatus(3, "[ScratchFile] copied", path, "to", scratch);
    return new ScratchFile(path, scratch);
  }

  public String getOriginalPath()
  {
    return originalPath;
  }

  /** The path the passes analyze and the rewriter writes. */
  public String getWorkingPath()
  {
    return workingPath;
  }

  public boolean isCopy()
  {
    return !workingPath.equals(originalPath);
  }

  /** Moves the working copy over the original file. */
  public void commit() throws IOException
  {
    if (!isCopy())
      return;
    Files.move(Paths.get(workingPath), Paths.get(originalPath), StandardCopyOption.REPLACE_EXISTING);
    PrintTools.printlnStatus(3, "[ScratchFile] renamed", workingPath, "to", originalPath);
  }

  /** Deletes the working copy, leaving the original untouched. */
  public void discard() throws IOException
  {
    if (isCopy())
      Files.deleteIfExists(Paths.get(workingPath));
  }
}
