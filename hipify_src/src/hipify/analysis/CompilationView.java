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

import java.util.*;

/**
 *
 * The two readings of one CUDA source. The host view is what the host
 * compiler sees, the device view what the device compiler sees: they
 * differ in the predefined macros and in which function bodies are
 * compiled at all.
 *
 */
public enum CompilationView
{
  HOST_ONLY("--cuda-host-only")
  {
    public boolean analyzesBody(boolean deviceFunction, boolean hostFunction)
    {
      return hostFunction;
    }
  },

  DEVICE_ONLY("--cuda-device-only")
  {
    public boolean analyzesBody(boolean deviceFunction, boolean hostFunction)
    {
      return deviceFunction;
    }
  };

  /** Value of __CUDA_ARCH__ in the device view. */
  public static final String DEVICE_ARCH = "300";

  private final String flag;

  CompilationView(String flag)
  {
    this.flag = flag;
  }

  /** The compiler flag selecting this view. */
  public String getFlag()
  {
    return flag;
  }

  /**
   * Whether a function body is analyzed in this view. A function is a
   * device function when declared __global__ or __device__, a host
   * function when declared __host__ or without any execution space.
   */
  public abstract boolean analyzesBody(boolean deviceFunction, boolean hostFunction);

  /** Macros defined before the first line of every file in this view. */
  public Map<String, String> getPredefinedMacros()
  {
    Map<String, String> macros = new LinkedHashMap<String, String>();
    macros.put("__CUDACC__", "1");
    macros.put("__HIPCC__", "1");
    if (this == DEVICE_ONLY) {
      macros.put("__CUDA_ARCH__", DEVICE_ARCH);
      macros.put("__HIP_DEVICE_COMPILE__", "1");
    }
    return macros;
  }
}
