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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import hipify.utils.*;

/**
 *
 * The CUDA to HIP rename list. The default list is kept exactly as it
 * grew historically, repeated coordinate and error entries included.
 *
 */
public class HipNames
{
  private HipNames()
  {
  }

  /** Returns the default CUDA to HIP table. */
  public static RenameTable create()
  {
    RenameTable.Builder names = RenameTable.builder();
    addDefaults(names);
    return names.build();
  }

  /**
   * Returns the default table with the entries of <var>file</var> layered
   * on top. The file is read as UTF-8. Each line is "cudaName=hipName";
   * blank lines and lines starting with '#' are ignored, malformed lines
   * are reported and skipped.
   */
  public static RenameTable load(File file) throws IOException
  {
    RenameTable.Builder names = RenameTable.builder();
    addDefaults(names);
    BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
    try {
      String line;
      int lineno = 0;
      while ((line = br.readLine()) != null) {
        lineno++;
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#"))
          continue;
        int eq = line.indexOf('=');
        if (eq <= 0 || eq == line.length() - 1) {
          System.err.println("hipify: ignoring malformed name entry at "
              + file.getName() + ":" + lineno + ": " + line);
          continue;
        }
        String cudaName = line.substring(0, eq).trim();
        String hipName = line.substring(eq + 1).trim();
        names.put(cudaName, hipName);
        PrintTools.printlnStatus(3, "[HipNames] loaded", cudaName, "->", hipName);
      }
    } finally {
      br.close();
    }
    PrintTools.printlnStatus(2, "[HipNames]", names.getOverwriteCount(), "entries overwritten");
    return names.build();
  }

  private static void addDefaults(RenameTable.Builder names)
  {
    // defines
    names.put("__CUDACC__", "__HIPCC__");

    // includes
    names.put("cuda_runtime.h", "hip_runtime.h");
    names.put("cuda_runtime_api.h", "hip_runtime_api.h");

    // Error codes and return types
    names.put("cudaError_t", "hipError_t");
    names.put("cudaError", "hipError");
    names.put("cudaSuccess", "hipSuccess");

    names.put("cudaErrorUnknown", "hipErrorUnknown");
    names.put("cudaErrorMemoryAllocation", "hipErrorMemoryAllocation");
    names.put("cudaErrorMemoryFree", "hipErrorMemoryFree");
    names.put("cudaErrorUnknownSymbol", "hipErrorUnknownSymbol");
    names.put("cudaErrorOutOfResources", "hipErrorOutOfResources");
    names.put("cudaErrorInvalidValue", "hipErrorInvalidValue");
    names.put("cudaErrorInvalidResourceHandle", "hipErrorInvalidResourceHandle");
    names.put("cudaErrorInvalidDevice", "hipErrorInvalidDevice");
    names.put("cudaErrorNoDevice", "hipErrorNoDevice");
    names.put("cudaErrorNotReady", "hipErrorNotReady");
    names.put("cudaErrorUnknown", "hipErrorUnknown");

    // Error APIs
    names.put("cudaGetLastError", "hipGetLastError");
    names.put("cudaPeekAtLastError", "hipPeekAtLastError");
    names.put("cudaGetErrorName", "hipGetErrorName");
    names.put("cudaGetErrorString", "hipGetErrorString");

    // Memcpy
    names.put("cudaMemcpy", "hipMemcpy");
    names.put("cudaMemcpyHostToHost", "hipMemcpyHostToHost");
    names.put("cudaMemcpyHostToDevice", "hipMemcpyHostToDevice");
    names.put("cudaMemcpyDeviceToHost", "hipMemcpyDeviceToHost");
    names.put("cudaMemcpyDeviceToDevice", "hipMemcpyDeviceToDevice");
    names.put("cudaMemcpyDefault", "hipMemcpyDefault");
    names.put("cudaMemcpyToSymbol", "hipMemcpyToSymbol");
    names.put("cudaMemset", "hipMemset");
    names.put("cudaMemsetAsync", "hipMemsetAsync");
    names.put("cudaMemcpyAsync", "hipMemcpyAsync");
    names.put("cudaMemGetInfo", "hipMemGetInfo");
    names.put("cudaMemcpyKind", "hipMemcpyKind");

    // Memory management
    names.put("cudaMalloc", "hipMalloc");
    names.put("cudaMallocHost", "hipMallocHost");
    names.put("cudaFree", "hipFree");
    names.put("cudaFreeHost", "hipFreeHost");

    // Coordinate indexing and dimensions
    names.put("threadIdx.x", "hipThreadIdx_x");
    names.put("threadIdx.y", "hipThreadIdx_y");
    names.put("threadIdx.z", "hipThreadIdx_z");

    names.put("blockIdx.x", "hipBlockIdx_x");
    names.put("blockIdx.y", "hipBlockIdx_y");
    names.put("blockIdx.z", "hipBlockIdx_z");

    names.put("blockDim.x", "hipBlockDim_x");
    names.put("blockDim.y", "hipBlockDim_y");
    names.put("blockDim.z", "hipBlockDim_z");

    names.put("gridDim.x", "hipGridDim_x");
    names.put("gridDim.y", "hipGridDim_y");
    names.put("gridDim.z", "hipGridDim_z");

    names.put("blockIdx.x", "hipBlockIdx_x");
    names.put("blockIdx.y", "hipBlockIdx_y");
    names.put("blockIdx.z", "hipBlockIdx_z");

    names.put("blockDim.x", "hipBlockDim_x");
    names.put("blockDim.y", "hipBlockDim_y");
    names.put("blockDim.z", "hipBlockDim_z");

    names.put("gridDim.x", "hipGridDim_x");
    names.put("gridDim.y", "hipGridDim_y");
    names.put("gridDim.z", "hipGridDim_z");

    names.put("warpSize", "hipWarpSize");

    // Events
    names.put("cudaEvent_t", "hipEvent_t");
    names.put("cudaEventCreate", "hipEventCreate");
    names.put("cudaEventCreateWithFlags", "hipEventCreateWithFlags");
    names.put("cudaEventDestroy", "hipEventDestroy");
    names.put("cudaEventRecord", "hipEventRecord");
    names.put("cudaEventElapsedTime", "hipEventElapsedTime");
    names.put("cudaEventSynchronize", "hipEventSynchronize");

    // Streams
    names.put("cudaStream_t", "hipStream_t");
    names.put("cudaStreamCreate", "hipStreamCreate");
    names.put("cudaStreamCreateWithFlags", "hipStreamCreateWithFlags");
    names.put("cudaStreamDestroy", "hipStreamDestroy");
    names.put("cudaStreamWaitEvent", "hipStreamWaitEven");
    names.put("cudaStreamSynchronize", "hipStreamSynchronize");
    names.put("cudaStreamDefault", "hipStreamDefault");
    names.put("cudaStreamNonBlocking", "hipStreamNonBlocking");

    // Other synchronization
    names.put("cudaDeviceSynchronize", "hipDeviceSynchronize");
    names.put("cudaThreadSynchronize", "hipDeviceSynchronize");   // deprecated
    names.put("cudaDeviceReset", "hipDeviceReset");
    names.put("cudaThreadExit", "hipDeviceReset");                // deprecated
    names.put("cudaSetDevice", "hipSetDevice");
    names.put("cudaGetDevice", "hipGetDevice");

    // Device
    names.put("cudaDeviceProp", "hipDeviceProp_t");
    names.put("cudaGetDeviceProperties", "hipDeviceGetProperties");

    // Cache config
    names.put("cudaDeviceSetCacheConfig", "hipDeviceSetCacheConfig");
    names.put("cudaThreadSetCacheConfig", "hipDeviceSetCacheConfig");  // deprecated
    names.put("cudaDeviceGetCacheConfig", "hipDeviceGetCacheConfig");
    names.put("cudaThreadGetCacheConfig", "hipDeviceGetCacheConfig");  // deprecated
    names.put("cudaFuncCache", "hipFuncCache");
    names.put("cudaFuncCachePreferNone", "hipFuncCachePreferNone");
    names.put("cudaFuncCachePreferShared", "hipFuncCachePreferShared");
    names.put("cudaFuncCachePreferL1", "hipFuncCachePreferL1");
    names.put("cudaFuncCachePreferEqual", "hipFuncCachePreferEqual");
    names.put("cudaFuncSetCacheConfig", "hipFuncSetCacheConfig");

    names.put("cudaDriverGetVersion", "hipDriverGetVersion");

    // Peer2Peer
    names.put("cudaDeviceCanAccessPeer", "hipDeviceCanAccessPeer");
    names.put("cudaDeviceDisablePeerAccess", "hipDeviceDisablePeerAccess");
    names.put("cudaDeviceEnablePeerAccess", "hipDeviceEnablePeerAccess");
    names.put("cudaMemcpyPeerAsync", "hipMemcpyPeerAsync");
    names.put("cudaMemcpyPeer", "hipMemcpyPeer");

    // Shared mem
    names.put("cudaDeviceSetSharedMemConfig", "hipDeviceSetSharedMemConfig");
    names.put("cudaThreadSetSharedMemConfig", "hipDeviceSetSharedMemConfig");  // deprecated
    names.put("cudaDeviceGetSharedMemConfig", "hipDeviceGetSharedMemConfig");
    names.put("cudaThreadGetSharedMemConfig", "hipDeviceGetSharedMemConfig");  // deprecated
    names.put("cudaSharedMemConfig", "hipSharedMemConfig");
    names.put("cudaSharedMemBankSizeDefault", "hipSharedMemBankSizeDefault");
    names.put("cudaSharedMemBankSizeFourByte", "hipSharedMemBankSizeFourByte");
    names.put("cudaSharedMemBankSizeEightByte", "hipSharedMemBankSizeEightByte");

    names.put("cudaGetDeviceCount", "hipGetDeviceCount");

    // Profiler
    names.put("cudaProfilerStart", "hipProfilerStart");
    names.put("cudaProfilerStop", "hipProfilerStop");

    // Textures
    names.put("cudaChannelFormatDesc", "hipChannelFormatDesc");
    names.put("cudaFilterModePoint", "hipFilterModePoint");
    names.put("cudaReadModeElementType", "hipReadModeElementType");

    names.put("cudaCreateChannelDesc", "hipCreateChannelDesc");
    names.put("cudaBindTexture", "hipBindTexture");
    names.put("cudaUnbindTexture", "hipUnbindTexture");
  }
}
