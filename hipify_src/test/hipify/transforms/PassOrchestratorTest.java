package hipify.transforms;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import hipify.analysis.*;
import hipify.common.*;
import hipify.ir.*;

import static org.junit.jupiter.api.Assertions.*;

public class PassOrchestratorTest
{
  private static final String CUDA =
      "#include <cuda_runtime.h>\n"
    + "__global__ void vadd(float *a, int n) {\n"
    + "  int i = threadIdx.x + blockIdx.x * blockDim.x;\n"
    + "  if (i < n) a[i] = 0;\n"
    + "}\n"
    + "int main() {\n"
    + "  float *d;\n"
    + "  cudaMalloc(&d, 4 * sizeof(float));\n"
    + "  vadd<<<1, 4>>>(d, 4);\n"
    + "  cudaError_t err = cudaGetLastError();\n"
    + "  printf(\"cuda says %s\", cudaGetErrorString(err));\n"
    + "  cudaFree(d);\n"
    + "  return 0;\n"
    + "}\n";

  private static final String HIP =
      "#include <hip_runtime.h>\n"
    + "__global__ void vadd(hipLaunchParm lp, float *a, int n) {\n"
    + "  int i = hipThreadIdx_x + hipBlockIdx_x * hipBlockDim_x;\n"
    + "  if (i < n) a[i] = 0;\n"
    + "}\n"
    + "int main() {\n"
    + "  float *d;\n"
    + "  hipMalloc(&d, 4 * sizeof(float));\n"
    + "  hipLaunchKernel(HIP_KERNEL_NAME(vadd), dim3(1), dim3(4), 0, 0, d, 4);\n"
    + "  hipError_t err = hipGetLastError();\n"
    + "  printf(\"hip says %s\", hipGetErrorString(err));\n"
    + "  hipFree(d);\n"
    + "  return 0;\n"
    + "}\n";

  private static SourceFile write(Path dir, String name, String text) throws Exception
  {
    Path file = dir.resolve(name);
    Files.write(file, text.getBytes(StandardCharsets.UTF_8));
    return SourceFile.read(file.toString());
  }

  private static String translate(SourceFile source) throws Exception
  {
    PassOrchestrator passes = new PassOrchestrator(HipNames.create());
    ReplacementSet edits = passes.translate(Collections.singletonList(source));
    ApplyResult result = new SourceRewriter(true).rewrite(source, edits);
    assertTrue(result.isClean(), "skipped " + result.getSkipped());
    return (result.getNewText() == null) ? source.getText() : result.getNewText();
  }

  @Test
  void translatesHostAndDeviceCode(@TempDir Path dir) throws Exception
  {
    assertEquals(HIP, translate(write(dir, "vadd.hip.cu", CUDA)));
  }

  @Test
  void qualifiedLaunchIsReplacedWhole(@TempDir Path dir) throws Exception
  {
    String cuda =
        "namespace ns { __global__ void k(int *a) { } }\n"
      + "void h(int *a) { ns::k<<<1, 2>>>(a); }\n";

    assertEquals("namespace ns { __global__ void k(hipLaunchParm lp, int *a) { } }\n"
        + "void h(int *a) { hipLaunchKernel(HIP_KERNEL_NAME(ns::k), dim3(1), dim3(2), 0, 0, a); }\n",
        translate(write(dir, "ns.hip.cu", cuda)));
  }

  @Test
  void callsInsideLaunchArgumentsAreRenamed(@TempDir Path dir) throws Exception
  {
    String cuda =
        "__global__ void k(int e) { }\n"
      + "void h(hipStream_t s) { k<<<1, 2, 0, s>>>(cudaGetLastError()); }\n";
    String hip =
        "__global__ void k(hipLaunchParm lp, int e) { }\n"
      + "void h(hipStream_t s) {"
      + " hipLaunchKernel(HIP_KERNEL_NAME(k), dim3(1), dim3(2), 0, s, hipGetLastError()); }\n";

    assertEquals(hip, translate(write(dir, "args.hip.cu", cuda)));
    assertTrue(new PassOrchestrator(HipNames.create())
        .translate(Collections.singletonList(write(dir, "again.hip.cu", hip))).isEmpty());
  }

  @Test
  void translatedOutputIsStable(@TempDir Path dir) throws Exception
  {
    SourceFile hip = write(dir, "vadd.hip.cu", HIP);
    PassOrchestrator passes = new PassOrchestrator(HipNames.create());

    assertTrue(passes.translate(Collections.singletonList(hip)).isEmpty());
  }

  @Test
  void deviceCodeIsOnlyTranslatedInDevicePass(@TempDir Path dir) throws Exception
  {
    SourceFile source = write(dir, "vadd.hip.cu", CUDA);
    List<SourceFile> files = Collections.singletonList(source);
    PassOrchestrator passes = new PassOrchestrator(HipNames.create());

    ReplacementSet host = passes.runPass(files, CompilationView.HOST_ONLY);
    for (Edit edit : host)
      assertNotEquals(MatchKind.BUILTIN_ACCESS, edit.getOrigin());

    ReplacementSet device = passes.runPass(files, CompilationView.DEVICE_ONLY);
    int builtins = 0;
    for (Edit edit : device) {
      assertNotEquals(MatchKind.KERNEL_LAUNCH, edit.getOrigin());
      if (edit.getOrigin() == MatchKind.BUILTIN_ACCESS)
        builtins++;
    }
    assertEquals(3, builtins);
  }

  @Test
  void singlePassLeavesTheRunUntouched(@TempDir Path dir) throws Exception
  {
    List<SourceFile> files = Collections.singletonList(write(dir, "vadd.hip.cu", CUDA));
    PassOrchestrator passes = new PassOrchestrator(HipNames.create());

    ReplacementSet host = passes.runPass(files, CompilationView.HOST_ONLY);

    assertFalse(host.isEmpty());
    assertNotSame(host, passes.getReplacements());
    assertTrue(passes.getReplacements().isEmpty());
    assertEquals(PassOrchestrator.State.HOST_ONLY_PASS, passes.getState());

    ReplacementSet all = passes.translate(files);
    for (Edit edit : host)
      assertTrue(all.getEdits(edit.getFile()).contains(edit), edit.toString());
    assertEquals(PassOrchestrator.State.DONE, passes.getState());
  }

  @Test
  void fileScopeEditsOfDevicePassAreDuplicates(@TempDir Path dir) throws Exception
  {
    PassOrchestrator passes = new PassOrchestrator(HipNames.create());
    ReplacementSet edits = passes.translate(Collections.singletonList(
          write(dir, "vadd.hip.cu", CUDA)));

    assertEquals(PassOrchestrator.State.DONE, passes.getState());
    assertFalse(edits.getRejected().isEmpty());
    for (Proposal rejected : edits.getRejected())
      assertTrue(rejected.isDuplicate(), rejected.toString());
  }

  @Test
  void failingFileKeepsEarlierEditsAndOthersContinue(@TempDir Path dir) throws Exception
  {
    SourceFile broken = write(dir, "broken.cpp", "void h() { cudaFree(p); foo<<<1, 2; }\n");
    SourceFile fine = write(dir, "fine.cpp", "void g() { cudaDeviceReset(); }\n");
    PassOrchestrator passes = new PassOrchestrator(HipNames.create());

    ReplacementSet edits = passes.translate(Arrays.asList(broken, fine));

    assertEquals(1, edits.getEdits(broken.getPath()).size());
    assertEquals("hipFree", edits.getEdits(broken.getPath()).get(0).getNewText());
    assertEquals(1, edits.getEdits(fine.getPath()).size());
    assertEquals(Collections.singleton(broken.getPath()), passes.getFailedFiles());
  }

  @Test
  void passesRunOnce(@TempDir Path dir) throws Exception
  {
    PassOrchestrator passes = new PassOrchestrator(HipNames.create());
    List<SourceFile> files = Collections.singletonList(write(dir, "a.cpp", "int x;\n"));
    passes.translate(files);

    assertThrows(IllegalStateException.class, () -> passes.translate(files));
  }
}
