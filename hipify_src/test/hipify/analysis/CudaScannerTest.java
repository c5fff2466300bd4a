package hipify.analysis;

import java.util.*;

import org.junit.jupiter.api.Test;

import hipify.ir.*;

import static org.junit.jupiter.api.Assertions.*;

public class CudaScannerTest
{
  private static final class Collector implements MatchListener
  {
    final List<MatchResult> matches = new ArrayList<MatchResult>();

    public void matched(MatchResult match)
    {
      matches.add(match);
    }

    <M extends MatchResult> List<M> of(Class<M> type)
    {
      List<M> ret = new ArrayList<M>();
      for (MatchResult m : matches)
        if (type.isInstance(m))
          ret.add(type.cast(m));
      return ret;
    }
  }

  private static Collector scan(String text, CompilationView view) throws ScanException
  {
    return scan(new CudaScanner(), text, view);
  }

  private static Collector scan(CudaScanner scanner, String text, CompilationView view)
      throws ScanException
  {
    Collector collector = new Collector();
    scanner.scan(new SourceFile("k.cu", text), view, collector);
    return collector;
  }

  private static String textOf(String text, SourceSpan span)
  {
    return text.substring(span.getStart(), span.getEnd());
  }

  private static List<String> callees(Collector c)
  {
    List<String> names = new ArrayList<String>();
    for (FunctionCall call : c.of(FunctionCall.class))
      names.add(call.getCalleeName());
    return names;
  }

  private static List<String> refs(Collector c)
  {
    List<String> names = new ArrayList<String>();
    for (EnumOrTypeRef ref : c.of(EnumOrTypeRef.class))
      names.add(ref.getName());
    return names;
  }

  @Test
  void kernelLaunchCapturesConfigurationAndArguments() throws ScanException
  {
    String text =
        "__global__ void foo(float *a, int b) { }\n"
      + "void run(float *a) { foo<<<grid, block>>>(a, (int)sizeof(float)); }\n";

    List<KernelLaunch> launches = scan(text, CompilationView.HOST_ONLY).of(KernelLaunch.class);

    assertEquals(1, launches.size());
    KernelLaunch launch = launches.get(0);
    assertEquals("foo", launch.getCalleeName());
    assertEquals("foo<<<grid, block>>>(a, (int)sizeof(float))", textOf(text, launch.getFullSpan()));
    assertEquals(1, launch.getParamListSpans().size());
    assertEquals("float *a, int b", textOf(text, launch.getParamListSpans().get(0)));
    assertEquals(Arrays.asList("a", "(int)sizeof(float)"), launch.getLaunchArgs());

    List<KernelLaunch.ConfigArgument> config = launch.getConfigArgs();
    assertEquals(4, config.size());
    assertEquals("grid", config.get(0).getText());
    assertEquals("dim3", config.get(0).getDeclaredType());
    assertEquals("block", config.get(1).getText());
    assertTrue(config.get(2).isDefault());
    assertEquals("size_t", config.get(2).getDeclaredType());
    assertTrue(config.get(3).isDefault());
    assertEquals("cudaStream_t", config.get(3).getDeclaredType());
  }

  @Test
  void templateKernelLaunchKeepsTemplateArguments() throws ScanException
  {
    String text =
        "template <typename T> __global__ void scale(T *a) { }\n"
      + "void run() { scale<float><<<n, 256, 0, stream>>>(d); }\n";

    KernelLaunch launch = scan(text, CompilationView.HOST_ONLY).of(KernelLaunch.class).get(0);

    assertEquals("scale<float>", launch.getCalleeName());
    assertEquals("T *a", textOf(text, launch.getParamListSpans().get(0)));
    assertEquals("0", launch.getConfigArgs().get(2).getText());
    assertEquals("stream", launch.getConfigArgs().get(3).getText());
    assertEquals(Collections.singletonList("d"), launch.getLaunchArgs());
  }

  @Test
  void qualifiedKernelLaunchSpansTheQualifier() throws ScanException
  {
    String text =
        "namespace ns { __global__ void k(int *a) { } }\n"
      + "void h(int *a) { ns::k<<<1, 2>>>(a); ::g<<<1, 1>>>(a); }\n";

    List<KernelLaunch> launches = scan(text, CompilationView.HOST_ONLY).of(KernelLaunch.class);

    assertEquals(2, launches.size());
    assertEquals("ns::k", launches.get(0).getCalleeName());
    assertEquals("ns::k<<<1, 2>>>(a)", textOf(text, launches.get(0).getFullSpan()));
    assertEquals("int *a", textOf(text, launches.get(0).getParamListSpans().get(0)));
    assertEquals("::g", launches.get(1).getCalleeName());
    assertEquals("::g<<<1, 1>>>(a)", textOf(text, launches.get(1).getFullSpan()));
  }

  @Test
  void emptyKernelParameterListGivesEmptySpan() throws ScanException
  {
    String text =
        "__global__ void tick();\n"
      + "void run() { tick<<<1, 1>>>(); }\n";

    KernelLaunch launch = scan(text, CompilationView.HOST_ONLY).of(KernelLaunch.class).get(0);

    SourceSpan params = launch.getParamListSpans().get(0);
    assertTrue(params.isEmpty());
    assertEquals(text.indexOf("tick(") + 5, params.getStart());
    assertTrue(launch.getLaunchArgs().isEmpty());
  }

  @Test
  void viewsSelectFunctionBodies() throws ScanException
  {
    String text =
        "__global__ void k(int *out) { out[0] = threadIdx.x; deviceOnly(); }\n"
      + "__host__ __device__ int both() { return shared(); }\n"
      + "int host() { return hostOnly(); }\n";

    Collector host = scan(text, CompilationView.HOST_ONLY);
    Collector device = scan(text, CompilationView.DEVICE_ONLY);

    assertTrue(host.of(BuiltinAccess.class).isEmpty());
    assertTrue(callees(host).contains("hostOnly"));
    assertTrue(callees(host).contains("shared"));
    assertFalse(callees(host).contains("deviceOnly"));

    assertEquals(1, device.of(BuiltinAccess.class).size());
    BuiltinAccess access = device.of(BuiltinAccess.class).get(0);
    assertEquals("threadIdx", access.getBaseName());
    assertEquals("x", access.getMemberName());
    assertEquals("threadIdx.x", textOf(text, access.getSpan()));
    assertTrue(callees(device).contains("deviceOnly"));
    assertTrue(callees(device).contains("shared"));
    assertFalse(callees(device).contains("hostOnly"));
  }

  @Test
  void spacedOrMemberAccessIsNotBuiltin() throws ScanException
  {
    String text = "__device__ int f() { return threadIdx . x + s.threadIdx.y; }\n";

    assertTrue(scan(text, CompilationView.DEVICE_ONLY).of(BuiltinAccess.class).isEmpty());
  }

  @Test
  void conditionalRegionsFollowTheView() throws ScanException
  {
    String text =
        "#ifdef __CUDA_ARCH__\n"
      + "int side = cudaSuccess;\n"
      + "#elif defined(__CUDACC__)\n"
      + "int side = cudaErrorUnknown;\n"
      + "#else\n"
      + "int side = neither;\n"
      + "#endif\n";

    Collector host = scan(text, CompilationView.HOST_ONLY);
    Collector device = scan(text, CompilationView.DEVICE_ONLY);

    assertTrue(refs(host).contains("cudaErrorUnknown"));
    assertFalse(refs(host).contains("cudaSuccess"));
    assertFalse(refs(host).contains("neither"));
    assertTrue(refs(device).contains("cudaSuccess"));
    assertFalse(refs(device).contains("cudaErrorUnknown"));

    List<ConditionalIdentifier> tested = host.of(ConditionalIdentifier.class);
    assertEquals(2, tested.size());
    assertEquals("__CUDA_ARCH__", tested.get(0).getName());
    assertEquals("ifdef", tested.get(0).getDirective());
    assertEquals("__CUDACC__", tested.get(1).getName());
    assertEquals("elif", tested.get(1).getDirective());
  }

  @Test
  void userMacrosAreDefinedInBothViews() throws ScanException
  {
    String text =
        "#if USE_STREAMS\n"
      + "cudaStream_t s;\n"
      + "#endif\n";
    CudaScanner scanner = new CudaScanner(Collections.singletonMap("USE_STREAMS", "1"));

    assertTrue(refs(scan(scanner, text, CompilationView.HOST_ONLY)).contains("cudaStream_t"));
    assertTrue(refs(scan(scanner, text, CompilationView.DEVICE_ONLY)).contains("cudaStream_t"));
    assertFalse(refs(scan(text, CompilationView.HOST_ONLY)).contains("cudaStream_t"));
  }

  @Test
  void includesAreReportedWithTheirSpelling() throws ScanException
  {
    String text =
        "#include <cuda_runtime.h>\n"
      + "#  include \"helper.h\"\n";

    List<Include> includes = scan(text, CompilationView.HOST_ONLY).of(Include.class);

    assertEquals(2, includes.size());
    assertEquals("cuda_runtime.h", includes.get(0).getTargetName());
    assertTrue(includes.get(0).isAngled());
    assertTrue(includes.get(0).isWrittenInMainFile());
    assertEquals("<cuda_runtime.h>", textOf(text, includes.get(0).getSpan()));
    assertEquals("helper.h", includes.get(1).getTargetName());
    assertFalse(includes.get(1).isAngled());
  }

  @Test
  void macroBodiesReportTheirIdentifiers() throws ScanException
  {
    String text = "#define CHECK(call) call; cudaDeviceSynchronize()\n"
      + "#define SIZE (16)\n";

    List<MacroBodyIdentifier> ids = scan(text, CompilationView.HOST_ONLY)
        .of(MacroBodyIdentifier.class);

    assertEquals(2, ids.size());
    assertEquals("call", ids.get(0).getName());
    assertEquals("CHECK", ids.get(0).getMacroName());
    assertEquals("cudaDeviceSynchronize", ids.get(1).getName());
    assertEquals("cudaDeviceSynchronize", textOf(text, ids.get(1).getSpan()));
  }

  @Test
  void callsInsideMacroArgumentsAreMarked() throws ScanException
  {
    String text =
        "#define CHECK(call) call\n"
      + "void h() { CHECK(cudaMalloc(&p, 4)); cudaFree(p); }\n";

    List<FunctionCall> calls = scan(text, CompilationView.HOST_ONLY).of(FunctionCall.class);
    Map<String, FunctionCall> byName = new HashMap<String, FunctionCall>();
    for (FunctionCall call : calls)
      byName.put(call.getCalleeName(), call);

    assertTrue(byName.get("cudaMalloc").isInMacroArgument());
    assertEquals("cudaMalloc", textOf(text, byName.get("cudaMalloc").getSpellingSpan()));
    assertFalse(byName.get("cudaFree").isInMacroArgument());
    assertFalse(byName.get("CHECK").isInMacroArgument());
  }

  @Test
  void memberCallsAreNotFunctionCalls() throws ScanException
  {
    String text = "void h(Alloc *a) { a->cudaMalloc(1); obj.cudaFree(2); cudaFree(3); }\n";

    List<String> names = callees(scan(text, CompilationView.HOST_ONLY));

    assertEquals(1, Collections.frequency(names, "cudaFree"));
    assertFalse(names.contains("cudaMalloc"));
  }

  @Test
  void declarationsAreClassified() throws ScanException
  {
    String text =
        "void h(cudaStream_t s) {\n"
      + "  cudaError_t err = cudaGetLastError();\n"
      + "  cudaDeviceProp prop;\n"
      + "  if (err != cudaSuccess) return;\n"
      + "}\n";

    Map<String, EnumOrTypeRef.RefKind> kinds = new HashMap<String, EnumOrTypeRef.RefKind>();
    for (EnumOrTypeRef ref : scan(text, CompilationView.HOST_ONLY).of(EnumOrTypeRef.class))
      kinds.put(ref.getName(), ref.getRefKind());

    assertEquals(EnumOrTypeRef.RefKind.PARAMETER, kinds.get("cudaStream_t"));
    assertEquals(EnumOrTypeRef.RefKind.ENUM_VARIABLE, kinds.get("cudaError_t"));
    assertEquals(EnumOrTypeRef.RefKind.STRUCT_VARIABLE, kinds.get("cudaDeviceProp"));
    assertEquals(EnumOrTypeRef.RefKind.ENUM_CONSTANT, kinds.get("cudaSuccess"));
  }

  @Test
  void stringLiteralsKeepTheirQuotes() throws ScanException
  {
    String text = "void h() { puts(\"cuda failed\"); }\n";

    List<StringLiteral> literals = scan(text, CompilationView.HOST_ONLY).of(StringLiteral.class);

    assertEquals(1, literals.size());
    assertEquals("\"cuda failed\"", literals.get(0).getRawText());
    assertEquals("\"cuda failed\"", textOf(text, literals.get(0).getSpan()));
  }

  @Test
  void commentsAndInactiveTextAreIgnored() throws ScanException
  {
    String text =
        "// cudaMalloc(p);\n"
      + "/* cudaFree(p); */\n"
      + "#if 0\n"
      + "void dead() { cudaMemset(p, 0, 4); }\n"
      + "#endif\n";

    assertTrue(scan(text, CompilationView.HOST_ONLY).matches.isEmpty());
  }

  @Test
  void preprocessorMatchesComeFirst() throws ScanException
  {
    String text =
        "void h() { cudaFree(p); }\n"
      + "#include <cuda_runtime.h>\n";

    List<MatchResult> matches = scan(text, CompilationView.HOST_ONLY).matches;

    assertEquals(MatchKind.INCLUDE, matches.get(0).getKind());
  }

  @Test
  void offsetsCountUtf16Characters() throws ScanException
  {
    String text = "// 😀 launch\nvoid h() { cudaFree(p); }\n";

    FunctionCall call = null;
    for (FunctionCall c : scan(text, CompilationView.HOST_ONLY).of(FunctionCall.class))
      if (c.getCalleeName().equals("cudaFree"))
        call = c;

    assertNotNull(call);
    assertEquals("cudaFree", textOf(text, call.getCallSpan()));
  }

  @Test
  void unterminatedConditionalFails()
  {
    ScanException e = assertThrows(ScanException.class,
        () -> scan("#ifdef X\nint a;\n", CompilationView.HOST_ONLY));
    assertEquals(1, e.getLine());
    assertThrows(ScanException.class, () -> scan("#endif\n", CompilationView.HOST_ONLY));
    assertThrows(ScanException.class,
        () -> scan("#if 1\n#else\n#else\n#endif\n", CompilationView.HOST_ONLY));
  }

  @Test
  void unterminatedLaunchKeepsEarlierMatches()
  {
    String text = "void h() { puts(\"cuda\"); foo<<<1, 2; }\n";
    final Collector collector = new Collector();

    assertThrows(ScanException.class, () -> new CudaScanner().scan(new SourceFile("k.cu", text),
          CompilationView.HOST_ONLY, collector));
    assertEquals(1, collector.of(StringLiteral.class).size());
  }
}
