package hipify.transforms.rules;

import java.util.*;

import org.junit.jupiter.api.Test;

import hipify.common.*;
import hipify.ir.*;

import static org.junit.jupiter.api.Assertions.*;

public class KernelLaunchRuleTest
{
  private static final String TEXT =
      "__global__ void foo(float *a, int b) {}\n"
    + "void run() { foo<<<grid, block>>>(a, b); }\n";

  private final SourceFile source = new SourceFile("k.cu", TEXT);
  private final RuleContext context = new RuleContext(HipNames.create(), source);

  private SourceSpan spanOf(String text)
  {
    int start = TEXT.indexOf(text);
    return new SourceSpan(start, start + text.length());
  }

  @Test
  void launchBecomesHipLaunchKernel()
  {
    KernelLaunch launch = new KernelLaunch("k.cu", "foo",
        Collections.singletonList(spanOf("float *a, int b")),
        Arrays.asList(KernelLaunch.ConfigArgument.written("grid", "dim3"),
                      KernelLaunch.ConfigArgument.written("block", "unsigned int")),
        Arrays.asList("a", "b"),
        spanOf("foo<<<grid, block>>>(a, b)"));

    List<Edit> edits = new KernelLaunchRule().apply(launch, context);

    assertEquals(2, edits.size());
    assertEquals("hipLaunchParm lp, float *a, int b", edits.get(0).getNewText());
    assertEquals(spanOf("float *a, int b"), edits.get(0).getSpan());
    assertEquals("hipLaunchKernel(HIP_KERNEL_NAME(foo), dim3(grid), block, a, b)",
        edits.get(1).getNewText());
    assertEquals(spanOf("foo<<<grid, block>>>(a, b)"), edits.get(1).getSpan());
    assertEquals(MatchKind.KERNEL_LAUNCH, edits.get(1).getOrigin());
  }

  @Test
  void elidedConfigArgumentsRenderAsZero()
  {
    KernelLaunch launch = new KernelLaunch("k.cu", "foo",
        Collections.<SourceSpan>emptyList(),
        Arrays.asList(KernelLaunch.ConfigArgument.written("n / 256", "dim3"),
                      KernelLaunch.ConfigArgument.written("256", "dim3"),
                      KernelLaunch.ConfigArgument.defaulted("size_t"),
                      KernelLaunch.ConfigArgument.defaulted("cudaStream_t")),
        Collections.<String>emptyList(),
        spanOf("foo<<<grid, block>>>(a, b)"));

    List<Edit> edits = new KernelLaunchRule().apply(launch, context);

    assertEquals(1, edits.size());
    assertEquals("hipLaunchKernel(HIP_KERNEL_NAME(foo), dim3(n / 256), dim3(256), 0, 0)",
        edits.get(0).getNewText());
  }

  @Test
  void launchParameterReplacesEmptyOrVoidList()
  {
    assertEquals("hipLaunchParm lp", KernelLaunchRule.addLaunchParam(""));
    assertEquals("hipLaunchParm lp", KernelLaunchRule.addLaunchParam("void"));
    assertEquals("hipLaunchParm lp, int n", KernelLaunchRule.addLaunchParam("int n"));
  }

  @Test
  void namesInsideLaunchArgumentsAreTranslated()
  {
    RenameTable names = HipNames.create();

    assertEquals("hipGetLastError()", KernelLaunchRule.renameArgument("cudaGetLastError()", names));
    assertEquals("hipBlockDim_x * 2", KernelLaunchRule.renameArgument("blockDim.x * 2", names));
    assertEquals("\"hip\"", KernelLaunchRule.renameArgument("\"cuda\"", names));
    assertEquals("s->cudaFree + 1.5f /* cudaFree */",
        KernelLaunchRule.renameArgument("s->cudaFree + 1.5f /* cudaFree */", names));
    assertEquals("obj.cudaMalloc(p)", KernelLaunchRule.renameArgument("obj.cudaMalloc(p)", names));
  }

  @Test
  void launchRendersTranslatedArguments()
  {
    KernelLaunch launch = new KernelLaunch("k.cu", "foo",
        Collections.<SourceSpan>emptyList(),
        Arrays.asList(KernelLaunch.ConfigArgument.written("1", "dim3"),
                      KernelLaunch.ConfigArgument.written("2", "dim3"),
                      KernelLaunch.ConfigArgument.written("0", "size_t"),
                      KernelLaunch.ConfigArgument.written("s", "cudaStream_t")),
        Collections.singletonList("cudaGetLastError()"),
        spanOf("foo<<<grid, block>>>(a, b)"));

    List<Edit> edits = new KernelLaunchRule().apply(launch, context);

    assertEquals("hipLaunchKernel(HIP_KERNEL_NAME(foo), dim3(1), dim3(2), 0, s, hipGetLastError())",
        edits.get(0).getNewText());
  }
}
