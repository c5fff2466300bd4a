package hipify.transforms.rules;

import java.util.*;

import org.junit.jupiter.api.Test;

import hipify.common.*;
import hipify.ir.*;

import static org.junit.jupiter.api.Assertions.*;

public class RuleDispatcherTest
{
  private static final String TEXT =
      "#include <cuda_runtime.h>\n"
    + "#include \"cuda_runtime.h\"\n"
    + "#define SYNC cudaDeviceSynchronize()\n"
    + "#ifdef __CUDACC__\n"
    + "#endif\n"
    + "cudaError_t err = cudaMalloc(&p, n);\n"
    + "int i = threadIdx.x + myCall(blockIdx.__fetch_builtin_y);\n";

  private final SourceFile source = new SourceFile("d.cu", TEXT);
  private final RuleDispatcher rules = new RuleDispatcher(HipNames.create(), source);

  private static SourceSpan spanOf(String text)
  {
    int start = TEXT.indexOf(text);
    return new SourceSpan(start, start + text.length());
  }

  private Edit only(MatchResult match)
  {
    List<Edit> edits = rules.apply(match);
    assertEquals(1, edits.size(), "edits of " + match);
    return edits.get(0);
  }

  @Test
  void callRenameLeavesArgumentsUntouched()
  {
    Edit edit = only(new FunctionCall("d.cu", "cudaMalloc", spanOf("cudaMalloc")));

    assertEquals("hipMalloc", edit.getNewText());
    assertEquals(spanOf("cudaMalloc"), edit.getSpan());
    assertEquals("cudaMalloc", source.getText(edit.getSpan()));
  }

  @Test
  void callInMacroArgumentUsesSpellingSpan()
  {
    SourceSpan spelling = spanOf("cudaMalloc");
    Edit edit = only(new FunctionCall("d.cu", "cudaMalloc", spanOf("cudaDeviceSynchronize"),
          spelling, true));

    assertEquals(spelling, edit.getSpan());
  }

  @Test
  void unknownCalleeProducesNoEdit()
  {
    assertTrue(rules.apply(new FunctionCall("d.cu", "myCall", spanOf("myCall"))).isEmpty());
  }

  @Test
  void builtinAccessBecomesCoordinateMacro()
  {
    Edit x = only(new BuiltinAccess("d.cu", "threadIdx", "x", spanOf("threadIdx.x")));
    assertEquals("hipThreadIdx_x", x.getNewText());
    assertEquals(spanOf("threadIdx.x"), x.getSpan());

    Edit y = only(new BuiltinAccess("d.cu", "blockIdx", "__fetch_builtin_y",
          spanOf("blockIdx.__fetch_builtin_y")));
    assertEquals("hipBlockIdx_y", y.getNewText());
    assertEquals("blockIdx._", source.getText(y.getSpan()));
  }

  @Test
  void declarationRenameCoversTypeName()
  {
    Edit edit = only(new EnumOrTypeRef("d.cu", "cudaError_t", spanOf("cudaError_t"),
          EnumOrTypeRef.RefKind.ENUM_VARIABLE));
    assertEquals("hipError_t", edit.getNewText());
    assertEquals(MatchKind.ENUM_OR_TYPE_REF, edit.getOrigin());
  }

  @Test
  void onlyAngledIncludesOfMainFileAreRewritten()
  {
    Edit edit = only(new Include("d.cu", "cuda_runtime.h", true, spanOf("<cuda_runtime.h>"), true));
    assertEquals("<hip_runtime.h>", edit.getNewText());

    assertTrue(rules.apply(new Include("d.cu", "cuda_runtime.h", false,
          spanOf("\"cuda_runtime.h\""), true)).isEmpty());
    assertTrue(rules.apply(new Include("d.cu", "cuda_runtime.h", true,
          spanOf("<cuda_runtime.h>"), false)).isEmpty());
  }

  @Test
  void macroAndConditionalIdentifiersAreRenamed()
  {
    Edit body = only(new MacroBodyIdentifier("d.cu", "cudaDeviceSynchronize", "SYNC",
          spanOf("cudaDeviceSynchronize"), true));
    assertEquals("hipDeviceSynchronize", body.getNewText());

    Edit tested = only(new ConditionalIdentifier("d.cu", "__CUDACC__", "ifdef",
          spanOf("__CUDACC__"), true));
    assertEquals("__HIPCC__", tested.getNewText());

    assertTrue(rules.apply(new MacroBodyIdentifier("d.cu", "cudaDeviceSynchronize", "SYNC",
          spanOf("cudaDeviceSynchronize"), false)).isEmpty());
  }

  @Test
  void matchOfAnotherFileIsRejected()
  {
    assertThrows(IllegalArgumentException.class,
        () -> rules.apply(new FunctionCall("other.cu", "cudaMalloc", new SourceSpan(0, 10))));
  }
}
