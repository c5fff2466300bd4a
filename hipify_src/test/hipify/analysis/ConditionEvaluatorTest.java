package hipify.analysis;

import java.util.*;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionEvaluatorTest
{
  private final Map<String, String> macros = new HashMap<String, String>();

  private boolean eval(String expression) throws ScanException
  {
    return new ConditionEvaluator(macros, "t.cu", 7).isTrue(ConditionEvaluator.lex(expression));
  }

  @Test
  void definedTestsMacroPresence() throws ScanException
  {
    macros.put("__CUDACC__", "1");

    assertTrue(eval("defined(__CUDACC__)"));
    assertTrue(eval("defined __CUDACC__"));
    assertFalse(eval("defined(__CUDA_ARCH__)"));
    assertTrue(eval("!defined(__CUDA_ARCH__) && defined(__CUDACC__)"));
  }

  @Test
  void macrosExpandToTheirValue() throws ScanException
  {
    macros.put("__CUDA_ARCH__", "300");
    macros.put("ARCH", "__CUDA_ARCH__");
    macros.put("EMPTY", "");

    assertTrue(eval("__CUDA_ARCH__ >= 200"));
    assertFalse(eval("__CUDA_ARCH__ < 300"));
    assertTrue(eval("ARCH == 300"));
    assertFalse(eval("UNDEFINED"));
    assertFalse(eval("EMPTY"));
  }

  @Test
  void arithmeticFollowsCPrecedence() throws ScanException
  {
    assertTrue(eval("1 + 2 * 3 == 7"));
    assertTrue(eval("(1 + 2) * 3 == 9"));
    assertTrue(eval("0x10 == 16 && 010 == 8 && 0b11 == 3"));
    assertTrue(eval("1 << 4 == 16"));
    assertTrue(eval("-1 < 0"));
    assertTrue(eval("0 ? 0 : 5"));
    assertTrue(eval("10UL / 3 == 3 && 10 % 3 == 1"));
    assertTrue(eval("'A' == 65"));
    assertTrue(eval("(6 & 3) == 2 && (6 | 1) == 7 && (6 ^ 2) == 4"));
  }

  @Test
  void functionLikeInvocationIsZero() throws ScanException
  {
    assertFalse(eval("__has_feature(cxx_rvalue_references)"));
    assertTrue(eval("__has_feature(x) || 1"));
  }

  @Test
  void malformedExpressionsFail()
  {
    ScanException e = assertThrows(ScanException.class, () -> eval("1 / 0"));
    assertEquals(7, e.getLine());
    assertTrue(e.getMessage().startsWith("t.cu:7: "));
    assertThrows(ScanException.class, () -> eval("(1"));
    assertThrows(ScanException.class, () -> eval("1 2"));
    assertThrows(ScanException.class, () -> eval(""));
  }
}
