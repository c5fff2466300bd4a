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

import org.antlr.v4.runtime.*;

import hipify.base.grammars.CudaLexer;

/**
 * Evaluates the controlling expression of #if and #elif against the macros
 * defined so far in one view. Undefined identifiers evaluate to 0, object
 * macros to the value of their body, function-like macro invocations to 0.
 */
public class ConditionEvaluator
{
  private static final int MAX_EXPANSION_DEPTH = 16;

  private final Map<String, String> macros;
  private final String file;
  private final int line;

  private List<Token> tokens;
  private int pos;

  public ConditionEvaluator(Map<String, String> macros, String file, int line)
  {
    this.macros = macros;
    this.file = file;
    this.line = line;
  }

  /**
   * Evaluates <var>expression</var>, the default-channel tokens following
   * the directive keyword.
   */
  public boolean isTrue(List<Token> expression) throws ScanException
  {
    return evaluate(expression, 0) != 0;
  }

  private long evaluate(List<Token> expression, int depth) throws ScanException
  {
    if (expression.isEmpty())
      throw error("#if with no expression");
    List<Token> savedTokens = tokens;
    int savedPos = pos;
    tokens = expression;
    pos = 0;
    try {
      long value = conditional(depth);
      if (pos < tokens.size())
        throw error("unexpected '" + tokens.get(pos).getText() + "' in #if expression");
      return value;
    } finally {
      tokens = savedTokens;
      pos = savedPos;
    }
  }

  private long conditional(int depth) throws ScanException
  {
    long cond = logicalOr(depth);
    if (accept("?")) {
      long ifTrue = conditional(depth);
      expect(":");
      long ifFalse = conditional(depth);
      return (cond != 0) ? ifTrue : ifFalse;
    }
    return cond;
  }

  private long logicalOr(int depth) throws ScanException
  {
    long value = logicalAnd(depth);
    while (accept("||")) {
      long rhs = logicalAnd(depth);
      value = (value != 0 || rhs != 0) ? 1 : 0;
    }
    return value;
  }

  private long logicalAnd(int depth) throws ScanException
  {
    long value = bitOr(depth);
    while (accept("&&")) {
      long rhs = bitOr(depth);
      value = (value != 0 && rhs != 0) ? 1 : 0;
    }
    return value;
  }

  private long bitOr(int depth) throws ScanException
  {
    long value = bitXor(depth);
    while (accept("|"))
      value |= bitXor(depth);
    return value;
  }

  private long bitXor(int depth) throws ScanException
  {
    long value = bitAnd(depth);
    while (accept("^"))
      value ^= bitAnd(depth);
    return value;
  }

  private long bitAnd(int depth) throws ScanException
  {
    long value = equality(depth);
    while (accept("&"))
      value &= equality(depth);
    return value;
  }

  private long equality(int depth) throws ScanException
  {
    long value = relational(depth);
    for (;;) {
      if (accept("=="))
        value = (value == relational(depth)) ? 1 : 0;
      else if (accept("!="))
        value = (value != relational(depth)) ? 1 : 0;
      else
        return value;
    }
  }

  private long relational(int depth) throws ScanException
  {
    long value = shift(depth);
    for (;;) {
      if (accept("<="))
        value = (value <= shift(depth)) ? 1 : 0;
      else if (accept(">="))
        value = (value >= shift(depth)) ? 1 : 0;
      else if (accept("<"))
        value = (value < shift(depth)) ? 1 : 0;
      else if (accept(">"))
        value = (value > shift(depth)) ? 1 : 0;
      else
        return value;
    }
  }

  private long shift(int depth) throws ScanException
  {
    long value = additive(depth);
    for (;;) {
      if (accept("<<"))
        value <<= additive(depth);
      else if (accept(">>"))
        value >>= additive(depth);
      else
        return value;
    }
  }

  private long additive(int depth) throws ScanException
  {
    long value = multiplicative(depth);
    for (;;) {
      if (accept("+"))
        value += multiplicative(depth);
      else if (accept("-"))
        value -= multiplicative(depth);
      else
        return value;
    }
  }

  private long multiplicative(int depth) throws ScanException
  {
    long value = unary(depth);
    for (;;) {
      if (accept("*")) {
        value *= unary(depth);
      }
      else if (accept("/")) {
        long rhs = unary(depth);
        if (rhs == 0)
          throw error("division by zero in #if expression");
        value /= rhs;
      }
      else if (accept("%")) {
        long rhs = unary(depth);
        if (rhs == 0)
          throw error("division by zero in #if expression");
        value %= rhs;
      }
      else {
        return value;
      }
    }
  }

  private long unary(int depth) throws ScanException
  {
    if (accept("!"))
      return (unary(depth) == 0) ? 1 : 0;
    if (accept("-"))
      return -unary(depth);
    if (accept("+"))
      return unary(depth);
    if (accept("~"))
      return ~unary(depth);
    return primary(depth);
  }

  private long primary(int depth) throws ScanException
  {
    if (pos >= tokens.size())
      throw error("#if expression ends unexpectedly");
    Token t = tokens.get(pos++);
    switch (t.getType()) {
      case CudaLexer.LPAREN:
        long value = conditional(depth);
        expect(")");
        return value;
      case CudaLexer.NUMBER:
        return parseNumber(t.getText());
      case CudaLexer.CHAR_LITERAL:
        return parseChar(t.getText());
      case CudaLexer.IDENTIFIER:
        if (t.getText().equals("defined"))
          return defined();
        return identifierValue(t.getText(), depth);
      default:
        throw error("unexpected '" + t.getText() + "' in #if expression");
    }
  }

  private long defined() throws ScanException
  {
    boolean paren = accept("(");
    if (pos >= tokens.size() || tokens.get(pos).getType() != CudaLexer.IDENTIFIER)
      throw error("'defined' without a macro name");
    String name = tokens.get(pos++).getText();
    if (paren)
      expect(")");
    return macros.containsKey(name) ? 1 : 0;
  }

  private long identifierValue(String name, int depth) throws ScanException
  {
    // Function-like macro invocation: skip the arguments
    if (pos < tokens.size() && tokens.get(pos).getType() == CudaLexer.LPAREN) {
      int nesting = 0;
      do {
        int type = tokens.get(pos).getType();
        if (type == CudaLexer.LPAREN)
          nesting++;
        else if (type == CudaLexer.RPAREN)
          nesting--;
        pos++;
      } while (nesting > 0 && pos < tokens.size());
      return 0;
    }

    String body = macros.get(name);
    if (body == null || depth >= MAX_EXPANSION_DEPTH)
      return 0;
    List<Token> expansion = lex(body);
    if (expansion.isEmpty())
      return 0;
    return evaluate(expansion, depth + 1);
  }

  /** Default-channel tokens of <var>text</var>. */
  public static List<Token> lex(String text)
  {
    CudaLexer lexer = new CudaLexer(CharStreams.fromString(text));
    lexer.removeErrorListeners();
    List<Token> result = new ArrayList<Token>();
    for (Token t : lexer.getAllTokens())
      if (t.getChannel() == Token.DEFAULT_CHANNEL)
        result.add(t);
    return result;
  }

  private boolean accept(String text)
  {
    if (pos < tokens.size() && tokens.get(pos).getText().equals(text)) {
      pos++;
      return true;
    }
    return false;
  }

  private void expect(String text) throws ScanException
  {
    if (!accept(text))
      throw error("expected '" + text + "' in #if expression");
  }

  private long parseNumber(String text) throws ScanException
  {
    String digits = text.replace("'", "");
    int end = digits.length();
    while (end > 0 && "uUlL".indexOf(digits.charAt(end - 1)) >= 0)
      end--;
    digits = digits.substring(0, end);
    try {
      if (digits.startsWith("0x") || digits.startsWith("0X"))
        return Long.parseUnsignedLong(digits.substring(2), 16);
      if (digits.startsWith("0b") || digits.startsWith("0B"))
        return Long.parseUnsignedLong(digits.substring(2), 2);
      if (digits.length() > 1 && digits.startsWith("0"))
        return Long.parseUnsignedLong(digits.substring(1), 8);
      return Long.parseUnsignedLong(digits);
    } catch (NumberFormatException e) {
      throw error("invalid integer '" + text + "' in #if expression");
    }
  }

  private long parseChar(String text) throws ScanException
  {
    int open = text.indexOf('\'');
    String body = text.substring(open + 1, text.length() - 1);
    if (body.length() == 1)
      return body.charAt(0);
    if (body.length() == 2 && body.charAt(0) == '\\') {
      switch (body.charAt(1)) {
        case 'n': return '\n';
        case 't': return '\t';
        case 'r': return '\r';
        case '0': return 0;
        default: return body.charAt(1);
      }
    }
    throw error("unsupported character constant " + text + " in #if expression");
  }

  private ScanException error(String message)
  {
    return new ScanException(file, line, message);
  }
}
