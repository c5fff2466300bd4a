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
import hipify.ir.*;
import hipify.utils.*;

/**
 *
 * Token-level recognizer of the constructs the translation rules act on.
 *
 * A scan runs in two steps over one file and one {@link CompilationView}.
 * The preprocessing step walks the raw token stream, evaluates conditional
 * directives for the view, reports includes, macro bodies and tested macro
 * names, and keeps the tokens of the active regions. The code step walks
 * those tokens, tracks which function bodies the view compiles and reports
 * calls, kernel launches, builtin coordinate accesses, type and enumerator
 * references and string literals, all in source order.
 *
 * The scanner never expands macros or reads included headers; every span
 * it reports is where the text is spelled in the scanned file.
 *
 */
public class CudaScanner
{
  /** Builtin coordinate variables of the device runtime. */
  public static final Set<String> BUILTIN_VARIABLES = new HashSet<String>(Arrays.asList(
        "threadIdx", "blockIdx", "blockDim", "gridDim"));

  /** Declared types of the launch configuration slots, in order. */
  public static final String[] LAUNCH_CONFIG_TYPES = {
    "dim3", "dim3", "size_t", "cudaStream_t"
  };

  /** Runtime type names that are enumerations rather than records. */
  public static final Set<String> ENUM_TYPES = new HashSet<String>(Arrays.asList(
        "cudaError_t", "cudaError", "cudaMemcpyKind", "cudaFuncCache",
        "cudaSharedMemConfig", "cudaChannelFormatKind", "cudaTextureFilterMode",
        "cudaTextureReadMode", "cudaComputeMode", "cudaLimit"));

  private static final Set<String> KEYWORDS = new HashSet<String>(Arrays.asList(
        "if", "else", "for", "while", "do", "switch", "case", "default", "break",
        "continue", "return", "goto", "sizeof", "alignof", "typeof", "decltype",
        "static_assert", "new", "delete", "throw", "try", "catch", "operator",
        "template", "typename", "typedef", "using", "namespace", "class", "struct",
        "union", "enum", "extern", "static", "inline", "const", "volatile",
        "register", "auto", "signed", "unsigned", "short", "long", "int", "char",
        "float", "double", "void", "bool", "true", "false", "nullptr", "this",
        "public", "private", "protected", "virtual", "friend", "explicit",
        "constexpr", "mutable", "restrict", "__restrict__", "__restrict",
        "static_cast", "dynamic_cast", "const_cast", "reinterpret_cast",
        "__global__", "__device__", "__host__", "__shared__", "__constant__",
        "__managed__", "__forceinline__", "__noinline__", "__launch_bounds__",
        "__attribute__", "__align__", "__declspec", "alignas", "defined"));

  /** Names followed by parentheses that are not function declarators. */
  private static final Set<String> NON_DECLARATORS = new HashSet<String>(Arrays.asList(
        "__launch_bounds__", "__attribute__", "__align__", "__declspec", "alignas",
        "if", "while", "for", "switch", "catch", "sizeof", "decltype"));

  private static final Set<String> TRAILING_QUALIFIERS = new HashSet<String>(Arrays.asList(
        "const", "volatile", "noexcept", "override", "final", "mutable"));

  private static final Set<String> DECLARATOR_QUALIFIERS = new HashSet<String>(Arrays.asList(
        "const", "volatile", "restrict", "__restrict__", "__restrict"));

  /** What an open brace started. */
  private enum ScopeKind
  {
    /** Namespace, record, enumeration or linkage body: still declaration level. */
    DECLARATIONS,
    FUNCTION_BODY,
    BLOCK
  }

  private static final class Scope
  {
    final ScopeKind kind;
    final boolean skip;

    Scope(ScopeKind kind, boolean skip)
    {
      this.kind = kind;
      this.skip = skip;
    }
  }

  /** One level of #if nesting. */
  private static final class Conditional
  {
    final boolean parentActive;
    final int line;
    boolean taken;
    boolean active;
    boolean sawElse;

    Conditional(boolean parentActive, boolean active, int line)
    {
      this.parentActive = parentActive;
      this.active = active;
      this.taken = active;
      this.line = line;
    }
  }

  private final Map<String, String> userMacros;

  // Per-scan state
  private SourceFile source;
  private CompilationView view;
  private MatchListener listener;
  private int[] charOffsets;
  private Map<String, String> macros;
  private Set<String> functionMacros;
  private Deque<Conditional> conditionals;
  private List<Token> code;
  private Map<String, List<SourceSpan>> kernelParamLists;

  public CudaScanner()
  {
    this(Collections.<String, String>emptyMap());
  }

  /**
   * @param userMacros macros defined in both views before every file,
   *   name to replacement text.
   */
  public CudaScanner(Map<String, String> userMacros)
  {
    this.userMacros = new LinkedHashMap<String, String>(userMacros);
  }

  /**
   * Reports the matches of <var>file</var> as read in <var>view</var>.
   *
   * @throws ScanException when the file cannot be analyzed any further;
   *   matches reported before the exception stay valid.
   */
  public void scan(SourceFile file, CompilationView view, MatchListener listener)
      throws ScanException
  {
    this.source = file;
    this.view = view;
    this.listener = listener;
    this.charOffsets = buildCharOffsets(file.getText());
    this.macros = new HashMap<String, String>(view.getPredefinedMacros());
    this.macros.putAll(userMacros);
    this.functionMacros = new HashSet<String>();
    this.conditionals = new ArrayDeque<Conditional>();
    this.code = new ArrayList<Token>();
    this.kernelParamLists = new HashMap<String, List<SourceSpan>>();

    try {
      CudaLexer lexer = new CudaLexer(CharStreams.fromString(file.getText(), file.getPath()));
      lexer.removeErrorListeners();
      preprocess(lexer.getAllTokens());
      collectKernelDeclarations();
      analyze();
    } finally {
      this.code = null;
      this.listener = null;
    }
  }

  // ---------------------------------------------------------------------
  // Preprocessing step
  // ---------------------------------------------------------------------

  private void preprocess(List<? extends Token> all) throws ScanException
  {
    boolean atLineStart = true;
    int i = 0;
    while (i < all.size()) {
      Token t = all.get(i);
      if (t.getType() == CudaLexer.NEWLINE) {
        atLineStart = true;
        i++;
        continue;
      }
      if (t.getChannel() != Token.DEFAULT_CHANNEL) {
        i++;
        continue;
      }
      if (t.getType() == CudaLexer.HASH && atLineStart) {
        List<Token> line = new ArrayList<Token>();
        int j = i + 1;
        while (j < all.size() && all.get(j).getType() != CudaLexer.NEWLINE) {
          if (all.get(j).getChannel() == Token.DEFAULT_CHANNEL)
            line.add(all.get(j));
          j++;
        }
        directive(t, line);
        i = j;
        continue;
      }
      atLineStart = false;
      if (isActive())
        code.add(t);
      i++;
    }

    if (!conditionals.isEmpty())
      throw new ScanException(source.getPath(), conditionals.peek().line,
          "unterminated conditional directive");
  }

  private boolean isActive()
  {
    return conditionals.isEmpty() || conditionals.peek().active;
  }

  private void directive(Token hash, List<Token> line) throws ScanException
  {
    if (line.isEmpty())
      return;
    String name = line.get(0).getText();
    List<Token> rest = line.subList(1, line.size());
    int lineno = hash.getLine();

    if (name.equals("if")) {
      boolean parentActive = isActive();
      boolean value = false;
      if (parentActive) {
        reportConditionalIdentifiers(rest, name);
        value = new ConditionEvaluator(macros, source.getPath(), lineno).isTrue(rest);
      }
      conditionals.push(new Conditional(parentActive, value, lineno));
    }
    else if (name.equals("ifdef") || name.equals("ifndef")) {
      boolean parentActive = isActive();
      if (rest.isEmpty() || rest.get(0).getType() != CudaLexer.IDENTIFIER)
        throw new ScanException(source.getPath(), lineno, "#" + name + " without a macro name");
      boolean value = false;
      if (parentActive) {
        reportConditionalIdentifiers(rest.subList(0, 1), name);
        boolean defined = macros.containsKey(rest.get(0).getText());
        value = name.equals("ifdef") ? defined : !defined;
      }
      conditionals.push(new Conditional(parentActive, value, lineno));
    }
    else if (name.equals("elif")) {
      Conditional top = openConditional(name, lineno);
      if (top.parentActive)
        reportConditionalIdentifiers(rest, name);
      if (top.taken || !top.parentActive) {
        top.active = false;
      }
      else {
        top.active = new ConditionEvaluator(macros, source.getPath(), lineno).isTrue(rest);
        top.taken = top.active;
      }
    }
    else if (name.equals("else")) {
      Conditional top = openConditional(name, lineno);
      top.sawElse = true;
      top.active = top.parentActive && !top.taken;
      top.taken = true;
    }
    else if (name.equals("endif")) {
      if (conditionals.isEmpty())
        throw new ScanException(source.getPath(), lineno, "#endif without #if");
      conditionals.pop();
    }
    else if (!isActive()) {
      return;
    }
    else if (name.equals("define")) {
      define(rest, lineno);
    }
    else if (name.equals("undef")) {
      if (!rest.isEmpty()) {
        macros.remove(rest.get(0).getText());
        functionMacros.remove(rest.get(0).getText());
      }
    }
    else if (name.equals("include") || name.equals("include_next")) {
      include(rest, lineno);
    }
  }

  private Conditional openConditional(String name, int lineno) throws ScanException
  {
    if (conditionals.isEmpty())
      throw new ScanException(source.getPath(), lineno, "#" + name + " without #if");
    Conditional top = conditionals.peek();
    if (top.sawElse)
      throw new ScanException(source.getPath(), lineno, "#" + name + " after #else");
    return top;
  }

  private void reportConditionalIdentifiers(List<Token> tokens, String directive)
  {
    for (Token t : tokens) {
      if (t.getType() == CudaLexer.IDENTIFIER && !t.getText().equals("defined"))
        listener.matched(new ConditionalIdentifier(source.getPath(), t.getText(), directive,
              span(t), true));
    }
  }

  private void define(List<Token> rest, int lineno) throws ScanException
  {
    if (rest.isEmpty() || rest.get(0).getType() != CudaLexer.IDENTIFIER)
      throw new ScanException(source.getPath(), lineno, "#define without a macro name");
    Token macro = rest.get(0);
    int body = 1;

    // Parameter list only when the parenthesis touches the name
    if (rest.size() > 1 && rest.get(1).getType() == CudaLexer.LPAREN
        && start(rest.get(1)) == end(macro)) {
      while (body < rest.size() && rest.get(body).getType() != CudaLexer.RPAREN)
        body++;
      if (body == rest.size())
        throw new ScanException(source.getPath(), lineno,
            "unterminated parameter list of macro " + macro.getText());
      body++;
      functionMacros.add(macro.getText());
    }

    String text = "";
    if (body < rest.size())
      text = source.getText().substring(start(rest.get(body)), end(rest.get(rest.size() - 1)));
    macros.put(macro.getText(), text);

    for (int i = body; i < rest.size(); i++) {
      Token t = rest.get(i);
      if (t.getType() == CudaLexer.IDENTIFIER)
        listener.matched(new MacroBodyIdentifier(source.getPath(), t.getText(), macro.getText(),
              span(t), true));
    }
  }

  private void include(List<Token> rest, int lineno) throws ScanException
  {
    if (rest.isEmpty())
      throw new ScanException(source.getPath(), lineno, "#include without a file name");
    Token first = rest.get(0);
    if (first.getType() == CudaLexer.STRING_LITERAL) {
      String quoted = first.getText();
      listener.matched(new Include(source.getPath(), quoted.substring(1, quoted.length() - 1),
            false, span(first), true));
      return;
    }
    if (first.getType() != CudaLexer.LT) {
      // Computed include, nothing to rewrite
      PrintTools.printlnStatus(3, "[CudaScanner] skipping computed include at",
          source.getPath() + ":" + lineno);
      return;
    }
    for (int i = 1; i < rest.size(); i++) {
      if (rest.get(i).getType() == CudaLexer.GT) {
        String name = source.getText().substring(end(first), start(rest.get(i))).trim();
        listener.matched(new Include(source.getPath(), name, true,
              new SourceSpan(start(first), end(rest.get(i))), true));
        return;
      }
    }
    throw new ScanException(source.getPath(), lineno, "missing '>' in #include");
  }

  // ---------------------------------------------------------------------
  // Code step
  // ---------------------------------------------------------------------

  /**
   * Records the parameter lists of the __global__ functions declared or
   * defined in the active text.
   */
  private void collectKernelDeclarations()
  {
    for (int i = 0; i < code.size(); i++) {
      if (!code.get(i).getText().equals("__global__"))
        continue;
      int j = i + 1;
      while (j < code.size()) {
        Token t = code.get(j);
        int type = t.getType();
        if (type == CudaLexer.SEMI || type == CudaLexer.LBRACE || type == CudaLexer.RBRACE
            || type == CudaLexer.ASSIGN)
          break;
        if (type == CudaLexer.IDENTIFIER && j + 1 < code.size()
            && code.get(j + 1).getType() == CudaLexer.LPAREN) {
          int close = matchForward(j + 1);
          if (close < 0)
            break;
          if (NON_DECLARATORS.contains(t.getText())) {
            j = close + 1;
            continue;
          }
          SourceSpan params;
          if (close == j + 2)
            params = new SourceSpan(end(code.get(j + 1)), end(code.get(j + 1)));
          else
            params = new SourceSpan(start(code.get(j + 2)), end(code.get(close - 1)));
          List<SourceSpan> spans = kernelParamLists.get(t.getText());
          if (spans == null) {
            spans = new ArrayList<SourceSpan>();
            kernelParamLists.put(t.getText(), spans);
          }
          if (!spans.contains(params))
            spans.add(params);
          PrintTools.printlnStatus(3, "[CudaScanner] kernel", t.getText(), "declared at",
              source.getPath() + ":" + t.getLine());
          break;
        }
        j++;
      }
    }
  }

  private void analyze() throws ScanException
  {
    Deque<Scope> scopes = new ArrayDeque<Scope>();
    Deque<Boolean> macroArgs = new ArrayDeque<Boolean>();
    int declStart = 0;
    int parenDepth = 0;

    for (int i = 0; i < code.size(); i++) {
      Token t = code.get(i);
      Scope top = scopes.peek();
      boolean declLevel = (top == null || top.kind == ScopeKind.DECLARATIONS);

      switch (t.getType()) {
        case CudaLexer.LBRACE:
          scopes.push(openScope(i, declStart, top, declLevel));
          if (scopes.peek().kind == ScopeKind.DECLARATIONS)
            declStart = i + 1;
          continue;
        case CudaLexer.RBRACE:
          if (!scopes.isEmpty())
            scopes.pop();
          if (scopes.isEmpty() || scopes.peek().kind == ScopeKind.DECLARATIONS)
            declStart = i + 1;
          continue;
        case CudaLexer.SEMI:
          if (declLevel)
            declStart = i + 1;
          continue;
        case CudaLexer.LPAREN:
          parenDepth++;
          boolean outer = !macroArgs.isEmpty() && macroArgs.peek();
          macroArgs.push(outer || (i > 0 && functionMacros.contains(code.get(i - 1).getText())));
          continue;
        case CudaLexer.RPAREN:
          if (parenDepth > 0)
            parenDepth--;
          if (!macroArgs.isEmpty())
            macroArgs.pop();
          continue;
        default:
          break;
      }

      if (top != null && top.skip)
        continue;

      if (t.getType() == CudaLexer.STRING_LITERAL) {
        listener.matched(new StringLiteral(source.getPath(), t.getText(), span(t)));
      }
      else if (t.getType() == CudaLexer.IDENTIFIER) {
        boolean inMacroArg = !macroArgs.isEmpty() && macroArgs.peek();
        i = identifier(i, declLevel && parenDepth > 0, inMacroArg);
      }
    }
  }

  /** Classifies the brace at <var>brace</var> and decides if its body is analyzed. */
  private Scope openScope(int brace, int declStart, Scope enclosing, boolean declLevel)
  {
    boolean inheritedSkip = enclosing != null && enclosing.skip;
    if (!declLevel)
      return new Scope(ScopeKind.BLOCK, inheritedSkip);

    int prev = brace - 1;
    while (prev >= declStart && TRAILING_QUALIFIERS.contains(code.get(prev).getText()))
      prev--;
    if (prev >= declStart && code.get(prev).getType() == CudaLexer.ASSIGN)
      return new Scope(ScopeKind.BLOCK, inheritedSkip);

    if (prev >= declStart && code.get(prev).getType() == CudaLexer.RPAREN) {
      int open = matchBackward(prev);
      if (open > declStart && code.get(open - 1).getType() == CudaLexer.IDENTIFIER
          && !NON_DECLARATORS.contains(code.get(open - 1).getText())) {
        boolean device = false;
        boolean host = false;
        for (int k = declStart; k < open - 1; k++) {
          String spec = code.get(k).getText();
          if (spec.equals("__global__") || spec.equals("__device__"))
            device = true;
          else if (spec.equals("__host__"))
            host = true;
        }
        if (!device)
          host = true;
        boolean skip = inheritedSkip || !view.analyzesBody(device, host);
        if (skip)
          PrintTools.printlnStatus(3, "[CudaScanner]", view, "skips body of",
              code.get(open - 1).getText(), "at", source.getPath() + ":" + code.get(brace).getLine());
        return new Scope(ScopeKind.FUNCTION_BODY, skip);
      }
    }
    return new Scope(ScopeKind.DECLARATIONS, inheritedSkip);
  }

  /**
   * Reports the construct starting with the identifier at <var>i</var>
   * and returns the index of the last token it consumed.
   */
  private int identifier(int i, boolean inParameterList, boolean inMacroArg) throws ScanException
  {
    Token t = code.get(i);
    String name = t.getText();

    if (i > 0) {
      int prevType = code.get(i - 1).getType();
      if (prevType == CudaLexer.DOT || prevType == CudaLexer.ARROW)
        return i;
    }

    if (BUILTIN_VARIABLES.contains(name) && typeAt(i + 1) == CudaLexer.DOT
        && typeAt(i + 2) == CudaLexer.IDENTIFIER) {
      Token dot = code.get(i + 1);
      Token member = code.get(i + 2);
      if (start(dot) == end(t) && start(member) == end(dot))
        listener.matched(new BuiltinAccess(source.getPath(), name, member.getText(),
              new SourceSpan(start(t), end(member))));
      else
        PrintTools.printlnStatus(2, "[CudaScanner] spaced builtin access", name + "." +
            member.getText(), "left alone at", source.getPath() + ":" + t.getLine());
      return i + 2;
    }

    int last = i;
    if (!KEYWORDS.contains(name)) {
      while (typeAt(last + 1) == CudaLexer.SCOPE && typeAt(last + 2) == CudaLexer.IDENTIFIER)
        last += 2;
    }
    int launchOpen = findLaunchOpen(last);
    if (launchOpen >= 0)
      return kernelLaunch(qualifiedStart(i), last, launchOpen);

    if (KEYWORDS.contains(name))
      return i;

    if (typeAt(i + 1) == CudaLexer.LPAREN) {
      SourceSpan callee = span(t);
      listener.matched(new FunctionCall(source.getPath(), name, callee, callee, inMacroArg));
      return i;
    }

    EnumOrTypeRef.RefKind kind = EnumOrTypeRef.RefKind.ENUM_CONSTANT;
    if (startsDeclarator(i + 1)) {
      if (inParameterList)
        kind = EnumOrTypeRef.RefKind.PARAMETER;
      else if (ENUM_TYPES.contains(name))
        kind = EnumOrTypeRef.RefKind.ENUM_VARIABLE;
      else
        kind = EnumOrTypeRef.RefKind.STRUCT_VARIABLE;
    }
    listener.matched(new EnumOrTypeRef(source.getPath(), name, span(t), kind));
    return i;
  }

  /** Whether a declarator (pointer, reference, qualifiers, name) starts at <var>j</var>. */
  private boolean startsDeclarator(int j)
  {
    while (j < code.size()) {
      Token t = code.get(j);
      if (t.getType() == CudaLexer.STAR || t.getType() == CudaLexer.AMP
          || DECLARATOR_QUALIFIERS.contains(t.getText()))
        j++;
      else
        return t.getType() == CudaLexer.IDENTIFIER && !KEYWORDS.contains(t.getText());
    }
    return false;
  }

  /**
   * Index of the '&lt;&lt;&lt;' of a launch whose callee starts at
   * <var>i</var>, either right after the name or after a template argument
   * list; -1 when <var>i</var> does not start a launch.
   */
  private int findLaunchOpen(int i)
  {
    if (typeAt(i + 1) == CudaLexer.LAUNCH_OPEN)
      return i + 1;
    if (typeAt(i + 1) != CudaLexer.LT)
      return -1;
    int nesting = 0;
    for (int j = i + 1; j < code.size(); j++) {
      int type = code.get(j).getType();
      if (type == CudaLexer.LT) {
        nesting++;
      }
      else if (type == CudaLexer.GT) {
        if (--nesting == 0)
          return (typeAt(j + 1) == CudaLexer.LAUNCH_OPEN) ? j + 1 : -1;
      }
      else if (type == CudaLexer.SEMI || type == CudaLexer.LBRACE || type == CudaLexer.RBRACE
          || type == CudaLexer.LAUNCH_OPEN) {
        return -1;
      }
    }
    return -1;
  }

  /**
   * Index of the first token of the name starting at the identifier
   * <var>i</var>, taking in a leading global '::'.
   */
  private int qualifiedStart(int i)
  {
    if (i == 0 || typeAt(i - 1) != CudaLexer.SCOPE)
      return i;
    if (i >= 2 && typeAt(i - 2) == CudaLexer.IDENTIFIER
        && !KEYWORDS.contains(code.get(i - 2).getText()))
      return i;
    return i - 1;
  }

  /**
   * Reports the launch whose (possibly qualified) callee spans the tokens
   * <var>first</var> to <var>last</var> and returns the index of the
   * closing parenthesis of its arguments.
   */
  private int kernelLaunch(int first, int last, int launchOpen) throws ScanException
  {
    Token callee = code.get(last);
    List<int[]> config = new ArrayList<int[]>();
    int configClose = collectArguments(launchOpen + 1, CudaLexer.LAUNCH_CLOSE, config, callee);
    if (typeAt(configClose + 1) != CudaLexer.LPAREN)
      throw new ScanException(source.getPath(), callee.getLine(),
          "kernel launch of " + callee.getText() + " without an argument list");
    List<int[]> args = new ArrayList<int[]>();
    int argsClose = collectArguments(configClose + 2, CudaLexer.RPAREN, args, callee);

    if (config.size() > LAUNCH_CONFIG_TYPES.length)
      throw new ScanException(source.getPath(), callee.getLine(),
          "too many launch configuration arguments for " + callee.getText());

    List<KernelLaunch.ConfigArgument> configArgs = new ArrayList<KernelLaunch.ConfigArgument>();
    for (int slot = 0; slot < LAUNCH_CONFIG_TYPES.length; slot++) {
      if (slot < config.size())
        configArgs.add(KernelLaunch.ConfigArgument.written(argumentText(config.get(slot)),
              LAUNCH_CONFIG_TYPES[slot]));
      else
        configArgs.add(KernelLaunch.ConfigArgument.defaulted(LAUNCH_CONFIG_TYPES[slot]));
    }
    List<String> launchArgs = new ArrayList<String>();
    for (int[] arg : args)
      launchArgs.add(argumentText(arg));

    String calleeText = source.getText().substring(start(code.get(first)),
        end(code.get(launchOpen - 1)));
    List<SourceSpan> params = kernelParamLists.get(callee.getText());
    if (params == null) {
      params = Collections.emptyList();
      PrintTools.printlnStatus(2, "[CudaScanner] no declaration of kernel", callee.getText(),
          "in", source.getPath());
    }

    listener.matched(new KernelLaunch(source.getPath(), calleeText, params, configArgs,
          launchArgs, new SourceSpan(start(code.get(first)), end(code.get(argsClose)))));
    return argsClose;
  }

  /**
   * Splits the comma separated arguments starting at <var>from</var> up to
   * the closing token of type <var>closeType</var>; each argument is kept
   * as the index range of its first and last token. Returns the index of
   * the closing token.
   */
  private int collectArguments(int from, int closeType, List<int[]> ranges, Token callee)
      throws ScanException
  {
    int depth = 0;
    int argStart = from;
    for (int j = from; j < code.size(); j++) {
      int type = code.get(j).getType();
      if (depth == 0 && (type == closeType || type == CudaLexer.COMMA)) {
        if (j > argStart)
          ranges.add(new int[] { argStart, j - 1 });
        else if (type == CudaLexer.COMMA || !ranges.isEmpty())
          throw new ScanException(source.getPath(), code.get(j).getLine(),
              "empty argument in kernel launch of " + callee.getText());
        if (type == closeType)
          return j;
        argStart = j + 1;
      }
      else if (type == CudaLexer.LPAREN || type == CudaLexer.LBRACKET || type == CudaLexer.LBRACE) {
        depth++;
      }
      else if (type == CudaLexer.RPAREN || type == CudaLexer.RBRACKET || type == CudaLexer.RBRACE) {
        depth--;
      }
      else if (type == CudaLexer.SEMI) {
        break;
      }
    }
    throw new ScanException(source.getPath(), callee.getLine(),
        "unterminated kernel launch of " + callee.getText());
  }

  /** Original text of an argument, inner spacing and comments included. */
  private String argumentText(int[] range)
  {
    return source.getText().substring(start(code.get(range[0])), end(code.get(range[1])));
  }

  private int matchForward(int open)
  {
    int depth = 0;
    for (int j = open; j < code.size(); j++) {
      int type = code.get(j).getType();
      if (type == CudaLexer.LPAREN)
        depth++;
      else if (type == CudaLexer.RPAREN && --depth == 0)
        return j;
    }
    return -1;
  }

  private int matchBackward(int close)
  {
    int depth = 0;
    for (int j = close; j >= 0; j--) {
      int type = code.get(j).getType();
      if (type == CudaLexer.RPAREN)
        depth++;
      else if (type == CudaLexer.LPAREN && --depth == 0)
        return j;
    }
    return -1;
  }

  private int typeAt(int j)
  {
    return (j >= 0 && j < code.size()) ? code.get(j).getType() : Token.EOF;
  }

  // ---------------------------------------------------------------------
  // Offsets
  // ---------------------------------------------------------------------

  private SourceSpan span(Token t)
  {
    return new SourceSpan(start(t), end(t));
  }

  /** Start of <var>t</var> as a String index into the original text. */
  private int start(Token t)
  {
    return toCharOffset(t.getStartIndex());
  }

  /** Exclusive end of <var>t</var> as a String index into the original text. */
  private int end(Token t)
  {
    return toCharOffset(t.getStopIndex() + 1);
  }

  /*
   * The lexer counts code points; spans count UTF-16 chars. The mapping is
   * only materialized for texts holding supplementary characters.
   */
  private int toCharOffset(int codePoint)
  {
    if (charOffsets == null)
      return codePoint;
    return charOffsets[codePoint];
  }

  private static int[] buildCharOffsets(String text)
  {
    int codePoints = text.codePointCount(0, text.length());
    if (codePoints == text.length())
      return null;
    int[] offsets = new int[codePoints + 1];
    int charIndex = 0;
    for (int cp = 0; cp < codePoints; cp++) {
      offsets[cp] = charIndex;
      charIndex += Character.charCount(text.codePointAt(charIndex));
    }
    offsets[codePoints] = charIndex;
    return offsets;
  }
}
