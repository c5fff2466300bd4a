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

package hipify.transforms.rules;

import java.util.*;

import hipify.common.*;
import hipify.ir.*;

/**
 * Rewrites a triple-chevron launch into a hipLaunchKernel call and adds
 * the launch parameter to the kernel's declarations. The configuration
 * and argument texts are carried over with their own names translated,
 * since the launch replaces them as a whole.
 */
public class KernelLaunchRule implements TranslationRule<KernelLaunch>
{
  public static final String LAUNCH_NAME = "hipLaunchKernel";
  public static final String KERNEL_NAME_WRAPPER = "HIP_KERNEL_NAME";
  public static final String LAUNCH_PARAM = "hipLaunchParm lp";
  public static final String DIM3_TYPE = "dim3";

  public String getRuleName()
  {
    return "[KernelLaunch]";
  }

  public List<Edit> apply(KernelLaunch launch, RuleContext context)
  {
    List<Edit> edits = new ArrayList<Edit>();

    for (SourceSpan params : launch.getParamListSpans()) {
      String paramList = context.getText(params);
      edits.add(new Edit(launch.getFile(), params, addLaunchParam(paramList), launch.getKind()));
    }

    edits.add(new Edit(launch.getFile(), launch.getFullSpan(), buildLaunch(launch, context.getNames()),
          launch.getKind()));
    return edits;
  }

  /** Prepends the launch parameter to a written parameter list. */
  public static String addLaunchParam(String paramList)
  {
    String trimmed = paramList.trim();
    if (trimmed.isEmpty() || trimmed.equals("void"))
      return LAUNCH_PARAM;
    return LAUNCH_PARAM + ", " + paramList;
  }

  /** The replacement text of the whole launch expression. */
  public static String buildLaunch(KernelLaunch launch, RenameTable names)
  {
    List<String> args = new ArrayList<String>();
    args.add(KERNEL_NAME_WRAPPER + "(" + launch.getCalleeName() + ")");

    for (KernelLaunch.ConfigArgument arg : launch.getConfigArgs()) {
      if (arg.isDefault())
        args.add("0");
      else if (DIM3_TYPE.equals(arg.getDeclaredType()))
        args.add(DIM3_TYPE + "(" + renameArgument(arg.getText(), names) + ")");
      else
        args.add(renameArgument(arg.getText(), names));
    }
    for (String arg : launch.getLaunchArgs())
      args.add(renameArgument(arg, names));

    StringBuilder sb = new StringBuilder(LAUNCH_NAME).append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0)
        sb.append(", ");
      sb.append(args.get(i));
    }
    return sb.append(')').toString();
  }

  /**
   * Translates one argument written inside a launch: identifiers found in
   * the table are renamed, contiguous builtin accesses such as threadIdx.x
   * included, and the markers of string literals are rewritten. Members
   * after '.' or '->', numbers and comments are copied unchanged.
   */
  public static String renameArgument(String text, RenameTable names)
  {
    StringBuilder sb = new StringBuilder(text.length());
    int n = text.length();
    int i = 0;
    while (i < n) {
      char c = text.charAt(i);
      int end;
      if (c == '"' || c == '\'') {
        end = skipQuoted(text, i);
        String literal = text.substring(i, end);
        String rewritten = (c == '"') ? StringLiteralRule.replaceMarkers(literal) : null;
        sb.append((rewritten == null) ? literal : rewritten);
      }
      else if (text.startsWith("//", i)) {
        end = text.indexOf('\n', i);
        end = (end < 0) ? n : end;
        sb.append(text, i, end);
      }
      else if (text.startsWith("/*", i)) {
        end = text.indexOf("*/", i + 2);
        end = (end < 0) ? n : end + 2;
        sb.append(text, i, end);
      }
      else if (Character.isDigit(c)) {
        end = i + 1;
        while (end < n && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '.'))
          end++;
        sb.append(text, i, end);
      }
      else if (Character.isLetter(c) || c == '_') {
        end = identifierEnd(text, i);
        String word = text.substring(i, end);
        if (followsMemberAccess(sb)) {
          sb.append(word);
        }
        else {
          String repName = null;
          if (end + 1 < n && text.charAt(end) == '.') {
            int memberEnd = identifierEnd(text, end + 1);
            if (memberEnd > end + 1)
              repName = names.lookup(text.substring(i, memberEnd));
            if (repName != null)
              end = memberEnd;
          }
          if (repName == null)
            repName = names.lookup(word);
          sb.append((repName == null) ? word : repName);
        }
      }
      else {
        end = i + 1;
        sb.append(c);
      }
      i = end;
    }
    return sb.toString();
  }

  private static int identifierEnd(String text, int from)
  {
    int end = from;
    while (end < text.length()
        && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_'))
      end++;
    return end;
  }

  private static int skipQuoted(String text, int open)
  {
    char quote = text.charAt(open);
    int j = open + 1;
    while (j < text.length()) {
      char c = text.charAt(j);
      if (c == '\\')
        j += 2;
      else if (c == quote)
        return j + 1;
      else
        j++;
    }
    return text.length();
  }

  private static boolean followsMemberAccess(CharSequence written)
  {
    int j = written.length() - 1;
    while (j >= 0 && Character.isWhitespace(written.charAt(j)))
      j--;
    if (j < 0)
      return false;
    if (written.charAt(j) == '.')
      return true;
    return j > 0 && written.charAt(j) == '>' && written.charAt(j - 1) == '-';
  }
}
