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

import hipify.ir.*;

/**
 * Rewrites every "cuda" inside a string literal to "hip".
 */
public class StringLiteralRule implements TranslationRule<StringLiteral>
{
  public static final String SOURCE_MARKER = "cuda";
  public static final String TARGET_MARKER = "hip";

  public String getRuleName()
  {
    return "[StringLiteral]";
  }

  public List<Edit> apply(StringLiteral literal, RuleContext context)
  {
    String rewritten = replaceMarkers(literal.getRawText());
    if (rewritten == null)
      return Collections.emptyList();
    return Collections.singletonList(new Edit(literal.getFile(), literal.getSpan(), rewritten,
          literal.getKind()));
  }

  /**
   * Replaces the markers left to right, resuming after each inserted
   * marker. Returns null when the text holds no marker.
   */
  public static String replaceMarkers(String text)
  {
    StringBuilder s = new StringBuilder(text);
    boolean found = false;
    int pos = 0;
    while ((pos = s.indexOf(SOURCE_MARKER, pos)) != -1) {
      s.replace(pos, pos + SOURCE_MARKER.length(), TARGET_MARKER);
      pos += TARGET_MARKER.length();
      found = true;
    }
    return found ? s.toString() : null;
  }
}
