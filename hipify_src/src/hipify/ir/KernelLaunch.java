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

package hipify.ir;

import java.util.*;

/**
 * A triple-chevron kernel launch, <code>foo&lt;&lt;&lt;grid, block&gt;&gt;&gt;(a, b)</code>.
 *
 * The configuration arguments are listed slot by slot together with the
 * declared type of the slot; slots the source leaves out are present as
 * defaulted arguments. The parameter list spans point at the parameter
 * lists of the kernel's declarations in the same file (possibly none).
 */
public final class KernelLaunch extends MatchResult
{
  /** One launch configuration slot. */
  public static final class ConfigArgument
  {
    private final String text;
    private final String declaredType;
    private final boolean isDefault;

    private ConfigArgument(String text, String declaredType, boolean isDefault)
    {
      this.text = text;
      this.declaredType = declaredType;
      this.isDefault = isDefault;
    }

    public static ConfigArgument written(String text, String declaredType)
    {
      return new ConfigArgument(text, declaredType, false);
    }

    public static ConfigArgument defaulted(String declaredType)
    {
      return new ConfigArgument(null, declaredType, true);
    }

    /** Source text of the argument, null for a defaulted slot. */
    public String getText()
    {
      return text;
    }

    public String getDeclaredType()
    {
      return declaredType;
    }

    public boolean isDefault()
    {
      return isDefault;
    }

    @Override
    public String toString()
    {
      return (isDefault ? "<default>" : text) + " <" + declaredType + ">";
    }
  }

  private final String calleeName;
  private final List<SourceSpan> paramListSpans;
  private final List<ConfigArgument> configArgs;
  private final List<String> launchArgs;
  private final SourceSpan fullSpan;

  public KernelLaunch(String file, String calleeName, List<SourceSpan> paramListSpans,
      List<ConfigArgument> configArgs, List<String> launchArgs, SourceSpan fullSpan)
  {
    super(file);
    this.calleeName = calleeName;
    this.paramListSpans = Collections.unmodifiableList(new ArrayList<SourceSpan>(paramListSpans));
    this.configArgs = Collections.unmodifiableList(new ArrayList<ConfigArgument>(configArgs));
    this.launchArgs = Collections.unmodifiableList(new ArrayList<String>(launchArgs));
    this.fullSpan = fullSpan;
  }

  public String getCalleeName()
  {
    return calleeName;
  }

  public List<SourceSpan> getParamListSpans()
  {
    return paramListSpans;
  }

  public List<ConfigArgument> getConfigArgs()
  {
    return configArgs;
  }

  public List<String> getLaunchArgs()
  {
    return launchArgs;
  }

  public SourceSpan getFullSpan()
  {
    return fullSpan;
  }

  public MatchKind getKind()
  {
    return MatchKind.KERNEL_LAUNCH;
  }

  public SourceSpan getSpan()
  {
    return fullSpan;
  }

  public <R> R accept(MatchVisitor<R> visitor)
  {
    return visitor.visit(this);
  }

  public String describe()
  {
    return calleeName + "<<<" + configArgs + ">>>" + launchArgs;
  }
}
