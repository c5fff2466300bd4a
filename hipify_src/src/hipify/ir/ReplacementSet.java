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
 *
 * The accepted edits of a run, grouped by file and ordered by span. The
 * first edit proposed for a span wins; later proposals that collide with
 * it under the configured {@link ConflictPolicy} are rejected and kept as
 * diagnostics.
 *
 * With the default policy only identical spans collide, so two partially
 * overlapping edits may both be accepted; the source rewriter detects
 * such pairs when it applies them.
 *
 */
public class ReplacementSet implements Iterable<Edit>
{
  private final ConflictPolicy mPolicy;

  private final LinkedHashMap<String, TreeMap<SourceSpan, Edit>> mEdits;

  private final List<Proposal> mRejected;

  public ReplacementSet()
  {
    this(ConflictPolicy.IDENTICAL);
  }

  public ReplacementSet(ConflictPolicy policy)
  {
    mPolicy = policy;
    mEdits = new LinkedHashMap<String, TreeMap<SourceSpan, Edit>>();
    mRejected = new ArrayList<Proposal>();
  }

  public ConflictPolicy getPolicy()
  {
    return mPolicy;
  }

  public Proposal propose(Edit edit)
  {
    TreeMap<SourceSpan, Edit> fileEdits = mEdits.get(edit.getFile());
    if (fileEdits == null) {
      fileEdits = new TreeMap<SourceSpan, Edit>();
      mEdits.put(edit.getFile(), fileEdits);
    }

    Edit owner = findCollision(fileEdits, edit.getSpan());
    if (owner != null) {
      Proposal rejection = Proposal.rejected(edit, owner);
      mRejected.add(rejection);
      return rejection;
    }
    fileEdits.put(edit.getSpan(), edit);
    return Proposal.accepted();
  }

  /**
   * Folds the accepted edits of <var>other</var> into this set after the
   * edits already here, file by file in span order, and takes over its
   * rejections. Returns the proposals this set rejected while folding.
   */
  public List<Proposal> addAll(ReplacementSet other)
  {
    mRejected.addAll(other.mRejected);
    List<Proposal> rejected = new ArrayList<Proposal>();
    for (Edit edit : other) {
      Proposal proposal = propose(edit);
      if (!proposal.isAccepted())
        rejected.add(proposal);
    }
    return rejected;
  }

  private Edit findCollision(TreeMap<SourceSpan, Edit> fileEdits, SourceSpan span)
  {
    Edit same = fileEdits.get(span);
    if (same != null)
      return same;
    if (mPolicy == ConflictPolicy.IDENTICAL)
      return null;
    for (Map.Entry<SourceSpan, Edit> entry : fileEdits.entrySet()) {
      if (entry.getKey().getStart() > span.getEnd())
        break;
      if (mPolicy.collides(entry.getKey(), span))
        return entry.getValue();
    }
    return null;
  }

  /** Files that received at least one accepted edit, in first-seen order. */
  public Set<String> getFiles()
  {
    Set<String> files = new LinkedHashSet<String>();
    for (Map.Entry<String, TreeMap<SourceSpan, Edit>> entry : mEdits.entrySet())
      if (!entry.getValue().isEmpty())
        files.add(entry.getKey());
    return files;
  }

  /** Accepted edits of <var>file</var> in ascending span order. */
  public List<Edit> getEdits(String file)
  {
    TreeMap<SourceSpan, Edit> fileEdits = mEdits.get(file);
    if (fileEdits == null)
      return Collections.emptyList();
    return new ArrayList<Edit>(fileEdits.values());
  }

  public List<Proposal> getRejected()
  {
    return Collections.unmodifiableList(mRejected);
  }

  public int size()
  {
    int n = 0;
    for (TreeMap<SourceSpan, Edit> fileEdits : mEdits.values())
      n += fileEdits.size();
    return n;
  }

  public boolean isEmpty()
  {
    return size() == 0;
  }

  /** Every accepted edit, file by file, each file in ascending span order. */
  public Iterator<Edit> iterator()
  {
    List<Edit> all = new ArrayList<Edit>(size());
    for (TreeMap<SourceSpan, Edit> fileEdits : mEdits.values())
      all.addAll(fileEdits.values());
    return Collections.unmodifiableList(all).iterator();
  }
}
