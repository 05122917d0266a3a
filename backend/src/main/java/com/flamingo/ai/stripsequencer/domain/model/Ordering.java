package com.flamingo.ai.stripsequencer.domain.model;

import java.util.List;

/**
 * A permutation of the input segments. The first segment is always the anchor (the first input
 * segment); {@code steps} holds one entry per chaining step that placed the following segments.
 *
 * <p>Orderings built with {@link #uploadOrder(List)} carry no steps.
 */
public record Ordering(List<Segment> segments, List<ChainStep> steps) {

  public Ordering {
    segments = List.copyOf(segments);
    steps = List.copyOf(steps);
  }

  /** Ordering that keeps the segments exactly as submitted. */
  public static Ordering uploadOrder(List<Segment> segments) {
    return new Ordering(segments, List.of());
  }

  public Segment anchor() {
    return segments.get(0);
  }

  public int size() {
    return segments.size();
  }

  /** Identities in output order. */
  public List<SegmentIdentity> identities() {
    return segments.stream().map(Segment::identity).toList();
  }
}
