package com.flamingo.ai.stripsequencer.service.sequencing;

import com.flamingo.ai.stripsequencer.domain.model.ChainStep;
import com.flamingo.ai.stripsequencer.domain.model.Ordering;
import com.flamingo.ai.stripsequencer.domain.model.Segment;
import com.flamingo.ai.stripsequencer.domain.model.SegmentIdentity;
import com.flamingo.ai.stripsequencer.exception.EmptyInputException;
import com.flamingo.ai.stripsequencer.exception.NoSelectableCandidateException;
import com.flamingo.ai.stripsequencer.service.distance.DistanceOracle;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Greedy nearest-neighbor chaining.
 *
 * <p>The first segment is the anchor. Each step computes {@code distance(last, candidate)} for
 * every remaining candidate, in upload order, and appends the candidate with the strictly smallest
 * finite distance. On exact ties the candidate seen first wins. A step in which no candidate has a
 * finite distance fails with {@link NoSelectableCandidateException}.
 *
 * <p>Performs {@code n(n-1)/2} oracle calls for {@code n} segments. Instances hold no state and may
 * be shared between threads.
 */
@Slf4j
public class GreedyChainSequencingEngine implements SequencingEngine {

  @Override
  public Ordering sequence(List<Segment> segments, DistanceOracle oracle) {
    if (segments == null || segments.isEmpty()) {
      throw new EmptyInputException("Cannot sequence an empty list of segments");
    }
    requireUniqueIdentities(segments);

    Segment anchor = segments.get(0);
    if (segments.size() == 1) {
      return new Ordering(List.of(anchor), List.of());
    }

    List<Segment> ordered = new ArrayList<>(segments.size());
    List<ChainStep> steps = new ArrayList<>(segments.size() - 1);
    List<Segment> remaining = new ArrayList<>(segments.subList(1, segments.size()));
    ordered.add(anchor);

    while (!remaining.isEmpty()) {
      Segment last = ordered.get(ordered.size() - 1);
      Selection best = selectNearest(last, remaining, oracle);

      remaining.remove(best.index());
      ordered.add(best.segment());
      steps.add(new ChainStep(last.identity(), best.segment().identity(), best.distance()));
      log.debug(
          "Chained {} -> {} (distance={}, {} left)",
          last.identity(),
          best.segment().identity(),
          best.distance(),
          remaining.size());
    }

    return new Ordering(ordered, steps);
  }

  private Selection selectNearest(
      Segment last, List<Segment> remaining, DistanceOracle oracle) {
    List<String> lastTokens = last.tokens();
    Selection best = null;

    int index = 0;
    for (Segment candidate : remaining) {
      double distance = oracle.distance(lastTokens, candidate.tokens());
      if (Double.isFinite(distance) && (best == null || distance < best.distance())) {
        best = new Selection(index, candidate, distance);
      }
      index++;
    }

    if (best == null) {
      throw new NoSelectableCandidateException(last.identity(), remaining.size());
    }
    return best;
  }

  private static void requireUniqueIdentities(List<Segment> segments) {
    Set<SegmentIdentity> seen = new HashSet<>();
    for (Segment segment : segments) {
      if (!seen.add(segment.identity())) {
        throw new IllegalArgumentException("Duplicate segment identity " + segment.identity());
      }
    }
  }

  private record Selection(int index, Segment segment, double distance) {}
}
