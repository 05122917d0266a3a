package com.flamingo.ai.stripsequencer.service.sequencing;

import com.flamingo.ai.stripsequencer.domain.model.Ordering;
import com.flamingo.ai.stripsequencer.domain.model.Segment;
import com.flamingo.ai.stripsequencer.service.distance.DistanceOracle;
import java.util.List;

/** Reconstructs a reading order for segments using only pairwise distances. */
public interface SequencingEngine {

  /**
   * Orders the segments. The first segment is kept first.
   *
   * @param segments segments in upload order
   * @param oracle distance oracle consulted for every comparison
   * @return a permutation of {@code segments} starting with {@code segments.get(0)}
   * @throws com.flamingo.ai.stripsequencer.exception.EmptyInputException if {@code segments} is
   *     empty
   * @throws com.flamingo.ai.stripsequencer.exception.NoSelectableCandidateException if a step finds
   *     no candidate with a finite distance
   */
  Ordering sequence(List<Segment> segments, DistanceOracle oracle);
}
