package com.flamingo.ai.stripsequencer.service.distance;

import java.util.List;

/**
 * Semantic distance between two token sequences.
 *
 * <p>Implementations must be deterministic for a fixed pair of inputs and free of side effects
 * visible to the caller. They need not be symmetric. A return value of {@link
 * Double#POSITIVE_INFINITY} means the two sequences cannot be compared, typically because one of
 * them holds no term the underlying model knows.
 */
@FunctionalInterface
public interface DistanceOracle {

  /**
   * Computes the distance from {@code from} to {@code to}.
   *
   * @param from tokens of the segment placed last
   * @param to tokens of the candidate segment
   * @return a non-negative distance, or positive infinity when incomparable
   */
  double distance(List<String> from, List<String> to);
}
