package com.flamingo.ai.stripsequencer.service.distance;

import java.util.Optional;

/** Source of word vectors for {@link WordMoversDistanceOracle}. */
public interface WordVectors {

  /**
   * Looks up the vector of a single word.
   *
   * @param word a whitespace-free token
   * @return the word's vector, or empty when the word is unknown to this source
   */
  Optional<float[]> vectorFor(String word);

  /** Human-readable name for logging. */
  String getSourceName();
}
