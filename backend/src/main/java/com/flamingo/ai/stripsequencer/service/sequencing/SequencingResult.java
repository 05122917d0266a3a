package com.flamingo.ai.stripsequencer.service.sequencing;

import com.flamingo.ai.stripsequencer.domain.model.Ordering;

/**
 * Outcome of one sequencing request.
 *
 * @param ordering the segments in output order
 * @param strategy how the order was obtained
 * @param fallbackReason why the chain could not be built; null unless {@code strategy} is {@link
 *     SequencingStrategy#UPLOAD_ORDER_FALLBACK}
 */
public record SequencingResult(
    Ordering ordering, SequencingStrategy strategy, String fallbackReason) {

  public static SequencingResult chained(Ordering ordering) {
    return new SequencingResult(ordering, SequencingStrategy.GREEDY_CHAIN, null);
  }

  public static SequencingResult fallback(Ordering ordering, String reason) {
    return new SequencingResult(ordering, SequencingStrategy.UPLOAD_ORDER_FALLBACK, reason);
  }

  public boolean isFallback() {
    return strategy == SequencingStrategy.UPLOAD_ORDER_FALLBACK;
  }
}
