package com.flamingo.ai.stripsequencer.exception;

import com.flamingo.ai.stripsequencer.domain.model.SegmentIdentity;

/**
 * Exception thrown when a chaining step finds no remaining segment with a finite distance from the
 * segment placed last.
 */
public class NoSelectableCandidateException extends RuntimeException {

  private final SegmentIdentity lastPlaced;
  private final int candidateCount;
  private final String userMessage;

  public NoSelectableCandidateException(SegmentIdentity lastPlaced, int candidateCount) {
    super(
        "No selectable candidate after "
            + lastPlaced
            + ": all "
            + candidateCount
            + " remaining segment(s) are incomparable");
    this.lastPlaced = lastPlaced;
    this.candidateCount = candidateCount;
    this.userMessage =
        "The panels could not be compared by meaning. Try images with more readable text.";
  }

  public SegmentIdentity getLastPlaced() {
    return lastPlaced;
  }

  public int getCandidateCount() {
    return candidateCount;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
