package com.flamingo.ai.stripsequencer.domain.model;

import com.flamingo.ai.stripsequencer.service.sequencing.Tokenizer;
import java.util.List;
import java.util.Objects;

/**
 * One unit of extracted text to be ordered.
 *
 * <p>Segments are immutable. The token list is derived from {@link #text()} on first access and
 * memoized; concurrent first accesses may tokenize twice but always observe an equal list.
 */
public final class Segment {

  private final SegmentIdentity identity;
  private final String text;
  private volatile List<String> tokens;

  public Segment(SegmentIdentity identity, String text) {
    this.identity = Objects.requireNonNull(identity, "identity");
    this.text = text != null ? text : "";
  }

  /** Convenience factory for a segment named after its upload. */
  public static Segment of(int uploadIndex, String name, String text) {
    return new Segment(new SegmentIdentity(uploadIndex, name), text);
  }

  public SegmentIdentity identity() {
    return identity;
  }

  public String text() {
    return text;
  }

  /** Whitespace tokens of the text; empty for blank text. */
  public List<String> tokens() {
    List<String> result = tokens;
    if (result == null) {
      result = Tokenizer.tokenize(text);
      tokens = result;
    }
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Segment other)) {
      return false;
    }
    return identity.equals(other.identity) && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identity, text);
  }

  @Override
  public String toString() {
    return "Segment" + identity;
  }
}
