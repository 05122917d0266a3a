package com.flamingo.ai.stripsequencer.api.dto.response;

import com.flamingo.ai.stripsequencer.domain.model.Segment;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one panel in reconstructed order. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FragmentResponse {

  /** 0-based position in the returned order. */
  private int position;

  /** 0-based position in the submitted batch. */
  private int uploadIndex;

  private String name;
  private String text;

  /** The text split on newlines, one entry per displayed line. Empty text gives one empty line. */
  private List<String> lines;

  /** Distance from the previous panel; null for the first panel and for upload-order results. */
  private Double distanceFromPrevious;

  /** Creates a FragmentResponse for a segment at the given position. */
  public static FragmentResponse fromSegment(
      Segment segment, int position, Double distanceFromPrevious) {
    return FragmentResponse.builder()
        .position(position)
        .uploadIndex(segment.identity().uploadIndex())
        .name(segment.identity().name())
        .text(segment.text())
        .lines(List.of(segment.text().split("\n", -1)))
        .distanceFromPrevious(distanceFromPrevious)
        .build();
  }
}
