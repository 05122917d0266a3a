package com.flamingo.ai.stripsequencer.api.dto.response;

import com.flamingo.ai.stripsequencer.domain.model.ChainStep;
import com.flamingo.ai.stripsequencer.domain.model.Ordering;
import com.flamingo.ai.stripsequencer.service.sequencing.SequencingResult;
import com.flamingo.ai.stripsequencer.service.sequencing.SequencingStrategy;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a sequencing request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SequenceResponse {

  private SequencingStrategy strategy;
  private String fallbackReason;
  private List<FragmentResponse> fragments;

  /** Creates a SequenceResponse from a sequencing result. */
  public static SequenceResponse fromResult(SequencingResult result) {
    Ordering ordering = result.ordering();
    List<ChainStep> steps = ordering.steps();
    List<FragmentResponse> fragments = new ArrayList<>(ordering.size());
    for (int i = 0; i < ordering.size(); i++) {
      Double distance = i > 0 && i - 1 < steps.size() ? steps.get(i - 1).distance() : null;
      fragments.add(FragmentResponse.fromSegment(ordering.segments().get(i), i, distance));
    }
    return SequenceResponse.builder()
        .strategy(result.strategy())
        .fallbackReason(result.fallbackReason())
        .fragments(fragments)
        .build();
  }
}
