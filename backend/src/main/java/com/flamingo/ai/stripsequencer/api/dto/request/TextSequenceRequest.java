package com.flamingo.ai.stripsequencer.api.dto.request;

import com.flamingo.ai.stripsequencer.domain.model.TextFragment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ordering fragments whose text was already extracted. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextSequenceRequest {

  /** Fragments in upload order; the first one anchors the result. */
  @NotNull(message = "Fragments are required")
  private List<@Valid Fragment> fragments;

  public List<TextFragment> toTextFragments() {
    return fragments.stream()
        .map(fragment -> new TextFragment(fragment.getName(), fragment.getText()))
        .toList();
  }

  /** One fragment of extracted text. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Fragment {

    @NotNull(message = "Name is required")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    private String name;

    /** Extracted text; null is treated as empty. */
    @Size(max = 20000, message = "Text must not exceed 20000 characters")
    private String text;
  }
}
