package com.flamingo.ai.stripsequencer.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for images sent as Base64 data URLs. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataUrlSequenceRequest {

  @NotNull(message = "Uploads are required")
  private List<@Valid Upload> uploads;

  /** One image, e.g. {@code data:image/png;base64,iVBOR...}. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Upload {

    private String fileName;

    @NotBlank(message = "Content is required")
    private String content;
  }
}
