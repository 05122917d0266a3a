package com.flamingo.ai.stripsequencer.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.stripsequencer.api.dto.request.DataUrlSequenceRequest;
import com.flamingo.ai.stripsequencer.api.dto.request.TextSequenceRequest;
import com.flamingo.ai.stripsequencer.config.SequencingConfig;
import com.flamingo.ai.stripsequencer.domain.model.ChainStep;
import com.flamingo.ai.stripsequencer.domain.model.ImageUpload;
import com.flamingo.ai.stripsequencer.domain.model.Ordering;
import com.flamingo.ai.stripsequencer.domain.model.Segment;
import com.flamingo.ai.stripsequencer.domain.model.TextFragment;
import com.flamingo.ai.stripsequencer.exception.EmptyInputException;
import com.flamingo.ai.stripsequencer.exception.GlobalExceptionHandler;
import com.flamingo.ai.stripsequencer.exception.NoSelectableCandidateException;
import com.flamingo.ai.stripsequencer.exception.TextExtractionException;
import com.flamingo.ai.stripsequencer.service.extraction.ImageUploadDecoder;
import com.flamingo.ai.stripsequencer.service.sequencing.SequencingResult;
import com.flamingo.ai.stripsequencer.service.sequencing.SequencingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("SequenceController Tests")
class SequenceControllerTest {

  private static final byte[] IMAGE_BYTES = "image".getBytes(StandardCharsets.UTF_8);

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private MeterRegistry meterRegistry;

  @Mock private SequencingService sequencingService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    SequencingConfig config = new SequencingConfig();
    config.getUpload().setMaxFiles(2);
    SequenceController controller =
        new SequenceController(sequencingService, new ImageUploadDecoder(config));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static SequencingResult chainedResult() {
    Segment first = Segment.of(0, "p1", "WHERE IS IT?\nLOOK!");
    Segment second = Segment.of(2, "p3", "BEHIND YOU");
    Segment third = Segment.of(1, "p2", "");
    return SequencingResult.chained(
        new Ordering(
            List.of(first, second, third),
            List.of(
                new ChainStep(first.identity(), second.identity(), 0.75),
                new ChainStep(second.identity(), third.identity(), 1.5))));
  }

  @Nested
  @DisplayName("POST /api/sequences/text")
  class TextEndpoint {

    @Test
    @DisplayName("Should return fragments in chained order with distances")
    void shouldReturnChainedFragments() throws Exception {
      when(sequencingService.sequenceTexts(anyList())).thenReturn(chainedResult());
      TextSequenceRequest request =
          TextSequenceRequest.builder()
              .fragments(
                  List.of(
                      new TextSequenceRequest.Fragment("p1", "WHERE IS IT?\nLOOK!"),
                      new TextSequenceRequest.Fragment("p2", ""),
                      new TextSequenceRequest.Fragment("p3", "BEHIND YOU")))
              .build();

      mockMvc
          .perform(
              post("/api/sequences/text")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.strategy").value("GREEDY_CHAIN"))
          .andExpect(jsonPath("$.fallbackReason").value(nullValue()))
          .andExpect(jsonPath("$.fragments.length()").value(3))
          .andExpect(jsonPath("$.fragments[0].name").value("p1"))
          .andExpect(jsonPath("$.fragments[0].position").value(0))
          .andExpect(jsonPath("$.fragments[0].lines.length()").value(2))
          .andExpect(jsonPath("$.fragments[0].distanceFromPrevious").value(nullValue()))
          .andExpect(jsonPath("$.fragments[1].name").value("p3"))
          .andExpect(jsonPath("$.fragments[1].uploadIndex").value(2))
          .andExpect(jsonPath("$.fragments[1].distanceFromPrevious").value(0.75))
          .andExpect(jsonPath("$.fragments[2].distanceFromPrevious").value(1.5))
          .andExpect(jsonPath("$.fragments[2].lines[0]").value(""));

      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<TextFragment>> captor = ArgumentCaptor.forClass(List.class);
      verify(sequencingService).sequenceTexts(captor.capture());
      assertThat(captor.getValue())
          .extracting(TextFragment::name)
          .containsExactly("p1", "p2", "p3");
    }

    @Test
    @DisplayName("Should report an upload-order fallback")
    void shouldReportFallback() throws Exception {
      Segment only = Segment.of(0, "p1", "HELLO");
      Segment other = Segment.of(1, "p2", "???");
      when(sequencingService.sequenceTexts(anyList()))
          .thenReturn(
              SequencingResult.fallback(
                  Ordering.uploadOrder(List.of(only, other)), "no comparable panels"));

      mockMvc
          .perform(
              post("/api/sequences/text")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"fragments\":[{\"name\":\"p1\",\"text\":\"HELLO\"},"
                      + "{\"name\":\"p2\",\"text\":\"???\"}]}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.strategy").value("UPLOAD_ORDER_FALLBACK"))
          .andExpect(jsonPath("$.fallbackReason").value("no comparable panels"))
          .andExpect(jsonPath("$.fragments[1].distanceFromPrevious").value(nullValue()));
    }

    @Test
    @DisplayName("Should return 400 when fragments are missing")
    void shouldRejectMissingFragments() throws Exception {
      mockMvc
          .perform(
              post("/api/sequences/text").contentType(MediaType.APPLICATION_JSON).content("{}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));

      verify(sequencingService, never()).sequenceTexts(anyList());
    }

    @Test
    @DisplayName("Should return 400 when a fragment has no name")
    void shouldRejectUnnamedFragment() throws Exception {
      mockMvc
          .perform(
              post("/api/sequences/text")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"fragments\":[{\"text\":\"HELLO\"}]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    }

    @Test
    @DisplayName("Should return 400 for an empty fragment list")
    void shouldRejectEmptyFragmentList() throws Exception {
      when(sequencingService.sequenceTexts(anyList()))
          .thenThrow(new EmptyInputException("Cannot sequence an empty list of segments"));

      mockMvc
          .perform(
              post("/api/sequences/text")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"fragments\":[]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("SEQUENCE_001"))
          .andExpect(jsonPath("$.path").value("/api/sequences/text"));

      assertThat(meterRegistry.counter("api_errors_total", "error_type", "empty_input").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return 422 when no candidate is selectable")
    void shouldReturnUnprocessableWhenNoCandidate() throws Exception {
      when(sequencingService.sequenceTexts(anyList()))
          .thenThrow(new NoSelectableCandidateException(Segment.of(0, "p1", "").identity(), 1));

      mockMvc
          .perform(
              post("/api/sequences/text")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"fragments\":[{\"name\":\"p1\"},{\"name\":\"p2\"}]}"))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.code").value("SEQUENCE_002"));
    }
  }

  @Nested
  @DisplayName("POST /api/sequences")
  class MultipartEndpoint {

    @Test
    @DisplayName("Should decode uploaded files in order")
    void shouldDecodeUploadedFiles() throws Exception {
      when(sequencingService.sequenceUploads(anyList())).thenReturn(chainedResult());

      mockMvc
          .perform(
              multipart("/api/sequences")
                  .file(new MockMultipartFile("files", "p1.png", "image/png", IMAGE_BYTES))
                  .file(new MockMultipartFile("files", "p2.jpg", "image/jpeg", IMAGE_BYTES)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.fragments.length()").value(3));

      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<ImageUpload>> captor = ArgumentCaptor.forClass(List.class);
      verify(sequencingService).sequenceUploads(captor.capture());
      assertThat(captor.getValue())
          .extracting(ImageUpload::fileName)
          .containsExactly("p1.png", "p2.jpg");
    }

    @Test
    @DisplayName("Should return 400 for a non-image upload")
    void shouldRejectNonImage() throws Exception {
      mockMvc
          .perform(
              multipart("/api/sequences")
                  .file(new MockMultipartFile("files", "notes.txt", "text/plain", IMAGE_BYTES)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("UPLOAD_001"))
          .andExpect(jsonPath("$.message").value(containsString("notes.txt")));

      verify(sequencingService, never()).sequenceUploads(any());
    }

    @Test
    @DisplayName("Should return 400 when too many files are uploaded")
    void shouldRejectTooManyFiles() throws Exception {
      mockMvc
          .perform(
              multipart("/api/sequences")
                  .file(new MockMultipartFile("files", "1.png", "image/png", IMAGE_BYTES))
                  .file(new MockMultipartFile("files", "2.png", "image/png", IMAGE_BYTES))
                  .file(new MockMultipartFile("files", "3.png", "image/png", IMAGE_BYTES)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("UPLOAD_001"));
    }

    @Test
    @DisplayName("Should return 503 when text extraction fails")
    void shouldReturnServiceUnavailableOnExtractionFailure() throws Exception {
      when(sequencingService.sequenceUploads(anyList()))
          .thenThrow(new TextExtractionException("p1.png", "Vision model call failed"));

      mockMvc
          .perform(
              multipart("/api/sequences")
                  .file(new MockMultipartFile("files", "p1.png", "image/png", IMAGE_BYTES)))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.code").value("OCR_001"));
    }
  }

  @Nested
  @DisplayName("POST /api/sequences/data-urls")
  class DataUrlEndpoint {

    @Test
    @DisplayName("Should decode data URLs and index them by position")
    void shouldDecodeDataUrls() throws Exception {
      when(sequencingService.sequenceUploads(anyList())).thenReturn(chainedResult());
      String encoded = Base64.getEncoder().encodeToString(IMAGE_BYTES);
      DataUrlSequenceRequest request =
          DataUrlSequenceRequest.builder()
              .uploads(
                  List.of(
                      new DataUrlSequenceRequest.Upload(
                          "a.png", "data:image/png;base64," + encoded),
                      new DataUrlSequenceRequest.Upload(null, encoded)))
              .build();

      mockMvc
          .perform(
              post("/api/sequences/data-urls")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk());

      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<ImageUpload>> captor = ArgumentCaptor.forClass(List.class);
      verify(sequencingService).sequenceUploads(captor.capture());
      assertThat(captor.getValue()).extracting(ImageUpload::index).containsExactly(0, 1);
      assertThat(captor.getValue())
          .extracting(ImageUpload::fileName)
          .containsExactly("a.png", "upload-2");
    }

    @Test
    @DisplayName("Should return 400 for blank content")
    void shouldRejectBlankContent() throws Exception {
      mockMvc
          .perform(
              post("/api/sequences/data-urls")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"uploads\":[{\"fileName\":\"a.png\",\"content\":\"\"}]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    }
  }
}
