package com.flamingo.ai.stripsequencer.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j models. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.vision-model.model-name:gpt-4o-mini}")
  private String visionModelName;

  @Value("${langchain4j.openai.vision-model.max-completion-tokens:1024}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.vision-model.timeout-seconds:60}")
  private int visionTimeoutSeconds;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  /** Vision-capable chat model used to transcribe the text of uploaded panels. */
  @Bean
  public ChatModel visionChatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(visionModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .temperature(0.0)
        .timeout(Duration.ofSeconds(visionTimeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /** Embedding model backing word vectors; only created when vectors come from the model. */
  @Bean
  @ConditionalOnProperty(
      name = "sequencing.distance.vectors",
      havingValue = "embedding-model",
      matchIfMissing = true)
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
