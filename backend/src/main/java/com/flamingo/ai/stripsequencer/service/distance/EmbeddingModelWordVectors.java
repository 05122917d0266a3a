package com.flamingo.ai.stripsequencer.service.distance;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Word vectors produced by a LangChain4j {@link EmbeddingModel}, one embedding call per distinct
 * word.
 *
 * <p>Vectors are memoized per word. Once {@code cacheSize} words are cached, further words are
 * still embedded but not stored. Every non-blank word is known to this source.
 */
@Slf4j
public class EmbeddingModelWordVectors implements WordVectors {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;
  private final int cacheSize;
  private final Map<String, float[]> cache = new ConcurrentHashMap<>();

  public EmbeddingModelWordVectors(
      EmbeddingModel embeddingModel, MeterRegistry meterRegistry, int cacheSize) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
    this.cacheSize = cacheSize;
  }

  @Override
  @Retry(name = "embedding")
  public Optional<float[]> vectorFor(String word) {
    if (word == null || word.isBlank()) {
      return Optional.empty();
    }

    float[] cached = cache.get(word);
    if (cached != null) {
      meterRegistry.counter("distance.word_vectors.lookups", "result", "cached").increment();
      return Optional.of(cached);
    }

    Response<Embedding> response = embeddingModel.embed(word);
    float[] vector = response.content().vector();
    meterRegistry.counter("distance.word_vectors.lookups", "result", "embedded").increment();

    if (cache.size() < cacheSize) {
      cache.putIfAbsent(word, vector);
    } else {
      log.debug("Word vector cache full ({} entries), not caching '{}'", cacheSize, word);
    }
    return Optional.of(vector);
  }

  @Override
  public String getSourceName() {
    return "EmbeddingModelWordVectors";
  }

  int cachedWordCount() {
    return cache.size();
  }
}
