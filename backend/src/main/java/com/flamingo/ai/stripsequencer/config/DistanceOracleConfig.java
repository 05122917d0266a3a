package com.flamingo.ai.stripsequencer.config;

import com.flamingo.ai.stripsequencer.service.distance.DistanceOracle;
import com.flamingo.ai.stripsequencer.service.distance.EmbeddingModelWordVectors;
import com.flamingo.ai.stripsequencer.service.distance.TextFormatWordVectors;
import com.flamingo.ai.stripsequencer.service.distance.WordMoversDistanceOracle;
import com.flamingo.ai.stripsequencer.service.distance.WordVectors;
import com.flamingo.ai.stripsequencer.service.sequencing.GreedyChainSequencingEngine;
import com.flamingo.ai.stripsequencer.service.sequencing.SequencingEngine;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the sequencing engine and its distance oracle.
 *
 * <p>The word vector source is chosen with {@code sequencing.distance.vectors}: {@code
 * embedding-model} (default) embeds words with the configured LangChain4j embedding model, {@code
 * file} loads {@code sequencing.distance.vectors-file}.
 */
@Configuration
@Slf4j
public class DistanceOracleConfig {

  @Bean
  @ConditionalOnProperty(
      name = "sequencing.distance.vectors",
      havingValue = "embedding-model",
      matchIfMissing = true)
  public WordVectors embeddingModelWordVectors(
      EmbeddingModel embeddingModel,
      MeterRegistry meterRegistry,
      SequencingConfig sequencingConfig) {
    int cacheSize = sequencingConfig.getDistance().getCacheSize();
    log.info("Using embedding model word vectors (cache size {})", cacheSize);
    return new EmbeddingModelWordVectors(embeddingModel, meterRegistry, cacheSize);
  }

  @Bean
  @ConditionalOnProperty(name = "sequencing.distance.vectors", havingValue = "file")
  public WordVectors textFormatWordVectors(SequencingConfig sequencingConfig) {
    SequencingConfig.Distance distance = sequencingConfig.getDistance();
    if (distance.getVectorsFile() == null || distance.getVectorsFile().isBlank()) {
      throw new IllegalStateException(
          "sequencing.distance.vectors-file is required when sequencing.distance.vectors=file");
    }
    Path path = Path.of(distance.getVectorsFile());
    try {
      return TextFormatWordVectors.load(path, distance.isLowercaseFallback());
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read word vectors from " + path, e);
    }
  }

  @Bean
  public DistanceOracle distanceOracle(WordVectors wordVectors, SequencingConfig sequencingConfig) {
    return new WordMoversDistanceOracle(
        wordVectors, sequencingConfig.getDistance().isNormalizeVectors());
  }

  @Bean
  public SequencingEngine sequencingEngine() {
    return new GreedyChainSequencingEngine();
  }
}
