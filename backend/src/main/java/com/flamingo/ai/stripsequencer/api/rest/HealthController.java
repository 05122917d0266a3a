package com.flamingo.ai.stripsequencer.api.rest;

import com.flamingo.ai.stripsequencer.config.SequencingConfig;
import com.flamingo.ai.stripsequencer.service.distance.WordVectors;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final WordVectors wordVectors;
  private final SequencingConfig sequencingConfig;

  /** Returns a simple health check response with the active sequencing setup. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "strip-sequencer");
    health.put("wordVectors", wordVectors.getSourceName());
    health.put("fallbackToUploadOrder", sequencingConfig.isFallbackToUploadOrder());
    return ResponseEntity.ok(health);
  }
}
