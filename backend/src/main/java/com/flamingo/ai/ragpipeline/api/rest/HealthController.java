package com.flamingo.ai.ragpipeline.api.rest;

import com.flamingo.ai.ragpipeline.elasticsearch.ChunkIndex;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and index info. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

  private final ChunkIndex chunkIndex;

  /** Returns a simple health check response. */
  @GetMapping("/healthz")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "healthy");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "rag-pipeline");
    return ResponseEntity.ok(health);
  }

  /** Returns index statistics. */
  @GetMapping("/index/stats")
  public ResponseEntity<Map<String, Object>> indexStats() {
    Map<String, Object> stats = new HashMap<>();
    stats.put("indexName", chunkIndex.getIndexName());
    stats.put("chunkCount", chunkIndex.count());
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
