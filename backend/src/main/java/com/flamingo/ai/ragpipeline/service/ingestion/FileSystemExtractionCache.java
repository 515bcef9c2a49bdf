package com.flamingo.ai.ragpipeline.service.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stores extraction output as one JSON file per content hash under {@code rag.cache.directory}.
 *
 * <p>Unreadable or unwritable entries are logged and treated as misses. Entries are written to a
 * temporary file and moved into place, so readers never see a partial entry.
 */
@Component
@ConditionalOnProperty(name = "rag.cache.enabled", havingValue = "true")
@Slf4j
public class FileSystemExtractionCache implements ExtractionCache {

  private final Path directory;
  private final ObjectMapper objectMapper;

  @Autowired
  public FileSystemExtractionCache(RagConfig ragConfig, ObjectMapper objectMapper) {
    this(Path.of(ragConfig.getCache().getDirectory()), objectMapper);
  }

  @VisibleForTesting
  public FileSystemExtractionCache(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    log.info("Extraction cache enabled at {}", directory.toAbsolutePath());
  }

  @Override
  public Optional<ExtractedDocument> get(String key) {
    Path file = fileFor(key);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      ExtractedDocument cached = objectMapper.readValue(file.toFile(), ExtractedDocument.class);
      log.debug("Extraction cache hit for {}", key);
      return Optional.of(cached);
    } catch (IOException e) {
      log.warn("Ignoring unreadable cache entry {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void put(String key, ExtractedDocument document) {
    Path file = fileFor(key);
    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, key, ".tmp");
      objectMapper.writeValue(temp.toFile(), document);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Cached extraction of {} as {}", document.fileName(), file.getFileName());
    } catch (IOException e) {
      log.warn("Could not cache extraction of {}: {}", document.fileName(), e.getMessage());
    }
  }

  private Path fileFor(String key) {
    return directory.resolve(key + ".json");
  }
}
