package com.flamingo.ai.ragpipeline.api.rest;

import com.flamingo.ai.ragpipeline.api.dto.response.IngestResponse;
import com.flamingo.ai.ragpipeline.exception.DocumentProcessingException;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionReport;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionService;
import com.flamingo.ai.ragpipeline.service.rag.model.SourceDocument;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for loading documents into the index. */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
@Slf4j
public class IngestController {

  private final IngestionService ingestionService;

  /**
   * Ingests uploaded PDFs. Each file is reported separately; one bad file does not fail the
   * request.
   */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestResponse> ingest(@RequestParam("files") List<MultipartFile> files) {
    List<SourceDocument> sources = new ArrayList<>(files.size());
    for (MultipartFile file : files) {
      if (file.isEmpty()) {
        log.warn("Skipping empty upload {}", file.getOriginalFilename());
        continue;
      }
      sources.add(toSource(file));
    }
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("At least one non-empty file is required");
    }
    IngestionReport report = ingestionService.ingest(sources);
    return ResponseEntity.ok(IngestResponse.fromReport(report));
  }

  private static SourceDocument toSource(MultipartFile file) {
    String name =
        file.getOriginalFilename() != null && !file.getOriginalFilename().isBlank()
            ? file.getOriginalFilename()
            : file.getName();
    try {
      return SourceDocument.of(name, file.getBytes());
    } catch (IOException e) {
      throw new DocumentProcessingException(
          SourceDocument.slugOf(name), "Failed to read upload " + name, e);
    }
  }
}
