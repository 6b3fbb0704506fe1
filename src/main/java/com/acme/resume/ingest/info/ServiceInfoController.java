package com.acme.resume.ingest.info;

import com.acme.resume.ingest.ResumeIngestApplication;
import com.acme.resume.ingest.common.ResumeIngestProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.acme.resume.ingest.lookup.ResumeLookupController.CHECK_PATH;
import static com.acme.resume.ingest.lookup.ResumeLookupController.SEARCH_PATH;
import static com.acme.resume.ingest.upload.ResumeUploadController.ANALYZE_PATH;
import static com.acme.resume.ingest.upload.ResumeUploadController.UPLOAD_PATH;
import static org.springframework.http.HttpHeaders.CACHE_CONTROL;
import static org.springframework.util.StringUtils.hasText;

/**
 * Route index & liveness report. Neither touches the backends
 */
@RestController
public class ServiceInfoController {

  private static final String DEFAULT_VERSION = "1.0.0";

  private final ResumeIngestProperties properties;
  private final Environment environment;
  private final String serviceName;

  public ServiceInfoController(ResumeIngestProperties properties, Environment environment,
      @Value("${spring.application.name:resume-ingest}") String serviceName) {
    this.properties = properties;
    this.environment = environment;
    this.serviceName = serviceName;
  }

  @GetMapping("/")
  public ServiceIndex index() {
    return new ServiceIndex("ok", "Climate Economy Assistant API Routes", List.of(UPLOAD_PATH, ANALYZE_PATH, CHECK_PATH, SEARCH_PATH));
  }

  @GetMapping("/health")
  public ResponseEntity<HealthReport> health() {
    final List<String> missingSettings = new ArrayList<>();
    if (!hasText(properties.ragApiUrl())) {
      missingSettings.add("app.ingest.rag-api-url");
    }
    if (!hasText(properties.agentApiUrl())) {
      missingSettings.add("app.ingest.agent-api-url");
    }
    if (!hasText(properties.checkApiUrl())) {
      missingSettings.add("app.ingest.check-api-url");
    }
    if (!hasText(properties.searchApiUrl())) {
      missingSettings.add("app.ingest.search-api-url");
    }

    final var activeProfiles = environment.getActiveProfiles();
    final var report = new HealthReport(
        "healthy",
        Instant.now().toString(),
        serviceName,
        Objects.requireNonNullElse(ResumeIngestApplication.class.getPackage().getImplementationVersion(), DEFAULT_VERSION),
        activeProfiles.length > 0 ? String.join(",", activeProfiles) : "development",
        missingSettings.isEmpty(),
        missingSettings.isEmpty() ? null : Map.of("missingSettings", missingSettings));

    return ResponseEntity.ok()
        .header(CACHE_CONTROL, "no-store, max-age=0")
        .body(report);
  }
}
