package com.acme.resume.ingest.upload;

import lombok.extern.log4j.Log4j2;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import static com.acme.resume.ingest.upload.ResumeSubmissionValidator.INVALID_TYPE_MESSAGE;
import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpStatus.BAD_REQUEST;

@Log4j2
@RestController
public class ResumeUploadController {

  public static final String UPLOAD_PATH = "/resume/upload";
  public static final String ANALYZE_PATH = "/api/resume/analyze";

  private final ResumeSubmissionValidator validator;
  private final ResumeIngestionPipeline pipeline;

  public ResumeUploadController(ResumeSubmissionValidator validator, ResumeIngestionPipeline pipeline) {
    this.validator = validator;
    this.pipeline = pipeline;
  }

  /**
   * Multipart form with <code>file</code>, optional <code>api_key</code> & optional <code>user_id</code>.
   * Rejections & internal errors are rendered by {@link ResumeUploadExceptionHandler}
   */
  @PostMapping({UPLOAD_PATH, ANALYZE_PATH})
  public Mono<ResponseEntity<Object>> upload(ServerWebExchange exchange,
      @Nullable @RequestHeader(value = AUTHORIZATION, required = false) String authorization) {
    // parts are read by hand so that a missing file gets our own message rather than the framework's
    return exchange.getMultipartData()
        // the part parser reads each part's content type before we get to see it
        .onErrorMap(ResumeUploadController::isUnparseableMediaType, __ -> new ResumeRejectedException(BAD_REQUEST, INVALID_TYPE_MESSAGE))
        .flatMap(parts -> validator.validate(parts, authorization))
        .doOnNext(submission -> log.info("Processing resume: {}, size: {} bytes, type: {}",
            submission.fileName(), submission.content().length, submission.contentType()))
        .flatMap(pipeline::ingest)
        .map(IngestionOutcome::toResponse);
  }

  private static boolean isUnparseableMediaType(Throwable error) {
    return NestedExceptionUtils.getMostSpecificCause(error) instanceof InvalidMediaTypeException;
  }
}
