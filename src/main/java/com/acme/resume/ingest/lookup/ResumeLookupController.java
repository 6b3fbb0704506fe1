package com.acme.resume.ingest.lookup;

import com.acme.resume.ingest.upload.PipelineReply;
import com.acme.resume.ingest.upload.ResumeRejectedException;
import com.acme.resume.ingest.upload.exchange.ErrorResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.UNAUTHORIZED;
import static org.springframework.util.StringUtils.hasText;

/**
 * Relays resume status & search queries to the agent backend. Unlike uploads, these only accept the authorization
 * header
 */
@RestController
public class ResumeLookupController {

  public static final String CHECK_PATH = "/api/resume/check/{userId}";
  public static final String SEARCH_PATH = "/api/resume/search";

  private static final String DEFAULT_LIMIT = "5";

  private final ResumeLookupClient lookupClient;

  public ResumeLookupController(ResumeLookupClient lookupClient) {
    this.lookupClient = lookupClient;
  }

  @GetMapping(CHECK_PATH)
  public Mono<ResponseEntity<Object>> check(@PathVariable String userId,
      @Nullable @RequestHeader(value = AUTHORIZATION, required = false) String authorization) {
    if (!hasText(authorization)) {
      return Mono.error(unauthorized());
    }
    return lookupClient.check(userId, authorization)
        .flatMap(reply -> relay(reply, "Resume check failed"));
  }

  @GetMapping(SEARCH_PATH)
  public Mono<ResponseEntity<Object>> search(@Nullable @RequestParam(required = false) String query,
      @Nullable @RequestParam(value = "user_id", required = false) String userId,
      @Nullable @RequestParam(required = false) String limit,
      @Nullable @RequestHeader(value = AUTHORIZATION, required = false) String authorization) {
    if (!hasText(query)) {
      return Mono.error(new ResumeRejectedException(BAD_REQUEST, "Query parameter is required"));
    }
    if (!hasText(authorization)) {
      return Mono.error(unauthorized());
    }
    return lookupClient.search(query, userId, hasText(limit) ? limit : DEFAULT_LIMIT, authorization)
        .flatMap(reply -> relay(reply, "Resume search failed"));
  }

  /**
   * Backend json is returned untouched; a backend error keeps its status & quotes the backend's own text
   */
  private static Mono<ResponseEntity<Object>> relay(PipelineReply reply, String failurePrefix) {
    if (reply.successful()) {
      return Mono.just(ResponseEntity.ok(reply.body()));
    }
    if (reply.emptySuccess()) {
      return Mono.error(new IllegalStateException("Agent backend returned an empty body"));
    }
    return Mono.just(ResponseEntity.status(reply.statusCode())
        .body(ErrorResponse.of(failurePrefix + ": " + reply.statusCode() + " - " + reply.errorBody())));
  }

  private static ResumeRejectedException unauthorized() {
    return new ResumeRejectedException(UNAUTHORIZED, "Unauthorized - Authentication required");
  }
}
