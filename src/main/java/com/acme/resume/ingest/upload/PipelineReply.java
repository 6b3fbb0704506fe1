package com.acme.resume.ingest.upload;

import com.acme.resume.ingest.util.MiscUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

/**
 * What a pipeline answered. Only 2xx replies carry a body; everything else keeps the raw error text for logging
 *
 * @param statusCode raw status, may be one {@link HttpStatus} does not know about. 0 when no response arrived at all
 */
public record PipelineReply(int statusCode, String statusText, @Nullable JsonNode body, String errorBody) {

  public boolean successful() {
    return isSuccess(statusCode) && body != null;
  }

  public boolean emptySuccess() {
    return isSuccess(statusCode) && body == null;
  }

  public static PipelineReply unanswered(Throwable error) {
    return new PipelineReply(0, error.toString(), null, "");
  }

  /**
   * Reads json for 2xx responses & plain text otherwise, whatever the response content type says. A 2xx without a body
   * results in a reply with no body; a body that is not json errors
   */
  public static Mono<PipelineReply> read(ClientResponse response, ObjectMapper objectMapper) {
    final var statusCode = response.rawStatusCode();
    final var status = HttpStatus.resolve(statusCode);
    final var statusText = status != null ? status.getReasonPhrase() : "";
    final var bodyText = response.bodyToFlux(DataBuffer.class)
        .as(MiscUtil::readAllBuffersAsUtf8String)
        .defaultIfEmpty("");
    if (isSuccess(statusCode)) {
      return bodyText.flatMap(text -> {
        if (text.isBlank()) {
          return Mono.just(new PipelineReply(statusCode, statusText, null, ""));
        }
        try {
          return Mono.just(new PipelineReply(statusCode, statusText, objectMapper.readTree(text), ""));
        } catch (JsonProcessingException e) {
          return Mono.error(e);
        }
      });
    }
    return bodyText.map(errorBody -> new PipelineReply(statusCode, statusText, null, errorBody));
  }

  public String describe() {
    return (statusCode + " " + statusText).trim();
  }

  public String failureReason() {
    if (statusCode == 0) {
      return statusText;
    }
    return emptySuccess() ? describe() + " with an empty body" : describe();
  }

  private static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }
}
