package com.acme.resume.ingest.upload;

import com.acme.resume.ingest.upload.exchange.AnalysisEnvelope;
import com.acme.resume.ingest.upload.exchange.ErrorResponse;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;

/**
 * Terminal state of a submission that made it past validation. Exactly one of the records below
 */
public interface IngestionOutcome {

  ResponseEntity<Object> toResponse();

  /**
   * Direct pipeline accepted the file. Its json goes back to the client untouched
   */
  record DirectSuccess(JsonNode body) implements IngestionOutcome {
    @Override
    public ResponseEntity<Object> toResponse() {
      return ResponseEntity.ok(body);
    }
  }

  /**
   * Direct pipeline failed, agent pipeline answered
   */
  record FallbackSuccess(JsonNode body) implements IngestionOutcome {
    @Override
    public ResponseEntity<Object> toResponse() {
      return ResponseEntity.ok(AnalysisEnvelope.success(body));
    }
  }

  /**
   * Both pipelines failed. The agent pipeline's status is what the client sees
   *
   * @param primaryFailure why the direct pipeline was abandoned
   */
  record FallbackFailure(int statusCode, String statusDescription, String primaryFailure) implements IngestionOutcome {
    @Override
    public ResponseEntity<Object> toResponse() {
      return ResponseEntity.status(statusCode)
          .body(new ErrorResponse("Resume analysis failed: " + statusDescription, null, primaryFailure));
    }
  }
}
