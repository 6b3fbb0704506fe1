package com.acme.resume.ingest.upload;

import com.acme.resume.ingest.lookup.ResumeLookupController;
import com.acme.resume.ingest.upload.exchange.ErrorResponse;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;

@Log4j2
@RestControllerAdvice(assignableTypes = {ResumeUploadController.class, ResumeLookupController.class})
public class ResumeUploadExceptionHandler {

  @ExceptionHandler(ResumeRejectedException.class)
  public ResponseEntity<ErrorResponse> handleRejection(ResumeRejectedException e) {
    log.info("Resume request rejected with {}: {}", e.getStatus().value(), e.getMessage());
    return ResponseEntity.status(e.getStatus()).body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e) {
    log.warn("Resume request failed with {}", e.getRawStatusCode(), e);
    return ResponseEntity.status(e.getRawStatusCode())
        .body(ErrorResponse.of(e.getReason() != null ? e.getReason() : e.getStatus().getReasonPhrase()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
    log.error("Resume API Error", e);
    return ResponseEntity.status(INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("Internal server error", e.getMessage(), null));
  }
}
