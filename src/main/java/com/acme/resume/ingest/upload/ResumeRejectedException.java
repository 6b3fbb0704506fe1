package com.acme.resume.ingest.upload;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Raised when a request fails a precondition. Always raised before any backend is contacted
 */
@Getter
public class ResumeRejectedException extends RuntimeException {

  private final HttpStatus status;

  public ResumeRejectedException(HttpStatus status, String message) {
    super(message);
    this.status = status;
  }
}
