package com.acme.resume.ingest.upload.exchange;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wraps agent pipeline results so clients can tell them apart from direct pipeline results, which are passed through untouched
 */
public record AnalysisEnvelope(String status, String message, JsonNode data) {

  public static AnalysisEnvelope success(JsonNode data) {
    return new AnalysisEnvelope("success", "Resume analyzed successfully", data);
  }
}
