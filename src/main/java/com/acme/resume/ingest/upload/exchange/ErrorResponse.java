package com.acme.resume.ingest.upload.exchange;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL;

@JsonInclude(NON_NULL)
public record ErrorResponse(@JsonProperty("error") String error,
                            @JsonProperty("details") String details,
                            @JsonProperty("primary_error") String primaryError) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, null, null);
  }
}
