package com.acme.resume.ingest.info;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL;

/**
 * @param warnings present only when some setting is missing, keyed by <code>missingSettings</code>
 */
@JsonInclude(NON_NULL)
public record HealthReport(String status,
                           String timestamp,
                           String service,
                           String version,
                           String environment,
                           boolean environmentValid,
                           Map<String, List<String>> warnings) {
}
