package com.acme.resume.ingest.common;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Everything the upload pipeline needs to know about its surroundings. Handed to collaborators explicitly so nothing
 * reads the environment on its own
 *
 * @param ragApiUrl       endpoint of the direct (document native) pipeline, receives the multipart upload as is
 * @param agentApiUrl     endpoint of the agent pipeline, receives a json task with the file embedded as base64
 * @param checkApiUrl     base of the resume status lookup, the user id is appended as a path segment
 * @param searchApiUrl    endpoint of the resume search
 * @param maxFileSize     largest accepted upload
 * @param defaultUserId   user id forwarded when the client sends none
 * @param analysisQuery   instruction sent to the agent pipeline along with the file
 * @param connectTimeout  tcp connect timeout for both pipelines
 * @param responseTimeout time allowed for either pipeline to respond
 */
@Validated
@ConfigurationProperties("app.ingest")
public record ResumeIngestProperties(
    @DefaultValue("http://localhost:8000/resume/upload") String ragApiUrl,
    @DefaultValue("http://localhost:8002/api/pendo-agent") String agentApiUrl,
    @DefaultValue("http://localhost:8002/api/resume/check") String checkApiUrl,
    @DefaultValue("http://localhost:8002/api/resume/search") String searchApiUrl,
    @NotNull @DefaultValue("5MB") DataSize maxFileSize,
    @NotEmpty @DefaultValue("demo_user") String defaultUserId,
    @NotEmpty @DefaultValue("Analyze this resume and extract all relevant information") String analysisQuery,
    @NotNull @DefaultValue("5s") Duration connectTimeout,
    @NotNull @DefaultValue("30s") Duration responseTimeout) {
}
