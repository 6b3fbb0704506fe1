package com.acme.resume.ingest.upload;

import com.acme.resume.ingest.common.ResumeIngestProperties;
import com.acme.resume.ingest.upload.IngestionOutcome.DirectSuccess;
import com.acme.resume.ingest.upload.IngestionOutcome.FallbackFailure;
import com.acme.resume.ingest.upload.IngestionOutcome.FallbackSuccess;
import com.acme.resume.ingest.upload.exchange.AgentFile;
import com.acme.resume.ingest.upload.exchange.AgentInvocationRequest;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.util.IdGenerator;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.springframework.util.Base64Utils.encodeToString;

/**
 * Two step delivery of a validated resume.
 * <p>
 * 1. Direct pipeline receives the original multipart upload. Any failure here (error status, transport error, timeout, unreadable body) only moves us on to step 2
 * <p>
 * 2. Agent pipeline receives the file as base64 inside a json task. An error status here is reported to the client along with the reason step 1 failed.
 * A transport error or unreadable body here is not handled & propagates to the caller
 * <p>
 * The two calls never overlap & neither is retried
 */
@Log4j2
@Component
public class ResumeIngestionPipeline {

  private final DirectPipelineClient directPipelineClient;
  private final AgentPipelineClient agentPipelineClient;
  private final IdGenerator idGenerator;
  private final ResumeIngestProperties properties;

  public ResumeIngestionPipeline(DirectPipelineClient directPipelineClient, AgentPipelineClient agentPipelineClient,
      IdGenerator idGenerator, ResumeIngestProperties properties) {
    this.directPipelineClient = directPipelineClient;
    this.agentPipelineClient = agentPipelineClient;
    this.idGenerator = idGenerator;
    this.properties = properties;
  }

  public Mono<IngestionOutcome> ingest(ResumeSubmission submission) {
    return attemptDirect(submission)
        .flatMap(directReply -> {
          if (directReply.successful()) {
            return Mono.<IngestionOutcome>just(new DirectSuccess(directReply.body()));
          }
          final var primaryFailure = "Resume upload failed: " + directReply.failureReason();
          log.info("Direct pipeline upload failed, falling back to agent pipeline: {}", primaryFailure);
          return attemptFallback(submission, primaryFailure);
        })
        .doOnSubscribe(__ -> log.info("Attempting to ingest resume {} for user {}", submission.fileName(), submission.userId()))
        .doFinally(signal -> log.info("Finished attempt to ingest resume {}. Final signal received is {}", submission.fileName(), signal));
  }

  private Mono<PipelineReply> attemptDirect(ResumeSubmission submission) {
    return directPipelineClient.upload(submission)
        .onErrorResume(error -> {
          log.debug("Direct pipeline call errored", error);
          return Mono.just(PipelineReply.unanswered(error));
        });
  }

  private Mono<IngestionOutcome> attemptFallback(ResumeSubmission submission, String primaryFailure) {
    return Mono.fromSupplier(() -> buildAgentRequest(submission))
        .flatMap(request -> agentPipelineClient.invoke(request, submission.authorization()))
        .flatMap(agentReply -> {
          if (agentReply.successful()) {
            return Mono.<IngestionOutcome>just(new FallbackSuccess(agentReply.body()));
          }
          if (agentReply.emptySuccess()) {
            return Mono.error(new IllegalStateException("Agent pipeline returned an empty body"));
          }
          return Mono.<IngestionOutcome>just(new FallbackFailure(agentReply.statusCode(), agentReply.describe(), primaryFailure));
        });
  }

  /**
   * Ids are drawn afresh on every call, so a client retrying the whole upload shows up downstream as a new request
   */
  AgentInvocationRequest buildAgentRequest(ResumeSubmission submission) {
    return new AgentInvocationRequest(
        properties.analysisQuery(),
        submission.userId(),
        idGenerator.generateId().toString(),
        idGenerator.generateId().toString(),
        List.of(new AgentFile(submission.fileName(), submission.contentType(), encodeToString(submission.content()))));
  }
}
