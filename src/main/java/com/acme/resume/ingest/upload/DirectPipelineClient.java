package com.acme.resume.ingest.upload;

import com.acme.resume.ingest.common.ResumeIngestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.function.Function;

import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.MediaType.MULTIPART_FORM_DATA;

/**
 * Hands the uploaded file as is to the document native (RAG) pipeline
 */
@Log4j2
@Component
public class DirectPipelineClient {

  private final ResumeIngestProperties properties;
  private final ObjectMapper objectMapper;
  private final WebClient webClient;

  public DirectPipelineClient(WebClient.Builder webClientBuilder,
      Function<String, ClientHttpConnector> loggerNameToClientHttpConnectorMapper,
      ResumeIngestProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.webClient = webClientBuilder.clone()
        .clientConnector(loggerNameToClientHttpConnectorMapper.apply(getClass().getCanonicalName()))
        .build();
  }

  /*
  curl '<rag-api-url>' \
    -H 'authorization: Bearer <>' \
    -F file='@<fullpath>' \
    -F user_id='<>'
   */
  public Mono<PipelineReply> upload(ResumeSubmission submission) {
    MultipartBodyBuilder multipartBodyBuilder = new MultipartBodyBuilder();
    multipartBodyBuilder.part("file", new ByteArrayResource(submission.content()), MediaType.parseMediaType(submission.contentType()))
        .filename(submission.fileName());
    multipartBodyBuilder.part("user_id", submission.userId());

    return webClient
        .method(POST)
        .uri(properties.ragApiUrl())
        .header(AUTHORIZATION, submission.authorization())
        .contentType(MULTIPART_FORM_DATA)
        .bodyValue(multipartBodyBuilder.build())
        .exchangeToMono(response -> PipelineReply.read(response, objectMapper))
        .doOnNext(reply -> {
          if (!reply.successful()) {
            log.error("Direct pipeline error response: {} {}", reply.describe(), reply.errorBody());
          }
        })
        .doOnSubscribe(__ -> log.info("Attempting to upload resume {} to direct pipeline", submission.fileName()))
        .doFinally(signal -> log.info("Finished attempt to upload resume to direct pipeline. Terminal signal received is {}", signal));
  }
}
