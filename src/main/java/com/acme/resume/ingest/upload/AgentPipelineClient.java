package com.acme.resume.ingest.upload;

import com.acme.resume.ingest.common.ResumeIngestProperties;
import com.acme.resume.ingest.upload.exchange.AgentInvocationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.function.Function;

import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.MediaType.APPLICATION_JSON;

/**
 * Asks the general purpose agent to analyse a resume embedded as base64
 */
@Log4j2
@Component
public class AgentPipelineClient {

  private final ResumeIngestProperties properties;
  private final ObjectMapper objectMapper;
  private final WebClient webClient;

  public AgentPipelineClient(WebClient.Builder webClientBuilder,
      Function<String, ClientHttpConnector> loggerNameToClientHttpConnectorMapper,
      ResumeIngestProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.webClient = webClientBuilder.clone()
        .clientConnector(loggerNameToClientHttpConnectorMapper.apply(getClass().getCanonicalName()))
        .build();
  }

  /*
  curl '<agent-api-url>' \
    -H 'authorization: Bearer <>' \
    -H 'content-type: application/json' \
    --data-raw '{"query":"<>","user_id":"<>","request_id":"<>","session_id":"<>","files":[{"name":"<>","type":"<>","content":"<base64>"}]}'
   */
  public Mono<PipelineReply> invoke(AgentInvocationRequest request, String authorization) {
    return webClient
        .method(POST)
        .uri(properties.agentApiUrl())
        .header(AUTHORIZATION, authorization)
        .contentType(APPLICATION_JSON)
        .bodyValue(request)
        .exchangeToMono(response -> PipelineReply.read(response, objectMapper))
        .doOnNext(reply -> {
          if (!reply.successful()) {
            log.error("Agent pipeline error response: {} {}", reply.describe(), reply.errorBody());
          }
        })
        .doOnSubscribe(__ -> log.info("Attempting to invoke agent pipeline with request id {}", request.requestId()))
        .doFinally(signal -> log.info("Finished attempt to invoke agent pipeline. Terminal signal received is {}", signal));
  }
}
