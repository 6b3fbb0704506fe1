package com.acme.resume.ingest.lookup;

import com.acme.resume.ingest.common.ResumeIngestProperties;
import com.acme.resume.ingest.upload.PipelineReply;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.function.Function;

import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.util.StringUtils.hasText;

/**
 * Read only queries against resumes the agent backend already holds
 */
@Log4j2
@Component
public class ResumeLookupClient {

  private final ResumeIngestProperties properties;
  private final ObjectMapper objectMapper;
  private final WebClient webClient;

  public ResumeLookupClient(WebClient.Builder webClientBuilder,
      Function<String, ClientHttpConnector> loggerNameToClientHttpConnectorMapper,
      ResumeIngestProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.webClient = webClientBuilder.clone()
        .clientConnector(loggerNameToClientHttpConnectorMapper.apply(getClass().getCanonicalName()))
        .build();
  }

  /*
  curl '<check-api-url>/<userId>' \
    -H 'authorization: Bearer <>'
   */
  public Mono<PipelineReply> check(String userId, String authorization) {
    return webClient
        .method(GET)
        .uri(properties.checkApiUrl() + "/{userId}", userId)
        .header(AUTHORIZATION, authorization)
        .exchangeToMono(response -> PipelineReply.read(response, objectMapper))
        .doOnSubscribe(__ -> log.info("Attempting to check resume of user {}", userId))
        .doFinally(signal -> log.info("Finished attempt to check resume of user {}. Terminal signal received is {}", userId, signal));
  }

  /*
  curl '<search-api-url>?query=<>&user_id=<>&limit=<>' \
    -H 'authorization: Bearer <>'
   */
  public Mono<PipelineReply> search(String query, @Nullable String userId, String limit, String authorization) {
    final var uriVariables = new HashMap<String, String>();
    uriVariables.put("query", query);
    uriVariables.put("limit", limit);
    final var uriBuilder = UriComponentsBuilder.fromUriString(properties.searchApiUrl())
        .queryParam("query", "{query}");
    if (hasText(userId)) {
      uriBuilder.queryParam("user_id", "{userId}");
      uriVariables.put("userId", userId);
    }
    final var uri = uriBuilder.queryParam("limit", "{limit}")
        .encode()
        .buildAndExpand(uriVariables)
        .toUri();

    return webClient
        .method(GET)
        .uri(uri)
        .header(AUTHORIZATION, authorization)
        .exchangeToMono(response -> PipelineReply.read(response, objectMapper))
        .doOnSubscribe(__ -> log.info("Attempting to search resumes"))
        .doFinally(signal -> log.info("Finished attempt to search resumes. Terminal signal received is {}", signal));
  }
}
