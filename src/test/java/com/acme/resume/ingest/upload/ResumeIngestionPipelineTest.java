package com.acme.resume.ingest.upload;

import com.acme.resume.ingest.common.ResumeIngestConfiguration;
import com.acme.resume.ingest.common.ResumeIngestProperties;
import com.acme.resume.ingest.upload.IngestionOutcome.DirectSuccess;
import com.acme.resume.ingest.upload.IngestionOutcome.FallbackFailure;
import com.acme.resume.ingest.upload.IngestionOutcome.FallbackSuccess;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.SimpleIdGenerator;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Base64;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResumeIngestionPipeline")
class ResumeIngestionPipelineTest {

  private static final String DIRECT_PATH = "/resume/upload";
  private static final String AGENT_PATH = "/api/pendo-agent";
  private static final byte[] RESUME = "%PDF-1.4 pretend resume".getBytes();

  private static WireMockServer wireMockServer;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ResumeIngestionPipeline pipeline;

  @BeforeAll
  static void startBackends() {
    wireMockServer = new WireMockServer(options().dynamicPort());
    wireMockServer.start();
  }

  @AfterAll
  static void stopBackends() {
    wireMockServer.stop();
  }

  @BeforeEach
  void setUp() {
    wireMockServer.resetAll();
    final var properties = new ResumeIngestProperties(
        wireMockServer.baseUrl() + DIRECT_PATH,
        wireMockServer.baseUrl() + AGENT_PATH,
        wireMockServer.baseUrl() + "/api/resume/check",
        wireMockServer.baseUrl() + "/api/resume/search",
        DataSize.ofMegabytes(5),
        "demo_user",
        "Analyze this resume and extract all relevant information",
        Duration.ofSeconds(2),
        Duration.ofSeconds(1));
    final var connectorMapper = new ResumeIngestConfiguration().loggerNameToClientHttpConnectorMapper(properties);
    pipeline = new ResumeIngestionPipeline(
        new DirectPipelineClient(WebClient.builder(), connectorMapper, properties, objectMapper),
        new AgentPipelineClient(WebClient.builder(), connectorMapper, properties, objectMapper),
        new SimpleIdGenerator(),
        properties);
  }

  private static ResumeSubmission submission() {
    return new ResumeSubmission("resume.pdf", "application/pdf", RESUME, "user-42", "Bearer token-123");
  }

  private static void stubDirect(int status, String body) {
    wireMockServer.stubFor(post(urlEqualTo(DIRECT_PATH)).willReturn(aResponse()
        .withStatus(status)
        .withHeader("Content-Type", "application/json")
        .withBody(body)));
  }

  private static void stubAgent(int status, String body) {
    wireMockServer.stubFor(post(urlEqualTo(AGENT_PATH)).willReturn(aResponse()
        .withStatus(status)
        .withHeader("Content-Type", "application/json")
        .withBody(body)));
  }

  @Test
  @DisplayName("Direct success is returned without touching the agent pipeline")
  void directSuccess() throws Exception {
    stubDirect(200, "{\"resume_id\":\"r-1\",\"chunks\":4}");

    StepVerifier.create(pipeline.ingest(submission()))
        .expectNext(new DirectSuccess(objectMapper.readTree("{\"resume_id\":\"r-1\",\"chunks\":4}")))
        .verifyComplete();

    wireMockServer.verify(1, postRequestedFor(urlEqualTo(DIRECT_PATH)).withHeader("Authorization", equalTo("Bearer token-123")));
    wireMockServer.verify(0, postRequestedFor(urlEqualTo(AGENT_PATH)));
  }

  @Test
  @DisplayName("Direct json is accepted whatever content type it is labelled with")
  void directSuccessIgnoresContentType() throws Exception {
    wireMockServer.stubFor(post(urlEqualTo(DIRECT_PATH)).willReturn(aResponse()
        .withStatus(200)
        .withHeader("Content-Type", "text/plain")
        .withBody("{\"x\":1}")));

    StepVerifier.create(pipeline.ingest(submission()))
        .expectNext(new DirectSuccess(objectMapper.readTree("{\"x\":1}")))
        .verifyComplete();

    wireMockServer.verify(0, postRequestedFor(urlEqualTo(AGENT_PATH)));
  }

  @Test
  @DisplayName("Direct error status falls back to the agent with a base64 task")
  void fallbackOnDirectError() throws Exception {
    stubDirect(500, "{\"detail\":\"vector store down\"}");
    stubAgent(200, "{\"mapped_skills\":[]}");

    StepVerifier.create(pipeline.ingest(submission()))
        .expectNext(new FallbackSuccess(objectMapper.readTree("{\"mapped_skills\":[]}")))
        .verifyComplete();

    wireMockServer.verify(1, postRequestedFor(urlEqualTo(AGENT_PATH))
        .withHeader("Authorization", equalTo("Bearer token-123"))
        .withHeader("Content-Type", equalTo("application/json"))
        .withRequestBody(matchingJsonPath("$.query", equalTo("Analyze this resume and extract all relevant information")))
        .withRequestBody(matchingJsonPath("$.user_id", equalTo("user-42")))
        .withRequestBody(matchingJsonPath("$.request_id", equalTo("00000000-0000-0000-0000-000000000001")))
        .withRequestBody(matchingJsonPath("$.session_id", equalTo("00000000-0000-0000-0000-000000000002")))
        .withRequestBody(matchingJsonPath("$.files[0].name", equalTo("resume.pdf")))
        .withRequestBody(matchingJsonPath("$.files[0].type", equalTo("application/pdf")))
        .withRequestBody(matchingJsonPath("$.files[0].content", equalTo(Base64.getEncoder().encodeToString(RESUME)))));
  }

  @Test
  @DisplayName("Every fallback draws fresh request & session ids")
  void freshIdsPerInvocation() {
    stubDirect(502, "");
    stubAgent(200, "{}");

    StepVerifier.create(pipeline.ingest(submission()).then(pipeline.ingest(submission())))
        .expectNextCount(1)
        .verifyComplete();

    wireMockServer.verify(1, postRequestedFor(urlEqualTo(AGENT_PATH))
        .withRequestBody(matchingJsonPath("$.request_id", equalTo("00000000-0000-0000-0000-000000000003")))
        .withRequestBody(matchingJsonPath("$.session_id", equalTo("00000000-0000-0000-0000-000000000004"))));
  }

  @Test
  @DisplayName("Both failing reports the agent status along with the direct failure")
  void bothFail() {
    stubDirect(500, "{\"detail\":\"boom\"}");
    stubAgent(503, "{\"detail\":\"agent overloaded\"}");

    StepVerifier.create(pipeline.ingest(submission()))
        .expectNext(new FallbackFailure(503, "503 Service Unavailable", "Resume upload failed: 500 Internal Server Error"))
        .verifyComplete();
  }

  @Test
  @DisplayName("Direct transport failure falls back")
  void fallbackOnDirectTransportFailure() {
    wireMockServer.stubFor(post(urlEqualTo(DIRECT_PATH)).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));
    stubAgent(200, "{\"ok\":true}");

    StepVerifier.create(pipeline.ingest(submission()))
        .assertNext(outcome -> assertThat(outcome).isInstanceOf(FallbackSuccess.class))
        .verifyComplete();
  }

  @Test
  @DisplayName("Direct pipeline exceeding the response timeout falls back")
  void fallbackOnDirectTimeout() {
    wireMockServer.stubFor(post(urlEqualTo(DIRECT_PATH)).willReturn(aResponse()
        .withStatus(200)
        .withHeader("Content-Type", "application/json")
        .withBody("{}")
        .withFixedDelay(3000)));
    stubAgent(200, "{\"ok\":true}");

    StepVerifier.create(pipeline.ingest(submission()))
        .assertNext(outcome -> assertThat(outcome).isInstanceOf(FallbackSuccess.class))
        .verifyComplete();
  }

  @Test
  @DisplayName("Direct success without a body falls back")
  void fallbackOnEmptyDirectBody() {
    wireMockServer.stubFor(post(urlEqualTo(DIRECT_PATH)).willReturn(aResponse().withStatus(200)));
    stubAgent(200, "{\"ok\":true}");

    StepVerifier.create(pipeline.ingest(submission()))
        .assertNext(outcome -> assertThat(outcome).isInstanceOf(FallbackSuccess.class))
        .verifyComplete();
  }

  @Test
  @DisplayName("Direct success with a body that is not json falls back")
  void fallbackOnMalformedDirectBody() {
    stubDirect(200, "{not json");
    stubAgent(200, "{\"ok\":true}");

    StepVerifier.create(pipeline.ingest(submission()))
        .assertNext(outcome -> assertThat(outcome).isInstanceOf(FallbackSuccess.class))
        .verifyComplete();
  }

  @Test
  @DisplayName("Agent transport failure after a direct failure propagates as an error")
  void agentTransportFailurePropagates() {
    stubDirect(500, "");
    wireMockServer.stubFor(post(urlEqualTo(AGENT_PATH)).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

    StepVerifier.create(pipeline.ingest(submission()))
        .expectError()
        .verify(Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("Agent success without a body propagates as an error")
  void agentEmptyBodyPropagates() {
    stubDirect(500, "");
    wireMockServer.stubFor(post(urlEqualTo(AGENT_PATH)).willReturn(aResponse().withStatus(200)));

    StepVerifier.create(pipeline.ingest(submission()))
        .expectError()
        .verify(Duration.ofSeconds(5));
  }
}
