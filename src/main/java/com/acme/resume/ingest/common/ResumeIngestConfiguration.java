package com.acme.resume.ingest.common;

import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.IdGenerator;
import org.springframework.util.JdkIdGenerator;
import reactor.netty.http.client.HttpClient;

import java.util.function.Function;

import static io.netty.handler.logging.LogLevel.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static reactor.netty.transport.logging.AdvancedByteBufFormat.TEXTUAL;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(ResumeIngestProperties.class)
public final class ResumeIngestConfiguration {
  @Bean
  public Function<String, ClientHttpConnector> loggerNameToClientHttpConnectorMapper(ResumeIngestProperties properties) {
    // lets allow the callers to specify the logger name
    return loggerName -> {
      HttpClient reactorHttpClient = HttpClient.create()
          .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(properties.connectTimeout().toMillis()))
          .responseTimeout(properties.responseTimeout()) // neither pipeline gets to block a request forever
          .wiretap(loggerName, DEBUG, TEXTUAL, UTF_8); // capture messages over wire
      return new ReactorClientHttpConnector(reactorHttpClient);
    };
  }

  /**
   * Source of request & session ids sent to the agent pipeline. Tests swap this for a predictable one
   */
  @Bean
  public IdGenerator requestIdGenerator() {
    return new JdkIdGenerator();
  }
}
