package com.acme.resume.ingest.common;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpHeaders.CONTENT_TYPE;

/**
 * Browser clients call the upload routes from another origin
 */
@Configuration(proxyBeanMethods = false)
public class WebCorsConfiguration implements WebFluxConfigurer {

  private static final String[] CORS_ENABLED_PATHS = {"/api/**", "/resume/**"};

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    for (String path : CORS_ENABLED_PATHS) {
      registry.addMapping(path)
          .allowedOrigins("*")
          .allowedMethods("GET", "POST", "OPTIONS")
          .allowedHeaders(CONTENT_TYPE, AUTHORIZATION);
    }
  }
}
