package com.acme.resume.ingest;

import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication(proxyBeanMethods = false)
public class ResumeIngestApplication {

  public static void main(String[] args) {
    new SpringApplicationBuilder(ResumeIngestApplication.class)
        .properties("spring.output.ansi.enabled=always")
        .bannerMode(Banner.Mode.OFF)
        .web(WebApplicationType.REACTIVE) // webflux server for the upload routes, webclient for both pipelines
        .run(args);
  }

}
