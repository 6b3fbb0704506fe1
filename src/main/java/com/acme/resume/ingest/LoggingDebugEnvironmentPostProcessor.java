package com.acme.resume.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;

/**
 * Changing logging properties so that we can enable debugging using commandline/system property/environment variable flag.
 * This will be processed as soon as bootstrap application context is initialised but before main application context is built & refreshed so we get an opportunity to modify environment that main application context can see environment changes
 * Both pipeline clients wiretap under their own class name, so raising <code>com.acme</code> to DEBUG also dumps the traffic to both pipelines.
 * This is made available to spring via `META-INF/spring.factories`
 */
public class LoggingDebugEnvironmentPostProcessor implements EnvironmentPostProcessor {

  static final String PROPERTY_SOURCE_NAME = "debugPropertyCustomSource";

  @Override
  public void postProcessEnvironment(ConfigurableEnvironment environment,
      SpringApplication application) {
    final var debugEnabled = environment.containsProperty("app.debug");
    if (debugEnabled) {
      var keyToValue = new HashMap<String, Object>();
      keyToValue.put("logging.level.com.acme", "DEBUG");
      // lets disable color so that we can redirect output to a log file & not have ansi characters in log
      keyToValue.put("spring.output.ansi.enabled", "never");
      keyToValue.put("logging.pattern.console", "%d{yyyy-MM-dd HH:mm:ss.SSS} %5p --- [%t] %-40.40c{1.} : %m%n%xwEx");
      final var propertySource = new MapPropertySource(PROPERTY_SOURCE_NAME, keyToValue);
      environment.getPropertySources().addFirst(propertySource);
    }
  }
}
