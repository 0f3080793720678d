package com.flamingo.ai.quartorium.config;

import org.apache.tomcat.util.buf.EncodedSolidusHandling;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedded server settings.
 *
 * <p>Asset URLs carry the document id as one percent-encoded path segment, so an encoded slash
 * ({@code %2F}) has to reach the dispatcher undecoded.
 */
@Configuration
public class WebServerConfig {

  @Bean
  public WebServerFactoryCustomizer<TomcatServletWebServerFactory> encodedSlashCustomizer() {
    return factory ->
        factory.addConnectorCustomizers(
            connector ->
                connector.setEncodedSolidusHandling(
                    EncodedSolidusHandling.PASS_THROUGH.getValue()));
  }
}
