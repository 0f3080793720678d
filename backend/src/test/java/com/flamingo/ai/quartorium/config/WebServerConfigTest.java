package com.flamingo.ai.quartorium.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.catalina.connector.Connector;
import org.apache.tomcat.util.buf.EncodedSolidusHandling;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;

class WebServerConfigTest {

  @Test
  @DisplayName("should let encoded slashes of asset URLs pass through undecoded")
  void shouldPassEncodedSlashThrough_whenConnectorCustomized() {
    TomcatServletWebServerFactory factory = new TomcatServletWebServerFactory();
    new WebServerConfig().encodedSlashCustomizer().customize(factory);
    Connector connector = new Connector();

    factory.getTomcatConnectorCustomizers().forEach(customizer -> customizer.customize(connector));

    assertThat(connector.getEncodedSolidusHandling())
        .isEqualTo(EncodedSolidusHandling.PASS_THROUGH.getValue());
  }
}
