package com.flamingo.ai.quartorium.service.conversion.jats;

import com.flamingo.ai.quartorium.exception.MalformedSourceException;
import java.io.IOException;
import java.io.StringReader;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses rendered JATS markup into a DOM.
 *
 * <p>JATS output declares a DOCTYPE pointing at the archiving DTD. The declaration is accepted but
 * the DTD and any other external entity are never loaded.
 */
@Component
@Slf4j
public class JatsDocumentParser {

  /** XLink namespace carrying {@code xlink:href} on graphics. */
  public static final String XLINK_NS = "http://www.w3.org/1999/xlink";

  private final DocumentBuilderFactory factory;

  public JatsDocumentParser() {
    factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setValidating(false);
    factory.setExpandEntityReferences(false);
    factory.setXIncludeAware(false);
    factory.setCoalescing(true);
    trySetFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    trySetFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    trySetFeature("http://xml.org/sax/features/external-general-entities", false);
    trySetFeature("http://xml.org/sax/features/external-parameter-entities", false);
  }

  /**
   * Parses {@code xml}.
   *
   * @throws MalformedSourceException if the markup is empty or not well-formed
   */
  public Document parse(String xml) {
    if (xml == null || xml.isBlank()) {
      throw new MalformedSourceException("Rendered document is empty");
    }
    try {
      DocumentBuilder builder = factory.newDocumentBuilder();
      // the DTD is never fetched, resolve every external reference to nothing
      builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
      builder.setErrorHandler(
          new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
              log.debug("JATS parse warning: {}", e.getMessage());
            }

            @Override
            public void error(SAXParseException e) {
              log.debug("JATS parse error: {}", e.getMessage());
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
              throw e;
            }
          });
      Document document = builder.parse(new InputSource(new StringReader(xml)));
      document.getDocumentElement().normalize();
      return document;
    } catch (ParserConfigurationException | SAXException | IOException e) {
      throw new MalformedSourceException("Rendered document is not well-formed XML", e);
    }
  }

  private void trySetFeature(String feature, boolean value) {
    try {
      factory.setFeature(feature, value);
    } catch (ParserConfigurationException e) {
      log.debug("XML parser does not support feature {}: {}", feature, e.getMessage());
    }
  }
}
