package com.flamingo.ai.quartorium.service.conversion.comment;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;

/**
 * Two-space pretty printer matching the layout browsers produce for {@code JSON.stringify(value,
 * null, 2)}: {@code "key": value}, LF line breaks and no padding inside empty containers. Keeping
 * the layout identical avoids diff noise when the web client and the backend both save a document.
 */
class CommentAppendixPrettyPrinter extends DefaultPrettyPrinter {

  private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

  CommentAppendixPrettyPrinter() {
    indentObjectsWith(INDENTER);
    indentArraysWith(INDENTER);
  }

  private CommentAppendixPrettyPrinter(CommentAppendixPrettyPrinter base) {
    super(base);
  }

  @Override
  public DefaultPrettyPrinter createInstance() {
    return new CommentAppendixPrettyPrinter(this);
  }

  @Override
  public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
    g.writeRaw(": ");
  }

  @Override
  public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
    if (!_objectIndenter.isInline()) {
      --_nesting;
    }
    if (nrOfEntries > 0) {
      _objectIndenter.writeIndentation(g, _nesting);
    }
    g.writeRaw('}');
  }

  @Override
  public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
    if (!_arrayIndenter.isInline()) {
      --_nesting;
    }
    if (nrOfValues > 0) {
      _arrayIndenter.writeIndentation(g, _nesting);
    }
    g.writeRaw(']');
  }
}
