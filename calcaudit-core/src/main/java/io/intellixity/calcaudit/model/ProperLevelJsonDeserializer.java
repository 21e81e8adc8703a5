package io.intellixity.calcaudit.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;

public final class ProperLevelJsonDeserializer extends JsonDeserializer<ProperLevel> {
  @Override
  public ProperLevel deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonToken t = p.currentToken();
    if (t == JsonToken.VALUE_NUMBER_INT) return ProperLevel.of(p.getIntValue());
    if (t == JsonToken.VALUE_STRING && ProperLevelJsonSerializer.CYCLE_TOKEN.equals(p.getText())) {
      return ProperLevel.CYCLE;
    }
    return (ProperLevel) ctxt.handleUnexpectedToken(ProperLevel.class, p);
  }
}
