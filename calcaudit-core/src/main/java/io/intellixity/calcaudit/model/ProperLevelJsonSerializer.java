package io.intellixity.calcaudit.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Writes a {@link ProperLevel} as a JSON number, or the string {@code "cycle"}. */
public final class ProperLevelJsonSerializer extends JsonSerializer<ProperLevel> {
  static final String CYCLE_TOKEN = "cycle";

  @Override
  public void serialize(ProperLevel level, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (level == null) {
      g.writeNull();
      return;
    }
    if (level.isCycle()) {
      g.writeString(CYCLE_TOKEN);
      return;
    }
    g.writeNumber(level.value());
  }
}
