package io.intellixity.calcaudit.model;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Declared versus graph-derived level of one key. Informational only.\n
 */
public record LevelDelta(String fullKey, int declaredLevel, ProperLevel properLevel) {
  public LevelDelta {
    Objects.requireNonNull(fullKey, "fullKey");
    Objects.requireNonNull(properLevel, "properLevel");
  }

  /** {@code declared - proper}; empty when the proper level is a cycle. */
  public OptionalInt delta() {
    return properLevel.isCycle() ? OptionalInt.empty() : OptionalInt.of(declaredLevel - properLevel.value());
  }

  public boolean matches() {
    return !properLevel.isCycle() && properLevel.value() == declaredLevel;
  }
}
