package io.intellixity.calcaudit.level;

import com.fasterxml.jackson.annotation.JsonValue;
import io.intellixity.calcaudit.model.ProperLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Proper level of every key of a run, in registry order. */
public final class LevelTable {
  private final Map<String, ProperLevel> levels;

  LevelTable(Map<String, ProperLevel> levels) {
    this.levels = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(levels, "levels")));
  }

  public Optional<ProperLevel> levelOf(String fullKey) {
    return Optional.ofNullable(levels.get(fullKey));
  }

  @JsonValue
  public Map<String, ProperLevel> asMap() { return levels; }

  public int size() { return levels.size(); }

  public long cycleCount() {
    return levels.values().stream().filter(ProperLevel::isCycle).count();
  }
}
