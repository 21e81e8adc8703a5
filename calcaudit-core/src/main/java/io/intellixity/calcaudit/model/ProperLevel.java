package io.intellixity.calcaudit.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.OptionalInt;

/**
 * Calculation level derived from the dependency graph.\n
 *
 * Either a non-negative integer or {@link #CYCLE}, which never compares equal to any integer level.\n
 */
@JsonSerialize(using = ProperLevelJsonSerializer.class)
@JsonDeserialize(using = ProperLevelJsonDeserializer.class)
public final class ProperLevel {
  public static final ProperLevel CYCLE = new ProperLevel(-1);

  private static final ProperLevel[] SMALL = new ProperLevel[16];
  static {
    for (int i = 0; i < SMALL.length; i++) SMALL[i] = new ProperLevel(i);
  }

  public static final ProperLevel ZERO = SMALL[0];

  private final int value;

  private ProperLevel(int value) {
    this.value = value;
  }

  public static ProperLevel of(int value) {
    if (value < 0) throw new IllegalArgumentException("level must be >= 0: " + value);
    return value < SMALL.length ? SMALL[value] : new ProperLevel(value);
  }

  public boolean isCycle() { return this == CYCLE; }

  /** Integer level; throws for {@link #CYCLE}. */
  public int value() {
    if (isCycle()) throw new IllegalStateException("cycle has no integer level");
    return value;
  }

  public OptionalInt asInt() {
    return isCycle() ? OptionalInt.empty() : OptionalInt.of(value);
  }

  /** Level of a key whose deepest dependency has this level. Cycles stay cycles. */
  public ProperLevel next() {
    return isCycle() ? CYCLE : of(value + 1);
  }

  /** Larger of two levels, where {@link #CYCLE} dominates. */
  public ProperLevel max(ProperLevel other) {
    if (isCycle() || other.isCycle()) return CYCLE;
    return value >= other.value ? this : other;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ProperLevel p)) return false;
    return value == p.value;
  }

  @Override
  public int hashCode() { return Integer.hashCode(value); }

  @Override
  public String toString() { return isCycle() ? "cycle" : String.valueOf(value); }
}
