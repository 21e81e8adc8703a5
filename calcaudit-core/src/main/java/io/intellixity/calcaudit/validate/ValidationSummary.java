package io.intellixity.calcaudit.validate;

import io.intellixity.calcaudit.model.ProblemKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts of one validation run.\n
 *
 * @param totalKeys keys in the registry\n
 * @param rawKeys keys with declared level 0\n
 * @param calculatedKeys keys with declared level above 0\n
 * @param calculatedWithoutFormula calculated keys that carry no formula\n
 * @param cyclicKeys keys whose proper level is a cycle\n
 * @param levelMismatches keys whose declared level differs from the proper level\n
 * @param violationsByKind violation count per kind (every kind present, zero included)\n
 */
public record ValidationSummary(
    int totalKeys,
    int rawKeys,
    int calculatedKeys,
    int calculatedWithoutFormula,
    int cyclicKeys,
    int levelMismatches,
    Map<ProblemKind, Integer> violationsByKind
) {
  public ValidationSummary {
    EnumMap<ProblemKind, Integer> m = new EnumMap<>(ProblemKind.class);
    for (ProblemKind k : ProblemKind.values()) m.put(k, 0);
    if (violationsByKind != null) m.putAll(violationsByKind);
    violationsByKind = Collections.unmodifiableMap(m);
  }

  public int totalViolations() {
    int n = 0;
    for (int c : violationsByKind.values()) n += c;
    return n;
  }
}
