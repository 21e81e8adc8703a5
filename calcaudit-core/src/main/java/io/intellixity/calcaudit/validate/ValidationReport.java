package io.intellixity.calcaudit.validate;

import io.intellixity.calcaudit.level.LevelTable;
import io.intellixity.calcaudit.model.LevelDelta;
import io.intellixity.calcaudit.model.ProblemKind;
import io.intellixity.calcaudit.model.Violation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one validation run.\n
 *
 * @param properLevels graph-derived level of every key\n
 * @param violations violations in key order, then reference order\n
 * @param levelDeltas keys whose declared level differs from the proper one (informational)\n
 * @param summary aggregate counts\n
 */
public record ValidationReport(
    LevelTable properLevels,
    List<Violation> violations,
    List<LevelDelta> levelDeltas,
    ValidationSummary summary
) {
  public ValidationReport {
    Objects.requireNonNull(properLevels, "properLevels");
    Objects.requireNonNull(summary, "summary");
    violations = violations == null ? List.of() : List.copyOf(violations);
    levelDeltas = levelDeltas == null ? List.of() : List.copyOf(levelDeltas);
  }

  public boolean isClean() { return violations.isEmpty(); }

  public List<Violation> violationsOf(String subjectKey) {
    return violations.stream().filter(v -> v.subjectKey().equals(subjectKey)).toList();
  }

  public List<Violation> violationsOf(ProblemKind kind) {
    return violations.stream().filter(v -> v.kind() == kind).toList();
  }

  public Optional<LevelDelta> deltaOf(String fullKey) {
    return levelDeltas.stream().filter(d -> d.fullKey().equals(fullKey)).findFirst();
  }
}
