package io.intellixity.calcaudit.model;

import java.util.Objects;

/**
 * A recorded inconsistency between declared metadata and what the dependency graph requires.\n
 *
 * @param subjectKey full key of the definition being checked\n
 * @param kind problem found\n
 * @param dependencyKey referenced full key the problem was found on\n
 * @param dependencyContext context of the dependency (the requested one when it is missing), or null\n
 * @param dependencyLevel declared level of the dependency, or null when it is missing\n
 * @param subjectLevel declared level of the subject\n
 * @param properLevel graph-derived level of the subject\n
 */
public record Violation(
    String subjectKey,
    ProblemKind kind,
    String dependencyKey,
    Context dependencyContext,
    Integer dependencyLevel,
    int subjectLevel,
    ProperLevel properLevel
) {
  public Violation {
    Objects.requireNonNull(subjectKey, "subjectKey");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(dependencyKey, "dependencyKey");
    Objects.requireNonNull(properLevel, "properLevel");
  }

  /** One-line audit text, e.g. {@code F!DG!K!current [level 2] -> Missing dependency -> F!DG!X!pf [level ?]}. */
  public String describe() {
    return subjectKey + " [level " + subjectLevel + "] -> " + kind.label() + " -> " + dependencyKey
        + " [level " + (dependencyLevel == null ? "?" : dependencyLevel) + "] -> [proper level " + properLevel + "]";
  }
}
