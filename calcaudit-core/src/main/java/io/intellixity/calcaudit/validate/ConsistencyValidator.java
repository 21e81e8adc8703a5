package io.intellixity.calcaudit.validate;

import io.intellixity.calcaudit.level.LevelResolver;
import io.intellixity.calcaudit.level.LevelTable;
import io.intellixity.calcaudit.model.Context;
import io.intellixity.calcaudit.model.DependencyRef;
import io.intellixity.calcaudit.model.LevelDelta;
import io.intellixity.calcaudit.model.ProblemKind;
import io.intellixity.calcaudit.model.ProperLevel;
import io.intellixity.calcaudit.model.Violation;
import io.intellixity.calcaudit.registry.KeyRegistry;
import io.intellixity.calcaudit.registry.RegisteredKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks declared level and context of every key against its references.\n
 *
 * Each reference of a key goes through these checks; the first that applies produces the violation:\n
 * 1. declared level is not 0 but the key has no formula: INVALID_CALCULATION_ORDER\n
 * 2. referenced key is not in the registry: MISSING_DEPENDENCY\n
 * 3. declared level is not 0 and the reference's declared level is not lower: INVALID_CALCULATION_ORDER\n
 * 4. requested context differs from the reference's context: EXPECTED_CURRENT_BUT_PF / EXPECTED_PF_BUT_CURRENT\n
 *
 * Independently, a key whose proper level is a cycle gets one CYCLIC_DEPENDENCY violation.\n
 * Declared/proper level differences are reported as {@link LevelDelta}s, never as violations.\n
 */
public final class ConsistencyValidator {
  private static final Logger log = LoggerFactory.getLogger(ConsistencyValidator.class);

  private final KeyRegistry registry;
  private final LevelResolver resolver;

  public ConsistencyValidator(KeyRegistry registry, LevelResolver resolver) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public ValidationReport validate() {
    LevelTable levels = resolver.resolveAll();
    List<Violation> violations = new ArrayList<>();
    List<LevelDelta> deltas = new ArrayList<>();

    for (RegisteredKey key : registry.keys()) {
      ProperLevel proper = resolver.resolve(key.fullKey());
      LevelDelta delta = new LevelDelta(key.fullKey(), key.calculationLevel(), proper);
      if (!delta.matches()) deltas.add(delta);

      for (DependencyRef ref : key.dependencies()) {
        Violation v = checkEdge(key, ref, proper);
        if (v != null) violations.add(v);
      }
      if (proper.isCycle()) violations.add(cycleViolation(key));
    }

    ValidationReport report = new ValidationReport(levels, violations, deltas, summarize(violations, deltas, levels));
    log.info("calcaudit.validate keys={} violations={} levelMismatches={} cyclic={}",
        report.summary().totalKeys(), violations.size(), deltas.size(), report.summary().cyclicKeys());
    return report;
  }

  private Violation checkEdge(RegisteredKey key, DependencyRef ref, ProperLevel proper) {
    int level = key.calculationLevel();
    String target = ref.targetFullKey();

    if (level != 0 && !key.record().hasFormula()) {
      return violation(key, ProblemKind.INVALID_CALCULATION_ORDER, target, null, null, proper);
    }

    Optional<RegisteredKey> found = registry.find(target);
    if (found.isEmpty()) {
      return violation(key, ProblemKind.MISSING_DEPENDENCY, target, ref.expectedContext(), null, proper);
    }

    RegisteredKey dep = found.get();
    Context depContext = dep.record().context();
    if (level != 0 && dep.calculationLevel() >= level) {
      return violation(key, ProblemKind.INVALID_CALCULATION_ORDER, target, depContext, dep.calculationLevel(), proper);
    }

    if (ref.expectedContext() == Context.CURRENT && !dep.current()) {
      return violation(key, ProblemKind.EXPECTED_CURRENT_BUT_PF, target, depContext, dep.calculationLevel(), proper);
    }
    if (ref.expectedContext() == Context.POINT_IN_TIME && dep.current()) {
      return violation(key, ProblemKind.EXPECTED_PF_BUT_CURRENT, target, depContext, dep.calculationLevel(), proper);
    }
    return null;
  }

  // Names the first reference that itself resolves to a cycle (possibly the key itself).
  private Violation cycleViolation(RegisteredKey key) {
    for (DependencyRef ref : key.dependencies()) {
      Optional<RegisteredKey> dep = registry.find(ref.targetFullKey());
      if (dep.isPresent() && resolver.resolve(ref.targetFullKey()).isCycle()) {
        RegisteredKey d = dep.get();
        return violation(key, ProblemKind.CYCLIC_DEPENDENCY, d.fullKey(), d.record().context(),
            d.calculationLevel(), ProperLevel.CYCLE);
      }
    }
    throw new IllegalStateException("Cyclic key without cyclic dependency: " + key.fullKey());
  }

  private static Violation violation(RegisteredKey key, ProblemKind kind, String depKey, Context depContext,
                                     Integer depLevel, ProperLevel proper) {
    Violation v = new Violation(key.fullKey(), kind, depKey, depContext, depLevel, key.calculationLevel(), proper);
    if (log.isDebugEnabled()) log.debug("calcaudit.violation {}", v.describe());
    return v;
  }

  private ValidationSummary summarize(List<Violation> violations, List<LevelDelta> deltas, LevelTable levels) {
    int raw = 0;
    int calculated = 0;
    int withoutFormula = 0;
    for (RegisteredKey k : registry.keys()) {
      if (k.calculationLevel() == 0) {
        raw++;
      } else {
        calculated++;
        if (!k.record().hasFormula()) withoutFormula++;
      }
    }
    Map<ProblemKind, Integer> byKind = new EnumMap<>(ProblemKind.class);
    for (Violation v : violations) byKind.merge(v.kind(), 1, Integer::sum);

    return new ValidationSummary(registry.size(), raw, calculated, withoutFormula,
        (int) levels.cycleCount(), deltas.size(), byKind);
  }
}
