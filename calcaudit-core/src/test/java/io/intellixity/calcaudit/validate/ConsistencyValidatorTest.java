package io.intellixity.calcaudit.validate;

import io.intellixity.calcaudit.extract.QuotedReferenceExtractor;
import io.intellixity.calcaudit.extract.ReferenceExtractor;
import io.intellixity.calcaudit.level.LevelResolver;
import io.intellixity.calcaudit.model.Context;
import io.intellixity.calcaudit.model.DependencyRef;
import io.intellixity.calcaudit.model.KeyRecord;
import io.intellixity.calcaudit.model.LevelDelta;
import io.intellixity.calcaudit.model.ProblemKind;
import io.intellixity.calcaudit.model.ProperLevel;
import io.intellixity.calcaudit.model.Violation;
import io.intellixity.calcaudit.registry.InMemoryKeyRegistry;
import io.intellixity.calcaudit.registry.KeyRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConsistencyValidatorTest {
  private static KeyRecord current(String name, int level, String formula) {
    return new KeyRecord("F1", "DG1", name, "F1!DG1!" + name + "!current", level, true, formula);
  }

  private static KeyRecord pf(String name, int level, String formula) {
    return new KeyRecord("F1", "DG1", name, "F1!DG1!" + name + "!pf", level, false, formula);
  }

  private static ValidationReport validate(ReferenceExtractor extractor, KeyRecord... records) {
    KeyRegistry reg = new InMemoryKeyRegistry(List.of(records), extractor);
    return new ConsistencyValidator(reg, new LevelResolver(reg)).validate();
  }

  private static ValidationReport validate(KeyRecord... records) {
    return validate(new QuotedReferenceExtractor(), records);
  }

  @Test
  void rawKeyHasLevelZeroAndNoViolations() {
    ValidationReport r = validate(current("K1", 0, null));
    assertEquals(ProperLevel.ZERO, r.properLevels().levelOf("F1!DG1!K1!current").orElseThrow());
    assertTrue(r.isClean());
    assertTrue(r.levelDeltas().isEmpty());
  }

  @Test
  void wellFormedCalculatedKeyIsClean() {
    ValidationReport r = validate(
        current("K1", 0, null),
        current("K2", 1, "\"DG1\"!\"K1\"!\"current\""));
    assertEquals(ProperLevel.of(1), r.properLevels().levelOf("F1!DG1!K2!current").orElseThrow());
    assertTrue(r.isClean());
  }

  @Test
  void declaredLevelZeroWithFormulaOnlyShowsAsDelta() {
    ValidationReport r = validate(
        current("K1", 0, null),
        current("K2", 0, "\"DG1\"!\"K1\"!\"current\""));

    assertTrue(r.isClean());
    LevelDelta d = r.deltaOf("F1!DG1!K2!current").orElseThrow();
    assertEquals(0, d.declaredLevel());
    assertEquals(ProperLevel.of(1), d.properLevel());
    assertEquals(-1, d.delta().getAsInt());
    assertEquals(1, r.summary().levelMismatches());
  }

  @Test
  void missingReferenceIsReportedAndLevelledAsLeaf() {
    ValidationReport r = validate(current("K3", 1, "\"DG1\"!\"K9\"!\"current\""));

    assertEquals(1, r.violations().size());
    Violation v = r.violations().get(0);
    assertEquals(ProblemKind.MISSING_DEPENDENCY, v.kind());
    assertEquals("F1!DG1!K3!current", v.subjectKey());
    assertEquals("F1!DG1!K9!current", v.dependencyKey());
    assertEquals(Context.CURRENT, v.dependencyContext());
    assertNull(v.dependencyLevel());
    assertEquals(1, v.subjectLevel());
    assertEquals(ProperLevel.of(1), v.properLevel());
    assertEquals(ProperLevel.of(1), r.properLevels().levelOf("F1!DG1!K3!current").orElseThrow());
  }

  @Test
  void missingReferenceKeepsRequestedContext() {
    ValidationReport r = validate(current("K3", 1, "\"DG1\"!\"K9\"!\"pf\""));
    assertEquals(Context.POINT_IN_TIME, r.violations().get(0).dependencyContext());
  }

  @Test
  void dependencyOnSameDeclaredLevelIsInvalidOrder() {
    ValidationReport r = validate(
        current("K5", 2, "1"),
        current("K4", 2, "\"DG1\"!\"K5\"!\"current\""));

    List<Violation> vs = r.violationsOf("F1!DG1!K4!current");
    assertEquals(1, vs.size());
    assertEquals(ProblemKind.INVALID_CALCULATION_ORDER, vs.get(0).kind());
    assertEquals(Integer.valueOf(2), vs.get(0).dependencyLevel());
    assertEquals(2, vs.get(0).subjectLevel());
  }

  @Test
  void dependencyOnHigherDeclaredLevelIsInvalidOrder() {
    ValidationReport r = validate(
        current("K5", 3, "1"),
        current("K4", 2, "\"DG1\"!\"K5\"!\"current\""));
    assertEquals(ProblemKind.INVALID_CALCULATION_ORDER, r.violations().get(0).kind());
  }

  @Test
  void expectedCurrentButDependencyIsPointInTime() {
    ValidationReport r = validate(
        pf("K7", 0, null),
        current("K6", 1, "\"DG1\"!\"K7\"!\"current\""));

    // a current reference never resolves to a pf full key
    assertEquals(ProblemKind.MISSING_DEPENDENCY, r.violations().get(0).kind());

    // full key says current, flag says pf
    KeyRecord mislabelled = new KeyRecord("F1", "DG1", "K7", "F1!DG1!K7!current", 0, false, null);
    ValidationReport r2 = validate(mislabelled, current("K6", 1, "\"DG1\"!\"K7\"!\"current\""));
    assertEquals(1, r2.violations().size());
    Violation v = r2.violations().get(0);
    assertEquals(ProblemKind.EXPECTED_CURRENT_BUT_PF, v.kind());
    assertEquals(Context.POINT_IN_TIME, v.dependencyContext());
    assertEquals(Integer.valueOf(0), v.dependencyLevel());
  }

  @Test
  void expectedPointInTimeButDependencyIsCurrent() {
    KeyRecord mislabelled = new KeyRecord("F1", "DG1", "K7", "F1!DG1!K7!pf", 0, true, null);
    ValidationReport r = validate(mislabelled, pf("K6", 1, "\"DG1\"!\"K7\"!\"pf\""));
    assertEquals(1, r.violations().size());
    assertEquals(ProblemKind.EXPECTED_PF_BUT_CURRENT, r.violations().get(0).kind());
    assertEquals(Context.CURRENT, r.violations().get(0).dependencyContext());
  }

  @Test
  void orderCheckWinsOverContextCheck() {
    KeyRecord mislabelled = new KeyRecord("F1", "DG1", "K7", "F1!DG1!K7!current", 1, false, "1");
    ValidationReport r = validate(mislabelled, current("K6", 1, "\"DG1\"!\"K7\"!\"current\""));
    assertEquals(1, r.violations().size());
    assertEquals(ProblemKind.INVALID_CALCULATION_ORDER, r.violations().get(0).kind());
  }

  @Test
  void levelZeroSubjectSkipsOrderCheckButNotContextCheck() {
    KeyRecord mislabelled = new KeyRecord("F1", "DG1", "K7", "F1!DG1!K7!current", 4, false, "1");
    ValidationReport r = validate(mislabelled, current("K6", 0, "\"DG1\"!\"K7\"!\"current\""));
    assertEquals(1, r.violations().size());
    assertEquals(ProblemKind.EXPECTED_CURRENT_BUT_PF, r.violations().get(0).kind());
  }

  @Test
  void calculatedKeyWithoutFormulaFailsEveryEdge() {
    // an extractor that finds references without formula text, so the first check can trigger
    ReferenceExtractor fixed = (formula, fundId) -> !"F2".equals(fundId) ? List.of() : List.of(
        new DependencyRef("F1!DG1!K1!current", Context.CURRENT),
        new DependencyRef("F1!DG1!K9!current", Context.CURRENT));
    KeyRecord k2 = new KeyRecord("F2", "DG1", "K2", "F1!DG1!K2!current", 2, true, null);
    ValidationReport r = validate(fixed, current("K1", 0, null), k2);

    List<Violation> vs = r.violationsOf("F1!DG1!K2!current");
    assertEquals(2, vs.size());
    assertTrue(vs.stream().allMatch(v -> v.kind() == ProblemKind.INVALID_CALCULATION_ORDER));
    assertEquals(List.of("F1!DG1!K1!current", "F1!DG1!K9!current"), vs.stream().map(Violation::dependencyKey).toList());
    assertEquals(1, r.summary().calculatedWithoutFormula());
  }

  @Test
  void cycleGetsOneViolationPerKeyOnTopOfEdgeChecks() {
    ValidationReport r = validate(
        current("A", 2, "\"DG1\"!\"B\"!\"current\""),
        current("B", 1, "\"DG1\"!\"A\"!\"current\""),
        current("C", 3, "\"DG1\"!\"A\"!\"current\""));

    assertTrue(r.properLevels().levelOf("F1!DG1!A!current").orElseThrow().isCycle());
    assertTrue(r.properLevels().levelOf("F1!DG1!C!current").orElseThrow().isCycle());

    List<Violation> cycles = r.violationsOf(ProblemKind.CYCLIC_DEPENDENCY);
    assertEquals(List.of("F1!DG1!A!current", "F1!DG1!B!current", "F1!DG1!C!current"),
        cycles.stream().map(Violation::subjectKey).toList());
    assertEquals("F1!DG1!B!current", cycles.get(0).dependencyKey());
    assertEquals("F1!DG1!A!current", cycles.get(2).dependencyKey());

    // B (level 1) -> A (level 2) is also an ordering problem
    List<Violation> order = r.violationsOf(ProblemKind.INVALID_CALCULATION_ORDER);
    assertEquals(1, order.size());
    assertEquals("F1!DG1!B!current", order.get(0).subjectKey());
    assertEquals(3, r.summary().cyclicKeys());
  }

  @Test
  void selfReferenceIsACycle() {
    ValidationReport r = validate(current("S", 1, "\"DG1\"!\"S\"!\"current\""));
    assertEquals(2, r.violations().size());
    assertEquals(ProblemKind.INVALID_CALCULATION_ORDER, r.violations().get(0).kind());
    assertEquals(ProblemKind.CYCLIC_DEPENDENCY, r.violations().get(1).kind());
    assertTrue(r.deltaOf("F1!DG1!S!current").orElseThrow().delta().isEmpty());
  }

  @Test
  void violationsFollowKeyThenReferenceOrder() {
    ValidationReport r = validate(
        current("Z", 1, "\"DG1\"!\"m1\"!\"current\" + \"DG1\"!\"m2\"!\"pf\""),
        current("A", 1, "\"DG1\"!\"m3\"!\"current\""));
    assertEquals(List.of("F1!DG1!m1!current", "F1!DG1!m2!pf", "F1!DG1!m3!current"),
        r.violations().stream().map(Violation::dependencyKey).toList());
  }

  @Test
  void summaryCountsKeysAndViolations() {
    ValidationReport r = validate(
        current("K1", 0, null),
        pf("P1", 0, null),
        current("K2", 1, "\"DG1\"!\"K1\"!\"current\" + \"DG1\"!\"gone\"!\"current\""),
        current("K3", 1, "\"DG1\"!\"K2\"!\"current\""),
        current("K4", 2, null));

    ValidationSummary s = r.summary();
    assertEquals(5, s.totalKeys());
    assertEquals(2, s.rawKeys());
    assertEquals(3, s.calculatedKeys());
    assertEquals(1, s.calculatedWithoutFormula());
    assertEquals(0, s.cyclicKeys());
    assertEquals(1, s.violationsByKind().get(ProblemKind.MISSING_DEPENDENCY));
    assertEquals(1, s.violationsByKind().get(ProblemKind.INVALID_CALCULATION_ORDER));
    assertEquals(0, s.violationsByKind().get(ProblemKind.CYCLIC_DEPENDENCY));
    assertEquals(2, s.totalViolations());
    // K3 declared 1, proper 2; K4 declared 2, proper 0
    assertEquals(2, s.levelMismatches());
  }

  @Test
  void describeRendersAuditLine() {
    ValidationReport r = validate(current("K3", 1, "\"DG1\"!\"K9\"!\"current\""));
    assertEquals("F1!DG1!K3!current [level 1] -> Missing dependency -> F1!DG1!K9!current [level ?] -> [proper level 1]",
        r.violations().get(0).describe());
  }
}
