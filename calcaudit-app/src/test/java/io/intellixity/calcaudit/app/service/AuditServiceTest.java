package io.intellixity.calcaudit.app.service;

import io.intellixity.calcaudit.audit.KeyRecordSource;
import io.intellixity.calcaudit.audit.KeyRecordSourceException;
import io.intellixity.calcaudit.model.KeyRecord;
import io.intellixity.calcaudit.model.ProblemKind;
import io.intellixity.calcaudit.model.ProperLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

final class AuditServiceTest {
  private final ExecutorService executor = Executors.newFixedThreadPool(2);

  @AfterEach
  void shutdown() {
    executor.shutdownNow();
  }

  static KeyRecord key(String fund, String name, int level, boolean current, String formula) {
    String tag = current ? "current" : "pf";
    return new KeyRecord(fund, "DG", name, fund + "!DG!" + name + "!" + tag, level, current, formula);
  }

  static KeyRecordSource source(Map<String, List<KeyRecord>> byFund) {
    return new KeyRecordSource() {
      @Override
      public List<KeyRecord> fetch(String fundId) {
        List<KeyRecord> rs = byFund.get(fundId);
        if (rs == null) throw new KeyRecordSourceException("no such fund " + fundId);
        return rs;
      }

      @Override
      public List<String> fundIds() { return byFund.keySet().stream().sorted().toList(); }
    };
  }

  private AuditService service() {
    return new AuditService(source(Map.of(
        "1", List.of(
            key("1", "NAV", 0, true, null),
            key("1", "IRR", 1, true, "ROUND(\"DG\"!\"NAV\"!\"current\", 2)"),
            key("1", "Bad", 1, true, "\"DG\"!\"NAV\"!\"pf\"")),
        "2", List.of(key("2", "NAV", 0, false, null)))), executor);
  }

  @Test
  void auditsOneFund() {
    var report = service().audit("1");
    assertEquals(1, report.violations().size());
    assertEquals(ProblemKind.MISSING_DEPENDENCY, report.violations().get(0).kind());
  }

  @Test
  void auditsAllFundsInSourceOrder() {
    List<AuditService.FundSummary> all = service().auditAll();
    assertEquals(List.of("1", "2"), all.stream().map(AuditService.FundSummary::fundId).toList());
    assertEquals(3, all.get(0).summary().totalKeys());
    assertEquals(1, all.get(1).summary().rawKeys());
  }

  @Test
  void keyDetailsCombineFormulaLevelsAndViolations() {
    KeyDetails d = service().keyDetails("1", "1!DG!IRR!current").orElseThrow();
    assertEquals(ProperLevel.of(1), d.properLevel());
    assertEquals(Integer.valueOf(0), d.levelDelta());
    assertEquals("ROUND(\n  \"DG\"!\"NAV\"!\"current\",\n  2\n)", d.formattedFormula());
    assertEquals(1, d.dependencies().size());
    assertTrue(d.violations().isEmpty());

    KeyDetails bad = service().keyDetails("1", "1!DG!Bad!current").orElseThrow();
    assertEquals(1, bad.violations().size());
  }

  @Test
  void unknownKeyHasNoDetails() {
    assertTrue(service().keyDetails("1", "1!DG!Nope!current").isEmpty());
  }

  @Test
  void unknownFundFailsBeforeAnyGraphWork() {
    assertThrows(KeyRecordSourceException.class, () -> service().audit("9"));
  }

  @Test
  void duplicateRowsFailAsSourceErrors() {
    AuditService svc = new AuditService(source(Map.of(
        "1", List.of(key("1", "NAV", 0, true, null), key("1", "NAV", 0, true, null)))), executor);

    assertThrows(KeyRecordSourceException.class, () -> svc.audit("1"));
    assertThrows(KeyRecordSourceException.class, () -> svc.keyDetails("1", "1!DG!NAV!current"));
  }
}
