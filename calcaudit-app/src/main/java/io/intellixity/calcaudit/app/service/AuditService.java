package io.intellixity.calcaudit.app.service;

import io.intellixity.calcaudit.audit.FundAudit;
import io.intellixity.calcaudit.audit.KeyRecordSource;
import io.intellixity.calcaudit.audit.LevelAudit;
import io.intellixity.calcaudit.extract.QuotedReferenceExtractor;
import io.intellixity.calcaudit.extract.ReferenceExtractor;
import io.intellixity.calcaudit.format.FormulaFormatter;
import io.intellixity.calcaudit.model.KeyRecord;
import io.intellixity.calcaudit.model.LevelDelta;
import io.intellixity.calcaudit.model.ProperLevel;
import io.intellixity.calcaudit.validate.ValidationReport;
import io.intellixity.calcaudit.validate.ValidationSummary;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

@Service
public final class AuditService {
  private final KeyRecordSource source;
  private final ReferenceExtractor extractor = new QuotedReferenceExtractor();
  private final LevelAudit audit;
  private final ExecutorService executor;

  public record FundSummary(String fundId, ValidationSummary summary) {}

  public AuditService(KeyRecordSource source, ExecutorService executor) {
    this.source = Objects.requireNonNull(source, "source");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.audit = new LevelAudit(source, extractor);
  }

  public List<String> fundIds() {
    return source.fundIds();
  }

  public ValidationReport audit(String fundId) {
    return audit.run(fundId).report();
  }

  public List<FundSummary> auditAll() {
    return audit.runAll(source.fundIds(), executor).stream()
        .map(a -> new FundSummary(a.fundId(), a.report().summary()))
        .toList();
  }

  /** Audits the fund and returns the details of one of its keys, if present. */
  public Optional<KeyDetails> keyDetails(String fundId, String fullKey) {
    List<KeyRecord> records = source.fetch(fundId);
    Optional<KeyRecord> match = records.stream().filter(r -> r.fullKey().equals(fullKey)).findFirst();
    if (match.isEmpty()) return Optional.empty();

    KeyRecord r = match.get();
    ValidationReport report = LevelAudit.validate(records, extractor);
    ProperLevel level = report.properLevels().levelOf(fullKey).orElseThrow();
    Integer delta = KeyDetails.deltaOf(new LevelDelta(fullKey, r.calculationLevel(), level));
    return Optional.of(new KeyDetails(
        r,
        FormulaFormatter.format(r.formula()),
        extractor.extract(r.formula(), r.fundId()),
        level,
        delta,
        report.violationsOf(fullKey)));
  }
}
