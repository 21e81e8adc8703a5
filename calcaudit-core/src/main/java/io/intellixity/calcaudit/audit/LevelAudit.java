package io.intellixity.calcaudit.audit;

import io.intellixity.calcaudit.extract.QuotedReferenceExtractor;
import io.intellixity.calcaudit.extract.ReferenceExtractor;
import io.intellixity.calcaudit.level.LevelResolver;
import io.intellixity.calcaudit.model.KeyRecord;
import io.intellixity.calcaudit.registry.InMemoryKeyRegistry;
import io.intellixity.calcaudit.registry.KeyRegistry;
import io.intellixity.calcaudit.validate.ConsistencyValidator;
import io.intellixity.calcaudit.validate.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Entry point for audits: fetch, build registry, resolve levels, validate.\n
 *
 * Every run builds its own registry and resolver; nothing is shared between runs, so funds can be audited
 * concurrently.\n
 */
public final class LevelAudit {
  private static final Logger log = LoggerFactory.getLogger(LevelAudit.class);

  private final KeyRecordSource source;
  private final ReferenceExtractor extractor;

  public LevelAudit(KeyRecordSource source) {
    this(source, new QuotedReferenceExtractor());
  }

  public LevelAudit(KeyRecordSource source, ReferenceExtractor extractor) {
    this.source = Objects.requireNonNull(source, "source");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  /**
   * Validates an already fetched snapshot.
   *
   * @throws KeyRecordSourceException if the snapshot repeats a full key
   */
  public static ValidationReport validate(List<KeyRecord> records, ReferenceExtractor extractor) {
    KeyRegistry registry;
    try {
      registry = new InMemoryKeyRegistry(records, extractor);
    } catch (IllegalArgumentException e) {
      throw new KeyRecordSourceException("Inconsistent key record snapshot: " + e.getMessage(), e);
    }
    return new ConsistencyValidator(registry, new LevelResolver(registry)).validate();
  }

  /**
   * @throws KeyRecordSourceException if the fund's records cannot be fetched or repeat a full key
   */
  public FundAudit run(String fundId) {
    Objects.requireNonNull(fundId, "fundId");
    long start = System.nanoTime();
    List<KeyRecord> records = source.fetch(fundId);
    log.debug("calcaudit.audit fetched fundId={} records={}", fundId, records.size());
    ValidationReport report = validate(records, extractor);
    log.info("calcaudit.audit_done fundId={} keys={} violations={} durationMs={}",
        fundId, records.size(), report.violations().size(), (System.nanoTime() - start) / 1_000_000.0);
    return new FundAudit(fundId, report);
  }

  /**
   * Audits each fund as an independent run on {@code executor}. Results keep the order of {@code fundIds}.
   *
   * @throws KeyRecordSourceException if any fund's fetch fails
   */
  public List<FundAudit> runAll(List<String> fundIds, ExecutorService executor) {
    Objects.requireNonNull(fundIds, "fundIds");
    Objects.requireNonNull(executor, "executor");

    List<Future<FundAudit>> futures = new ArrayList<>(fundIds.size());
    for (String fundId : fundIds) {
      futures.add(executor.submit(() -> run(fundId)));
    }

    List<FundAudit> out = new ArrayList<>(futures.size());
    try {
      for (Future<FundAudit> f : futures) out.add(f.get());
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new KeyRecordSourceException("Interrupted while auditing funds", e);
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      throw new KeyRecordSourceException("Fund audit failed", cause);
    }
    return out;
  }
}
