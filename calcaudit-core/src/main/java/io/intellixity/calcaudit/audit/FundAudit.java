package io.intellixity.calcaudit.audit;

import io.intellixity.calcaudit.validate.ValidationReport;

import java.util.Objects;

/** Report of one fund's run. */
public record FundAudit(String fundId, ValidationReport report) {
  public FundAudit {
    Objects.requireNonNull(fundId, "fundId");
    Objects.requireNonNull(report, "report");
  }
}
