package io.intellixity.calcaudit.app.service;

import io.intellixity.calcaudit.model.DependencyRef;
import io.intellixity.calcaudit.model.KeyRecord;
import io.intellixity.calcaudit.model.LevelDelta;
import io.intellixity.calcaudit.model.ProperLevel;
import io.intellixity.calcaudit.model.Violation;

import java.util.List;

/** One key with everything the audit knows about it, for display. */
public record KeyDetails(
    KeyRecord record,
    String formattedFormula,
    List<DependencyRef> dependencies,
    ProperLevel properLevel,
    Integer levelDelta,
    List<Violation> violations
) {
  static Integer deltaOf(LevelDelta d) {
    return d.delta().isPresent() ? d.delta().getAsInt() : null;
  }
}
