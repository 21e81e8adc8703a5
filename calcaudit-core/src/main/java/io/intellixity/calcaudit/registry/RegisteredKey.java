package io.intellixity.calcaudit.registry;

import io.intellixity.calcaudit.extract.ReferenceExtractor;
import io.intellixity.calcaudit.model.DependencyRef;
import io.intellixity.calcaudit.model.KeyRecord;

import java.util.List;
import java.util.Objects;

/**
 * A key record inside a registry, with its dependency references extracted on first use and kept for the run.\n
 *
 * Not thread-safe; a registry belongs to a single run.\n
 */
public final class RegisteredKey {
  private final KeyRecord record;
  private final ReferenceExtractor extractor;
  private List<DependencyRef> dependencies;

  RegisteredKey(KeyRecord record, ReferenceExtractor extractor) {
    this.record = Objects.requireNonNull(record, "record");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  public KeyRecord record() { return record; }
  public String fullKey() { return record.fullKey(); }
  public int calculationLevel() { return record.calculationLevel(); }
  public boolean current() { return record.current(); }

  public List<DependencyRef> dependencies() {
    if (dependencies == null) {
      dependencies = List.copyOf(extractor.extract(record.formula(), record.fundId()));
    }
    return dependencies;
  }

  @Override
  public String toString() { return "RegisteredKey[" + record.fullKey() + "]"; }
}
