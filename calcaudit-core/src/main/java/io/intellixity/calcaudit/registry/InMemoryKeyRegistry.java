package io.intellixity.calcaudit.registry;

import io.intellixity.calcaudit.extract.QuotedReferenceExtractor;
import io.intellixity.calcaudit.extract.ReferenceExtractor;
import io.intellixity.calcaudit.model.KeyRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link KeyRegistry} over an in-memory record list.\n
 *
 * Built once from the complete input; rejects duplicate full keys.\n
 */
public final class InMemoryKeyRegistry implements KeyRegistry {
  private final Map<String, RegisteredKey> keys;

  public InMemoryKeyRegistry(List<KeyRecord> records) {
    this(records, new QuotedReferenceExtractor());
  }

  public InMemoryKeyRegistry(List<KeyRecord> records, ReferenceExtractor extractor) {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(extractor, "extractor");
    Map<String, RegisteredKey> m = new LinkedHashMap<>();
    for (KeyRecord r : records) {
      Objects.requireNonNull(r, "record");
      if (m.putIfAbsent(r.fullKey(), new RegisteredKey(r, extractor)) != null) {
        throw new IllegalArgumentException("Duplicate full key: " + r.fullKey());
      }
    }
    this.keys = Collections.unmodifiableMap(m);
  }

  @Override
  public Optional<RegisteredKey> find(String fullKey) {
    return Optional.ofNullable(fullKey == null ? null : keys.get(fullKey));
  }

  @Override
  public boolean contains(String fullKey) { return fullKey != null && keys.containsKey(fullKey); }

  @Override
  public RegisteredKey get(String fullKey) {
    RegisteredKey k = (fullKey == null) ? null : keys.get(fullKey);
    if (k == null) throw new IllegalArgumentException("Unknown full key: " + fullKey);
    return k;
  }

  @Override
  public Collection<RegisteredKey> keys() { return keys.values(); }

  @Override
  public int size() { return keys.size(); }
}
