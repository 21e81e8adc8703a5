package io.intellixity.calcaudit.registry;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only lookup of every key record of one run, by full key.
 * <p>
 * The registry answers existence and attribute queries only; it never judges whether references resolve.
 */
public interface KeyRegistry {
  Optional<RegisteredKey> find(String fullKey);

  boolean contains(String fullKey);

  /** Like {@link #find(String)} but for keys the caller knows exist. */
  RegisteredKey get(String fullKey);

  /** All keys, in input order. */
  Collection<RegisteredKey> keys();

  int size();
}
