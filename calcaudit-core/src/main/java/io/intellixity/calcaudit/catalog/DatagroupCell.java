package io.intellixity.calcaudit.catalog;

import java.util.Objects;

/** One datagroup of one fund, with the number of live keys defined under it. */
public record DatagroupCell(String fundId, String fundName, String datagroupId, String datagroupName, int keyCount) {
  public DatagroupCell {
    Objects.requireNonNull(fundId, "fundId");
    Objects.requireNonNull(fundName, "fundName");
    Objects.requireNonNull(datagroupId, "datagroupId");
    Objects.requireNonNull(datagroupName, "datagroupName");
    if (keyCount < 0) throw new IllegalArgumentException("keyCount must be >= 0: " + keyCount);
  }

  public boolean hasKeys() {
    return keyCount > 0;
  }
}
