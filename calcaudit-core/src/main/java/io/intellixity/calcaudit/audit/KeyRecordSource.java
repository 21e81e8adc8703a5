package io.intellixity.calcaudit.audit;

import io.intellixity.calcaudit.model.KeyRecord;

import java.util.List;

/**
 * SPI for the batch fetch of key records.
 * <p>
 * A failed fetch throws {@link KeyRecordSourceException}; no graph work happens after that.
 */
public interface KeyRecordSource {
  /** Every key record of the fund, as one consistent snapshot. */
  List<KeyRecord> fetch(String fundId);

  /** Funds that have key metadata. */
  List<String> fundIds();
}
