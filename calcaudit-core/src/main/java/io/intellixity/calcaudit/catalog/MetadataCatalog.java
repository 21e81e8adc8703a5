package io.intellixity.calcaudit.catalog;

import io.intellixity.calcaudit.audit.KeyRecordSource;

import java.util.List;

/**
 * Read-only view of the fund and datagroup catalog around the key records.\n
 *
 * Failures surface as {@link io.intellixity.calcaudit.audit.KeyRecordSourceException}, the same as
 * {@link KeyRecordSource}.\n
 */
public interface MetadataCatalog {
  /** Every live datagroup of every live fund, ordered by fund name then datagroup sequence. */
  List<DatagroupCell> datagroupCells();

  MetadataStats stats();
}
