package io.intellixity.calcaudit.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Funds as rows, datagroup display names as columns.\n
 *
 * Rows keep the order of the first cell seen for each fund; columns are sorted by name. A fund without a datagroup
 * of a given name has no cell in that column.\n
 */
public record FundDatagroupMatrix(List<String> datagroups, List<Row> rows) {

  public record Row(String fundId, String fundName, Map<String, DatagroupCell> cells) {
    public Optional<DatagroupCell> cell(String datagroupName) {
      return Optional.ofNullable(cells.get(datagroupName));
    }
  }

  public FundDatagroupMatrix {
    datagroups = List.copyOf(datagroups);
    rows = List.copyOf(rows);
  }

  public static FundDatagroupMatrix of(List<DatagroupCell> cells) {
    Objects.requireNonNull(cells, "cells");
    TreeSet<String> columns = new TreeSet<>();
    Map<String, Map<String, DatagroupCell>> byFund = new LinkedHashMap<>();
    Map<String, String> names = new LinkedHashMap<>();

    for (DatagroupCell c : cells) {
      columns.add(c.datagroupName());
      names.putIfAbsent(c.fundId(), c.fundName());
      // a repeated display name keeps the first datagroup, sums keys
      byFund.computeIfAbsent(c.fundId(), k -> new LinkedHashMap<>())
          .merge(c.datagroupName(), c, (a, b) -> new DatagroupCell(a.fundId(), a.fundName(), a.datagroupId(),
              a.datagroupName(), a.keyCount() + b.keyCount()));
    }

    List<Row> rows = new ArrayList<>(byFund.size());
    for (Map.Entry<String, Map<String, DatagroupCell>> e : byFund.entrySet()) {
      rows.add(new Row(e.getKey(), names.get(e.getKey()), Collections.unmodifiableMap(e.getValue())));
    }
    return new FundDatagroupMatrix(new ArrayList<>(columns), rows);
  }

  public Optional<Row> row(String fundId) {
    return rows.stream().filter(r -> r.fundId().equals(fundId)).findFirst();
  }
}
