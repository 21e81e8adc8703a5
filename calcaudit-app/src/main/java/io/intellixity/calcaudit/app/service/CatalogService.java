package io.intellixity.calcaudit.app.service;

import io.intellixity.calcaudit.catalog.DatagroupCell;
import io.intellixity.calcaudit.catalog.FundDatagroupMatrix;
import io.intellixity.calcaudit.catalog.MetadataCatalog;
import io.intellixity.calcaudit.catalog.MetadataStats;
import io.intellixity.calcaudit.review.ReviewLog;
import io.intellixity.calcaudit.review.ReviewedPair;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Fund/datagroup matrix and catalog statistics, joined with the review log. */
@Service
public final class CatalogService {
  /** Review state of one fund/datagroup cell; a reviewed cell is REVIEWED whatever its key count. */
  public enum CellStatus { REVIEWED, HAS_KEYS, NO_KEYS }

  public record CellView(String datagroupId, int keyCount, CellStatus status) {}

  public record RowView(String fundId, String fundName, Map<String, CellView> cells) {}

  public record MatrixView(List<String> datagroups, List<RowView> rows) {}

  public record StatsView(int funds, int datagroupColumns, int reviewed, MetadataStats metadata) {}

  private final MetadataCatalog catalog;
  private final ReviewLog reviews;

  public CatalogService(MetadataCatalog catalog, ReviewLog reviews) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.reviews = Objects.requireNonNull(reviews, "reviews");
  }

  public MatrixView matrix() {
    FundDatagroupMatrix m = FundDatagroupMatrix.of(catalog.datagroupCells());
    Set<ReviewedPair> reviewed = reviews.reviewedPairs();

    List<RowView> rows = new ArrayList<>(m.rows().size());
    for (FundDatagroupMatrix.Row r : m.rows()) {
      Map<String, CellView> cells = new LinkedHashMap<>();
      for (String dg : m.datagroups()) {
        r.cell(dg).ifPresent(c -> cells.put(dg, new CellView(c.datagroupId(), c.keyCount(), statusOf(c, reviewed))));
      }
      rows.add(new RowView(r.fundId(), r.fundName(), cells));
    }
    return new MatrixView(m.datagroups(), rows);
  }

  public StatsView stats() {
    FundDatagroupMatrix m = FundDatagroupMatrix.of(catalog.datagroupCells());
    return new StatsView(m.rows().size(), m.datagroups().size(), reviews.reviewedPairs().size(), catalog.stats());
  }

  static CellStatus statusOf(DatagroupCell c, Set<ReviewedPair> reviewed) {
    if (reviewed.contains(new ReviewedPair(c.fundName(), c.datagroupName()))) return CellStatus.REVIEWED;
    return c.hasKeys() ? CellStatus.HAS_KEYS : CellStatus.NO_KEYS;
  }
}
