package io.intellixity.calcaudit.review;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of the review log.\n
 *
 * @param fundName fund display name\n
 * @param datagroupName datagroup display name\n
 * @param reviewerName who reviewed\n
 * @param reviewedAt when\n
 */
public record ReviewEntry(String fundName, String datagroupName, String reviewerName, Instant reviewedAt) {
  public ReviewEntry {
    Objects.requireNonNull(fundName, "fundName");
    Objects.requireNonNull(datagroupName, "datagroupName");
  }

  public ReviewedPair pair() { return new ReviewedPair(fundName, datagroupName); }
}
