package io.intellixity.calcaudit.review;

import java.util.Objects;

/** A fund/datagroup combination that can be marked as reviewed. */
public record ReviewedPair(String fundName, String datagroupName) {
  public ReviewedPair {
    Objects.requireNonNull(fundName, "fundName");
    Objects.requireNonNull(datagroupName, "datagroupName");
  }
}
