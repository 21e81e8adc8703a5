package io.intellixity.calcaudit.model;

import java.util.Objects;

/**
 * A reference to another key found in a formula.\n
 *
 * @param targetFullKey full key of the referenced definition (may not exist)\n
 * @param expectedContext context the formula asks for\n
 */
public record DependencyRef(String targetFullKey, Context expectedContext) {
  public DependencyRef {
    Objects.requireNonNull(targetFullKey, "targetFullKey");
    Objects.requireNonNull(expectedContext, "expectedContext");
  }
}
