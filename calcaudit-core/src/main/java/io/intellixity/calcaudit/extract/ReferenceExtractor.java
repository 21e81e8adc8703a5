package io.intellixity.calcaudit.extract;

import io.intellixity.calcaudit.model.DependencyRef;

import java.util.List;

/**
 * Turns formula text into the dependency references it contains.
 * <p>
 * Implementations never fail on malformed text: anything that does not parse as a reference is skipped.
 */
public interface ReferenceExtractor {
  /**
   * @param formula raw formula text, may be {@code null}
   * @param fundId fund that owns the formula; references resolve inside this fund
   * @return references in order of appearance, duplicates included
   */
  List<DependencyRef> extract(String formula, String fundId);
}
