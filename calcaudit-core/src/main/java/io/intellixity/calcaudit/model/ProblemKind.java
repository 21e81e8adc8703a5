package io.intellixity.calcaudit.model;

public enum ProblemKind {
  INVALID_CALCULATION_ORDER("Invalid calculation order"),
  MISSING_DEPENDENCY("Missing dependency"),
  EXPECTED_CURRENT_BUT_PF("Expected current but dependency is pf"),
  EXPECTED_PF_BUT_CURRENT("Expected pf but dependency is current"),
  /** The key's proper level is a cycle; reported once per key. */
  CYCLIC_DEPENDENCY("Cyclic dependency");

  private final String label;

  ProblemKind(String label) {
    this.label = label;
  }

  public String label() { return label; }
}
