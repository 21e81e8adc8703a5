package io.intellixity.calcaudit.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Pretty-printer for formula display.\n
 *
 * Breaks after every '(' and ',', puts ')' on its own line and indents two spaces per open parenthesis.
 * Purely textual: it does not parse the formula and tolerates unbalanced parentheses.\n
 */
public final class FormulaFormatter {
  private static final String INDENT = "  ";

  private FormulaFormatter() {}

  public static String format(String formula) {
    if (formula == null || formula.isEmpty()) return "";

    String s = formula.replace("\n", " ").strip();
    List<String> lines = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int depth = 0;

    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '(' -> {
          lines.add(indent(depth) + current.toString().strip() + "(");
          current.setLength(0);
          depth++;
        }
        case ')' -> {
          if (!current.toString().isBlank()) lines.add(indent(depth) + current.toString().strip());
          depth--;
          lines.add(indent(depth) + ")");
          current.setLength(0);
        }
        case ',' -> {
          lines.add(indent(depth) + current.toString().strip() + ",");
          current.setLength(0);
        }
        default -> current.append(c);
      }
    }
    if (!current.toString().isBlank()) lines.add(indent(depth) + current.toString().strip());

    List<String> kept = new ArrayList<>(lines.size());
    for (String l : lines) {
      if (!l.isBlank()) kept.add(l);
    }
    return String.join("\n", kept);
  }

  // Negative depth (more ')' than '(') indents like depth 0.
  private static String indent(int depth) {
    return depth <= 0 ? "" : INDENT.repeat(depth);
  }
}
