package io.intellixity.calcaudit.extract;

import io.intellixity.calcaudit.model.Context;
import io.intellixity.calcaudit.model.DependencyRef;
import io.intellixity.calcaudit.model.KeyRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Scanner for references of the form {@code "<datagroup>"!"<key>"!"<current|pf>"}.\n
 *
 * Datagroup and key are non-empty and cannot contain a double quote. Matching is left-to-right and
 * non-overlapping: after a match, scanning resumes right after its closing quote; after a miss, at the next
 * character.\n
 *
 * Lenient on purpose: a candidate with broken quoting, an empty part or an unknown context tag is skipped,
 * not reported. The validator still flags most of what this hides as missing dependencies.\n
 */
public final class QuotedReferenceExtractor implements ReferenceExtractor {
  private static final char QUOTE = '"';

  @Override
  public List<DependencyRef> extract(String formula, String fundId) {
    if (formula == null || formula.isBlank()) return List.of();

    List<DependencyRef> out = new ArrayList<>();
    int i = 0;
    while (i < formula.length()) {
      int end = (formula.charAt(i) == QUOTE) ? tryMatch(formula, i, fundId, out) : -1;
      i = (end < 0) ? i + 1 : end;
    }
    return out;
  }

  /** Returns the index after the match, or -1 when no reference starts at {@code start}. */
  private static int tryMatch(String s, int start, String fundId, List<DependencyRef> out) {
    int dgEnd = quotedEnd(s, start);
    if (dgEnd < 0 || !separatorAt(s, dgEnd + 1)) return -1;

    int keyStart = dgEnd + 2;
    int keyEnd = quotedEnd(s, keyStart);
    if (keyEnd < 0 || !separatorAt(s, keyEnd + 1)) return -1;

    int ctxStart = keyEnd + 2;
    int ctxEnd = quotedEnd(s, ctxStart);
    if (ctxEnd < 0) return -1;

    Context ctx = Context.fromTag(s.substring(ctxStart + 1, ctxEnd));
    if (ctx == null) return -1;

    String datagroup = s.substring(start + 1, dgEnd);
    String key = s.substring(keyStart + 1, keyEnd);
    out.add(new DependencyRef(KeyRecord.fullKey(fundId, datagroup, key, ctx), ctx));
    return ctxEnd + 1;
  }

  /** For a quote at {@code open}, the index of the closing quote of a non-empty part, else -1. */
  private static int quotedEnd(String s, int open) {
    if (open >= s.length() || s.charAt(open) != QUOTE) return -1;
    int close = s.indexOf(QUOTE, open + 1);
    if (close <= open + 1) return -1;
    return close;
  }

  // '!' immediately followed by the next part's opening quote
  private static boolean separatorAt(String s, int i) {
    return i + 1 < s.length() && s.charAt(i) == KeyRecord.SEPARATOR && s.charAt(i + 1) == QUOTE;
  }
}
