package io.intellixity.calcaudit.model;

/**
 * Temporal variant of a key.\n
 *
 * {@code current} is the latest snapshot; {@code pf} (point-in-time) is a historical snapshot.\n
 */
public enum Context {
  CURRENT("current"),
  POINT_IN_TIME("pf");

  private final String tag;

  Context(String tag) {
    this.tag = tag;
  }

  /** Tag used inside formula references and full keys. */
  public String tag() { return tag; }

  public boolean isCurrent() { return this == CURRENT; }

  public static Context ofCurrentFlag(boolean isCurrent) {
    return isCurrent ? CURRENT : POINT_IN_TIME;
  }

  /** Returns the context for a reference tag, or {@code null} if the tag is not one of ours. */
  public static Context fromTag(String tag) {
    if (tag == null) return null;
    for (Context c : values()) {
      if (c.tag.equals(tag)) return c;
    }
    return null;
  }
}
