package io.intellixity.calcaudit.level;

/**
 * Per-key progress of a {@link LevelResolver}.\n
 *
 * UNVISITED -> IN_PROGRESS -> FINALIZED. Reaching an IN_PROGRESS key again means a cycle.\n
 */
public enum VisitState {
  UNVISITED,
  IN_PROGRESS,
  FINALIZED
}
