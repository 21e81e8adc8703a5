package io.intellixity.calcaudit.level;

import io.intellixity.calcaudit.model.DependencyRef;
import io.intellixity.calcaudit.model.ProperLevel;
import io.intellixity.calcaudit.registry.KeyRegistry;
import io.intellixity.calcaudit.registry.RegisteredKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the proper (graph-derived) calculation level of registry keys.\n
 *
 * Rules:\n
 * - no references: 0\n
 * - otherwise: 1 + max(level of each reference)\n
 * - a reference to a key missing from the registry counts as level 0\n
 * - a reference back to a key still being resolved yields {@link ProperLevel#CYCLE}, which wins every max\n
 *
 * Depth-first with an explicit stack, so long chains do not consume the thread stack. Results are memoized for
 * the lifetime of the resolver; create one resolver per run.\n
 */
public final class LevelResolver {
  private static final Logger log = LoggerFactory.getLogger(LevelResolver.class);

  private final KeyRegistry registry;
  private final Map<String, VisitState> states = new HashMap<>();
  private final Map<String, ProperLevel> memo = new HashMap<>();

  public LevelResolver(KeyRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public VisitState stateOf(String fullKey) {
    registry.get(fullKey);
    return states.getOrDefault(fullKey, VisitState.UNVISITED);
  }

  /**
   * @throws IllegalArgumentException if {@code fullKey} is not in the registry
   */
  public ProperLevel resolve(String fullKey) {
    ProperLevel known = memo.get(fullKey);
    if (known != null) return known;

    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(enter(registry.get(fullKey)));

    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      if (top.hasNext()) {
        String target = top.next().targetFullKey();
        if (!registry.contains(target)) {
          top.accept(ProperLevel.ZERO);
          continue;
        }
        ProperLevel done = memo.get(target);
        if (done != null) {
          top.accept(done);
          continue;
        }
        if (states.get(target) == VisitState.IN_PROGRESS) {
          if (log.isTraceEnabled()) log.trace("calcaudit.levels cycle_reentry from={} to={}", top.key.fullKey(), target);
          top.accept(ProperLevel.CYCLE);
          continue;
        }
        stack.push(enter(registry.get(target)));
        continue;
      }

      stack.pop();
      ProperLevel level = top.result();
      memo.put(top.key.fullKey(), level);
      states.put(top.key.fullKey(), VisitState.FINALIZED);
      if (!stack.isEmpty()) stack.peek().accept(level);
    }
    return memo.get(fullKey);
  }

  /** Resolves every registry key. */
  public LevelTable resolveAll() {
    long start = System.nanoTime();
    Map<String, ProperLevel> out = new LinkedHashMap<>();
    for (RegisteredKey k : registry.keys()) {
      out.put(k.fullKey(), resolve(k.fullKey()));
    }
    LevelTable table = new LevelTable(out);
    if (log.isDebugEnabled()) {
      log.debug("calcaudit.levels resolved={} cyclic={} durationMs={}",
          table.size(), table.cycleCount(), (System.nanoTime() - start) / 1_000_000.0);
    }
    return table;
  }

  private Frame enter(RegisteredKey key) {
    states.put(key.fullKey(), VisitState.IN_PROGRESS);
    return new Frame(key);
  }

  private static final class Frame {
    final RegisteredKey key;
    final List<DependencyRef> deps;
    int next;
    ProperLevel deepest;

    Frame(RegisteredKey key) {
      this.key = key;
      this.deps = key.dependencies();
    }

    boolean hasNext() { return next < deps.size(); }

    DependencyRef next() { return deps.get(next++); }

    void accept(ProperLevel level) {
      deepest = (deepest == null) ? level : deepest.max(level);
    }

    ProperLevel result() {
      return (deepest == null) ? ProperLevel.ZERO : deepest.next();
    }
  }
}
