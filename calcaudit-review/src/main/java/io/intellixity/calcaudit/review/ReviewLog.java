package io.intellixity.calcaudit.review;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only review log stored as JSON lines.\n
 *
 * - marking a pair always appends a new line; the latest line for a pair wins\n
 * - unmarking rewrites the file without the pair's lines\n
 * - a missing file is an empty log; unparsable lines are skipped with a warning\n
 *
 * Writes are serialized per instance; share one instance per file.\n
 */
public final class ReviewLog {
  private static final Logger log = LoggerFactory.getLogger(ReviewLog.class);

  private final Path file;
  private final Clock clock;
  private final ObjectMapper json;

  public ReviewLog(Path file) {
    this(file, Clock.systemUTC());
  }

  public ReviewLog(Path file, Clock clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.json = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public Path file() { return file; }

  public synchronized ReviewEntry markReviewed(String fundName, String datagroupName, String reviewerName) {
    ReviewEntry e = new ReviewEntry(fundName, datagroupName, reviewerName, clock.instant());
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
        w.write(json.writeValueAsString(e));
        w.newLine();
      }
    } catch (IOException ex) {
      throw new ReviewLogException("Failed to append review to " + file, ex);
    }
    log.info("calcaudit.review marked fund={} datagroup={} reviewer={}", fundName, datagroupName, reviewerName);
    return e;
  }

  /** Removes every entry of the pair. Returns how many lines were dropped. */
  public synchronized int unmarkReviewed(String fundName, String datagroupName) {
    if (!Files.exists(file)) return 0;
    ReviewedPair target = new ReviewedPair(fundName, datagroupName);

    List<ReviewEntry> kept = new ArrayList<>();
    int removed = 0;
    for (ReviewEntry e : entries()) {
      if (e.pair().equals(target)) removed++;
      else kept.add(e);
    }

    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        for (ReviewEntry e : kept) {
          w.write(json.writeValueAsString(e));
          w.newLine();
        }
      }
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      throw new ReviewLogException("Failed to rewrite " + file, ex);
    }
    log.info("calcaudit.review unmarked fund={} datagroup={} removed={}", fundName, datagroupName, removed);
    return removed;
  }

  /** All parseable entries, in file order. */
  public synchronized List<ReviewEntry> entries() {
    if (!Files.exists(file)) return List.of();
    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new ReviewLogException("Failed to read " + file, ex);
    }

    List<ReviewEntry> out = new ArrayList<>(lines.size());
    int lineNo = 0;
    for (String line : lines) {
      lineNo++;
      if (line.isBlank()) continue;
      try {
        ReviewEntry e = json.readValue(line, ReviewEntry.class);
        if (e == null) {
          log.warn("calcaudit.review skipped_line file={} line={} reason=null entry", file, lineNo);
          continue;
        }
        out.add(e);
      } catch (JsonProcessingException | IllegalArgumentException ex) {
        log.warn("calcaudit.review skipped_line file={} line={} reason={}", file, lineNo, ex.getMessage());
      }
    }
    return out;
  }

  public Set<ReviewedPair> reviewedPairs() {
    Set<ReviewedPair> out = new LinkedHashSet<>();
    for (ReviewEntry e : entries()) out.add(e.pair());
    return out;
  }

  public boolean isReviewed(String fundName, String datagroupName) {
    return reviewedPairs().contains(new ReviewedPair(fundName, datagroupName));
  }

  /** Latest entry for the pair, if it was ever marked. */
  public Optional<ReviewEntry> latest(String fundName, String datagroupName) {
    ReviewedPair target = new ReviewedPair(fundName, datagroupName);
    ReviewEntry last = null;
    for (ReviewEntry e : entries()) {
      if (e.pair().equals(target)) last = e;
    }
    return Optional.ofNullable(last);
  }
}
