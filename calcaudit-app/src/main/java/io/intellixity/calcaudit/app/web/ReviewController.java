package io.intellixity.calcaudit.app.web;

import io.intellixity.calcaudit.review.ReviewEntry;
import io.intellixity.calcaudit.review.ReviewLog;
import io.intellixity.calcaudit.review.ReviewedPair;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

@RestController
@RequestMapping("/api/reviews")
public final class ReviewController {
  private final ReviewLog reviews;

  public ReviewController(ReviewLog reviews) {
    this.reviews = reviews;
  }

  public record MarkReviewedRequest(String fundName, String datagroupName, String reviewerName) {}

  @GetMapping
  public Set<ReviewedPair> reviewed() {
    return reviews.reviewedPairs();
  }

  @GetMapping("/latest")
  public ResponseEntity<ReviewEntry> latest(@RequestParam("fundName") String fundName,
                                            @RequestParam("datagroupName") String datagroupName) {
    return reviews.latest(fundName, datagroupName)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping
  public ReviewEntry mark(@RequestBody MarkReviewedRequest req) {
    if (req == null || isBlank(req.fundName()) || isBlank(req.datagroupName()) || isBlank(req.reviewerName())) {
      throw new IllegalArgumentException("fundName, datagroupName and reviewerName are required");
    }
    return reviews.markReviewed(req.fundName(), req.datagroupName(), req.reviewerName().trim());
  }

  @DeleteMapping
  public int unmark(@RequestParam("fundName") String fundName,
                    @RequestParam("datagroupName") String datagroupName) {
    return reviews.unmarkReviewed(fundName, datagroupName);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
