package io.intellixity.calcaudit.review;

/** Raised when the review log file cannot be read or written. */
public final class ReviewLogException extends RuntimeException {
  public ReviewLogException(String message, Throwable cause) {
    super(message, cause);
  }
}
