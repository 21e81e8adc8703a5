package io.intellixity.calcaudit.audit;

/**
 * Raised when the key record set cannot be obtained (connectivity, I/O, malformed rows).
 * <p>
 * This is the only fatal outcome of an audit; data-quality findings are reported as violations.
 */
public final class KeyRecordSourceException extends RuntimeException {
  public KeyRecordSourceException(String message) {
    super(message);
  }

  public KeyRecordSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
