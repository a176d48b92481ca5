package io.intellixity.arbor.query;

/**
 * Raised when a query references an association, attribute or join path that cannot be resolved against
 * the entity model, or when two relations cannot be merged.
 * <p>
 * Thrown while building; a failed build yields no query structure.
 */
public final class ResolutionException extends RuntimeException {
  public ResolutionException(String message) {
    super(message);
  }

  public ResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
