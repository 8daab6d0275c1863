package org.groupscholar.planner.infrastructure.persistence;

import java.io.IOException;

/**
 * Raised when the run store cannot persist a report; wraps the underlying {@link java.sql.SQLException}.
 *
 * @since 0.1.0
 */
public final class RunStoreException extends IOException {
  private static final long serialVersionUID = 1L;

  public RunStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
