package com.farmcrm.common.status;

/**
 * Outcome categories for data-access operations.
 *
 * <p>A lookup that matches no row is an {@link #OK} result carrying an empty value.
 */
public enum StatusCode {
  OK,
  /** The caller supplied an argument the store was never asked about. */
  INVALID_ARGUMENT,
  /** The store could not be reached: refused connection, pool timeout, dropped socket. */
  UNAVAILABLE,
  /** The store was reached but the statement failed. */
  INTERNAL
}
