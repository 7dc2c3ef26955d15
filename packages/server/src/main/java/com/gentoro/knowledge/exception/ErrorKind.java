package com.gentoro.knowledge.exception;

/**
 * How an error should be treated by the caller.
 *
 * <p>{@link #ACTION} errors are voluntary aborts (user cancellation), {@link #NORMAL} errors are
 * expected conditions the caller should fix (not found, forbidden), {@link #RETRYABLE} errors are
 * transient and may be retried with backoff, {@link #RUNTIME} errors are unexpected faults that are
 * surfaced with diagnostic detail.
 */
public enum ErrorKind {
  ACTION,
  NORMAL,
  RETRYABLE,
  RUNTIME;

  /** Only runtime faults expose internal details (context, stack trace) to callers. */
  public boolean includesDiagnostics() {
    return this == RUNTIME;
  }
}
