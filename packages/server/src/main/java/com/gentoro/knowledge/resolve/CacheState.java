package com.gentoro.knowledge.resolve;

public enum CacheState {
  /** The cached content matches the external system. */
  VALID,
  /** Some or all cached content must be read again. */
  STALE,
  /** Nothing is cached for the resource. */
  ABSENT
}
