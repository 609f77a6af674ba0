package dev.aahmedlab.oneshot;

/**
 * Result of a bounded wait on a {@link Future}.
 *
 * @since 1.0.0
 */
public enum WaitStatus {
  /**
   * A result (value or error) was published before the deadline.
   *
   * @since 1.0.0
   */
  READY,

  /**
   * The deadline elapsed with nothing published. Nothing was consumed.
   *
   * @since 1.0.0
   */
  TIMEOUT
}
