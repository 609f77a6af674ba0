package dev.aahmedlab.oneshot;

/**
 * Internal state of a shared state's result slot. This enum is package-private and not part of the
 * public API. Use {@link Future#isReady()} and {@link Promise#isSatisfied()} to observe it.
 */
enum SlotState {
  EMPTY,
  HAS_VALUE,
  HAS_ERROR,
  CONSUMED
}
