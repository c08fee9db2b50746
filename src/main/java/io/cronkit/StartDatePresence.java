package io.cronkit;

/** Whether the reference date itself may be returned as a run date when it already matches. */
public enum StartDatePresence {
  /** The reference date is a run date when it matches the expression. */
  INCLUDED,
  /** Runs are searched strictly after (or before) the reference date. */
  EXCLUDED
}
