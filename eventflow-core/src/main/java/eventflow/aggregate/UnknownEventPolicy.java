package eventflow.aggregate;

/**
 * What replay does with a stored event whose name has no registered mutation.
 */
public enum UnknownEventPolicy {
  /**
   * Abort the replay with a {@link eventflow.ReplayException}.
   */
  FAIL,
  /**
   * Log a warning and skip the state change; the event still counts toward the version.
   */
  SKIP
}
