package eventflow;

/**
 * Causality envelope attached to events raised by a command.
 *
 * <p>{@code correlationId} is shared by every event of one request or saga chain;
 * {@code causationId} identifies the event or command that triggered the new events.
 * Either may be {@code null}: an event without a correlation id starts a new chain.
 *
 * @param correlationId id shared by the whole chain, or {@code null}
 * @param causationId   id of the direct trigger, or {@code null}
 */
public record EventMetadata(String correlationId, String causationId) {

  /** Metadata that starts a new chain. */
  public static final EventMetadata NONE = new EventMetadata(null, null);

  public static EventMetadata of(String correlationId, String causationId) {
    return new EventMetadata(correlationId, causationId);
  }

  public static EventMetadata correlatedWith(String correlationId) {
    return new EventMetadata(correlationId, null);
  }
}
