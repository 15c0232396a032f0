package eventflow;

/**
 * Thrown when an aggregate cannot be rebuilt from its stored events, either because
 * an event name has no registered mutation or because a payload cannot be decoded.
 */
public class ReplayException extends RuntimeException {

    private final String eventId;
    private final String eventName;

    public ReplayException(String message, DomainEvent event) {
        this(message, event, null);
    }

    public ReplayException(String message, DomainEvent event, Throwable cause) {
        super(message + " [eventId=" + event.eventId() + ", eventName=" + event.eventName()
                + ", aggregate=" + event.partitionKey() + ", version=" + event.version() + "]", cause);
        this.eventId = event.eventId();
        this.eventName = event.eventName();
    }

    public String eventId() {
        return eventId;
    }

    public String eventName() {
        return eventName;
    }
}
