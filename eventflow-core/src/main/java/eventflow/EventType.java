package eventflow;

import java.util.Objects;

/**
 * Represents a domain event name.
 *
 * <p>Event names are past-tense business labels ({@code "user.created"},
 * {@code "user.role_changed"}). Enums implement this interface by returning the dotted
 * label from {@link #eventName()}; {@code Enum.name()} is the constant name and is not used:
 * <pre>{@code
 * public enum UserEvents implements EventType {
 *   CREATED("user.created"),
 *   ROLE_CHANGED("user.role_changed");
 *
 *   private final String label;
 *   UserEvents(String label) { this.label = label; }
 *
 *   @Override
 *   public String eventName() { return label; }
 * }
 * }</pre>
 */
public interface EventType {

    /**
     * Returns the event name persisted with every event of this type.
     *
     * @return the event name, never null
     */
    String eventName();

    /**
     * Creates an event type from a string.
     *
     * @param eventName the event name
     * @return a new event type
     * @throws IllegalArgumentException if the name is empty
     */
    static EventType of(String eventName) {
        Objects.requireNonNull(eventName, "eventName");
        if (eventName.isEmpty()) {
            throw new IllegalArgumentException("event name cannot be empty");
        }
        return () -> eventName;
    }
}
