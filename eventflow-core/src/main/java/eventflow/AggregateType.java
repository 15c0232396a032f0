package eventflow;

import java.util.Objects;

/**
 * Represents an aggregate type tag.
 *
 * <p>Implementations can be enums for compile-time safety:
 * <pre>{@code
 * public enum Aggregates implements AggregateType {
 *   USER,
 *   MATCHING_REQUEST
 * }
 * }</pre>
 *
 * <p>Or use {@link #of(String)} for dynamic aggregate types.
 */
public interface AggregateType {

    /**
     * Returns the string representation of this aggregate type.
     * This value is persisted and forms the prefix of the partition key.
     *
     * @return the aggregate type name, never null
     */
    String name();

    /**
     * Creates an aggregate type from a string.
     *
     * @param name the aggregate type name
     * @return a new aggregate type
     * @throws IllegalArgumentException if the name is empty
     */
    static AggregateType of(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("aggregate type name cannot be empty");
        }
        return () -> name;
    }
}
