package eventflow;

/**
 * Thrown by an {@link eventflow.spi.EventBus} when it rejects a publish call as a whole.
 *
 * <p>Every entry of the rejected call is treated as failed: its attempt count is
 * incremented and it is rescheduled with backoff. Per-entry failures are reported
 * through {@link eventflow.bus.PublishResult} instead.
 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
