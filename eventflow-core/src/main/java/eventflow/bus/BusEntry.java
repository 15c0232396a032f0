package eventflow.bus;

import java.util.Objects;

/**
 * One message on the external bus.
 *
 * @param source     name of the publishing service
 * @param detailType event name
 * @param detailJson JSON-encoded event detail
 */
public record BusEntry(String source, String detailType, String detailJson) {

  public BusEntry {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(detailType, "detailType");
    Objects.requireNonNull(detailJson, "detailJson");
  }
}
