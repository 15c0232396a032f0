package eventflow.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eventflow.DomainEvent;
import eventflow.util.JacksonJsonCodec;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Converts between {@link DomainEvent} and the bus wire shape.
 *
 * <pre>{@code
 * { "source": "user.service", "detailType": "user.role_changed",
 *   "detail": { "eventId": "...", "occurredAt": "2024-05-01T10:15:30Z",
 *               "aggregateId": "...", "aggregateType": "USER", "version": 3,
 *               "correlationId": "...", "causationId": null,
 *               "payload": { ... } } }
 * }</pre>
 *
 * <p>{@code aggregateType} and {@code version} are optional on decode so events from
 * services that do not send them are still accepted: the aggregate type then defaults
 * to the event name prefix before the first dot, the version to 1.
 */
public final class EventWireCodec {

  private final ObjectMapper mapper;

  public EventWireCodec() {
    this(JacksonJsonCodec.defaultObjectMapper());
  }

  public EventWireCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public BusEntry encode(String source, DomainEvent event) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(event, "event");
    return new BusEntry(source, event.eventName(), write(detail(event), event));
  }

  public DomainEvent decode(BusEntry entry) {
    Objects.requireNonNull(entry, "entry");
    return decode(entry.detailType(), readObject(entry.detailJson(), "Event detail"));
  }

  /**
   * Self-contained JSON form of an event, {@code {"detailType": ..., "detail": {...}}}, for
   * storing an event outside the bus.
   */
  public String toJson(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    ObjectNode node = mapper.createObjectNode();
    node.put("detailType", event.eventName());
    node.set("detail", detail(event));
    return write(node, event);
  }

  /**
   * Reads the form written by {@link #toJson(DomainEvent)}.
   */
  public DomainEvent fromJson(String json) {
    JsonNode node = readObject(json, "Stored event");
    return decode(text(node, "detailType", null), node.get("detail"));
  }

  private ObjectNode detail(DomainEvent event) {
    ObjectNode detail = mapper.createObjectNode();
    detail.put("eventId", event.eventId());
    detail.put("occurredAt", event.occurredAt().toString());
    detail.put("aggregateId", event.aggregateId());
    detail.put("aggregateType", event.aggregateType());
    detail.put("version", event.version());
    detail.put("correlationId", event.correlationId());
    detail.put("causationId", event.causationId());
    detail.set("payload", readPayload(event.payloadJson()));
    return detail;
  }

  private String write(JsonNode node, DomainEvent event) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode event " + event.eventId(), e);
    }
  }

  private JsonNode readObject(String json, String what) {
    if (json == null) {
      throw new IllegalArgumentException(what + " is missing");
    }
    JsonNode node;
    try {
      node = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed " + what.toLowerCase() + ": " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException(what + " must be a JSON object");
    }
    return node;
  }

  private DomainEvent decode(String eventName, JsonNode detail) {
    if (eventName == null || eventName.isEmpty()) {
      throw new IllegalArgumentException("Event is missing its detailType");
    }
    if (detail == null || !detail.isObject()) {
      throw new IllegalArgumentException("Event detail must be a JSON object");
    }
    JsonNode payload = detail.get("payload");
    return DomainEvent.builder(eventName)
        .eventId(required(detail, "eventId"))
        .aggregate(text(detail, "aggregateType", defaultAggregateType(eventName)), required(detail, "aggregateId"))
        .version(detail.hasNonNull("version") ? detail.get("version").asLong() : 1L)
        .occurredAt(parseInstant(required(detail, "occurredAt")))
        .payloadJson(payload == null || payload.isNull() ? "{}" : payload.toString())
        .correlationId(text(detail, "correlationId", null))
        .causationId(text(detail, "causationId", null))
        .build();
  }

  private JsonNode readPayload(String payloadJson) {
    try {
      return mapper.readTree(payloadJson);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Payload is not valid JSON", e);
    }
  }

  private static String required(JsonNode node, String field) {
    String value = text(node, field, null);
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Event detail is missing '" + field + "'");
    }
    return value;
  }

  private static String text(JsonNode node, String field, String fallback) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? fallback : value.asText();
  }

  private static Instant parseInstant(String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid occurredAt: " + value, e);
    }
  }

  private static String defaultAggregateType(String eventName) {
    int dot = eventName.indexOf('.');
    return dot > 0 ? eventName.substring(0, dot) : eventName;
  }
}
