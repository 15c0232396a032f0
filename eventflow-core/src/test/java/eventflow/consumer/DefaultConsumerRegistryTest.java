package eventflow.consumer;

import eventflow.EventType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultConsumerRegistryTest {

  @Test
  void wildcardConsumersComeAfterSpecificOnes() {
    EventConsumer specific = e -> { };
    EventConsumer wildcard = e -> { };
    DefaultConsumerRegistry registry = new DefaultConsumerRegistry()
        .registerAll(wildcard)
        .register(EventType.of("user.created"), specific);

    assertEquals(2, registry.consumersFor("user.created").size());
    assertSame(specific, registry.consumersFor("user.created").get(0));
    assertSame(wildcard, registry.consumersFor("user.created").get(1));
    assertEquals(1, registry.consumersFor("user.deleted").size());
  }

  @Test
  void returnedListIsImmutable() {
    DefaultConsumerRegistry registry = new DefaultConsumerRegistry().register("a.b", e -> { });

    assertThrows(UnsupportedOperationException.class, () -> registry.consumersFor("a.b").clear());
  }

  @Test
  void emptyWhenNothingRegistered() {
    assertTrue(new DefaultConsumerRegistry().consumersFor("a.b").isEmpty());
  }
}
