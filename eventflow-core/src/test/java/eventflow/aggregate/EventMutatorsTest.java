package eventflow.aggregate;

import eventflow.DomainEvent;
import eventflow.ReplayException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static eventflow.support.Events.event;
import static org.junit.jupiter.api.Assertions.*;

class EventMutatorsTest {

  record Score(int points) {
  }

  @Test
  void typedMutationReceivesDecodedPayload() {
    List<Integer> seen = new ArrayList<>();
    EventMutators<List<Integer>> mutators = EventMutators.<List<Integer>>builder()
        .on("quiz.scored", Score.class, (target, score) -> target.add(score.points()))
        .build();
    DomainEvent scored = DomainEvent.builder("quiz.scored")
        .aggregate("QUIZ", "q-1").version(1).payloadJson("{\"points\":7}").build();

    mutators.applyLive(seen, scored);

    assertEquals(List.of(7), seen);
  }

  @Test
  void duplicateRegistrationIsRejected() {
    EventMutators.Builder<Object> builder = EventMutators.builder()
        .onEvent("quiz.scored", (a, e) -> { });

    assertThrows(IllegalStateException.class, () -> builder.onEvent("quiz.scored", (a, e) -> { }));
  }

  @Test
  void skipPolicyIgnoresUnknownEventsDuringReplay() {
    List<String> seen = new ArrayList<>();
    EventMutators<List<String>> mutators = EventMutators.<List<String>>builder()
        .onEvent("quiz.started", (target, e) -> target.add(e.eventName()))
        .unknownEventPolicy(UnknownEventPolicy.SKIP)
        .build();

    mutators.applyReplayed(seen, event("quiz.archived", "QUIZ", "q-1", 1));
    mutators.applyReplayed(seen, event("quiz.started", "QUIZ", "q-1", 2));

    assertEquals(List.of("quiz.started"), seen);
  }

  @Test
  void liveApplicationOfUnknownEventFailsEvenWhenSkipping() {
    EventMutators<Object> mutators = EventMutators.builder()
        .unknownEventPolicy(UnknownEventPolicy.SKIP)
        .build();

    assertThrows(IllegalArgumentException.class,
        () -> mutators.applyLive(new Object(), event("quiz.archived", "QUIZ", "q-1", 1)));
  }

  @Test
  void undecodablePayloadBecomesReplayException() {
    EventMutators<Object> mutators = EventMutators.builder()
        .on("quiz.scored", Score.class, (target, score) -> { })
        .build();
    DomainEvent broken = DomainEvent.builder("quiz.scored")
        .aggregate("QUIZ", "q-1").version(1).payloadJson("{\"points\":\"many\"}").build();

    ReplayException ex = assertThrows(ReplayException.class, () -> mutators.applyReplayed(new Object(), broken));

    assertEquals(broken.eventId(), ex.eventId());
  }

  @Test
  void reportsRegisteredNames() {
    EventMutators<Object> mutators = EventMutators.builder()
        .onEvent("a.one", (t, e) -> { })
        .onEvent("a.two", (t, e) -> { })
        .build();

    assertTrue(mutators.handles("a.one"));
    assertFalse(mutators.handles("a.three"));
    assertEquals(List.of("a.one", "a.two"), new ArrayList<>(mutators.eventNames()));
    assertEquals(UnknownEventPolicy.FAIL, mutators.unknownEventPolicy());
  }
}
