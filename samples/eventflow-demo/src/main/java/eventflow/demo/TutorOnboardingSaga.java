package eventflow.demo;

import eventflow.saga.SagaDefinition;
import eventflow.saga.SagaStep;
import eventflow.util.JsonCodec;

import java.time.Duration;

/**
 * Onboarding of a user promoted to tutor: welcome pack, wait for account verification,
 * then book an introduction call once the grace period is over.
 */
public final class TutorOnboardingSaga {
  public static final String TYPE = "tutor-onboarding";

  private TutorOnboardingSaga() {
  }

  public static SagaDefinition definition(Duration introCallDelay) {
    return SagaDefinition.builder(TYPE)
        .startOn(UserAccount.Events.ROLE_CHANGED)
        .startWhen(event -> JsonCodec.getDefault()
            .fromJson(event.payloadJson(), UserAccount.RoleChanged.class).to() == UserAccount.Role.TUTOR)
        .step(SagaStep.immediately("send-welcome-pack", ctx -> {
          System.out.println("[Saga] Welcome pack sent to tutor " + ctx.get("aggregateId")
              + " (key " + ctx.idempotencyKey() + ")");
          ctx.put("welcomePack", "sent");
        }))
        .step(SagaStep.onEvent("await-verification", UserAccount.Events.ACTIVATED, ctx -> {
          System.out.println("[Saga] Tutor " + ctx.get("aggregateId") + " verified");
          ctx.put("verifiedAt", ctx.now().toString());
        }))
        .step(SagaStep.after("book-intro-call", introCallDelay, ctx -> {
          System.out.println("[Saga] Intro call booked for tutor " + ctx.get("aggregateId"));
          ctx.put("introCall", "booked");
        }))
        .build();
  }
}
