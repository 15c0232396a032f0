package eventflow.spring.boot;

import eventflow.EventType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a consumer of inbound bus events.
 *
 * <p>The annotated bean must implement {@link eventflow.consumer.EventConsumer}.
 *
 * <pre>{@code
 * @Component
 * @EventFlowConsumer(eventName = "user.created", idempotencyKey = "welcome-mail")
 * public class WelcomeMailer implements EventConsumer {
 *   public void onEvent(DomainEvent event) { ... }
 * }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>{@code eventTypeClass} takes precedence over {@code eventName}; it must be an enum
 *       and every constant is registered</li>
 *   <li>exactly one of {@code eventName}/{@code eventTypeClass} must be specified</li>
 *   <li>{@code "*"} subscribes to every event name</li>
 *   <li>a non-empty {@code idempotencyKey} wraps the bean so each event id is handled once
 *       under that consumer name</li>
 * </ul>
 *
 * @see EventFlowConsumerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventFlowConsumer {

  String eventName() default "";

  Class<? extends EventType> eventTypeClass() default EventType.class;

  /**
   * Consumer name for processed-event tracking; empty for a plain, non-deduplicating consumer.
   */
  String idempotencyKey() default "";
}
