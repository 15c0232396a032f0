package eventflow.spring.boot;

import eventflow.EventFlow;
import eventflow.EventType;
import eventflow.consumer.DefaultConsumerRegistry;
import eventflow.consumer.EventConsumer;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Scans for beans annotated with {@link EventFlowConsumer} and registers them
 * in the {@link DefaultConsumerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 */
public class EventFlowConsumerRegistrar implements SmartInitializingSingleton {

  private final ListableBeanFactory beanFactory;
  private final DefaultConsumerRegistry registry;
  private final ObjectProvider<EventFlow> eventFlow;

  public EventFlowConsumerRegistrar(ListableBeanFactory beanFactory, DefaultConsumerRegistry registry,
                                    ObjectProvider<EventFlow> eventFlow) {
    this.beanFactory = beanFactory;
    this.registry = registry;
    this.eventFlow = eventFlow;
  }

  @Override
  public void afterSingletonsInstantiated() {
    Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventFlowConsumer.class);
    for (Map.Entry<String, Object> entry : beans.entrySet()) {
      String beanName = entry.getKey();
      Object bean = entry.getValue();

      if (!(bean instanceof EventConsumer consumer)) {
        throw new BeanCreationException(beanName,
            "Bean annotated with @EventFlowConsumer must implement EventConsumer, " +
                "but " + bean.getClass().getName() + " does not");
      }
      // Proxies may hide the annotation on the target class
      EventFlowConsumer annotation = AnnotationUtils.findAnnotation(bean.getClass(), EventFlowConsumer.class);
      if (annotation == null) {
        throw new BeanCreationException(beanName,
            "Could not find @EventFlowConsumer annotation on " + bean.getClass().getName());
      }

      EventConsumer registered = consumer;
      if (!annotation.idempotencyKey().isEmpty()) {
        EventFlow flow = eventFlow.getIfAvailable();
        if (flow == null) {
          throw new BeanCreationException(beanName, "idempotencyKey requires an EventFlow bean");
        }
        registered = flow.idempotent(annotation.idempotencyKey(), consumer);
      }
      for (String eventName : resolveEventNames(beanName, annotation)) {
        registry.register(eventName, registered);
      }
    }
  }

  private List<String> resolveEventNames(String beanName, EventFlowConsumer annotation) {
    Class<? extends EventType> eventTypeClass = annotation.eventTypeClass();
    if (eventTypeClass != EventType.class) {
      EventType[] constants = eventTypeClass.getEnumConstants();
      if (constants == null || constants.length == 0) {
        throw new BeanCreationException(beanName,
            "@EventFlowConsumer eventTypeClass must be an enum with constants: " + eventTypeClass.getName());
      }
      return Arrays.stream(constants).map(EventType::eventName).toList();
    }
    if (annotation.eventName().isEmpty()) {
      throw new BeanCreationException(beanName,
          "@EventFlowConsumer must specify either eventName or eventTypeClass");
    }
    return List.of(annotation.eventName());
  }
}
