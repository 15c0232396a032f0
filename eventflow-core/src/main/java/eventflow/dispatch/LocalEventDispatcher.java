package eventflow.dispatch;

import eventflow.DomainEvent;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans committed events out to an explicit list of in-process handlers.
 *
 * <p>Each {@link eventflow.aggregate.AggregateRepository} is given its dispatcher;
 * there is no process-wide instance. A failing handler is logged and skipped: the
 * events are already committed and the remaining handlers still run.
 */
public final class LocalEventDispatcher {
  private static final Logger logger = Logger.getLogger(LocalEventDispatcher.class.getName());

  private final List<LocalEventHandler> handlers = new CopyOnWriteArrayList<>();

  public LocalEventDispatcher() {
  }

  public LocalEventDispatcher(List<LocalEventHandler> handlers) {
    Objects.requireNonNull(handlers, "handlers");
    handlers.forEach(this::register);
  }

  public LocalEventDispatcher register(LocalEventHandler handler) {
    handlers.add(Objects.requireNonNull(handler, "handler"));
    return this;
  }

  public int handlerCount() {
    return handlers.size();
  }

  /**
   * Invokes every handler with the committed events.
   */
  public void dispatch(List<DomainEvent> events) {
    if (events == null || events.isEmpty()) {
      return;
    }
    List<DomainEvent> committed = List.copyOf(events);
    for (LocalEventHandler handler : handlers) {
      try {
        handler.onCommitted(committed);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Local handler " + handler.getClass().getName()
            + " failed for " + committed.get(0).partitionKey(), e);
      }
    }
  }
}
