package eventflow.dispatch;

import eventflow.DomainEvent;

import java.util.List;

/**
 * In-process reaction to events right after they were committed, such as updating a
 * read model or a cache. Runs on the committing thread.
 */
@FunctionalInterface
public interface LocalEventHandler {

  /**
   * @param events the committed events of one save, in version order
   */
  void onCommitted(List<DomainEvent> events);
}
